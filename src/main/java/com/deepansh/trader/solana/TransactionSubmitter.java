package com.deepansh.trader.solana;

import com.deepansh.trader.config.SolanaProperties;
import com.deepansh.trader.core.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Sends a signed transaction with bounded retries and exponential backoff,
 * then polls for confirmation.
 *
 * Retry policy:
 *   - at most maxRetries attempts; after failed attempt n (0-based) wait baseDelay * 2^n
 *   - the placeholder signature (base58 of 64 zero bytes) is a transient failure
 *   - RPC errors are retried only when they look transient (timeouts, rate limits,
 *     busy node, expired blockhash); anything else fails at once
 *
 * Confirmation is best-effort: once the node has accepted the transaction it is
 * never re-sent, confirmed or not.
 */
@Slf4j
public class TransactionSubmitter {

    /** base58 of 64 zero bytes, returned by misbehaving nodes instead of a real signature */
    public static final String PLACEHOLDER_SIGNATURE = "1".repeat(64);

    private static final List<String> RETRYABLE_MARKERS =
            List.of("timeout", "rate limit", "too busy", "blockhash", "timed out");

    private static final int DIRECT_RPC_MAX_RETRIES = 5;

    private final SolanaRpcClient primary;
    private final SolanaRpcClient fallback;
    private final SolanaProperties.Confirmation confirmation;
    private final Sleeper sleeper;

    public TransactionSubmitter(SolanaRpcClient primary,
                                SolanaRpcClient fallback,
                                SolanaProperties.Confirmation confirmation,
                                Sleeper sleeper) {
        this.primary = primary;
        this.fallback = fallback;
        this.confirmation = confirmation;
        this.sleeper = sleeper;
    }

    /** Primary path: the configured RPC node with preflight simulation. */
    public SubmissionResult submit(String signedTxBase64, int maxRetries, Duration baseDelay) {
        return submitWithRetry(primary, signedTxBase64, false, null, maxRetries, baseDelay);
    }

    /**
     * Fallback path: the fallback node, preflight skipped, node-side rebroadcast.
     * Reports failure without any attempt when no fallback endpoint is configured.
     */
    public SubmissionResult submitDirect(String signedTxBase64, int maxRetries, Duration baseDelay) {
        if (fallback == null) {
            return SubmissionResult.failure("No fallback RPC endpoint configured", 0, null);
        }
        return submitWithRetry(fallback, signedTxBase64, true, DIRECT_RPC_MAX_RETRIES, maxRetries, baseDelay);
    }

    public boolean hasFallback() {
        return fallback != null;
    }

    static boolean isRetryable(String error) {
        if (error == null) return false;
        String lower = error.toLowerCase(Locale.ROOT);
        return RETRYABLE_MARKERS.stream().anyMatch(lower::contains);
    }

    private SubmissionResult submitWithRetry(SolanaRpcClient rpc,
                                             String signedTxBase64,
                                             boolean skipPreflight,
                                             Integer rpcMaxRetries,
                                             int maxRetries,
                                             Duration baseDelay) {
        String lastError = "no attempt made";
        int attempts = 0;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            attempts++;
            try {
                String signature = rpc.sendTransaction(signedTxBase64, skipPreflight, rpcMaxRetries);

                if (PLACEHOLDER_SIGNATURE.equals(signature)) {
                    lastError = "Node returned placeholder signature";
                    log.warn("Placeholder signature from {} [attempt={}/{}]", rpc.endpoint(), attempts, maxRetries);
                } else {
                    log.info("Transaction submitted [signature={}, endpoint={}, attempt={}]",
                            signature, rpc.endpoint(), attempts);
                    return confirm(rpc, signature, attempts);
                }

            } catch (RpcException e) {
                lastError = e.getMessage();
                if (!isRetryable(lastError)) {
                    log.error("Transaction rejected, not retrying [endpoint={}]: {}", rpc.endpoint(), lastError);
                    return SubmissionResult.failure(lastError, attempts, rpc.endpoint());
                }
                log.warn("Transient submission failure [attempt={}/{}]: {}", attempts, maxRetries, lastError);
            }

            Duration delay = baseDelay.multipliedBy(1L << attempt);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SubmissionResult.failure("Interrupted during backoff: " + lastError, attempts, rpc.endpoint());
            }
        }

        log.error("Transaction submission gave up after {} attempts: {}", attempts, lastError);
        return SubmissionResult.failure("Failed after " + attempts + " attempts: " + lastError, attempts, rpc.endpoint());
    }

    private SubmissionResult confirm(SolanaRpcClient rpc, String signature, int attempts) {
        SubmissionResult.SubmissionResultBuilder result = SubmissionResult.builder()
                .success(true)
                .signature(signature)
                .attempts(attempts)
                .endpoint(rpc.endpoint());

        for (int poll = 0; poll < confirmation.getPollAttempts(); poll++) {
            try {
                sleeper.sleep(confirmation.getPollInterval());
                Optional<SignatureStatus> status = rpc.getSignatureStatus(signature);
                if (status.isPresent() && status.get().err() != null) {
                    log.warn("Transaction {} landed with error: {}", signature, status.get().err());
                    return result.confirmationStatus(SubmissionResult.UNCONFIRMED)
                            .warning("Transaction landed with on-chain error: " + status.get().err())
                            .build();
                }
                if (status.isPresent() && status.get().isConfirmed()) {
                    log.info("Transaction confirmed [signature={}, status={}]",
                            signature, status.get().confirmationStatus());
                    return result.confirmationStatus(SubmissionResult.CONFIRMED).build();
                }
            } catch (RpcException e) {
                log.debug("Confirmation poll failed for {}: {}", signature, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        log.warn("Could not confirm transaction {} after {} polls; it may still land",
                signature, confirmation.getPollAttempts());
        return result.confirmationStatus(SubmissionResult.UNCONFIRMED)
                .warning("Submitted but not confirmed; check the signature before retrying")
                .build();
    }
}
