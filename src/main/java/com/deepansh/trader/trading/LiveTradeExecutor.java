package com.deepansh.trader.trading;

import com.deepansh.trader.config.SolanaProperties;
import com.deepansh.trader.exception.AgentException;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.JupiterClient;
import com.deepansh.trader.solana.SolanaWallet;
import com.deepansh.trader.solana.SubmissionResult;
import com.deepansh.trader.solana.TransactionSigner;
import com.deepansh.trader.solana.TransactionSubmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Real funds path: Jupiter swap build, sign, submit.
 * Only reachable from the execution action after the dry-run gate has passed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiveTradeExecutor {

    private final JupiterClient jupiter;
    private final SolanaWallet wallet;
    private final TransactionSubmitter submitter;
    private final SolanaProperties props;

    /** Never throws; every failure is a failed {@link SubmissionResult} */
    public SubmissionResult execute(Map<String, Object> quote) {
        if (!wallet.isConfigured()) {
            return SubmissionResult.failure("Wallet not configured: set solana.private-key for live trading", 0, null);
        }
        TransactionSigner signer = wallet.getSigner().orElseThrow();

        String unsignedTx;
        try {
            unsignedTx = jupiter.getSwapTransaction(quote, signer.publicKey());
        } catch (DataSourceException e) {
            log.error("Swap transaction build failed: {}", e.getMessage());
            return SubmissionResult.failure("Failed to get transaction from Jupiter: " + e.getMessage(), 0, null);
        }

        String signedTx;
        try {
            signedTx = signer.sign(unsignedTx);
        } catch (AgentException e) {
            log.error("Signing failed: {}", e.getMessage());
            return SubmissionResult.failure("Failed to sign transaction: " + e.getMessage(), 0, null);
        }

        SolanaProperties.Submission submission = props.getSubmission();
        SubmissionResult result = submitter.submit(signedTx, submission.getMaxRetries(), submission.getBaseDelay());

        if (!result.isSuccess() && submitter.hasFallback()) {
            log.warn("Primary submission failed ({}), trying fallback endpoint", result.getError());
            result = submitter.submitDirect(signedTx, submission.getMaxRetries(), submission.getBaseDelay());
        }
        return result;
    }
}
