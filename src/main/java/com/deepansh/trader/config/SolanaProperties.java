package com.deepansh.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Blockchain RPC endpoint, wallet key and submission/confirmation tuning.
 * Bound from application.yml under the "solana" prefix.
 */
@ConfigurationProperties(prefix = "solana")
@Data
public class SolanaProperties {

    private String rpcUrl = "https://solana-rpc.publicnode.com";

    /** Empty means no fallback submission path */
    private String fallbackRpcUrl = "";

    /** Base58 64-byte keypair. Empty disables live trading and wallet reads. */
    private String privateKey = "";

    private String commitment = "confirmed";

    private Submission submission = new Submission();
    private Confirmation confirmation = new Confirmation();

    public boolean hasWallet() {
        return privateKey != null && !privateKey.isBlank();
    }

    public boolean hasFallback() {
        return fallbackRpcUrl != null && !fallbackRpcUrl.isBlank();
    }

    @Data
    public static class Submission {
        private int maxRetries = 3;
        private long baseDelayMs = 2000;

        public Duration getBaseDelay() {
            return Duration.ofMillis(baseDelayMs);
        }
    }

    @Data
    public static class Confirmation {
        private int pollAttempts = 5;
        private long pollIntervalMs = 2000;

        public Duration getPollInterval() {
            return Duration.ofMillis(pollIntervalMs);
        }
    }
}
