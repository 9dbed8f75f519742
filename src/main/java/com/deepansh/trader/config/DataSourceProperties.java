package com.deepansh.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Endpoints, keys and cache TTLs of the external market/safety/social sources.
 * Bound from application.yml under the "datasources" prefix.
 *
 * TTLs are per data kind: volatile market data short, profile-like data longer.
 */
@ConfigurationProperties(prefix = "datasources")
@Data
public class DataSourceProperties {

    private String chainId = "solana";

    private DexScreener dexscreener = new DexScreener();
    private RugCheck rugcheck = new RugCheck();
    private TweetScout tweetscout = new TweetScout();
    private Jupiter jupiter = new Jupiter();
    private Enrichment enrichment = new Enrichment();

    @Data
    public static class DexScreener {
        private String baseUrl = "https://api.dexscreener.com";
        /** The batch token endpoint accepts at most 30 addresses per call */
        private int maxBatchSize = 30;
        private Duration boostedTtl = Duration.ofSeconds(300);
        private Duration profilesTtl = Duration.ofSeconds(600);
        private Duration searchTtl = Duration.ofSeconds(180);
        private Duration pairsTtl = Duration.ofSeconds(300);
    }

    @Data
    public static class RugCheck {
        private String baseUrl = "https://api.rugcheck.xyz/v1";
        private String apiKey = "";
        private Duration reportTtl = Duration.ofSeconds(600);
    }

    @Data
    public static class TweetScout {
        private String baseUrl = "https://api.tweetscout.io/v2";
        private String apiKey = "";
        private int searchLimit = 5;
        private Duration socialTtl = Duration.ofSeconds(600);

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class Jupiter {
        private String quoteUrl = "https://quote-api.jup.ag/v6/quote";
        private String swapUrl = "https://quote-api.jup.ag/v6/swap";
        private int defaultSlippageBps = 100;
        private long computeUnitPriceMicroLamports = 50000;
        private int maxAccounts = 64;
    }

    @Data
    public static class Enrichment {
        private Duration unifiedTtl = Duration.ofSeconds(300);
    }
}
