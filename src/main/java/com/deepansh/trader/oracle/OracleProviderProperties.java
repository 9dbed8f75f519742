package com.deepansh.trader.oracle;

import lombok.Data;

/**
 * Connection settings of one OpenAI-compatible chat-completions provider.
 */
@Data
public class OracleProviderProperties {
    private String apiKey = "";
    private String baseUrl;
    private String model;
    private int maxTokens = 4096;
    private double temperature = 0.2;
}
