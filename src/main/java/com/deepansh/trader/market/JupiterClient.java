package com.deepansh.trader.market;

import com.deepansh.trader.config.DataSourceProperties;
import com.deepansh.trader.exception.DataSourceException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jupiter aggregator v6: swap quotes and pre-built swap transactions.
 *
 * Quotes are not cached: they go stale within seconds and the swap endpoint
 * rejects an outdated one. Neither call is retried here; a failed quote is
 * reported to the oracle and a failed swap build aborts the trade.
 */
@Component
@Slf4j
public class JupiterClient {

    public static final String SOURCE = "jupiter";
    public static final String SOL_MINT = "So11111111111111111111111111111111111111112";
    public static final long LAMPORTS_PER_SOL = 1_000_000_000L;

    private final RestClient restClient;
    private final DataSourceProperties.Jupiter props;

    public JupiterClient(RestClient.Builder restClientBuilder, DataSourceProperties props) {
        this.props = props.getJupiter();
        this.restClient = restClientBuilder.clone()
                .defaultHeader("Accept", "application/json")
                .build();
    }

    public static long solToLamports(double sol) {
        return Math.round(sol * LAMPORTS_PER_SOL);
    }

    /**
     * @param amount input amount in the input mint's smallest unit
     * @throws DataSourceException on transport failure or an empty quote
     */
    public JsonNode getQuote(String inputMint, String outputMint, long amount, int slippageBps) {
        log.info("Requesting Jupiter quote [{} -> {}, amount={}, slippageBps={}]",
                inputMint, outputMint, amount, slippageBps);
        try {
            JsonNode quote = restClient.get()
                    .uri(props.getQuoteUrl() + "?inputMint={in}&outputMint={out}&amount={amount}&slippageBps={bps}",
                            inputMint, outputMint, amount, slippageBps)
                    .retrieve()
                    .body(JsonNode.class);

            if (quote == null || !quote.has("outAmount")) {
                throw new DataSourceException(SOURCE, "Jupiter returned no route for " + outputMint);
            }
            log.info("Jupiter quote received [inAmount={}, outAmount={}, priceImpactPct={}]",
                    quote.path("inAmount").asText(), quote.path("outAmount").asText(),
                    quote.path("priceImpactPct").asText());
            return quote;

        } catch (RestClientException e) {
            log.error("Jupiter quote failed: {}", e.getMessage());
            throw new DataSourceException(SOURCE, "quote request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the versioned swap transaction for a quote, unsigned, base64.
     *
     * @throws DataSourceException on transport failure or a response without swapTransaction
     */
    public String getSwapTransaction(Object quoteResponse, String userPublicKey) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("quoteResponse", quoteResponse);
        body.put("userPublicKey", userPublicKey);
        body.put("wrapAndUnwrapSol", true);
        body.put("computeUnitPriceMicroLamports", props.getComputeUnitPriceMicroLamports());
        body.put("asLegacyTransaction", false);
        body.put("skipUserAccountsRpcCalls", true);
        body.put("maxAccounts", props.getMaxAccounts());

        try {
            JsonNode response = restClient.post()
                    .uri(props.getSwapUrl())
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

            String tx = response != null ? JsonValues.textOrNull(response.path("swapTransaction")) : null;
            if (tx == null) {
                throw new DataSourceException(SOURCE, "No swapTransaction in Jupiter response");
            }
            log.info("Jupiter swap transaction received [{} chars]", tx.length());
            return tx;

        } catch (RestClientException e) {
            log.error("Jupiter swap build failed: {}", e.getMessage());
            throw new DataSourceException(SOURCE, "swap request failed: " + e.getMessage(), e);
        }
    }

    public int getDefaultSlippageBps() {
        return props.getDefaultSlippageBps();
    }
}
