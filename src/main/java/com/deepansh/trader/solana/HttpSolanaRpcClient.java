package com.deepansh.trader.solana;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP against one Solana node.
 * Instances are created per endpoint by {@link SolanaClientConfig}.
 */
@Slf4j
public class HttpSolanaRpcClient implements SolanaRpcClient {

    private final RestClient restClient;
    private final String endpoint;
    private final String commitment;
    private final AtomicLong requestIds = new AtomicLong();

    public HttpSolanaRpcClient(String endpoint, String commitment, RestClient.Builder restClientBuilder) {
        this.endpoint = endpoint;
        this.commitment = commitment;
        this.restClient = restClientBuilder.clone()
                .baseUrl(endpoint)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public long getBalanceLamports(String publicKey) {
        JsonNode result = call("getBalance", List.of(publicKey, Map.of("commitment", commitment)));
        return result.path("value").asLong();
    }

    @Override
    public String sendTransaction(String signedTxBase64, boolean skipPreflight, Integer rpcMaxRetries) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("encoding", "base64");
        config.put("skipPreflight", skipPreflight);
        config.put("preflightCommitment", commitment);
        if (rpcMaxRetries != null) config.put("maxRetries", rpcMaxRetries);

        JsonNode result = call("sendTransaction", List.of(signedTxBase64, config));
        if (!result.isTextual()) {
            throw new RpcException("sendTransaction returned no signature");
        }
        return result.asText();
    }

    @Override
    public Optional<SignatureStatus> getSignatureStatus(String signature) {
        JsonNode result = call("getSignatureStatuses",
                List.of(List.of(signature), Map.of("searchTransactionHistory", true)));
        JsonNode status = result.path("value").path(0);
        if (status.isMissingNode() || status.isNull()) return Optional.empty();

        JsonNode err = status.path("err");
        return Optional.of(new SignatureStatus(
                status.path("confirmationStatus").asText(null),
                err.isMissingNode() || err.isNull() ? null : err.toString()));
    }

    @Override
    public boolean verifyTransaction(String signature) {
        JsonNode result = call("getTransaction", List.of(signature, Map.of(
                "encoding", "json",
                "commitment", commitment,
                "maxSupportedTransactionVersion", 0)));
        if (result.isNull() || result.isMissingNode()) return false;
        JsonNode err = result.path("meta").path("err");
        return err.isMissingNode() || err.isNull();
    }

    @Override
    public double getTokenBalance(String owner, String mint) {
        JsonNode result = call("getTokenAccountsByOwner", List.of(
                owner, Map.of("mint", mint), Map.of("encoding", "jsonParsed")));
        double total = 0;
        for (JsonNode account : result.path("value")) {
            total += account.path("account").path("data").path("parsed").path("info")
                    .path("tokenAmount").path("uiAmount").asDouble(0);
        }
        return total;
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    private JsonNode call(String method, List<Object> params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        request.put("params", params);

        JsonNode response;
        try {
            response = restClient.post()
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("Solana RPC {} transport failure [{}]: {}", method, endpoint, e.getMessage());
            throw new RpcException(method + " failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new RpcException(method + " returned an empty body");
        }
        JsonNode error = response.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.path("message").asText("unknown RPC error");
            log.debug("Solana RPC {} error [code={}]: {}", method, error.path("code").asInt(), message);
            throw new RpcException(message, error.path("code").asInt());
        }
        return response.path("result");
    }
}
