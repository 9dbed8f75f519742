package com.deepansh.trader.memory;

import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Text embeddings via OpenAI's embeddings API.
 *
 * Embeddings of the same text are deterministic, so they are cached in the
 * ephemeral cache (key embed:{sha256(text)}, 24h). Repeated searches with the
 * same query cost one API call.
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "embed:";
    private static final Duration CACHE_TTL = Duration.ofHours(24);

    private final RestClient restClient;
    private final EphemeralCache cache;
    private final String model;
    private final boolean configured;

    public EmbeddingService(
            @Value("${openai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${openai.api-key:}") String apiKey,
            @Value("${openai.embedding-model:text-embedding-3-small}") String model,
            RestClient.Builder restClientBuilder,
            EphemeralCache cache) {
        this.cache = cache;
        this.model = model;
        this.configured = apiKey != null && !apiKey.isBlank();
        this.restClient = restClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
        if (!configured) {
            log.warn("openai.api-key not set: experience memory falls back to keyword search");
        }
    }

    public boolean isConfigured() {
        return configured;
    }

    /**
     * @throws AgentException if no API key is configured
     */
    public float[] embed(String text) {
        if (!configured) {
            throw new AgentException("Embeddings unavailable: openai.api-key is not set");
        }
        return cache.getOrLoad(CACHE_PREFIX + sha256(text), float[].class, CACHE_TTL, () -> fetchEmbedding(text));
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response = restClient.post()
                .uri("/embeddings")
                .body(Map.of("model", model, "input", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        if (response == null || response.get("data") == null) {
            throw new AgentException("Embeddings API returned no data");
        }
        List<Map<String, Object>> data = (List<Map<String, Object>>) response.get("data");
        List<Number> raw = (List<Number>) data.get(0).get("embedding");

        float[] result = new float[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            result[i] = raw.get(i).floatValue();
        }
        return result;
    }

    private static String sha256(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
