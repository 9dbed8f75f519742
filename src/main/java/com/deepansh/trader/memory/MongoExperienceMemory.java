package com.deepansh.trader.memory;

import com.deepansh.trader.action.input.PatternType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Experience memory backed by MongoDB with in-process cosine similarity.
 *
 * Candidates (experiences with an embedding, narrowed by metadata filters) are
 * loaded and scored in Java. Fine at the scale one agent produces; an Atlas
 * $vectorSearch stage can replace the scoring without changing callers.
 *
 * Without embeddings (no API key, none computed yet, or the embeddings call
 * failed) search falls back to case-insensitive keyword matching on content.
 *
 * Embedding generation is @Async and never blocks the store path.
 * Self-invocation goes through the ApplicationContext proxy to honour @Async.
 */
@Service
@Slf4j
public class MongoExperienceMemory implements ExperienceMemory, ApplicationContextAware {

    static final double SIMILARITY_THRESHOLD = 0.75;
    private static final double HIGH_PROFIT_PCT = 20.0;
    private static final double QUICK_TRADE_HOURS = 2.0;
    private static final Pattern NUMERIC = Pattern.compile("[-+]?\\d+(\\.\\d+)?");

    private final MongoTemplate mongoTemplate;
    private final TradingExperienceRepository repository;
    private final EmbeddingService embeddingService;
    private ApplicationContext applicationContext;

    public MongoExperienceMemory(MongoTemplate mongoTemplate,
                                 TradingExperienceRepository repository,
                                 EmbeddingService embeddingService) {
        this.mongoTemplate = mongoTemplate;
        this.repository = repository;
        this.embeddingService = embeddingService;
    }

    @Override
    public void setApplicationContext(ApplicationContext ctx) {
        this.applicationContext = ctx;
    }

    private MongoExperienceMemory self() {
        return applicationContext != null ? applicationContext.getBean(MongoExperienceMemory.class) : this;
    }

    @Override
    public String store(String tokenAddress, Map<String, Object> tradingData, String aiReasoning, String sessionId) {
        Double profit = number(tradingData.get("profitPercentage"), tradingData.get("profit_percentage"));
        Double hold = number(tradingData.get("holdTimeHours"), tradingData.get("hold_time_hours"));
        String symbol = text(tradingData.get("tokenSymbol"), tradingData.get("token_symbol"));
        String tradeType = text(tradingData.get("tradeType"), tradingData.get("trade_type"));

        TradingExperience experience = TradingExperience.builder()
                .tokenAddress(tokenAddress)
                .tokenSymbol(symbol)
                .tradeType(tradeType != null ? tradeType : "analysis")
                .content(describe(tokenAddress, symbol, tradingData, aiReasoning))
                .aiReasoning(aiReasoning)
                .sessionId(sessionId)
                .tradingData(tradingData)
                .metadata(scalarFields(tradingData))
                .profitPercentage(profit)
                .wasProfitable(profit != null ? profit > 0 : null)
                .holdTimeHours(hold)
                .build();

        TradingExperience saved = repository.save(experience);
        log.info("Stored trading experience [id={}, token={}, profit={}]", saved.getId(), symbol, profit);

        if (embeddingService.isConfigured()) {
            self().embedExperienceAsync(saved.getId(), saved.getContent());
        }
        return saved.getId();
    }

    @Override
    public List<ExperienceMatch> search(String query, Map<String, Object> filters, int limit) {
        Criteria filterCriteria = metadataCriteria(filters);

        if (embeddingService.isConfigured()) {
            try {
                float[] queryEmbedding = embeddingService.embed(query);
                Query candidatesQuery = new Query(new Criteria().andOperator(
                        Criteria.where("embedding").exists(true), filterCriteria));
                List<TradingExperience> candidates = mongoTemplate.find(candidatesQuery, TradingExperience.class);

                if (!candidates.isEmpty()) {
                    return candidates.stream()
                            .map(e -> new ExperienceMatch(e, cosineSimilarity(queryEmbedding, toFloatArray(e.getEmbedding()))))
                            .filter(m -> m.similarity() >= SIMILARITY_THRESHOLD)
                            .sorted(Comparator.comparingDouble(ExperienceMatch::similarity).reversed())
                            .limit(limit)
                            .toList();
                }
                log.debug("No embedded experiences match the filters, falling back to keyword search");
            } catch (RestClientException e) {
                log.warn("Query embedding failed, falling back to keyword search: {}", e.getMessage());
            }
        }
        return keywordSearch(query, filterCriteria, limit);
    }

    @Override
    public List<ExperienceMatch> findSimilarTokens(Map<String, Object> characteristics, int limit) {
        List<String> parts = new ArrayList<>();
        characteristics.forEach((key, value) -> {
            if (value != null) parts.add(key + " " + value);
        });
        return search("Token with " + String.join(", ", parts), Map.of(), limit);
    }

    @Override
    public List<TradingExperience> findPatterns(PatternType type, int limit) {
        Criteria criteria = switch (type) {
            case PROFITABLE -> Criteria.where("wasProfitable").is(true);
            case LOSING -> Criteria.where("wasProfitable").is(false);
            case HIGH_PROFIT -> Criteria.where("profitPercentage").gte(HIGH_PROFIT_PCT);
            case QUICK_TRADES -> Criteria.where("holdTimeHours").lte(QUICK_TRADE_HOURS);
            case ALL -> new Criteria();
        };
        Query query = new Query(criteria).with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(limit);
        return mongoTemplate.find(query, TradingExperience.class);
    }

    @Override
    public Map<String, Object> stats() {
        long total = repository.count();
        long profitable = repository.countByWasProfitable(true);
        long losing = repository.countByWasProfitable(false);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_experiences", total);
        stats.put("profitable_trades", profitable);
        stats.put("losing_trades", losing);
        stats.put("win_rate", profitable + losing > 0 ? (double) profitable / (profitable + losing) : 0.0);
        stats.put("semantic_search", embeddingService.isConfigured());
        return stats;
    }

    /**
     * Generate and persist the embedding for an experience.
     * Called async after every store; failures leave it keyword-searchable only.
     */
    @Async("memoryTaskExecutor")
    public void embedExperienceAsync(String experienceId, String content) {
        try {
            List<Double> embedding = toDoubleList(embeddingService.embed(content));
            mongoTemplate.updateFirst(
                    new Query(Criteria.where("_id").is(experienceId)),
                    new Update().set("embedding", embedding),
                    TradingExperience.class);
            log.debug("Embedding stored for experience id={}", experienceId);
        } catch (RuntimeException e) {
            log.error("Failed to embed experience id={}", experienceId, e);
        }
    }

    // ─── Internals ──────────────────────────────────────────────────────────

    private List<ExperienceMatch> keywordSearch(String query, Criteria filterCriteria, int limit) {
        List<Criteria> terms = Arrays.stream(query.split("\\s+"))
                .filter(t -> t.length() >= 3)
                .map(t -> Criteria.where("content").regex(Pattern.quote(t), "i"))
                .toList();

        Criteria textCriteria = terms.isEmpty()
                ? new Criteria()
                : new Criteria().orOperator(terms.toArray(new Criteria[0]));

        Query keywordQuery = new Query(new Criteria().andOperator(textCriteria, filterCriteria))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(limit);
        return mongoTemplate.find(keywordQuery, TradingExperience.class).stream()
                .map(e -> new ExperienceMatch(e, null))
                .toList();
    }

    private Criteria metadataCriteria(Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) return new Criteria();
        List<Criteria> parts = filters.entrySet().stream()
                .map(f -> Criteria.where("metadata." + f.getKey()).is(f.getValue()))
                .toList();
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    static String describe(String tokenAddress, String symbol, Map<String, Object> tradingData, String reasoning) {
        StringBuilder sb = new StringBuilder()
                .append("Token: ").append(symbol != null ? symbol : "unknown")
                .append(" (").append(tokenAddress).append(")\n");
        tradingData.forEach((key, value) -> sb.append(key).append(": ").append(value).append('\n'));
        if (reasoning != null && !reasoning.isBlank()) {
            sb.append("Reasoning: ").append(reasoning);
        }
        return sb.toString();
    }

    private static Map<String, Object> scalarFields(Map<String, Object> tradingData) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        tradingData.forEach((key, value) -> {
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                metadata.put(key, value);
            }
        });
        return metadata;
    }

    private static Double number(Object... candidates) {
        for (Object c : candidates) {
            if (c instanceof Number n) return n.doubleValue();
            if (c instanceof String s && NUMERIC.matcher(s.trim()).matches()) return Double.parseDouble(s.trim());
        }
        return null;
    }

    private static String text(Object... candidates) {
        for (Object c : candidates) {
            if (c != null && !c.toString().isBlank()) return c.toString();
        }
        return null;
    }

    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        return (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static float[] toFloatArray(List<Double> list) {
        if (list == null) return new float[0];
        float[] arr = new float[list.size()];
        for (int i = 0; i < list.size(); i++) arr[i] = list.get(i).floatValue();
        return arr;
    }

    private static List<Double> toDoubleList(float[] arr) {
        List<Double> result = new ArrayList<>(arr.length);
        for (float f : arr) result.add((double) f);
        return result;
    }
}
