package com.deepansh.trader.memory;

import com.deepansh.trader.action.input.PatternType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoExperienceMemoryTest {

    @Mock MongoTemplate mongoTemplate;
    @Mock TradingExperienceRepository repository;
    @Mock EmbeddingService embeddingService;

    private MongoExperienceMemory memory;

    @BeforeEach
    void setUp() {
        memory = new MongoExperienceMemory(mongoTemplate, repository, embeddingService);
    }

    private static TradingExperience experience(String id, List<Double> embedding) {
        return TradingExperience.builder().id(id).tokenSymbol(id).content("Token: " + id).embedding(embedding).build();
    }

    @Test
    void store_derivesOutcomeFieldsAndSkipsEmbeddingWhenUnconfigured() {
        when(embeddingService.isConfigured()).thenReturn(false);
        when(repository.save(any())).thenAnswer(inv -> {
            TradingExperience e = inv.getArgument(0);
            e.setId("exp-1");
            return e;
        });

        String id = memory.store("Mint111", Map.of(
                "tokenSymbol", "BONK", "trade_type", "sell", "profitPercentage", "35.5", "holdTimeHours", 1.5,
                "socials", List.of("twitter")), "took profit", "session-1");

        ArgumentCaptor<TradingExperience> saved = ArgumentCaptor.forClass(TradingExperience.class);
        verify(repository).save(saved.capture());
        TradingExperience e = saved.getValue();
        assertThat(id).isEqualTo("exp-1");
        assertThat(e.getTokenSymbol()).isEqualTo("BONK");
        assertThat(e.getTradeType()).isEqualTo("sell");
        assertThat(e.getProfitPercentage()).isEqualTo(35.5);
        assertThat(e.getWasProfitable()).isTrue();
        assertThat(e.getHoldTimeHours()).isEqualTo(1.5);
        assertThat(e.getContent()).contains("BONK").contains("Reasoning: took profit");
        assertThat(e.getMetadata()).containsKey("profitPercentage").doesNotContainKey("socials");
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    void store_withoutProfit_leavesOutcomeUnknown() {
        when(embeddingService.isConfigured()).thenReturn(false);
        when(repository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        memory.store("Mint111", Map.of("note", "watching"), null, null);

        ArgumentCaptor<TradingExperience> saved = ArgumentCaptor.forClass(TradingExperience.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getWasProfitable()).isNull();
        assertThat(saved.getValue().getTradeType()).isEqualTo("analysis");
    }

    @Test
    void search_withEmbeddings_ranksBySimilarityAndDropsBelowThreshold() {
        when(embeddingService.isConfigured()).thenReturn(true);
        when(embeddingService.embed("momentum play")).thenReturn(new float[]{1f, 0f});
        when(mongoTemplate.find(any(Query.class), eq(TradingExperience.class))).thenReturn(List.of(
                experience("CLOSE", List.of(0.9, 0.1)),
                experience("EXACT", List.of(1.0, 0.0)),
                experience("ORTHOGONAL", List.of(0.0, 1.0))));

        List<ExperienceMatch> matches = memory.search("momentum play", Map.of(), 5);

        assertThat(matches).extracting(m -> m.experience().getId()).containsExactly("EXACT", "CLOSE");
        assertThat(matches.get(0).similarity()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void search_embeddingCallFails_fallsBackToKeywords() {
        when(embeddingService.isConfigured()).thenReturn(true);
        when(embeddingService.embed(anyString())).thenThrow(new ResourceAccessException("timeout"));
        when(mongoTemplate.find(any(Query.class), eq(TradingExperience.class)))
                .thenReturn(List.of(experience("KW", null)));

        List<ExperienceMatch> matches = memory.search("rug pull", Map.of(), 5);

        assertThat(matches).singleElement().satisfies(m -> {
            assertThat(m.experience().getId()).isEqualTo("KW");
            assertThat(m.similarity()).isNull();
        });
    }

    @Test
    void search_unconfigured_usesKeywordQueryWithFilters() {
        when(embeddingService.isConfigured()).thenReturn(false);
        when(mongoTemplate.find(any(Query.class), eq(TradingExperience.class))).thenReturn(List.of());

        memory.search("high liquidity", Map.of("trade_type", "buy"), 3);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(TradingExperience.class));
        String rendered = query.getValue().getQueryObject().toJson();
        assertThat(rendered).contains("metadata.trade_type").contains("content");
        assertThat(query.getValue().getLimit()).isEqualTo(3);
    }

    @Test
    void findPatterns_highProfit_queriesProfitThreshold() {
        when(mongoTemplate.find(any(Query.class), eq(TradingExperience.class))).thenReturn(List.of());

        memory.findPatterns(PatternType.HIGH_PROFIT, 20);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(TradingExperience.class));
        assertThat(query.getValue().getQueryObject().toJson()).contains("profitPercentage").contains("$gte");
    }

    @Test
    void stats_computesWinRate() {
        when(repository.count()).thenReturn(10L);
        when(repository.countByWasProfitable(true)).thenReturn(3L);
        when(repository.countByWasProfitable(false)).thenReturn(1L);
        when(embeddingService.isConfigured()).thenReturn(true);

        Map<String, Object> stats = memory.stats();

        assertThat(stats).containsEntry("total_experiences", 10L).containsEntry("win_rate", 0.75);
    }

    @Test
    void embedExperienceAsync_writesEmbedding() {
        when(embeddingService.embed("content")).thenReturn(new float[]{0.5f, 0.25f});

        memory.embedExperienceAsync("exp-1", "content");

        verify(mongoTemplate).updateFirst(any(Query.class), any(Update.class), eq(TradingExperience.class));
    }

    @Test
    void cosineSimilarity_mismatchedLengths_isZero() {
        assertThat(MongoExperienceMemory.cosineSimilarity(new float[]{1f}, new float[]{1f, 0f})).isZero();
    }
}
