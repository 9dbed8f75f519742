package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.EmptyInput;
import com.deepansh.trader.cache.EphemeralCache;
import com.deepansh.trader.config.DataSourceProperties;
import com.deepansh.trader.market.DexScreenerClient;
import com.deepansh.trader.market.RugCheckClient;
import com.deepansh.trader.market.SocialDataClient;
import com.deepansh.trader.memory.ExperienceMemory;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.solana.SolanaRpcClient;
import com.deepansh.trader.solana.SolanaWallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health of every collaborator, from their passive success/failure records.
 * Spends no rate-limited calls.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CheckSystemStatusAction implements TradingAction<EmptyInput> {

    private final DexScreenerClient dexScreener;
    private final RugCheckClient rugCheck;
    private final SocialDataClient socialData;
    private final ExperienceMemory memory;
    private final EphemeralCache cache;
    private final SolanaWallet wallet;
    private final SolanaRpcClient rpcClient;
    private final DataSourceProperties dataSources;

    @Override
    public ActionType getType() {
        return ActionType.CHECK_SYSTEM_STATUS;
    }

    @Override
    public String getDescription() {
        return """
                Health of the data sources (DexScreener, RugCheck, TweetScout), the cache,
                trading memory and the wallet. Use it when actions start failing to see
                which source is degraded.
                """;
    }

    @Override
    public Class<EmptyInput> getInputType() {
        return EmptyInput.class;
    }

    @Override
    public ActionResult execute(EmptyInput input, ActionContext context) {
        List<Map<String, Object>> sources = List.of(
                dexScreener.getHealth().snapshot(true),
                rugCheck.getHealth().snapshot(true),
                socialData.getHealth().snapshot(dataSources.getTweetscout().isConfigured()));

        boolean degraded = sources.stream().anyMatch(s -> "degraded".equals(s.get("status")));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("overall_status", degraded ? "degraded" : "operational");
        payload.put("trading_mode", context.getTradingMode().wireName());
        payload.put("data_sources", sources);
        payload.put("cache", cache.stats());
        payload.put("memory", memoryStatus());
        payload.put("wallet_configured", wallet.isConfigured());
        payload.put("rpc_endpoint", rpcClient.endpoint());
        return ActionResult.ok(payload);
    }

    private Map<String, Object> memoryStatus() {
        try {
            Map<String, Object> status = new LinkedHashMap<>(memory.stats());
            status.put("status", "operational");
            return status;
        } catch (RuntimeException e) {
            log.warn("Trading memory unavailable: {}", e.getMessage());
            return Map.of("status", "unavailable", "error", String.valueOf(e.getMessage()));
        }
    }
}
