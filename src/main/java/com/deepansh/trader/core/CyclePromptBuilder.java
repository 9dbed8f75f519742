package com.deepansh.trader.core;

import com.deepansh.trader.model.AgentState;
import com.deepansh.trader.model.Message;
import com.deepansh.trader.model.PortfolioMetrics;
import com.deepansh.trader.model.Position;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the two opening messages of a cycle: the standing system prompt and
 * the per-cycle context document (balance, positions, objectives).
 */
@Component
@Slf4j
public class CyclePromptBuilder {

    private static final String SYSTEM_PROMPT = """
            You are an autonomous trading agent for newly launched Solana tokens.
            You make every judgment yourself: which tokens to look at, whether they are safe,
            whether to trade, and how much. The actions you can call only fetch data,
            filter it mechanically, remember past trades and execute trades.

            Working method for a cycle:
            1. Check the portfolio and decide whether open positions need to be exited.
            2. Discover candidates, then narrow them down with filter_tokens and sort_tokens.
            3. Enrich the few most promising candidates with get_comprehensive_token_data.
            4. Consult memory (search_trading_history, find_similar_tokens) before committing.
            5. To trade: get_swap_quote first, then execute_trade with that quote.
            6. Save what you learned with save_trading_experience.

            Rules:
            - In dry_run mode always call execute_trade with dryRun=true. A live request is refused.
            - Never trade more than the available balance. Keep a cash reserve.
            - Missing data from one source is normal; decide with what is available.
            - If an action returns an error, do not repeat the identical call.
            - Finish the cycle with a short plain-text summary of what you did and why.
            """;

    private final ObjectMapper objectMapper;

    public CyclePromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<Message> openingMessages(AgentState state, long cycleNumber) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.builder().role(Message.Role.system).content(SYSTEM_PROMPT).build());
        messages.add(Message.builder().role(Message.Role.user).content(contextDocument(state, cycleNumber)).build());
        return messages;
    }

    String contextDocument(AgentState state, long cycleNumber) {
        PortfolioMetrics metrics = state.getPortfolioMetrics() != null
                ? state.getPortfolioMetrics()
                : new PortfolioMetrics();
        List<Position> positions = state.getActivePositions();
        long simulated = positions.stream().filter(Position::isSimulated).count();

        StringBuilder sb = new StringBuilder();
        sb.append("TRADING CYCLE ").append(cycleNumber).append("\n\n");
        sb.append("Portfolio:\n");
        sb.append("- Wallet balance: ").append(sol(state.getWalletBalanceSol())).append(" SOL\n");
        sb.append("- Open positions: ").append(positions.size());
        if (simulated > 0) sb.append(" (").append(simulated).append(" simulated)");
        sb.append('\n');
        sb.append("- Total portfolio value: ").append(sol(metrics.getTotalPortfolioValueSol())).append(" SOL\n");
        if (metrics.getSimulatedPositionValueSol() > 0) {
            sb.append("- Simulated position value: ").append(sol(metrics.getSimulatedPositionValueSol())).append(" SOL\n");
        }
        sb.append("- Cash allocation: ").append(String.format(Locale.ROOT, "%.1f", metrics.getCashAllocationPct())).append("%\n");
        sb.append("- Realized profit: ").append(sol(metrics.getRealizedProfitSol())).append(" SOL\n");
        sb.append("- Cycles completed: ").append(state.getCyclesCompleted()).append('\n');
        sb.append("- Strategy: ").append(state.getAiStrategy()).append('\n');
        sb.append("- Trading mode: ").append(state.getTradingMode().wireName()).append("\n\n");

        if (!positions.isEmpty()) {
            sb.append("Positions:\n").append(toJson(positions)).append("\n\n");
        }
        if (!state.getAgentParameters().isEmpty()) {
            sb.append("Parameters:\n").append(toJson(state.getAgentParameters())).append("\n\n");
        }

        sb.append("Objectives:\n");
        sb.append("1. Review open positions against their stop-loss and take-profit levels.\n");
        sb.append("2. Look for new opportunities if cash allows.\n");
        sb.append("3. Record lessons from any closed trade.\n");
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not render {} for the prompt: {}", value.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(value);
        }
    }

    private static String sol(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
