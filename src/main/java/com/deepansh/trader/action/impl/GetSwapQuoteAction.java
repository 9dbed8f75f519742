package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.SwapQuoteInput;
import com.deepansh.trader.exception.DataSourceException;
import com.deepansh.trader.market.JupiterClient;
import com.deepansh.trader.model.ActionResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class GetSwapQuoteAction implements TradingAction<SwapQuoteInput> {

    private final JupiterClient jupiter;

    @Override
    public ActionType getType() {
        return ActionType.GET_SWAP_QUOTE;
    }

    @Override
    public String getDescription() {
        return """
                Jupiter swap quote. For a buy, inputMint is SOL and amountSol is the size.
                For a sell, inputMint is the token and amountRaw its amount in base units.
                Pass the returned 'quote' object unchanged as quoteData to execute_trade.
                """;
    }

    @Override
    public Class<SwapQuoteInput> getInputType() {
        return SwapQuoteInput.class;
    }

    @Override
    public ActionResult execute(SwapQuoteInput input, ActionContext context) {
        String inputMint = input.inputMint() != null && !input.inputMint().isBlank()
                ? input.inputMint()
                : JupiterClient.SOL_MINT;

        long amount;
        if (input.amountRaw() != null) {
            amount = input.amountRaw();
        } else if (input.amountSol() != null && JupiterClient.SOL_MINT.equals(inputMint)) {
            amount = JupiterClient.solToLamports(input.amountSol());
        } else {
            return ActionResult.failure("Quote needs amountSol when selling SOL, or amountRaw for any other input mint");
        }

        int slippageBps = input.slippageBps() != null ? input.slippageBps() : jupiter.getDefaultSlippageBps();

        JsonNode quote;
        try {
            quote = jupiter.getQuote(inputMint, input.outputMint(), amount, slippageBps);
        } catch (DataSourceException e) {
            return ActionResult.failure("Swap quote failed: " + e.getMessage());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("input_mint", inputMint);
        payload.put("output_mint", input.outputMint());
        payload.put("in_amount", quote.path("inAmount").asText(null));
        payload.put("out_amount", quote.path("outAmount").asText(null));
        payload.put("price_impact_pct", quote.path("priceImpactPct").asText(null));
        payload.put("slippage_bps", slippageBps);
        payload.put("quote", quote);
        return ActionResult.ok(payload);
    }
}
