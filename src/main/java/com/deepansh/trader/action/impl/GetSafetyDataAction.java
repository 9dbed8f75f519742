package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.TokenLookupInput;
import com.deepansh.trader.market.RugCheckClient;
import com.deepansh.trader.market.SourceData;
import com.deepansh.trader.model.ActionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GetSafetyDataAction implements TradingAction<TokenLookupInput> {

    private final RugCheckClient rugCheck;

    @Override
    public ActionType getType() {
        return ActionType.GET_SAFETY_DATA;
    }

    @Override
    public String getDescription() {
        return """
                Raw RugCheck safety report for one token: risk score, mint and freeze
                authority, holder count and top holders, LP providers and listed risks.
                """;
    }

    @Override
    public Class<TokenLookupInput> getInputType() {
        return TokenLookupInput.class;
    }

    @Override
    public ActionResult execute(TokenLookupInput input, ActionContext context) {
        SourceData report = rugCheck.getSafetyReport(input.tokenAddress());
        if (!report.available()) {
            return ActionResult.failure("Safety data unavailable: " + report.error());
        }
        return ActionResult.ok(GetComprehensiveTokenDataAction.section(report));
    }
}
