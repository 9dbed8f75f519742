package com.deepansh.trader.action.impl;

import com.deepansh.trader.action.ActionContext;
import com.deepansh.trader.action.ActionType;
import com.deepansh.trader.action.TradingAction;
import com.deepansh.trader.action.input.TokenLookupInput;
import com.deepansh.trader.market.SocialDataClient;
import com.deepansh.trader.market.SourceData;
import com.deepansh.trader.model.ActionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GetSocialDataAction implements TradingAction<TokenLookupInput> {

    private final SocialDataClient socialData;

    @Override
    public ActionType getType() {
        return ActionType.GET_SOCIAL_DATA;
    }

    @Override
    public String getDescription() {
        return """
                Social presence of one token: website and social links from DexScreener,
                plus matching Twitter accounts and recent tweets from TweetScout when configured.
                """;
    }

    @Override
    public Class<TokenLookupInput> getInputType() {
        return TokenLookupInput.class;
    }

    @Override
    public ActionResult execute(TokenLookupInput input, ActionContext context) {
        SourceData social = socialData.getSocialData(input.tokenAddress(), input.tokenSymbol());
        if (!social.available()) {
            return ActionResult.failure("Social data unavailable: " + social.error());
        }
        return ActionResult.ok(GetComprehensiveTokenDataAction.section(social));
    }
}
