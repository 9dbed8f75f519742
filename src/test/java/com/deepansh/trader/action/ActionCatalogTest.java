package com.deepansh.trader.action;

import com.deepansh.trader.action.input.DiscoverTokensInput;
import com.deepansh.trader.action.input.DiscoveryStrategy;
import com.deepansh.trader.action.input.EmptyInput;
import com.deepansh.trader.model.ActionInvocation;
import com.deepansh.trader.model.ActionResult;
import com.deepansh.trader.model.AgentState;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
    private final AtomicReference<DiscoverTokensInput> lastDiscoverInput = new AtomicReference<>();

    private ActionCatalog catalog;
    private ActionContext context;

    @BeforeEach
    void setUp() {
        List<TradingAction<?>> actions = new ArrayList<>();
        for (ActionType type : ActionType.values()) {
            if (type == ActionType.DISCOVER_TOKENS) {
                actions.add(new StubAction<>(type, DiscoverTokensInput.class, input -> {
                    lastDiscoverInput.set(input);
                    return ActionResult.ok(Map.of("strategy", input.strategy().wireName()));
                }));
            } else if (type == ActionType.GET_WALLET_BALANCE) {
                actions.add(new StubAction<>(type, EmptyInput.class, input -> {
                    throw new IllegalStateException("rpc exploded");
                }));
            } else if (type == ActionType.GET_MARKET_OVERVIEW) {
                actions.add(new StubAction<>(type, EmptyInput.class, input -> null));
            } else {
                actions.add(new StubAction<>(type, EmptyInput.class, input -> ActionResult.ok(type.wireName())));
            }
        }
        catalog = new ActionCatalog(actions, objectMapper, validator);
        context = ActionContext.builder().state(new AgentState()).cycleNumber(1).build();
    }

    private static ActionInvocation call(String name, Map<String, Object> args) {
        return ActionInvocation.builder().id("call_1").actionName(name).arguments(args).build();
    }

    @Test
    void getAllDefinitions_coversEveryActionInEnumOrder() {
        List<ActionDefinition> definitions = catalog.getAllDefinitions();

        assertThat(definitions).extracting(ActionDefinition::getName)
                .containsExactlyElementsOf(Arrays.stream(ActionType.values()).map(ActionType::wireName).toList());
        assertThat(catalog.actionCount()).isEqualTo(16);
    }

    @Test
    void dispatch_unknownAction_returnsFailureListingCatalog() {
        ActionResult result = catalog.dispatch(call("launch_rocket", Map.of()), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("Unknown action 'launch_rocket'").contains("execute_trade");
    }

    @Test
    void dispatch_bindsWireEnumAndDefaults() {
        ActionResult result = catalog.dispatch(
                call("discover_tokens", Map.of("strategy", "boosted_top", "extraField", "ignored")), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(lastDiscoverInput.get().strategy()).isEqualTo(DiscoveryStrategy.BOOSTED_TOP);
        assertThat(lastDiscoverInput.get().effectiveLimit()).isEqualTo(20);
    }

    @Test
    void dispatch_missingRequiredArgument_failsValidation() {
        ActionResult result = catalog.dispatch(call("discover_tokens", Map.of("limit", 5)), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("Invalid arguments for 'discover_tokens'").contains("strategy");
    }

    @Test
    void dispatch_outOfRangeArgument_failsValidation() {
        ActionResult result = catalog.dispatch(
                call("discover_tokens", Map.of("strategy", "boosted_latest", "limit", 500)), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("limit");
    }

    @Test
    void dispatch_unbindableArgument_returnsFailure() {
        ActionResult result = catalog.dispatch(call("discover_tokens", Map.of("strategy", "moonshot")), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("Invalid arguments for 'discover_tokens'");
    }

    @Test
    void dispatch_actionThrows_isConvertedToFailure() {
        ActionResult result = catalog.dispatch(call("get_wallet_balance", null), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("rpc exploded");
    }

    @Test
    void dispatch_actionReturnsNull_isConvertedToFailure() {
        ActionResult result = catalog.dispatch(call("get_market_overview", Map.of()), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("returned no result");
    }

    @Test
    void construction_missingImplementation_fails() {
        List<TradingAction<?>> partial = List.of(
                new StubAction<>(ActionType.EXECUTE_TRADE, EmptyInput.class, input -> ActionResult.ok(null)));

        assertThatThrownBy(() -> new ActionCatalog(partial, objectMapper, validator))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("get_wallet_balance");
    }

    @Test
    void construction_duplicateImplementation_fails() {
        List<TradingAction<?>> duplicated = List.of(
                new StubAction<>(ActionType.EXECUTE_TRADE, EmptyInput.class, input -> ActionResult.ok(null)),
                new StubAction<>(ActionType.EXECUTE_TRADE, EmptyInput.class, input -> ActionResult.ok(null)));

        assertThatThrownBy(() -> new ActionCatalog(duplicated, objectMapper, validator))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate implementation");
    }

    private static final class StubAction<I> implements TradingAction<I> {
        private final ActionType type;
        private final Class<I> inputType;
        private final Function<I, ActionResult> body;

        StubAction(ActionType type, Class<I> inputType, Function<I, ActionResult> body) {
            this.type = type;
            this.inputType = inputType;
            this.body = body;
        }

        @Override
        public ActionType getType() {
            return type;
        }

        @Override
        public String getDescription() {
            return "stub " + type.wireName();
        }

        @Override
        public Class<I> getInputType() {
            return inputType;
        }

        @Override
        public ActionResult execute(I input, ActionContext context) {
            return body.apply(input);
        }
    }
}
