package com.deepansh.trader.action;

import com.deepansh.trader.model.ActionInvocation;
import com.deepansh.trader.model.ActionResult;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry and dispatcher for the closed set of trading actions.
 *
 * Spring injects every TradingAction bean; construction fails unless each
 * {@link ActionType} is covered exactly once, so the catalog the oracle sees
 * can never drift from the enum.
 *
 * Dispatch binds the oracle's raw arguments onto the action's input record,
 * validates them, and runs the action. Nothing escapes as an exception:
 * unknown names, bad arguments and action crashes all come back as
 * {@code ActionResult.failure} so the cycle keeps going and the oracle can react.
 */
@Component
@Slf4j
public class ActionCatalog {

    private final Map<ActionType, TradingAction<?>> actions = new EnumMap<>(ActionType.class);
    private final ObjectMapper argumentMapper;
    private final Validator validator;

    public ActionCatalog(List<TradingAction<?>> actionBeans, ObjectMapper objectMapper, Validator validator) {
        this.argumentMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = validator;

        actionBeans.forEach(action -> {
            TradingAction<?> previous = actions.put(action.getType(), action);
            if (previous != null) {
                throw new IllegalStateException("Duplicate implementation for action "
                        + action.getName() + ": " + previous.getClass().getSimpleName()
                        + " and " + action.getClass().getSimpleName());
            }
            // Fail at startup, not on the oracle's first call
            ActionSchemaGenerator.schemaFor(action.getInputType());
            log.info("Registered action: [{}] ({})", action.getName(), action.getType().category());
        });

        List<String> missing = Arrays.stream(ActionType.values())
                .filter(t -> !actions.containsKey(t))
                .map(ActionType::wireName)
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Actions without implementation: " + missing);
        }
        log.info("Total actions registered: {}", actions.size());
    }

    public List<ActionDefinition> getAllDefinitions() {
        return actions.values().stream()
                .sorted(Comparator.comparing(a -> a.getType().ordinal()))
                .map(ActionDefinition::from)
                .collect(Collectors.toList());
    }

    public ActionResult dispatch(ActionInvocation invocation, ActionContext context) {
        ActionType type = ActionType.fromWireName(invocation.getActionName()).orElse(null);

        if (type == null) {
            String msg = String.format("Unknown action '%s'. Available actions: %s",
                    invocation.getActionName(),
                    Arrays.stream(ActionType.values()).map(ActionType::wireName).toList());
            log.warn(msg);
            return ActionResult.failure(msg);
        }

        log.info("Executing action: [{}] with args: {} [cycle={}]",
                type.wireName(), invocation.getArguments(), context.getCycleNumber());
        return invoke(actions.get(type), invocation.getArguments(), context);
    }

    public boolean hasAction(String name) {
        return ActionType.fromWireName(name).isPresent();
    }

    public int actionCount() {
        return actions.size();
    }

    private <I> ActionResult invoke(TradingAction<I> action, Map<String, Object> arguments, ActionContext context) {
        I input;
        try {
            input = argumentMapper.convertValue(arguments != null ? arguments : Map.of(), action.getInputType());
        } catch (IllegalArgumentException e) {
            log.warn("Action [{}] rejected arguments: {}", action.getName(), e.getMessage());
            return ActionResult.failure("Invalid arguments for '" + action.getName() + "': "
                    + rootMessage(e));
        }

        Set<ConstraintViolation<I>> violations = validator.validate(input);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.warn("Action [{}] failed validation: {}", action.getName(), detail);
            return ActionResult.failure("Invalid arguments for '" + action.getName() + "': " + detail);
        }

        try {
            ActionResult result = action.execute(input, context);
            if (result == null) {
                return ActionResult.failure("Action '" + action.getName() + "' returned no result");
            }
            if (!result.isSuccess()) {
                log.warn("Action [{}] failed: {}", action.getName(), result.getError());
            }
            return result;
        } catch (Exception e) {
            log.error("Unexpected error in action [{}]", action.getName(), e);
            return ActionResult.failure("Action execution failed: " + e.getMessage());
        }
    }

    private String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String msg = root.getMessage();
        if (msg == null) return root.getClass().getSimpleName();
        int newline = msg.indexOf('\n');
        return newline > 0 ? msg.substring(0, newline) : msg;
    }
}
