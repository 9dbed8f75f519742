package com.deepansh.trader.action;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of an action's schema sent to the oracle.
 * Decouples the provider wire format from the TradingAction implementation.
 */
@Data
@Builder
public class ActionDefinition {

    private String name;
    private ActionCategory category;
    private String description;
    private Map<String, Object> inputSchema;

    public static ActionDefinition from(TradingAction<?> action) {
        return ActionDefinition.builder()
                .name(action.getName())
                .category(action.getType().category())
                .description(action.getDescription())
                .inputSchema(ActionSchemaGenerator.schemaFor(action.getInputType()))
                .build();
    }

    /**
     * OpenAI-compatible tool format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
