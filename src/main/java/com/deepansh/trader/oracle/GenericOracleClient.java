package com.deepansh.trader.oracle;

import com.deepansh.trader.action.ActionDefinition;
import com.deepansh.trader.exception.AgentException;
import com.deepansh.trader.exception.OracleConfigurationException;
import com.deepansh.trader.model.ActionInvocation;
import com.deepansh.trader.model.Message;
import com.deepansh.trader.model.OracleTurn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI-compatible chat-completions client: Groq, OpenAI, and Anthropic's
 * compatibility endpoint.
 *
 * Error mapping:
 *
 * | Error                    | Action                                          |
 * |--------------------------|-------------------------------------------------|
 * | 401 invalid key          | OracleConfigurationException (ends the session) |
 * | 400 model_decommissioned | OracleConfigurationException (ends the session) |
 * | 400 tool_use_failed      | Recover invocations from failed_generation XML  |
 * | 429                      | RuntimeException (retried)                      |
 * | other 4xx                | AgentException (not retried)                    |
 * | 5xx                      | RuntimeException (retried, counts as failure)   |
 * | network error            | ResourceAccessException (retried)               |
 */
@Slf4j
public class GenericOracleClient implements OracleClient {

    // Groq sometimes emits tool calls as XML in failed_generation, with or without parens:
    //   <function=discover_tokens({"strategy": "boosted_top"})</function>
    //   <function=discover_tokens{"strategy": "boosted_top"}></function>
    private static final Pattern GROQ_XML_CALL =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    private final OracleProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;

    public GenericOracleClient(OracleProviderProperties props,
                               ObjectMapper objectMapper,
                               String providerName,
                               RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeaders(h -> {
                    h.setBearerAuth(props.getApiKey() == null ? "" : props.getApiKey());
                    h.setContentType(MediaType.APPLICATION_JSON);
                })
                .build();
    }

    @Override
    public OracleTurn chat(List<Message> messages, List<ActionDefinition> actions) {
        ObjectNode request = buildRequest(messages, actions);

        log.debug("Invoking oracle [provider={}, model={}, messages={}, actions={}]",
                providerName, props.getModel(), messages.size(), actions.size());

        return restClient.post()
                .uri("/chat/completions")
                .body(request)
                .exchange((req, res) -> {
                    HttpStatusCode status = res.getStatusCode();
                    String raw = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    if (status.is2xxSuccessful()) {
                        return toTurn(objectMapper.readTree(raw));
                    }
                    log.error("Oracle call rejected [provider={}, status={}]: {}", providerName, status, raw);
                    if (status.is5xxServerError()) {
                        throw new RuntimeException(providerName + " server error [" + status + "]: " + raw);
                    }
                    return onClientError(status.value(), raw);
                });
    }

    /** 4xx: either a recoverable Groq formatting fault, or an exception */
    private OracleTurn onClientError(int status, String raw) {
        if (raw.contains("model_decommissioned")) {
            log.error("Model {} is no longer served by {}. Update oracle.providers.{}.model",
                    props.getModel(), providerName, providerName);
            throw new OracleConfigurationException(
                    "Model '" + props.getModel() + "' is decommissioned by " + providerName);
        }
        if (raw.contains("tool_use_failed")) {
            return recoverGroqCalls(raw);
        }
        if (status == 401) {
            throw new OracleConfigurationException(
                    providerName + " API key is invalid. Check oracle.providers." + providerName + ".api-key");
        }
        if (status == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded, will retry");
        }
        throw new AgentException(providerName + " client error [" + status + "]: " + raw);
    }

    /**
     * Groq rejects a generation whose tool calls came out as XML and echoes it
     * in error.failed_generation. Each call found there becomes an invocation.
     */
    private OracleTurn recoverGroqCalls(String raw) {
        String generation;
        try {
            generation = objectMapper.readTree(raw).path("error").path("failed_generation").asText("");
        } catch (JsonProcessingException e) {
            log.error("Unreadable tool_use_failed body from {}: {}", providerName, e.getMessage());
            return noActions();
        }
        if (generation.isBlank()) {
            log.warn("tool_use_failed without failed_generation, nothing to recover");
            return noActions();
        }

        List<ActionInvocation> recovered = new ArrayList<>();
        Matcher matcher = GROQ_XML_CALL.matcher(generation);
        while (matcher.find()) {
            try {
                recovered.add(ActionInvocation.builder()
                        .id("groq-recovered-" + UUID.randomUUID().toString().substring(0, 8))
                        .actionName(matcher.group(1))
                        .arguments(objectMapper.readValue(matcher.group(2), ARGUMENTS))
                        .build());
            } catch (JsonProcessingException e) {
                log.warn("Skipping unparseable recovered call [action={}]: {}", matcher.group(1), e.getMessage());
            }
        }

        if (recovered.isEmpty()) {
            log.warn("No action call found in failed_generation: {}", generation);
            return noActions();
        }
        log.info("Recovered {} action call(s) from tool_use_failed: {}", recovered.size(),
                recovered.stream().map(ActionInvocation::getActionName).toList());
        return OracleTurn.builder().invocations(recovered).build();
    }

    private OracleTurn noActions() {
        return OracleTurn.builder().content("Action formatting failed; no actions taken this turn.").build();
    }

    // ─── Request ────────────────────────────────────────────────────────────

    private ObjectNode buildRequest(List<Message> messages, List<ActionDefinition> actions) {
        ObjectNode request = objectMapper.createObjectNode()
                .put("model", props.getModel())
                .put("max_tokens", props.getMaxTokens())
                .put("temperature", props.getTemperature());

        ArrayNode wireMessages = request.putArray("messages");
        messages.forEach(m -> wireMessages.add(toWire(m)));

        if (!actions.isEmpty()) {
            ArrayNode tools = request.putArray("tools");
            actions.forEach(a -> tools.add(objectMapper.valueToTree(a.toOpenAiSchema())));
            request.put("tool_choice", "auto");
        }
        return request;
    }

    private ObjectNode toWire(Message msg) {
        ObjectNode node = objectMapper.createObjectNode().put("role", msg.getRole().name());
        switch (msg.getRole()) {
            case tool -> node.put("tool_call_id", msg.getToolCallId()).put("content", msg.getContent());
            case assistant -> {
                // Tool messages that follow are matched against these ids
                node.put("content", msg.getContent());
                if (msg.getInvocations() != null && !msg.getInvocations().isEmpty()) {
                    ArrayNode calls = node.putArray("tool_calls");
                    msg.getInvocations().forEach(inv -> calls.add(toWire(inv)));
                }
            }
            default -> node.put("content", msg.getContent() == null ? "" : msg.getContent());
        }
        return node;
    }

    private ObjectNode toWire(ActionInvocation invocation) {
        ObjectNode call = objectMapper.createObjectNode()
                .put("id", invocation.getId())
                .put("type", "function");
        call.putObject("function")
                .put("name", invocation.getActionName())
                .put("arguments", objectMapper.valueToTree(
                        invocation.getArguments() == null ? Map.of() : invocation.getArguments()).toString());
        return call;
    }

    // ─── Response ───────────────────────────────────────────────────────────

    private OracleTurn toTurn(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");
        log.debug("Oracle finish_reason [provider={}]: {}", providerName, choice.path("finish_reason").asText());

        // finish_reason can be "stop" even when tool_calls are present
        List<ActionInvocation> invocations = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            invocations.add(ActionInvocation.builder()
                    .id(call.path("id").asText(null))
                    .actionName(function.path("name").asText(null))
                    .arguments(toArguments(function.get("arguments")))
                    .build());
        }

        JsonNode usage = response.path("usage");
        return OracleTurn.builder()
                .content(message.path("content").isTextual() ? message.get("content").asText() : null)
                .invocations(invocations)
                .promptTokens(usage.path("prompt_tokens").asInt(0))
                .completionTokens(usage.path("completion_tokens").asInt(0))
                .build();
    }

    // Arguments arrive as a JSON string from most providers, as an object from some
    private Map<String, Object> toArguments(JsonNode raw) {
        if (raw == null || raw.isNull()) return Map.of();
        if (raw.isObject()) return objectMapper.convertValue(raw, ARGUMENTS);
        String text = raw.asText();
        if (text.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(text, ARGUMENTS);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to parse action arguments: " + text, e);
        }
    }
}
