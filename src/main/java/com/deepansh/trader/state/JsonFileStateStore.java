package com.deepansh.trader.state;

import com.deepansh.trader.config.AgentProperties;
import com.deepansh.trader.exception.StateStoreException;
import com.deepansh.trader.model.AgentState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State document as one pretty-printed JSON file.
 *
 * Saves go to a sibling temp file that is then renamed over the target, so a
 * reader never sees a half-written document. Loads validate the document and
 * migrate it in memory when top-level fields are missing or null.
 */
@Component
@Slf4j
public class JsonFileStateStore implements StateStore {

    static final List<String> REQUIRED_FIELDS = List.of(
            "wallet_balance_sol", "active_positions", "portfolio_metrics", "agent_parameters",
            "trading_mode", "cycles_completed", "last_invoked_actions", "last_update_timestamp");

    private final Path file;
    private final ObjectMapper mapper;
    private final AgentStateFactory factory;

    @Autowired
    public JsonFileStateStore(AgentProperties props, ObjectMapper objectMapper, AgentStateFactory factory) {
        this(Path.of(props.getStateFile()), objectMapper, factory);
    }

    JsonFileStateStore(Path file, ObjectMapper objectMapper, AgentStateFactory factory) {
        this.file = file;
        this.factory = factory;
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<AgentState> load() {
        if (!Files.exists(file)) {
            log.info("No state file at {}, a new state will be created", file.toAbsolutePath());
            return Optional.empty();
        }

        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (!(root instanceof ObjectNode stored)) {
                log.error("State file {} is not a JSON object, ignoring it", file);
                return Optional.empty();
            }

            ObjectNode document = stored;
            if (!validate(document)) {
                log.warn("State file {} is missing fields, migrating", file);
                document = migrate(document);
            }

            AgentState state = mapper.treeToValue(document, AgentState.class);
            log.info("State loaded [cycles={}, balance={} SOL, positions={}, mode={}]",
                    state.getCyclesCompleted(), state.getWalletBalanceSol(),
                    state.positionCount(), state.getTradingMode());
            return Optional.of(state);

        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load state from {}: {}", file, e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public void save(AgentState state) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            mapper.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("State saved [cycles={}, file={}]", state.getCyclesCompleted(), file);

        } catch (IOException e) {
            throw new StateStoreException("Failed to save state to " + file, e);
        }
    }

    @Override
    public boolean validate(ObjectNode document) {
        return REQUIRED_FIELDS.stream().allMatch(f -> document.hasNonNull(f));
    }

    @Override
    public ObjectNode migrate(ObjectNode document) {
        ObjectNode defaults = mapper.valueToTree(factory.createInitial());
        ObjectNode migrated = document.deepCopy();

        Iterator<Map.Entry<String, JsonNode>> fields = defaults.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode current = migrated.get(field.getKey());
            boolean absent = current == null || (current.isNull() && !field.getValue().isNull());
            if (absent) {
                migrated.set(field.getKey(), field.getValue());
                log.info("Migrated state field '{}' from defaults", field.getKey());
            }
        }
        return migrated;
    }

    Path getFile() {
        return file;
    }
}
