package com.deepansh.trader.api;

import com.deepansh.trader.action.ActionCatalog;
import com.deepansh.trader.action.ActionDefinition;
import com.deepansh.trader.core.BackgroundRunner;
import com.deepansh.trader.core.CycleOrchestrator;
import com.deepansh.trader.core.CycleOutcome;
import com.deepansh.trader.core.RunnerStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control surface of the agent. Mutates only through start, stop and a
 * foreground cycle; everything else is a read-only projection.
 *
 * POST /api/v1/agent/start    body: cycle parameters (optional) → 200, or 409 if a session is active
 * POST /api/v1/agent/stop
 * GET  /api/v1/agent/status
 * POST /api/v1/agent/cycle    body: parameter overrides (optional) → one synchronous cycle
 * GET  /api/v1/agent/health
 * GET  /api/v1/agent/actions  → capability catalog as sent to the oracle
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final BackgroundRunner runner;
    private final CycleOrchestrator orchestrator;
    private final ActionCatalog actionCatalog;

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody(required = false) Map<String, Object> params) {
        log.info("Start request [params={}]", params);

        if (!runner.start(params != null ? params : Map.of())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "started", false,
                    "error", "A trading session is already active or could not be launched"));
        }

        RunnerStatus status = runner.status();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("started", true);
        body.put("session_id", status.getSessionId());
        body.put("trading_mode", status.getTradingMode());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        boolean stopped = runner.stop();
        return ResponseEntity.ok(Map.of(
                "stopped", stopped,
                "message", stopped ? "Trading session stopped" : "Worker did not stop gracefully"));
    }

    @GetMapping("/status")
    public ResponseEntity<RunnerStatus> status() {
        return ResponseEntity.ok(runner.status());
    }

    @PostMapping("/cycle")
    public ResponseEntity<CycleSummary> runCycle(@RequestBody(required = false) Map<String, Object> overrides) {
        log.info("Foreground cycle request [overrides={}]", overrides);
        CycleOutcome outcome = orchestrator.runSingleCycle(overrides != null ? overrides : Map.of());
        return ResponseEntity.ok(CycleSummary.from(outcome));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        RunnerStatus status = runner.status();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("running", status.isRunning());
        body.put("state_healthy", status.isStateHealthy());
        body.put("trading_mode", status.getTradingMode());
        body.put("actions", actionCatalog.actionCount());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/actions")
    public ResponseEntity<List<Map<String, Object>>> actions() {
        return ResponseEntity.ok(actionCatalog.getAllDefinitions().stream()
                .map(ActionDefinition::toOpenAiSchema)
                .toList());
    }
}
