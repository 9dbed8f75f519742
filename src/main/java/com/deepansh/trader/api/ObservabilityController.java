package com.deepansh.trader.api;

import com.deepansh.trader.observability.CycleTrace;
import com.deepansh.trader.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/traces/recent                 latest 50 cycle traces
 * GET /api/v1/traces/session/{sessionId}    traces of one session, newest cycle first
 * GET /api/v1/traces/analytics              last 24h latency, tokens, status breakdown
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/recent")
    public ResponseEntity<List<CycleTrace>> recent() {
        return ResponseEntity.ok(traceService.recent());
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<CycleTrace>> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(traceService.forSession(sessionId));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> analytics() {
        return ResponseEntity.ok(traceService.getAnalytics());
    }
}
