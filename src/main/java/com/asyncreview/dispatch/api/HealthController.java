package com.asyncreview.dispatch.api;

import com.asyncreview.core.session.SessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for the serve mode.
 */
@RestController
public class HealthController {

    private final SessionStore sessionStore;
    private final SseStreamingService sseStreamingService;

    public HealthController(SessionStore sessionStore, SseStreamingService sseStreamingService) {
        this.sessionStore = sessionStore;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * GET /health — Always UP while the server runs, with session and stream counts.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "UP");
        result.put("sessions", sessionStore.size());
        result.put("activeStreams", sseStreamingService.activeEmitterCount());
        return ResponseEntity.ok(result);
    }
}
