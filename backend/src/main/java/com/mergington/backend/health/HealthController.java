package com.mergington.backend.health;

import java.time.Clock;
import java.time.Instant;

import com.mergington.backend.modules.activity.application.ActivityRegistry;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes.
 */
@RestController
public class HealthController {

    private final ActivityRegistry activityRegistry;
    private final Clock clock;

    public HealthController(ActivityRegistry activityRegistry, Clock clock) {
        this.activityRegistry = activityRegistry;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    /**
     * Ready once the catalog has been loaded.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        boolean ready = activityRegistry.size() > 0;
        HealthResponse body = new HealthResponse(ready ? "UP" : "DOWN", Instant.now(clock).toString());
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    // kept for older probes
    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    public record HealthResponse(
        String status,   // "UP" | "DOWN"
        String timestamp // ISO-8601
    ) {}
}
