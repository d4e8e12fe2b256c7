package com.whereq.foundry.controller;

import com.whereq.foundry.cache.JobCache;
import com.whereq.foundry.service.JobSupervisor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and cache status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private JobCache jobCache;

    @Autowired
    private JobSupervisor jobSupervisor;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is up and whether the job cache is active")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobCache.keyCounts()
                .map(keys -> {
                    Map<String, Object> health = baseHealth();

                    Map<String, Object> cacheInfo = new HashMap<>();
                    cacheInfo.put("mode", jobCache.getMode());
                    cacheInfo.put("keys", keys);
                    health.put("cache", cacheInfo);

                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = baseHealth();

                    Map<String, Object> cacheInfo = new HashMap<>();
                    cacheInfo.put("mode", jobCache.getMode());
                    cacheInfo.put("error", e.getMessage());
                    health.put("cache", cacheInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }

    private Map<String, Object> baseHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "whereq-foundry");
        health.put("runningJobs", jobSupervisor.runningCount());
        return health;
    }
}
