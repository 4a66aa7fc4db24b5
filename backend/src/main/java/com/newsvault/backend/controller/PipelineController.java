package com.newsvault.backend.controller;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.dedup.DuplicateFilter;
import com.newsvault.backend.health.DependencyHealthRegistry;
import com.newsvault.backend.retention.RetentionException;
import com.newsvault.backend.retention.RetentionResult;
import com.newsvault.backend.retention.RetentionSweeper;
import com.newsvault.backend.scraper.source.SourceRegistry;
import com.newsvault.backend.startup.CycleOrchestrator;
import com.newsvault.backend.startup.CycleStats;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of pipeline state plus manual triggers.
 */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

    private final CycleOrchestrator cycleOrchestrator;
    private final RetentionSweeper retentionSweeper;
    private final DependencyHealthRegistry healthRegistry;
    private final DuplicateFilter duplicateFilter;
    private final SourceRegistry sourceRegistry;
    private final PipelineProperties properties;
    private final Executor generalTaskExecutor;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new HashMap<>();
        response.put("startupComplete", cycleOrchestrator.isStartupComplete());
        response.put("cycleRunning", cycleOrchestrator.isCycleRunning());
        response.put("lastCycle", cycleOrchestrator.getLastCycle().orElse(null));
        response.put("retentionState", retentionSweeper.getState());
        response.put("lastRetention", retentionSweeper.getLastResult());
        response.put("dependencies", healthRegistry.snapshot());
        response.put("duplicateCacheSize", duplicateFilter.size());
        response.put("duplicateCacheCapacity", duplicateFilter.getCapacity());
        response.put("sources", sourceRegistry.getSources().size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/cycles/last")
    public ResponseEntity<CycleStats> getLastCycle() {
        Optional<CycleStats> lastCycle = cycleOrchestrator.getLastCycle();
        return lastCycle.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/cycles")
    public ResponseEntity<Map<String, Object>> triggerCycle() {
        Map<String, Object> response = new HashMap<>();
        if (cycleOrchestrator.isCycleRunning()) {
            response.put("accepted", false);
            response.put("message", "A cycle is already running");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }

        log.info("🚀 Manual cycle triggered");
        CompletableFuture.runAsync(cycleOrchestrator::runCycle, generalTaskExecutor);
        response.put("accepted", true);
        response.put("message", "Cycle started");
        return ResponseEntity.accepted().body(response);
    }

    @PostMapping("/retention")
    public ResponseEntity<Map<String, Object>> triggerRetention(@RequestParam(required = false) Integer retentionHours) {
        int hours = retentionHours != null ? retentionHours : properties.getRetention().getRetentionHours();
        Map<String, Object> response = new HashMap<>();
        if (hours <= 0) {
            response.put("success", false);
            response.put("message", "retentionHours must be positive");
            return ResponseEntity.badRequest().body(response);
        }
        try {
            RetentionResult result = retentionSweeper.sweep(hours);
            response.put("success", result.getError() == null);
            response.put("result", result);
            return ResponseEntity.ok(response);
        } catch (RetentionException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
    }
}
