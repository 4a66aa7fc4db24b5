package com.newsvault.backend.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.newsvault.backend.config.PipelineProperties;
import com.newsvault.backend.dedup.DuplicateFilter;
import com.newsvault.backend.health.DependencyHealthRegistry;
import com.newsvault.backend.retention.RetentionException;
import com.newsvault.backend.retention.RetentionResult;
import com.newsvault.backend.retention.RetentionState;
import com.newsvault.backend.retention.RetentionSweeper;
import com.newsvault.backend.scraper.source.SourceRegistry;
import com.newsvault.backend.startup.CycleOrchestrator;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PipelineControllerTest {

    private CycleOrchestrator cycleOrchestrator;
    private RetentionSweeper retentionSweeper;
    private Executor executor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cycleOrchestrator = mock(CycleOrchestrator.class);
        retentionSweeper = mock(RetentionSweeper.class);
        executor = mock(Executor.class);
        SourceRegistry sourceRegistry = mock(SourceRegistry.class);
        when(sourceRegistry.getSources()).thenReturn(List.of());
        when(cycleOrchestrator.getLastCycle()).thenReturn(Optional.empty());
        when(retentionSweeper.getState()).thenReturn(RetentionState.IDLE);

        PipelineProperties properties = new PipelineProperties();
        PipelineController controller = new PipelineController(cycleOrchestrator, retentionSweeper,
                new DependencyHealthRegistry(Clock.systemUTC()), new DuplicateFilter(properties, Clock.systemUTC()),
                sourceRegistry, properties, executor);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void statusReportsPipelineState() throws Exception {
        mockMvc.perform(get("/api/pipeline/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycleRunning").value(false))
                .andExpect(jsonPath("$.retentionState").value("IDLE"))
                .andExpect(jsonPath("$.duplicateCacheCapacity").value(10000));
    }

    @Test
    void lastCycleIsEmptyBeforeFirstRun() throws Exception {
        mockMvc.perform(get("/api/pipeline/cycles/last"))
                .andExpect(status().isNoContent());
    }

    @Test
    void triggerStartsCycleInBackground() throws Exception {
        mockMvc.perform(post("/api/pipeline/cycles"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted").value(true));

        verify(executor).execute(any(Runnable.class));
    }

    @Test
    void triggerIsRejectedWhileCycleRuns() throws Exception {
        when(cycleOrchestrator.isCycleRunning()).thenReturn(true);

        mockMvc.perform(post("/api/pipeline/cycles"))
                .andExpect(status().isConflict());

        verify(executor, never()).execute(any(Runnable.class));
    }

    @Test
    void retentionValidatesHours() throws Exception {
        mockMvc.perform(post("/api/pipeline/retention").param("retentionHours", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void retentionRunsSweep() throws Exception {
        when(retentionSweeper.sweep(12)).thenReturn(RetentionResult.builder()
                .status(RetentionState.COMPLETED)
                .retentionHours(12)
                .deletedCount(5)
                .build());

        mockMvc.perform(post("/api/pipeline/retention").param("retentionHours", "12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.deletedCount").value(5));
    }

    @Test
    void concurrentRetentionIsConflict() throws Exception {
        when(retentionSweeper.sweep(24)).thenThrow(new RetentionException("A retention sweep is already running"));

        mockMvc.perform(post("/api/pipeline/retention"))
                .andExpect(status().isConflict());
    }
}
