package com.newsvault.backend.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.newsvault.backend.persistence.PersistenceCoordinator;
import com.newsvault.backend.retention.RetentionException;
import com.newsvault.backend.retention.RetentionResult;
import com.newsvault.backend.retention.RetentionState;
import com.newsvault.backend.retention.RetentionSweeper;
import com.newsvault.backend.storage.index.VectorIndexException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationContext;

class MaintenanceCommandRunnerTest {

    private RetentionSweeper retentionSweeper;
    private PersistenceCoordinator persistenceCoordinator;
    private MaintenanceCommandRunner runner;

    @BeforeEach
    void setUp() {
        retentionSweeper = mock(RetentionSweeper.class);
        persistenceCoordinator = mock(PersistenceCoordinator.class);
        runner = new MaintenanceCommandRunner(retentionSweeper, persistenceCoordinator, mock(ApplicationContext.class));
    }

    @Test
    void noCommandKeepsServiceRunning() {
        assertEquals(MaintenanceCommandRunner.NO_COMMAND, runner.execute(new DefaultApplicationArguments()));
        verifyNoInteractions(retentionSweeper, persistenceCoordinator);
    }

    @Test
    void manualRetentionSweepsWithGivenHours() {
        when(retentionSweeper.sweep(48)).thenReturn(RetentionResult.builder().status(RetentionState.COMPLETED).deletedCount(12).build());

        assertEquals(0, runner.execute(new DefaultApplicationArguments("--retention-hours=48")));
        verify(retentionSweeper).sweep(48);
    }

    @Test
    void failedOrRejectedSweepExitsNonZero() {
        when(retentionSweeper.sweep(24)).thenReturn(RetentionResult.builder().status(RetentionState.FAILED).error("down").build());
        assertEquals(1, runner.execute(new DefaultApplicationArguments("--retention-hours=24")));

        when(retentionSweeper.sweep(24)).thenThrow(new RetentionException("A retention sweep is already running"));
        assertEquals(1, runner.execute(new DefaultApplicationArguments("--retention-hours=24")));
    }

    @Test
    void nonNumericHoursIsUsageError() {
        assertEquals(2, runner.execute(new DefaultApplicationArguments("--retention-hours=a-day")));
        verify(retentionSweeper, never()).sweep(anyInt());
    }

    @Test
    void clearAndRecreateIndex() {
        when(persistenceCoordinator.clearIndex()).thenReturn(7L);

        assertEquals(0, runner.execute(new DefaultApplicationArguments("--clear-index")));
        assertEquals(0, runner.execute(new DefaultApplicationArguments("--recreate-index")));
        verify(persistenceCoordinator).clearIndex();
        verify(persistenceCoordinator).recreateIndex();
    }

    @Test
    void indexCommandFailureExitsNonZero() {
        doThrow(new VectorIndexException("unreachable", null)).when(persistenceCoordinator).recreateIndex();

        assertEquals(1, runner.execute(new DefaultApplicationArguments("--recreate-index")));
    }
}
