package com.newsvault.backend.cli;

import com.newsvault.backend.persistence.PersistenceCoordinator;
import com.newsvault.backend.retention.RetentionException;
import com.newsvault.backend.retention.RetentionResult;
import com.newsvault.backend.retention.RetentionState;
import com.newsvault.backend.retention.RetentionSweeper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot maintenance commands. The process exits after running one.
 * <ul>
 *   <li>{@code --retention-hours=N} runs a single retention sweep</li>
 *   <li>{@code --clear-index} deletes every point from the vector index</li>
 *   <li>{@code --recreate-index} drops and recreates the vector index collection</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaintenanceCommandRunner implements ApplicationRunner {

    static final int NO_COMMAND = -1;

    private final RetentionSweeper retentionSweeper;
    private final PersistenceCoordinator persistenceCoordinator;
    private final ApplicationContext applicationContext;

    @Override
    public void run(ApplicationArguments args) {
        int exitCode = execute(args);
        if (exitCode != NO_COMMAND) {
            System.exit(SpringApplication.exit(applicationContext, () -> exitCode));
        }
    }

    int execute(ApplicationArguments args) {
        if (args.containsOption("retention-hours")) {
            return runRetention(args.getOptionValues("retention-hours"));
        }
        if (args.containsOption("clear-index")) {
            log.warn("🗑️ Clearing the vector index...");
            try {
                long removed = persistenceCoordinator.clearIndex();
                log.info("✅ Vector index cleared, {} points removed", removed);
                return 0;
            } catch (RuntimeException e) {
                log.error("❌ Failed to clear vector index: {}", e.getMessage(), e);
                return 1;
            }
        }
        if (args.containsOption("recreate-index")) {
            log.warn("🗑️ Recreating the vector index collection...");
            try {
                persistenceCoordinator.recreateIndex();
                log.info("✅ Vector index collection recreated");
                return 0;
            } catch (RuntimeException e) {
                log.error("❌ Failed to recreate vector index: {}", e.getMessage(), e);
                return 1;
            }
        }
        return NO_COMMAND;
    }

    private int runRetention(List<String> values) {
        int hours;
        try {
            hours = Integer.parseInt(values == null || values.isEmpty() ? "" : values.get(0).trim());
        } catch (NumberFormatException e) {
            log.error("❌ --retention-hours needs a whole number of hours, got {}", values);
            return 2;
        }

        try {
            RetentionResult result = retentionSweeper.sweep(hours);
            log.info("🧹 Manual retention finished: status={}, deleted={}, duration={}s",
                    result.getStatus(), result.getDeletedCount(), result.getDurationSeconds());
            return result.getStatus() == RetentionState.COMPLETED ? 0 : 1;
        } catch (RetentionException e) {
            log.error("❌ Manual retention rejected: {}", e.getMessage());
            return 1;
        }
    }
}
