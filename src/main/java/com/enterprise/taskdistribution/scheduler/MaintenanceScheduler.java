package com.enterprise.taskdistribution.scheduler;

import com.enterprise.taskdistribution.memory.MemoryStore;
import it.sauronsoftware.cron4j.Scheduler;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Cron-driven housekeeping for a task scheduler.
 * <p>
 * Each run sweeps timed-out assignments, drains the backlog and applies the
 * memory store retention policy. The scheduler itself never starts threads;
 * this job is what drives its periodic work.
 */
public class MaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    public static final String DEFAULT_PATTERN = "* * * * *";

    private final TaskScheduler taskScheduler;
    private final MemoryStore memoryStore;
    private final String pattern;
    private final Scheduler cronScheduler;
    private String jobId;

    public MaintenanceScheduler(TaskScheduler taskScheduler, MemoryStore memoryStore, String pattern) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "Task scheduler is required");
        this.memoryStore = memoryStore;
        if (pattern == null || !SchedulingPattern.validate(pattern)) {
            throw new IllegalArgumentException("Invalid cron expression: " + pattern);
        }
        this.pattern = pattern;
        this.cronScheduler = new Scheduler();
        this.cronScheduler.setDaemon(true);
    }

    public MaintenanceScheduler(TaskScheduler taskScheduler, MemoryStore memoryStore) {
        this(taskScheduler, memoryStore, DEFAULT_PATTERN);
    }

    /**
     * Runs one maintenance pass on the calling thread
     */
    public MaintenanceRun runOnce() {
        int timedOut = taskScheduler.checkTaskTimeouts();
        int assigned = taskScheduler.processBacklog();
        int purged = memoryStore != null ? memoryStore.cleanupOldEntries() : 0;

        MaintenanceRun run = new MaintenanceRun(timedOut, assigned, purged);
        if (timedOut > 0 || assigned > 0 || purged > 0) {
            logger.info("Maintenance pass: {}", run);
        } else {
            logger.debug("Maintenance pass: nothing to do");
        }
        return run;
    }

    /**
     * Start running maintenance on the cron pattern
     */
    public synchronized void start() {
        if (cronScheduler.isStarted()) {
            return;
        }
        jobId = cronScheduler.schedule(pattern, () -> {
            try {
                runOnce();
            } catch (RuntimeException e) {
                logger.error("Error during scheduled maintenance", e);
            }
        });
        cronScheduler.start();
        logger.info("MaintenanceScheduler started with pattern: {}", pattern);
    }

    /**
     * Stop the cron scheduler
     */
    public synchronized void stop() {
        if (!cronScheduler.isStarted()) {
            return;
        }
        cronScheduler.deschedule(jobId);
        cronScheduler.stop();
        jobId = null;
        logger.info("MaintenanceScheduler stopped");
    }

    public boolean isRunning() {
        return cronScheduler.isStarted();
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Outcome of one maintenance pass
     */
    public static class MaintenanceRun {
        private final int timedOutAssignments;
        private final int backlogAssignments;
        private final int purgedRecords;

        public MaintenanceRun(int timedOutAssignments, int backlogAssignments, int purgedRecords) {
            this.timedOutAssignments = timedOutAssignments;
            this.backlogAssignments = backlogAssignments;
            this.purgedRecords = purgedRecords;
        }

        public int getTimedOutAssignments() { return timedOutAssignments; }
        public int getBacklogAssignments() { return backlogAssignments; }
        public int getPurgedRecords() { return purgedRecords; }

        @Override
        public String toString() {
            return "MaintenanceRun{" +
                    "timedOut=" + timedOutAssignments +
                    ", assigned=" + backlogAssignments +
                    ", purged=" + purgedRecords +
                    '}';
        }
    }
}
