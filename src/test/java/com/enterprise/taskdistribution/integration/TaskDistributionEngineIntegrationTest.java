package com.enterprise.taskdistribution.integration;

import com.enterprise.taskdistribution.TaskDistributionEngine;
import com.enterprise.taskdistribution.TaskDistributionFactory;
import com.enterprise.taskdistribution.config.TaskDistributionConfig;
import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.SubTask;
import com.enterprise.taskdistribution.core.Task;
import com.enterprise.taskdistribution.core.TaskStatus;
import com.enterprise.taskdistribution.memory.MemoryRecord;
import com.enterprise.taskdistribution.memory.MemoryStore;
import com.enterprise.taskdistribution.monitoring.SchedulerHealthChecker;
import com.enterprise.taskdistribution.scheduler.MaintenanceScheduler;
import com.enterprise.taskdistribution.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end flows through the engine facade: composite tasks, failures,
 * timeouts and maintenance
 */
class TaskDistributionEngineIntegrationTest {

    @TempDir
    File tempDir;

    private MutableClock clock;
    private TaskDistributionEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        TaskDistributionConfig config = TaskDistributionConfig.builder()
            .schedulingConfig(new TaskDistributionConfig.SchedulingConfig(
                2, Duration.ofMinutes(5), Duration.ofMinutes(30), 2))
            .registryConfig(new TaskDistributionConfig.RegistryConfig(false, null))
            .memoryStoreConfig(new TaskDistributionConfig.MemoryStoreConfig(
                true, new File(tempDir, "memory.db").getAbsolutePath(), true, 30))
            .maintenanceConfig(new TaskDistributionConfig.MaintenanceConfig(false, "* * * * *"))
            .build();
        engine = TaskDistributionFactory.create(config, new SimpleMeterRegistry(), clock);
        engine.start();

        engine.registerAgent("architect", List.of(
            AgentCapability.of(Capability.CRITICAL_ANALYSIS, 0.9),
            AgentCapability.of(Capability.CODE_REVIEW, 0.8)));
        engine.registerAgent("developer", List.of(
            AgentCapability.of(Capability.CODE_GENERATION, 0.95),
            AgentCapability.of(Capability.CODE_REVIEW, 0.6)));
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    @Test
    void testCompositeTaskRunsToCompletion() {
        Task parent = engine.taskBuilder()
            .id("feature-42")
            .requiredCapabilities(Capability.CODE_GENERATION, Capability.CODE_REVIEW)
            .build();

        List<SubTask> subtasks = engine.submitCompositeTask(parent);
        assertEquals(3, subtasks.size());
        assertEquals(Duration.ofMinutes(30), subtasks.get(0).getTimeout());

        SubTask analysis = subtasks.get(0);
        assertEquals("architect", analysis.getAssignedAgent());
        assertTrue(engine.reportCompletion("architect", "feature-42_analysis", Map.of("plan", "done")));
        assertEquals(TaskStatus.COMPLETED, analysis.getStatus());

        SubTask implement = subtasks.get(1);
        assertEquals(TaskStatus.IN_PROGRESS, implement.getStatus());
        assertEquals("developer", implement.getAssignedAgent());
        assertTrue(engine.reportCompletion("developer", "feature-42_implement", null));

        SubTask test = subtasks.get(2);
        assertEquals(TaskStatus.IN_PROGRESS, test.getStatus());
        assertEquals("architect", test.getAssignedAgent());
        assertTrue(engine.reportCompletion("architect", "feature-42_test", null));

        assertTrue(engine.getDecomposer().getSubtasksForTask("feature-42").stream()
            .allMatch(subtask -> subtask.getStatus() == TaskStatus.COMPLETED));
        assertEquals(3, engine.getScheduler().getStatistics().getTotalTasksCompleted());
        assertEquals(0, engine.getScheduler().getActiveAssignmentCount());
    }

    @Test
    void testFailedSubtaskIsRetriedOnAnotherPass() {
        List<SubTask> subtasks = engine.submitCompositeTask(engine.taskBuilder()
            .id("bugfix")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .build());

        assertTrue(engine.reportFailure("architect", "bugfix_analysis", "context window exceeded", true));
        assertEquals(TaskStatus.PENDING, subtasks.get(0).getStatus());
        assertTrue(engine.getScheduler().isQueued("bugfix_analysis"));

        MaintenanceScheduler.MaintenanceRun run = engine.runMaintenance();

        assertEquals(1, run.getBacklogAssignments());
        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(0).getStatus());
        assertEquals("architect", subtasks.get(0).getAssignedAgent());
        assertEquals(1, engine.getScheduler().getAgentTasks("architect").get(0).getTask().getRetryCount());
    }

    @Test
    void testTimedOutTaskFailsAfterRetriesAreExhausted() {
        engine.submitTask(engine.taskBuilder()
            .id("slow")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .build());

        for (int attempt = 0; attempt <= 2; attempt++) {
            clock.advance(Duration.ofMinutes(31));
            engine.heartbeat("developer");
            engine.runMaintenance();
        }

        assertTrue(engine.getScheduler().getFailedTasks().containsKey("slow"));
        assertEquals(3, engine.getScheduler().getTaskHistory("slow").size());

        List<MemoryRecord> failures = engine.getMemoryStore().retrieve("slow", MemoryStore.KIND_TASK_FAILURE);
        assertEquals(1, failures.size());
        assertEquals("Task timed out", failures.get(0).getContent().get("reason"));
        assertEquals(2, failures.get(0).getContent().get("retry_count"));
    }

    @Test
    void testSilentAgentStopsReceivingWork() {
        clock.advance(Duration.ofMinutes(6));
        engine.heartbeat("architect");

        Optional<String> agent = engine.submitTask(engine.taskBuilder()
            .id("review")
            .requiredCapabilities(Capability.CODE_REVIEW)
            .build());

        assertEquals(Optional.of("architect"), agent);

        Optional<String> none = engine.submitTask(engine.taskBuilder()
            .id("generate")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .build());
        assertFalse(none.isPresent());

        SchedulerHealthChecker.HealthStatus health = engine.checkHealth();
        assertTrue(health.getCheck("agents.healthy_ratio").isPassed());
        assertEquals(1, engine.getScheduler().getStatistics().getBacklogSize());
    }
}
