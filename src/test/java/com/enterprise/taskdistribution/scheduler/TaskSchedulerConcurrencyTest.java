package com.enterprise.taskdistribution.scheduler;

import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.TaskAssignment;
import com.enterprise.taskdistribution.core.TaskImpl;
import com.enterprise.taskdistribution.registry.CapabilityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent submission and completion against a single scheduler
 */
class TaskSchedulerConcurrencyTest {

    private static final int AGENTS = 4;
    private static final int MAX_TASKS_PER_AGENT = 2;

    private CapabilityRegistry registry;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        scheduler = TaskScheduler.builder(registry)
            .maxTasksPerAgent(MAX_TASKS_PER_AGENT)
            .build();
        for (int i = 0; i < AGENTS; i++) {
            String agentId = "agent-" + i;
            registry.registerAgent(agentId, List.of(AgentCapability.of(Capability.CODE_GENERATION, 0.5 + i * 0.1)));
            scheduler.updateAgentHealth(agentId);
        }
    }

    @Test
    @Timeout(value = 1, unit = TimeUnit.MINUTES)
    void testConcurrentSubmissionRespectsCapacity() throws Exception {
        int threadCount = 8;
        int tasksPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger assigned = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    for (int i = 0; i < tasksPerThread; i++) {
                        boolean placed = scheduler.assignTask(TaskImpl.builder()
                            .id("task-" + threadId + "-" + i)
                            .requiredCapabilities(Capability.CODE_GENERATION)
                            .priority(1 + (i % 5))
                            .build()).isPresent();
                        if (placed) {
                            assigned.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }

            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        SchedulerStatistics stats = scheduler.getStatistics();
        assertEquals(threadCount * tasksPerThread, stats.getTotalTasksSubmitted());
        assertEquals(AGENTS * MAX_TASKS_PER_AGENT, assigned.get());
        assertEquals(AGENTS * MAX_TASKS_PER_AGENT, stats.getActiveAssignments());
        assertEquals(threadCount * tasksPerThread - AGENTS * MAX_TASKS_PER_AGENT, stats.getBacklogSize());
        stats.getActiveAssignmentsByAgent().values()
            .forEach(count -> assertTrue(count <= MAX_TASKS_PER_AGENT));
    }

    @Test
    @Timeout(value = 1, unit = TimeUnit.MINUTES)
    void testConcurrentCompletionDrainsEverything() throws Exception {
        int totalTasks = 200;
        for (int i = 0; i < totalTasks; i++) {
            scheduler.assignTask(TaskImpl.builder()
                .id("task-" + i)
                .requiredCapabilities(Capability.CODE_GENERATION)
                .build());
        }

        ExecutorService executor = Executors.newFixedThreadPool(AGENTS);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger capacityViolations = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int a = 0; a < AGENTS; a++) {
                String agentId = "agent-" + a;
                futures.add(executor.submit(() -> {
                    while (true) {
                        // Backlog first: once it is empty no agent can receive new work
                        boolean backlogEmpty = scheduler.getQueuedTasks().isEmpty();
                        List<TaskAssignment> held = scheduler.getAgentTasks(agentId);
                        if (held.size() > MAX_TASKS_PER_AGENT) {
                            capacityViolations.incrementAndGet();
                        }
                        if (backlogEmpty && held.isEmpty()) {
                            return null;
                        }
                        for (TaskAssignment assignment : held) {
                            if (scheduler.completeTask(agentId, assignment.getTaskId())) {
                                completed.incrementAndGet();
                            }
                        }
                        Thread.yield();
                    }
                }));
            }

            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(totalTasks, completed.get());
        assertEquals(0, capacityViolations.get());

        SchedulerStatistics stats = scheduler.getStatistics();
        assertEquals(totalTasks, stats.getTotalTasksCompleted());
        assertEquals(0, stats.getActiveAssignments());
        assertEquals(0, stats.getBacklogSize());
    }
}
