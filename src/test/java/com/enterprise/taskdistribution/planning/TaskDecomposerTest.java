package com.enterprise.taskdistribution.planning;

import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.SubTask;
import com.enterprise.taskdistribution.core.Task;
import com.enterprise.taskdistribution.core.TaskImpl;
import com.enterprise.taskdistribution.core.TaskStatus;
import com.enterprise.taskdistribution.exception.ValidationException;
import com.enterprise.taskdistribution.memory.MapDBMemoryStore;
import com.enterprise.taskdistribution.memory.MemoryRecord;
import com.enterprise.taskdistribution.memory.MemoryStore;
import com.enterprise.taskdistribution.registry.CapabilityRegistry;
import com.enterprise.taskdistribution.scheduler.TaskScheduler;
import com.enterprise.taskdistribution.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decomposition, dependency gating and status tracking against a live scheduler
 */
class TaskDecomposerTest {

    private MutableClock clock;
    private CapabilityRegistry registry;
    private MemoryStore memoryStore;
    private TaskScheduler scheduler;
    private TaskDecomposer decomposer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new CapabilityRegistry();
        memoryStore = MapDBMemoryStore.inMemory(30, clock);
        scheduler = TaskScheduler.builder(registry)
            .memoryStore(memoryStore)
            .clock(clock)
            .build();
        decomposer = new TaskDecomposer(scheduler, memoryStore, clock);
    }

    @AfterEach
    void tearDown() {
        memoryStore.close();
    }

    private void registerFullStackAgent(String agentId) {
        registry.registerAgent(agentId, List.of(
            AgentCapability.of(Capability.CRITICAL_ANALYSIS, 0.8),
            AgentCapability.of(Capability.CODE_GENERATION, 0.9),
            AgentCapability.of(Capability.CODE_REVIEW, 0.7),
            AgentCapability.of(Capability.CODE_OPTIMIZATION, 0.6)));
        scheduler.updateAgentHealth(agentId);
    }

    private static Task codeTask(String id, Capability... capabilities) {
        return TaskImpl.builder()
            .id(id)
            .requiredCapabilities(capabilities)
            .build();
    }

    @Test
    void testCodeTaskDecomposition() {
        List<SubTask> subtasks = decomposer.decomposeTask(
            codeTask("P", Capability.CODE_GENERATION, Capability.CODE_REVIEW));

        assertEquals(List.of("P_analysis", "P_implement", "P_test"), ids(subtasks));

        SubTask analysis = subtasks.get(0);
        assertEquals(List.of(Capability.CRITICAL_ANALYSIS), analysis.getRequiredCapabilities());
        assertEquals(1, analysis.getStepNumber());
        assertTrue(analysis.getDependencies().isEmpty());
        assertEquals(1.728, analysis.getEstimatedComplexity(), 1e-9);
        assertEquals(TaskStatus.PENDING, analysis.getStatus());
        assertNull(analysis.getAssignedAgent());
        assertEquals("P", analysis.getParentTaskId());
        assertEquals("Analyze requirements and plan implementation approach", analysis.getDescription());

        SubTask implement = subtasks.get(1);
        assertEquals(List.of(Capability.CODE_GENERATION, Capability.CODE_REVIEW), implement.getRequiredCapabilities());
        assertEquals(List.of("P_analysis"), implement.getDependencies());

        SubTask test = subtasks.get(2);
        assertEquals(List.of(Capability.CODE_REVIEW), test.getRequiredCapabilities());
        assertEquals(List.of("P_implement"), test.getDependencies());
        assertEquals(3, test.getStepNumber());
    }

    @Test
    void testOptimizeStepAddedWhenRequested() {
        List<SubTask> subtasks = decomposer.decomposeTask(
            codeTask("P", Capability.CODE_GENERATION, Capability.CODE_OPTIMIZATION));

        assertEquals(List.of("P_analysis", "P_implement", "P_test", "P_optimize"), ids(subtasks));
        assertEquals(List.of(Capability.CODE_OPTIMIZATION), subtasks.get(3).getRequiredCapabilities());
        assertEquals(List.of("P_test"), subtasks.get(3).getDependencies());
    }

    @Test
    void testWritingTaskDecomposition() {
        List<SubTask> subtasks = decomposer.decomposeTask(
            codeTask("doc", Capability.TECHNICAL_WRITING, Capability.SUMMARIZATION));

        assertEquals(List.of("doc_research", "doc_outline", "doc_write", "doc_review"), ids(subtasks));
        assertEquals(List.of(Capability.RESEARCH), subtasks.get(0).getRequiredCapabilities());
        assertEquals(List.of(Capability.TECHNICAL_WRITING), subtasks.get(1).getRequiredCapabilities());
        assertEquals(List.of(Capability.TECHNICAL_WRITING, Capability.SUMMARIZATION),
                     subtasks.get(2).getRequiredCapabilities());
        assertEquals(List.of(Capability.CRITICAL_ANALYSIS), subtasks.get(3).getRequiredCapabilities());
    }

    @Test
    void testAnalysisTaskDecomposition() {
        List<SubTask> subtasks = decomposer.decomposeTask(codeTask("study", Capability.DATA_ANALYSIS));

        assertEquals(List.of("study_gather", "study_analyze", "study_synthesize", "study_report"), ids(subtasks));
        assertEquals(List.of(Capability.DATA_ANALYSIS), subtasks.get(1).getRequiredCapabilities());
        assertEquals(List.of(Capability.TECHNICAL_WRITING), subtasks.get(3).getRequiredCapabilities());
    }

    @Test
    void testGeneralTaskDecomposition() {
        List<SubTask> subtasks = decomposer.decomposeTask(codeTask("t", Capability.TRANSLATION));

        assertEquals(List.of("t_plan", "t_execute", "t_review"), ids(subtasks));
        assertEquals(List.of(Capability.TRANSLATION), subtasks.get(1).getRequiredCapabilities());
    }

    @Test
    void testSubtasksInheritParentAttributes() {
        Instant deadline = clock.instant().plus(Duration.ofHours(6));
        Task parent = TaskImpl.builder()
            .id("P")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .priority(2)
            .deadline(deadline)
            .timeout(Duration.ofMinutes(15))
            .maxRetries(5)
            .build();

        for (SubTask subtask : decomposer.decomposeTask(parent)) {
            assertEquals(2, subtask.getPriority());
            assertEquals(deadline, subtask.getDeadline());
            assertEquals(Duration.ofMinutes(15), subtask.getTimeout());
            assertEquals(5, subtask.getMaxRetries());
            assertEquals(0, subtask.getRetryCount());
            assertEquals("P", subtask.getMetadata().get(TaskDecomposer.METADATA_PARENT_TASK_ID));
            assertEquals(subtask.getStepNumber(), subtask.getMetadata().get(TaskDecomposer.METADATA_STEP_NUMBER));
        }
    }

    @Test
    void testDecomposingTwiceIsRejected() {
        decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION));

        assertThrows(ValidationException.class,
            () -> decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION)));
        assertEquals(3, decomposer.getSubtasksForTask("P").size());
    }

    @Test
    void testInvalidParentIsRejected() {
        assertThrows(ValidationException.class, () -> decomposer.decomposeTask(codeTask("P")));
        assertTrue(decomposer.getSubtasksForTask("P").isEmpty());
    }

    @Test
    void testOnlyReadySubtasksAreAssigned() {
        registerFullStackAgent("A1");
        List<SubTask> subtasks = decomposer.decomposeTask(
            codeTask("P", Capability.CODE_GENERATION, Capability.CODE_REVIEW));

        List<String> assigned = decomposer.assignSubtasks(subtasks);

        assertEquals(List.of("P_analysis"), assigned);
        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(0).getStatus());
        assertEquals("A1", subtasks.get(0).getAssignedAgent());
        assertEquals(TaskStatus.PENDING, subtasks.get(1).getStatus());
        assertEquals(TaskStatus.PENDING, subtasks.get(2).getStatus());
        assertFalse(scheduler.isQueued("P_implement"));

        // Assigning again is a no-op for subtasks already in progress
        assertTrue(decomposer.assignSubtasks(subtasks).isEmpty());
    }

    @Test
    void testCompletionCascadesToDependents() {
        registerFullStackAgent("A1");
        List<SubTask> subtasks = decomposer.decomposeTask(
            codeTask("P", Capability.CODE_GENERATION, Capability.CODE_REVIEW));
        decomposer.assignSubtasks(subtasks);

        assertTrue(scheduler.completeTask("A1", "P_analysis"));
        assertTrue(decomposer.updateSubtaskStatus("P_analysis", TaskStatus.COMPLETED));

        assertEquals(TaskStatus.COMPLETED, subtasks.get(0).getStatus());
        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(1).getStatus());
        assertEquals("A1", subtasks.get(1).getAssignedAgent());
        assertEquals(TaskStatus.PENDING, subtasks.get(2).getStatus());
        assertEquals(Optional.of("A1"), scheduler.getTaskAgent("P_implement"));
    }

    @Test
    void testUnknownSubtaskStatusUpdate() {
        assertFalse(decomposer.updateSubtaskStatus("missing", TaskStatus.COMPLETED));
        assertFalse(decomposer.isSubtask("missing"));
    }

    @Test
    void testUnplaceableSubtaskStaysPendingUntilBacklogDrains() {
        List<SubTask> subtasks = decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION));

        assertTrue(decomposer.assignSubtasks(subtasks).isEmpty());
        assertEquals(TaskStatus.PENDING, subtasks.get(0).getStatus());
        assertTrue(scheduler.isQueued("P_analysis"));

        registerFullStackAgent("A1");
        assertEquals(1, scheduler.processBacklog());

        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(0).getStatus());
        assertEquals("A1", subtasks.get(0).getAssignedAgent());
    }

    @Test
    void testRequeuedSubtaskReturnsToPending() {
        registerFullStackAgent("A1");
        Task parent = TaskImpl.builder()
            .id("P")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .timeout(Duration.ZERO)
            .build();
        List<SubTask> subtasks = decomposer.decomposeTask(parent);
        decomposer.assignSubtasks(subtasks);
        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(0).getStatus());

        assertEquals(1, scheduler.checkTaskTimeouts());

        assertEquals(TaskStatus.PENDING, subtasks.get(0).getStatus());
        assertNull(subtasks.get(0).getAssignedAgent());
        assertTrue(scheduler.isQueued("P_analysis"));
    }

    @Test
    void testPermanentFailureReturnsSubtaskToPending() {
        registerFullStackAgent("A1");
        Task parent = TaskImpl.builder()
            .id("P")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .maxRetries(0)
            .build();
        List<SubTask> subtasks = decomposer.decomposeTask(parent);
        decomposer.assignSubtasks(subtasks);

        assertTrue(scheduler.failTask("A1", "P_analysis", "model refused", true));

        assertEquals(TaskStatus.PENDING, subtasks.get(0).getStatus());
        assertTrue(scheduler.getFailedTasks().containsKey("P_analysis"));
    }

    @Test
    void testLaterPassKeepsRetryAttempt() {
        registerFullStackAgent("A1");
        Task parent = TaskImpl.builder()
            .id("P")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .timeout(Duration.ZERO)
            .maxRetries(2)
            .build();
        List<SubTask> subtasks = decomposer.decomposeTask(parent);
        decomposer.assignSubtasks(subtasks);

        assertEquals(1, scheduler.checkTaskTimeouts());
        assertEquals(List.of("P_analysis"), decomposer.assignSubtasks(subtasks));

        Task held = scheduler.getAgentTasks("A1").get(0).getTask();
        assertEquals(1, held.getRetryCount());
        assertEquals(2, held.getPriority());
        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(0).getStatus());

        assertEquals(1, scheduler.checkTaskTimeouts());
        assertEquals(List.of("P_analysis"), decomposer.assignSubtasks(subtasks));
        assertEquals(2, scheduler.getAgentTasks("A1").get(0).getTask().getRetryCount());

        assertEquals(1, scheduler.checkTaskTimeouts());
        assertTrue(scheduler.isFailed("P_analysis"));
        assertTrue(decomposer.assignSubtasks(subtasks).isEmpty());
        assertEquals(3, scheduler.getTaskHistory("P_analysis").size());
    }

    @Test
    void testPermanentlyFailedSubtaskIsNotReassigned() {
        registerFullStackAgent("A1");
        Task parent = TaskImpl.builder()
            .id("P")
            .requiredCapabilities(Capability.CODE_GENERATION)
            .maxRetries(0)
            .build();
        List<SubTask> subtasks = decomposer.decomposeTask(parent);
        decomposer.assignSubtasks(subtasks);
        scheduler.failTask("A1", "P_analysis", "model refused", true);

        assertTrue(decomposer.assignSubtasks(subtasks).isEmpty());

        assertEquals(Optional.empty(), scheduler.getTaskAgent("P_analysis"));
        assertTrue(scheduler.isFailed("P_analysis"));
        assertEquals(1, scheduler.getTaskHistory("P_analysis").size());
    }

    @Test
    void testRetryFailedTasksReassignsFailedSubtask() {
        registerFullStackAgent("A1");
        List<SubTask> subtasks = decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION));
        decomposer.assignSubtasks(subtasks);
        scheduler.failTask("A1", "P_analysis", "agent crashed", false);
        assertTrue(decomposer.assignSubtasks(subtasks).isEmpty());

        assertEquals(1, scheduler.retryFailedTasks());

        assertEquals(TaskStatus.IN_PROGRESS, subtasks.get(0).getStatus());
        assertEquals("A1", subtasks.get(0).getAssignedAgent());
        assertFalse(scheduler.isFailed("P_analysis"));
    }

    @Test
    void testCompletedSubtaskIsNotReset() {
        registerFullStackAgent("A1");
        List<SubTask> subtasks = decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION));
        decomposer.updateSubtaskStatus("P_analysis", TaskStatus.COMPLETED);

        decomposer.onTaskRequeued(subtasks.get(0), "late retry");

        assertEquals(TaskStatus.COMPLETED, subtasks.get(0).getStatus());
    }

    @Test
    void testProgressIsRecorded() {
        registerFullStackAgent("A1");
        List<SubTask> subtasks = decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION));
        clock.advance(Duration.ofSeconds(1));
        decomposer.assignSubtasks(subtasks);

        List<MemoryRecord> records = memoryStore.retrieve("P_analysis", MemoryStore.KIND_TASK_PROGRESS);
        assertEquals(2, records.size());
        assertEquals("in_progress", records.get(0).getContent().get("status"));
        assertEquals("A1", records.get(0).getContent().get("assigned_agent"));
        assertEquals("pending", records.get(1).getContent().get("status"));
        assertEquals(1, records.get(1).getContent().get("step_number"));
    }

    @Test
    void testLookups() {
        decomposer.decomposeTask(codeTask("P", Capability.CODE_GENERATION));

        assertTrue(decomposer.isSubtask("P_test"));
        assertFalse(decomposer.isSubtask("P"));
        assertEquals(2, decomposer.getSubtask("P_implement").get().getStepNumber());
        assertEquals(List.of("P_analysis", "P_implement", "P_test"), ids(decomposer.getSubtasksForTask("P")));
    }

    private static List<String> ids(List<SubTask> subtasks) {
        return subtasks.stream().map(SubTask::getId).collect(Collectors.toList());
    }
}
