package com.enterprise.taskdistribution.planning;

import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.SubTask;
import com.enterprise.taskdistribution.core.Task;
import com.enterprise.taskdistribution.core.TaskAssignment;
import com.enterprise.taskdistribution.core.TaskImpl;
import com.enterprise.taskdistribution.core.TaskStatus;
import com.enterprise.taskdistribution.core.TaskValidator;
import com.enterprise.taskdistribution.exception.PersistenceException;
import com.enterprise.taskdistribution.exception.ValidationException;
import com.enterprise.taskdistribution.memory.MemoryStore;
import com.enterprise.taskdistribution.scheduler.AssignmentListener;
import com.enterprise.taskdistribution.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Splits composite tasks into ordered chains of subtasks and feeds them to the
 * scheduler as their dependencies complete.
 * <p>
 * The decomposer never holds its lock while calling the scheduler. It also
 * listens to the scheduler so that subtasks assigned later from the backlog,
 * or put back on it, are reflected in their status.
 */
public class TaskDecomposer implements AssignmentListener {

    private static final Logger logger = LoggerFactory.getLogger(TaskDecomposer.class);

    public static final String METADATA_DESCRIPTION = "description";
    public static final String METADATA_PARENT_TASK_ID = "parent_task_id";
    public static final String METADATA_STEP_NUMBER = "step_number";

    private final TaskScheduler scheduler;
    private final MemoryStore memoryStore;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SubTask> subtasks = new LinkedHashMap<>();
    private final Set<String> inFlight = new HashSet<>();
    // Latest retry copy per subtask, as reported by the scheduler
    private final Map<String, Task> latestAttempts = new HashMap<>();

    public TaskDecomposer(TaskScheduler scheduler, MemoryStore memoryStore, Clock clock) {
        this.scheduler = scheduler;
        this.memoryStore = memoryStore;
        this.clock = clock;
        scheduler.addListener(this);
        logger.info("TaskDecomposer initialized");
    }

    public TaskDecomposer(TaskScheduler scheduler, MemoryStore memoryStore) {
        this(scheduler, memoryStore, Clock.systemUTC());
    }

    /**
     * Decomposes a task into its archetype's chain of subtasks.
     *
     * @return The subtasks in step order, each depending on the previous one
     * @throws ValidationException if the task is malformed or was already decomposed
     */
    public List<SubTask> decomposeTask(Task task) {
        TaskValidator.validate(task);

        List<Capability> parentCapabilities = task.getRequiredCapabilities();
        TaskArchetype archetype = TaskArchetype.classify(parentCapabilities);
        logger.info("Task {} identified as {} task", task.getId(), archetype);

        List<SubTask> created = new ArrayList<>();
        String previousId = null;
        int stepNumber = 1;
        for (StepTemplate step : DecompositionTemplates.stepsFor(archetype, parentCapabilities)) {
            SubTask subtask = createSubtask(task, step, stepNumber++, previousId);
            created.add(subtask);
            previousId = subtask.getId();
            logger.debug("Created subtask {} with complexity {}", subtask.getId(), subtask.getEstimatedComplexity());
        }

        lock.lock();
        try {
            for (SubTask subtask : created) {
                if (subtasks.containsKey(subtask.getId())) {
                    throw new ValidationException("taskId", "Task " + task.getId() + " has already been decomposed");
                }
            }
            created.forEach(subtask -> subtasks.put(subtask.getId(), subtask));
        } finally {
            lock.unlock();
        }

        for (SubTask subtask : created) {
            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("status", statusValue(subtask.getStatus()));
            progress.put("description", subtask.getDescription());
            progress.put("step_number", subtask.getStepNumber());
            progress.put("complexity", subtask.getEstimatedComplexity());
            progress.put("dependencies", subtask.getDependencies());
            recordProgress(subtask.getId(), progress);
        }

        logger.info("Task {} decomposed into {} subtasks", task.getId(), created.size());
        return List.copyOf(created);
    }

    /**
     * Submits every ready subtask to the scheduler, in step order.
     * <p>
     * A subtask is ready when it is pending, all of its dependencies are
     * completed and the scheduler does not hold it as permanently failed. A
     * subtask that was retried is submitted as its latest attempt, keeping its
     * retry count and raised priority. Subtasks the scheduler cannot place stay
     * pending.
     *
     * @return Ids of the subtasks assigned to an agent in this pass
     */
    public List<String> assignSubtasks(List<SubTask> candidates) {
        List<SubTask> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(SubTask::getStepNumber));

        List<String> assigned = new ArrayList<>();
        for (SubTask candidate : ordered) {
            if (scheduler.isFailed(candidate.getId())) {
                logger.info("Skipping assignment of {}, failed permanently", candidate.getId());
                continue;
            }

            SubTask subtask;
            Task attempt;
            lock.lock();
            try {
                subtask = subtasks.get(candidate.getId());
                if (subtask == null) {
                    logger.warn("Skipping unknown subtask {}", candidate.getId());
                    continue;
                }
                if (subtask.getStatus() != TaskStatus.PENDING || inFlight.contains(subtask.getId())) {
                    continue;
                }
                List<String> waitingOn = pendingDependencies(subtask);
                if (!waitingOn.isEmpty()) {
                    logger.info("Skipping assignment of {}, waiting for dependencies: {}", subtask.getId(), waitingOn);
                    continue;
                }
                inFlight.add(subtask.getId());
                attempt = latestAttempts.getOrDefault(subtask.getId(), subtask);
            } finally {
                lock.unlock();
            }

            Optional<String> agentId = Optional.empty();
            try {
                agentId = scheduler.assignTask(attempt);
            } catch (ValidationException e) {
                logger.warn("Scheduler rejected subtask {}: {}", subtask.getId(), e.getMessage());
            } finally {
                lock.lock();
                try {
                    inFlight.remove(subtask.getId());
                    if (agentId.isPresent() && subtask.getStatus() == TaskStatus.PENDING) {
                        subtask.setStatus(TaskStatus.IN_PROGRESS);
                        subtask.setAssignedAgent(agentId.get());
                    }
                } finally {
                    lock.unlock();
                }
            }

            if (agentId.isEmpty()) {
                // A concurrent backlog drain may have placed it while it was in flight
                String subtaskId = subtask.getId();
                scheduler.getTaskAgent(subtaskId).ifPresent(agent -> markAssignedFromBacklog(subtaskId, agent));
            }

            if (agentId.isPresent()) {
                assigned.add(subtask.getId());
                recordAssignment(subtask.getId(), agentId.get());
                logger.info("Assigned subtask {} to agent {}", subtask.getId(), agentId.get());
            } else {
                logger.warn("No suitable agent found for subtask {}", subtask.getId());
            }
        }
        return assigned;
    }

    /**
     * Updates a subtask's status. Completing a subtask submits the subtasks
     * that depend on it.
     *
     * @return false if the subtask is unknown
     */
    public boolean updateSubtaskStatus(String subtaskId, TaskStatus status) {
        SubTask subtask;
        TaskStatus previous;
        List<SubTask> dependents = new ArrayList<>();
        lock.lock();
        try {
            subtask = subtasks.get(subtaskId);
            if (subtask == null) {
                logger.warn("Attempted to update status of unknown subtask {}", subtaskId);
                return false;
            }
            previous = subtask.getStatus();
            subtask.setStatus(status);
            if (status == TaskStatus.COMPLETED) {
                for (SubTask other : subtasks.values()) {
                    if (other.getDependencies().contains(subtaskId)) {
                        dependents.add(other);
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("status", statusValue(status));
        progress.put("updated_at", clock.instant().toString());
        recordProgress(subtaskId, progress);
        logger.info("Updated subtask {} status: {} -> {}", subtaskId, previous, status);

        if (!dependents.isEmpty()) {
            logger.info("Found {} dependent subtasks to potentially assign", dependents.size());
            assignSubtasks(dependents);
        }
        return true;
    }

    public Optional<SubTask> getSubtask(String subtaskId) {
        lock.lock();
        try {
            return Optional.ofNullable(subtasks.get(subtaskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Subtasks of a parent task in step order
     */
    public List<SubTask> getSubtasksForTask(String parentTaskId) {
        lock.lock();
        try {
            return subtasks.values().stream()
                .filter(subtask -> subtask.getParentTaskId().equals(parentTaskId))
                .sorted(Comparator.comparingInt(SubTask::getStepNumber))
                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public boolean isSubtask(String taskId) {
        return getSubtask(taskId).isPresent();
    }

    @Override
    public void onTaskAssigned(TaskAssignment assignment) {
        markAssignedFromBacklog(assignment.getTaskId(), assignment.getAgentId());
    }

    private void markAssignedFromBacklog(String taskId, String agentId) {
        lock.lock();
        try {
            SubTask subtask = subtasks.get(taskId);
            // Direct submissions are tracked by assignSubtasks itself
            if (subtask == null || inFlight.contains(taskId) || subtask.getStatus() != TaskStatus.PENDING) {
                return;
            }
            subtask.setStatus(TaskStatus.IN_PROGRESS);
            subtask.setAssignedAgent(agentId);
        } finally {
            lock.unlock();
        }

        recordAssignment(taskId, agentId);
        logger.info("Subtask {} assigned from backlog to agent {}", taskId, agentId);
    }

    @Override
    public void onTaskRequeued(Task task, String reason) {
        if (resetToPending(task.getId(), task)) {
            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("status", statusValue(TaskStatus.PENDING));
            progress.put("requeued_reason", reason);
            progress.put("retry_count", task.getRetryCount());
            recordProgress(task.getId(), progress);
        }
    }

    @Override
    public void onTaskFailed(TaskAssignment assignment) {
        if (resetToPending(assignment.getTaskId(), assignment.getTask())) {
            Map<String, Object> progress = new LinkedHashMap<>();
            progress.put("status", statusValue(TaskStatus.PENDING));
            progress.put("failed", true);
            progress.put("failure_reason", assignment.getFailureReason());
            recordProgress(assignment.getTaskId(), progress);
        }
    }

    // Caller must hold the lock
    private List<String> pendingDependencies(SubTask subtask) {
        List<String> waitingOn = new ArrayList<>();
        for (String dependencyId : subtask.getDependencies()) {
            SubTask dependency = subtasks.get(dependencyId);
            if (dependency == null || dependency.getStatus() != TaskStatus.COMPLETED) {
                waitingOn.add(dependencyId);
            }
        }
        return waitingOn;
    }

    private boolean resetToPending(String taskId, Task attempt) {
        lock.lock();
        try {
            SubTask subtask = subtasks.get(taskId);
            if (subtask == null || subtask.getStatus() == TaskStatus.COMPLETED) {
                return false;
            }
            latestAttempts.merge(taskId, attempt,
                (known, reported) -> reported.getRetryCount() >= known.getRetryCount() ? reported : known);
            subtask.setStatus(TaskStatus.PENDING);
            subtask.setAssignedAgent(null);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private SubTask createSubtask(Task parent, StepTemplate step, int stepNumber, String previousId) {
        List<Capability> capabilities = step.selectCapabilities(parent.getRequiredCapabilities());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(METADATA_DESCRIPTION, step.getDescription());
        metadata.put(METADATA_PARENT_TASK_ID, parent.getId());
        metadata.put(METADATA_STEP_NUMBER, stepNumber);

        Task delegate = TaskImpl.builder()
            .id(parent.getId() + "_" + step.getSuffix())
            .requiredCapabilities(capabilities)
            .priority(parent.getPriority())
            .deadline(parent.getDeadline())
            .timeout(parent.getTimeout())
            .maxRetries(parent.getMaxRetries())
            .metadata(metadata)
            .createdAt(clock.instant())
            .build();

        double complexity = ComplexityEstimator.estimate(step.getDescription(), capabilities.size());
        List<String> dependencies = previousId != null ? List.of(previousId) : List.of();
        return new SubTask(delegate, parent.getId(), dependencies, stepNumber, complexity);
    }

    private void recordAssignment(String subtaskId, String agentId) {
        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("status", statusValue(TaskStatus.IN_PROGRESS));
        progress.put("assigned_agent", agentId);
        progress.put("assigned_at", clock.instant().toString());
        recordProgress(subtaskId, progress);
    }

    private void recordProgress(String subtaskId, Map<String, Object> progress) {
        if (memoryStore == null) {
            return;
        }
        try {
            memoryStore.store(subtaskId, MemoryStore.KIND_TASK_PROGRESS, progress);
        } catch (PersistenceException e) {
            logger.error("Failed to record progress for subtask {}", subtaskId, e);
        }
    }

    private static String statusValue(TaskStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
