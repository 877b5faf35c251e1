package com.enterprise.taskdistribution.scheduler;

import com.enterprise.taskdistribution.core.Task;
import com.enterprise.taskdistribution.core.TaskAssignment;

/**
 * Callbacks for scheduler state transitions.
 * <p>
 * Invoked on the calling thread after the scheduler lock has been released.
 * Exceptions thrown by a listener are logged and do not affect the scheduler.
 */
public interface AssignmentListener {

    /**
     * A task was bound to an agent, either directly or from the backlog
     */
    default void onTaskAssigned(TaskAssignment assignment) {
    }

    /**
     * A failed or timed-out task was put back on the backlog for another attempt
     */
    default void onTaskRequeued(Task task, String reason) {
    }

    /**
     * A task failed permanently
     */
    default void onTaskFailed(TaskAssignment assignment) {
    }
}
