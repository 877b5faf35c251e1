package com.enterprise.taskdistribution.scheduler;

import com.enterprise.taskdistribution.core.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Tasks waiting for an eligible agent, ordered by priority then arrival.
 * <p>
 * Not thread-safe; guarded by the owning scheduler's lock.
 */
class TaskBacklog {

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
        Comparator.comparingInt(Entry::getPriority).thenComparingLong(Entry::getSequence)
    );
    private final Map<String, Entry> entriesByTaskId = new HashMap<>();
    private long nextSequence = 0;

    /**
     * Adds a task behind every queued task of the same priority
     */
    Entry push(Task task) {
        remove(task.getId());
        Entry entry = new Entry(task, nextSequence++);
        queue.offer(entry);
        entriesByTaskId.put(task.getId(), entry);
        return entry;
    }

    /**
     * Puts a previously polled entry back in its original position
     */
    void pushBack(Entry entry) {
        queue.offer(entry);
        entriesByTaskId.put(entry.getTask().getId(), entry);
    }

    Entry poll() {
        Entry entry = queue.poll();
        if (entry != null) {
            entriesByTaskId.remove(entry.getTask().getId());
        }
        return entry;
    }

    boolean remove(String taskId) {
        Entry entry = entriesByTaskId.remove(taskId);
        return entry != null && queue.remove(entry);
    }

    boolean contains(String taskId) {
        return entriesByTaskId.containsKey(taskId);
    }

    int size() {
        return queue.size();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Queued tasks in the order they would be drained
     */
    List<Task> snapshot() {
        List<Entry> entries = new ArrayList<>(queue);
        entries.sort(queue.comparator());
        return entries.stream().map(Entry::getTask).collect(Collectors.toList());
    }

    static final class Entry {
        private final Task task;
        private final long sequence;

        private Entry(Task task, long sequence) {
            this.task = task;
            this.sequence = sequence;
        }

        Task getTask() { return task; }

        int getPriority() { return task.getPriority(); }

        long getSequence() { return sequence; }
    }
}
