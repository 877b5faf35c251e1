package com.enterprise.taskdistribution.registry;

import com.enterprise.taskdistribution.core.AgentCapability;
import com.enterprise.taskdistribution.core.Capability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent mutations against a registry backed by a store
 */
class CapabilityRegistryConcurrencyTest {

    private RecordingStore store;
    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        store = new RecordingStore();
        registry = new CapabilityRegistry(store);
    }

    @Test
    @Timeout(value = 1, unit = TimeUnit.MINUTES)
    void testSlowSaveIsNotOverwrittenByOlderSnapshot() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            store.blockNextSave();
            Future<?> first = executor.submit(() ->
                registry.registerAgent("A1", List.of(AgentCapability.of(Capability.RESEARCH, 0.5))));
            assertTrue(store.saveStarted.await(10, TimeUnit.SECONDS));

            Future<?> second = executor.submit(() ->
                registry.registerAgent("A2", List.of(AgentCapability.of(Capability.TRANSLATION, 0.7))));
            while (registry.getAgentCount() < 2) {
                Thread.sleep(5);
            }
            try {
                second.get(200, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // Waiting behind the blocked save
            }

            store.releaseSave.countDown();
            first.get(10, TimeUnit.SECONDS);
            second.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }

        assertEquals(List.of("A1", "A2"), registry.getAgentIds());
        assertEquals(List.of("A1", "A2"), new ArrayList<>(store.lastSaved().keySet()));

        CapabilityRegistry restored = new CapabilityRegistry(store);
        assertEquals(List.of("A1", "A2"), restored.getAgentIds());
    }

    @Test
    @Timeout(value = 1, unit = TimeUnit.MINUTES)
    void testConcurrentRegistrationsPersistFinalState() throws Exception {
        int threadCount = 8;
        int agentsPerThread = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    for (int i = 0; i < agentsPerThread; i++) {
                        registry.registerAgent("agent-" + threadId + "-" + i,
                            List.of(AgentCapability.of(Capability.DATA_ANALYSIS, 0.5)));
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

        assertEquals(threadCount * agentsPerThread, registry.getAgentCount());
        assertEquals(registry.getAgentIds(), new ArrayList<>(store.lastSaved().keySet()));
    }

    /**
     * In-memory store that can hold one save until released
     */
    private static class RecordingStore implements CapabilityStore {
        private final List<Map<String, List<AgentCapability>>> saves = new CopyOnWriteArrayList<>();
        private final CountDownLatch saveStarted = new CountDownLatch(1);
        private final CountDownLatch releaseSave = new CountDownLatch(1);
        private volatile boolean blockNext;

        void blockNextSave() {
            blockNext = true;
        }

        Map<String, List<AgentCapability>> lastSaved() {
            return saves.isEmpty() ? Map.of() : saves.get(saves.size() - 1);
        }

        @Override
        public void saveAll(Map<String, List<AgentCapability>> profiles) {
            if (blockNext) {
                blockNext = false;
                saveStarted.countDown();
                try {
                    releaseSave.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            saves.add(new LinkedHashMap<>(profiles));
        }

        @Override
        public Map<String, List<AgentCapability>> loadAll() {
            return new LinkedHashMap<>(lastSaved());
        }

        @Override
        public void close() {
        }
    }
}
