package com.lorekeeper.core.memory;

import com.lorekeeper.core.access.AccessArbiter;
import com.lorekeeper.core.error.CanonVersionConflictException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.persistence.InMemoryMemoryStorage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many writers racing on one Canon key.
 */
class CanonConcurrencyTest {

    private final MemoryLayers layers =
            new MemoryLayers(new InMemoryMemoryStorage(), new AccessArbiter(), new EventBus());
    private final AgentHandle orchestrator = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "race");
    private final AgentHandle curator = AgentHandle.system("curator", AgentRole.CURATOR, "task-1");

    @Test
    void unconditionalWritersProduceContiguousVersions() throws Exception {
        int writers = 16;
        int perWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        var start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int id = w;
                futures.add(pool.submit((Callable<Void>) () -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        layers.writeCanon(CanonWrite.direct("facts/counter", id + ":" + i, 0.5), orchestrator);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        List<Long> versions = layers.canonHistory("facts/counter", curator).stream()
                .map(CanonEntry::version).toList();
        assertEquals(LongStream.rangeClosed(1, (long) writers * perWriter).boxed().toList(), versions);
    }

    @Test
    void conditionalWritersOnTheSameVersionHaveExactlyOneWinner() throws Exception {
        int writers = 12;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        var start = new CountDownLatch(1);
        var wins = new AtomicInteger();
        var conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int id = w;
                futures.add(pool.submit((Callable<Void>) () -> {
                    start.await();
                    try {
                        layers.writeCanon(new CanonWrite("facts/winner", "writer-" + id, 0.8, 0L, List.of()), curator);
                        wins.incrementAndGet();
                    } catch (CanonVersionConflictException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, wins.get());
        assertEquals(writers - 1, conflicts.get());
        assertEquals(1, layers.canonHistory("facts/winner", curator).size());
    }
}
