package com.realtime.messaging.gateway;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupSequencer")
class GroupSequencerTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("tasks for one group run one at a time in submission order")
    void serialPerGroup() throws Exception {
        GroupSequencer sequencer = new GroupSequencer(pool);
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            int n = i;
            futures.add(sequencer.submit("room:r1", () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(n);
                running.decrementAndGet();
            }));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(5, TimeUnit.SECONDS);

        assertEquals(1, maxRunning.get());
        for (int i = 0; i < 200; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    @DisplayName("different groups do not wait for each other")
    void groupsRunIndependently() throws Exception {
        GroupSequencer sequencer = new GroupSequencer(pool);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> blocked = sequencer.submit("room:slow", () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        CompletableFuture<Void> other = sequencer.submit("room:fast", () -> { });

        other.get(2, TimeUnit.SECONDS);
        assertFalse(blocked.isDone());
        release.countDown();
        blocked.get(2, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("a failing task completes exceptionally without stalling the lane")
    void failureDoesNotStall() throws Exception {
        GroupSequencer sequencer = new GroupSequencer(Runnable::run);

        CompletableFuture<Void> bad = sequencer.submit("room:r1", () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Void> good = sequencer.submit("room:r1", () -> { });

        assertTrue(bad.isCompletedExceptionally());
        assertNull(good.get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("a task may resubmit to its own group and runs after the current task")
    void nestedSubmitQueuesBehind() {
        GroupSequencer sequencer = new GroupSequencer(Runnable::run);
        List<String> order = new ArrayList<>();

        sequencer.submit("room:r1", () -> {
            order.add("outer-start");
            sequencer.submit("room:r1", () -> order.add("inner"));
            order.add("outer-end");
        });

        assertEquals(List.of("outer-start", "outer-end", "inner"), order);
    }

    @Test
    @DisplayName("submissions after shutdown are rejected")
    void rejectsAfterShutdown() {
        GroupSequencer sequencer = new GroupSequencer(Runnable::run);
        sequencer.shutdown();

        CompletableFuture<Void> f = sequencer.submit("room:r1", () -> { });

        ExecutionException e = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
    }

    @Test
    @DisplayName("idle lanes are released once their queue drains")
    void idleLanesReleased() {
        GroupSequencer sequencer = new GroupSequencer(Runnable::run);

        for (int i = 0; i < 10_000; i++) {
            sequencer.submit("room:r" + i, () -> { });
        }

        assertEquals(0, sequencer.activeLanes());
    }

    @Test
    @DisplayName("lanes are released under concurrent submission without losing tasks")
    void lanesReleasedConcurrently() throws Exception {
        GroupSequencer sequencer = new GroupSequencer(pool);
        AtomicInteger ran = new AtomicInteger();
        List<CompletableFuture<Void>> futures = Collections.synchronizedList(new ArrayList<>());

        ExecutorService submitters = Executors.newFixedThreadPool(4);
        try {
            for (int t = 0; t < 4; t++) {
                submitters.execute(() -> {
                    for (int i = 0; i < 500; i++) {
                        futures.add(sequencer.submit("room:r" + (i % 20), ran::incrementAndGet));
                    }
                });
            }
            submitters.shutdown();
            assertTrue(submitters.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            submitters.shutdownNow();
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get(5, TimeUnit.SECONDS);

        assertEquals(2000, ran.get());
        long deadline = System.currentTimeMillis() + 2000;
        while (sequencer.activeLanes() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, sequencer.activeLanes());
    }
}
