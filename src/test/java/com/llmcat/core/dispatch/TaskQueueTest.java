package com.llmcat.core.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicIntegerArray;

import static org.junit.jupiter.api.Assertions.*;

class TaskQueueTest {

    @Test
    @DisplayName("claims tasks in index order until drained")
    void claimsInOrder() {
        var queue = new TaskQueue<>(List.of("a", "b"));

        var first = queue.claim();
        var second = queue.claim();

        assertEquals(0, first.index());
        assertEquals("a", first.task());
        assertEquals(1, second.index());
        assertEquals("b", second.task());
        assertNull(queue.claim());
        assertNull(queue.claim());
    }

    @Test
    @DisplayName("empty queue is drained from the start")
    void emptyQueue() {
        assertNull(new TaskQueue<>(List.of()).claim());
    }

    @Test
    @DisplayName("concurrent claimers receive every index exactly once")
    void concurrentClaimsAreUnique() throws InterruptedException {
        int n = 5_000;
        var tasks = new ArrayList<Integer>();
        for (int i = 0; i < n; i++) {
            tasks.add(i);
        }
        var queue = new TaskQueue<>(tasks);
        var visits = new AtomicIntegerArray(n);
        var start = new CountDownLatch(1);

        var threads = new ArrayList<Thread>();
        for (int t = 0; t < 8; t++) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                TaskQueue.Claim<Integer> claim;
                while ((claim = queue.claim()) != null) {
                    visits.incrementAndGet(claim.index());
                }
            });
            threads.add(thread);
            thread.start();
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        for (int i = 0; i < n; i++) {
            assertEquals(1, visits.get(i), "index " + i);
        }
    }
}
