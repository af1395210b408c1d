package com.llmcat.core.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every task of a {@link TaskQueue} on {@code min(requested, taskCount)} workers.
 * <p>
 * With no tasks nothing happens. With one effective worker (or one task) the tasks
 * run serially on the calling thread and no thread is created. Otherwise that many
 * platform threads pull from the shared cursor until it is exhausted, which
 * balances uneven task costs without static partitioning. The caller waits for all
 * workers; there is no timeout and no cancellation. A handler failure ends only
 * its own worker, so the others still drain the queue, and is rethrown once every
 * worker has finished, the same as it propagates when the tasks run inline.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

    /**
     * Effective worker count for a run.
     */
    public static int effectiveWorkers(int requestedThreads, int taskCount) {
        return Math.max(0, Math.min(requestedThreads, taskCount));
    }

    /**
     * Drains the queue.
     *
     * @return number of threads spawned, 0 when the tasks ran on the calling thread
     */
    public <T> int execute(TaskQueue<T> queue, int requestedThreads, TaskHandler<T> handler) {
        int taskCount = queue.size();
        int workers = effectiveWorkers(requestedThreads, taskCount);

        if (workers == 0) {
            log.debug("No tasks to run");
            return 0;
        }

        if (workers == 1 || taskCount == 1) {
            log.debug("Running {} task(s) on the calling thread", taskCount);
            drain(queue, handler);
            return 0;
        }

        log.debug("Spawning {} workers for {} tasks", workers, taskCount);
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            var futures = new ArrayList<CompletableFuture<Void>>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(CompletableFuture.runAsync(() -> drain(queue, handler), executor));
            }

            Throwable failure = null;
            for (var future : futures) {
                try {
                    future.join();
                } catch (CompletionException e) {
                    log.error("Worker terminated unexpectedly", e.getCause());
                    if (failure == null) {
                        failure = e.getCause();
                    }
                }
            }
            if (failure != null) {
                rethrow(failure);
            }
        } finally {
            executor.shutdown();
        }
        return workers;
    }

    private static void rethrow(Throwable failure) {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new CompletionException(failure);
    }

    private static <T> void drain(TaskQueue<T> queue, TaskHandler<T> handler) {
        TaskQueue.Claim<T> claim;
        while ((claim = queue.claim()) != null) {
            handler.handle(claim.index(), claim.task());
        }
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_COUNTER.incrementAndGet();
        var counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, "llmcat-" + pool + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
