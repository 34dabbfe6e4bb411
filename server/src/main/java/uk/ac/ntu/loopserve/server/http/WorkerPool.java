package uk.ac.ntu.loopserve.server.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed set of threads that run route handlers for the HTTP server.
 * <p>
 * When every worker is busy and the queue is full, the exchange goes to a single
 * overflow thread instead. Code running there sees {@link #shedding()} as {@code true}
 * and is expected to answer without doing the real work.
 */
public final class WorkerPool implements Executor, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final ThreadLocal<Boolean> SHEDDING = new ThreadLocal<>();

    private final BlockingQueue<Runnable> queue;
    private final ThreadPoolExecutor exec;
    private final ThreadPoolExecutor overflow;
    private final AtomicLong shed = new AtomicLong();

    public WorkerPool(int workers, int queueCapacity) {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1: " + queueCapacity);
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.exec = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                this.queue,
                new Named("loopserve-worker-"),
                new ThreadPoolExecutor.AbortPolicy() // reject when full
        );
        this.overflow = new ThreadPoolExecutor(
                1, 1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new Named("loopserve-overflow-")
        );
    }

    /**
     * True on the overflow thread while it runs a rejected exchange.
     */
    public static boolean shedding() {
        return Boolean.TRUE.equals(SHEDDING.get());
    }

    public int queued() {
        return queue.size();
    }

    public int capacity() {
        return queue.remainingCapacity() + queue.size();
    }

    public long shed() {
        return shed.get();
    }

    @Override
    public void execute(Runnable task) {
        try {
            exec.execute(task);
        } catch (RejectedExecutionException rej) {
            if (exec.isShutdown()) throw rej;
            long n = shed.incrementAndGet();
            log.warn("Workers saturated (queue {}/{}), shedding request #{}", queued(), capacity(), n);
            overflow.execute(() -> {
                SHEDDING.set(Boolean.TRUE);
                try {
                    task.run();
                } finally {
                    SHEDDING.remove();
                }
            });
        }
    }

    @Override
    public void close() {
        exec.shutdownNow();
        overflow.shutdownNow();
    }

    private static final class Named implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        Named(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
