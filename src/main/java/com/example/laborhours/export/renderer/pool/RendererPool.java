package com.example.laborhours.export.renderer.pool;

import com.example.laborhours.export.exception.ExportException;
import com.example.laborhours.export.exception.RendererCrashedException;
import com.example.laborhours.export.exception.RendererPoolExhaustedException;
import com.example.laborhours.export.exception.RendererTimeoutException;
import com.example.laborhours.export.model.RenderJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of renderer handles.
 *
 * At most {@code size} handles exist at once and each runs one job at a time.
 * Callers beyond that wait up to the acquire timeout, then fail with a
 * retryable {@link RendererPoolExhaustedException}. Handles are created lazily.
 * A handle whose job crashed, timed out or was abandoned is closed rather than
 * returned, and a fresh one is created on the next acquire.
 *
 * Jobs run on threads owned by the pool so the caller can stop waiting at the
 * deadline even when a converter ignores interruption.
 */
@Slf4j
public class RendererPool implements AutoCloseable {
    private final RendererFactory factory;
    private final int size;
    private final Duration acquireTimeout;
    private final Semaphore permits;
    private final Deque<RendererHandle> idle = new ConcurrentLinkedDeque<>();
    private final ExecutorService executor;
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger discarded = new AtomicInteger();
    private volatile boolean closed;

    public RendererPool(RendererFactory factory, int size, Duration acquireTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("Renderer pool size must be at least 1, got " + size);
        }
        this.factory = factory;
        this.size = size;
        this.acquireTimeout = acquireTimeout;
        this.permits = new Semaphore(size, true);
        this.executor = Executors.newFixedThreadPool(size, namedDaemonThreads(factory.getName()));
        log.info("Renderer pool '{}' ready: size={}, acquireTimeout={}", factory.getName(), size, acquireTimeout);
    }

    public RendererHandle acquire() throws InterruptedException {
        return acquire(acquireTimeout);
    }

    /**
     * Waits for a free handle.
     *
     * @throws RendererPoolExhaustedException if none became free in time
     * @throws InterruptedException if the caller was interrupted while waiting; no permit is held then
     */
    public RendererHandle acquire(Duration timeout) throws InterruptedException {
        if (closed) {
            throw new IllegalStateException("Renderer pool is closed");
        }
        if (!permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new RendererPoolExhaustedException(
                    "All " + size + " renderer(s) stayed busy for " + timeout.toMillis() + " ms");
        }
        RendererHandle handle = idle.pollFirst();
        if (handle != null) {
            return handle;
        }
        try {
            handle = factory.create();
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        created.incrementAndGet();
        log.debug("Created renderer handle {}", handle.getId());
        return handle;
    }

    /**
     * Returns a healthy handle to the pool.
     */
    public void release(RendererHandle handle) {
        if (closed) {
            handle.close();
        } else {
            idle.offerFirst(handle);
        }
        permits.release();
    }

    /**
     * Closes a handle that must not be reused and frees its slot for a fresh one.
     */
    public void discard(RendererHandle handle) {
        discarded.incrementAndGet();
        log.warn("Discarding renderer handle {}", handle.getId());
        try {
            handle.close();
        } finally {
            permits.release();
        }
    }

    /**
     * Acquires a handle, runs the job on it within the job's deadline, and
     * releases or discards the handle afterwards.
     */
    public byte[] render(RenderJob job) throws InterruptedException {
        RendererHandle handle = acquire();
        boolean healthy = false;
        try {
            byte[] result = runWithDeadline(handle, job);
            healthy = true;
            return result;
        } finally {
            if (healthy) {
                release(handle);
            } else {
                discard(handle);
            }
        }
    }

    private byte[] runWithDeadline(RendererHandle handle, RenderJob job) throws InterruptedException {
        Future<byte[]> future = executor.submit(() -> handle.render(job));
        Duration remaining = job.remaining();
        try {
            return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RendererTimeoutException("Rendering '" + job.getLabel() + "' did not finish before its deadline", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExportException) {
                throw (ExportException) cause;
            }
            throw new RendererCrashedException("Renderer " + handle.getId() + " failed on '" + job.getLabel() + "': " + cause, cause);
        }
    }

    public int getSize() {
        return size;
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    public int getIdleCount() {
        return idle.size();
    }

    public int getCreatedCount() {
        return created.get();
    }

    public int getDiscardedCount() {
        return discarded.get();
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdownNow();
        RendererHandle handle;
        while ((handle = idle.pollFirst()) != null) {
            handle.close();
        }
        log.info("Renderer pool '{}' closed", factory.getName());
    }

    private static ThreadFactory namedDaemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "renderer-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
