package com.panwatch.core.concurrent;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One blocking I/O call running on a pool with a deadline fixed at submission.
 *
 * <p>Backed by a {@link FutureTask}, so a call that misses its deadline is cancelled with an
 * interrupt of the worker running it; a call still queued when it is cancelled never starts.
 * The deadline covers queueing time as well as execution.
 */
public final class BoundedCall<T> {

    private final FutureTask<T> task;
    private final long timeoutMs;
    private final long deadlineNanos;

    private BoundedCall(FutureTask<T> task, long timeoutMs) {
        this.task = task;
        this.timeoutMs = timeoutMs;
        this.deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    }

    /**
     * Hands {@code call} to {@code executor}.
     *
     * @throws RejectedExecutionException when the pool is saturated; nothing was started
     */
    public static <T> BoundedCall<T> submit(Executor executor, Callable<T> call, Duration timeout) {
        BoundedCall<T> bounded = new BoundedCall<>(new FutureTask<>(call), timeout.toMillis());
        executor.execute(bounded.task);
        return bounded;
    }

    /**
     * Waits for the result until the deadline. On timeout or interrupt the call is cancelled
     * and its worker interrupted before the exception propagates.
     *
     * @throws ExecutionException wrapping whatever the call threw
     */
    public T await() throws TimeoutException, ExecutionException, InterruptedException {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return task.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            task.cancel(true);
            throw e;
        }
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public boolean isCancelled() {
        return task.isCancelled();
    }
}
