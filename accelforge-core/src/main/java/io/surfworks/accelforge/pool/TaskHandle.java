package io.surfworks.accelforge.pool;

import io.surfworks.accelforge.accelerator.ProcessResult;

import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle of a task submitted to an {@link AcceleratorPoolExecutor}.
 *
 * <p>Resolves to the process result, to an {@link ExecutionException} carrying the failure
 * ({@link java.util.concurrent.TimeoutException} when the job timeout elapsed), or to a
 * cancellation.
 *
 * <p>Cancelling a queued task removes it from the queue. Cancelling a running task resolves the
 * handle as cancelled right away; the remote work may go on and the accelerator stays busy until
 * it returns.
 */
public final class TaskHandle implements Future<ProcessResult> {

    private final PoolTask task;
    private final AcceleratorPoolExecutor pool;

    TaskHandle(PoolTask task, AcceleratorPoolExecutor pool) {
        this.task = task;
        this.pool = pool;
    }

    /**
     * Returns the submission sequence number, starting at 0 for the first submitted task.
     */
    public long sequence() {
        return task.sequence();
    }

    public TaskState state() {
        return task.state();
    }

    /**
     * Returns the index of the pool member the task was assigned to, if any.
     */
    public OptionalInt member() {
        int member = task.member();
        return member < 0 ? OptionalInt.empty() : OptionalInt.of(member);
    }

    /**
     * Returns a dependent future completing with this task.
     * Completing or cancelling it does not affect the task.
     */
    public CompletableFuture<ProcessResult> toCompletableFuture() {
        return task.future().copy();
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        return pool.cancel(task);
    }

    @Override
    public boolean isCancelled() {
        return task.future().isCancelled();
    }

    @Override
    public boolean isDone() {
        return task.future().isDone();
    }

    @Override
    public ProcessResult get() throws InterruptedException, ExecutionException {
        return task.future().get();
    }

    @Override
    public ProcessResult get(long timeout, TimeUnit unit)
            throws InterruptedException, ExecutionException, TimeoutException {
        return task.future().get(timeout, unit);
    }

    CompletableFuture<ProcessResult> future() {
        return task.future();
    }

    @Override
    public String toString() {
        return "TaskHandle[" + task.sequence() + ", " + task.state() + "]";
    }
}
