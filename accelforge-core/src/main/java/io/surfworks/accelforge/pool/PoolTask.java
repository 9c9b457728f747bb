package io.surfworks.accelforge.pool;

import io.surfworks.accelforge.accelerator.ProcessRequest;
import io.surfworks.accelforge.accelerator.ProcessResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Internal representation of a submitted task.
 *
 * <p>The future is the single source of truth for terminal states: it resolves exactly once,
 * with a result, a failure (including a timeout) or a cancellation.
 */
final class PoolTask {

    private final long sequence;
    private final ProcessRequest request;
    private final CompletableFuture<ProcessResult> future;
    private final AtomicReference<TaskState> progress;
    private volatile int member = -1;

    PoolTask(long sequence, ProcessRequest request) {
        this.sequence = sequence;
        this.request = request;
        this.future = new CompletableFuture<>();
        this.progress = new AtomicReference<>(TaskState.QUEUED);
    }

    long sequence() {
        return sequence;
    }

    ProcessRequest request() {
        return request;
    }

    CompletableFuture<ProcessResult> future() {
        return future;
    }

    TaskState state() {
        if (future.isCancelled()) {
            return TaskState.CANCELLED;
        }
        if (future.isCompletedExceptionally()) {
            return TaskState.FAILED;
        }
        if (future.isDone()) {
            return TaskState.DONE;
        }
        return progress.get();
    }

    int member() {
        return member;
    }

    boolean markAssigned(int memberIndex) {
        if (!future.isDone() && progress.compareAndSet(TaskState.QUEUED, TaskState.ASSIGNED)) {
            member = memberIndex;
            return true;
        }
        return false;
    }

    /**
     * Moves the task to RUNNING and arms its processing timeout.
     *
     * @return false if the task was resolved meanwhile and must not run
     */
    boolean markRunning() {
        if (future.isDone() || !progress.compareAndSet(TaskState.ASSIGNED, TaskState.RUNNING)) {
            return false;
        }
        if (request.timeout() != null) {
            future.orTimeout(request.timeout().toNanos(), TimeUnit.NANOSECONDS);
        }
        return true;
    }

    void complete(ProcessResult result) {
        future.complete(result);
    }

    void fail(Throwable error) {
        future.completeExceptionally(error);
    }

    boolean cancel() {
        return future.cancel(false);
    }

    @Override
    public String toString() {
        return "PoolTask[" + sequence + ", " + state() + "]";
    }
}
