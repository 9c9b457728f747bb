package io.surfworks.accelforge.pool;

/**
 * States of a task submitted to an {@link AcceleratorPoolExecutor}.
 */
public enum TaskState {
    /** Waiting for an idle accelerator */
    QUEUED,

    /** Handed to an accelerator, not started yet */
    ASSIGNED,

    /** Accelerator is processing the task */
    RUNNING,

    /** Task returned a result */
    DONE,

    /** Task failed or timed out */
    FAILED,

    /** Task was cancelled */
    CANCELLED;

    /**
     * Returns true if the task handle is resolved.
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
