package io.surfworks.accelforge.pool;

import java.util.List;

/**
 * Exception thrown when a pool cannot be started.
 * The failure of every member that did not start is attached as a suppressed exception.
 */
public class PoolStartException extends Exception {

    private final List<Throwable> failures;

    public PoolStartException(String message, List<Throwable> failures) {
        super(message, failures.isEmpty() ? null : failures.get(0));
        this.failures = List.copyOf(failures);
        for (Throwable failure : this.failures) {
            addSuppressed(failure);
        }
    }

    /**
     * Returns the start failures, one per failed member.
     */
    public List<Throwable> failures() {
        return failures;
    }
}
