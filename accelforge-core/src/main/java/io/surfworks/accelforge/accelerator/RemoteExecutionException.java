package io.surfworks.accelforge.accelerator;

/**
 * Exception thrown when the remote accelerator fails to configure or to process.
 *
 * <p>The failure concerns one call only; the accelerator stays usable and the caller may retry.
 */
public class RemoteExecutionException extends Exception {

    public RemoteExecutionException(String message) {
        super(message);
    }

    public RemoteExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public RemoteExecutionException(Throwable cause) {
        super(cause);
    }
}
