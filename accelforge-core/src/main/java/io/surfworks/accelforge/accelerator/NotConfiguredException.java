package io.surfworks.accelforge.accelerator;

/**
 * Thrown when an accelerator is asked to process before it was configured with start().
 */
public class NotConfiguredException extends IllegalStateException {

    public NotConfiguredException(String message) {
        super(message);
    }
}
