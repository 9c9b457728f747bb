package io.surfworks.accelforge.host;

/**
 * Exception thrown when a host instance never became ready.
 *
 * <p>Causes include provider errors, an instance ID the provider does not know, an instance
 * entering an error status, and the reachability timeout elapsing.
 */
public class ProvisioningException extends Exception {

    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProvisioningException(Throwable cause) {
        super(cause);
    }
}
