package io.surfworks.accelforge.host.provider;

/**
 * Exception raised when a provider does not know the requested instance.
 */
public class InstanceNotFoundException extends ProviderException {

    private final String instanceId;

    public InstanceNotFoundException(String instanceId) {
        super("Instance not found: " + instanceId);
        this.instanceId = instanceId;
    }

    public String instanceId() {
        return instanceId;
    }
}
