package io.surfworks.accelforge.host.provider;

/**
 * Provider-side status of a compute instance, normalized across providers.
 */
public enum InstanceStatus {
    /** Instance is being created or booted */
    PENDING,

    /** Instance is running */
    READY,

    /** Instance exists but is stopped or suspended */
    STOPPED,

    /** Provider reports an unrecoverable error */
    ERROR;

    /**
     * Returns true if waiting longer cannot make the instance ready.
     */
    public boolean isUnrecoverable() {
        return this == ERROR;
    }
}
