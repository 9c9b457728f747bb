package io.surfworks.accelforge.host;

/**
 * Lifecycle states of a {@link Host}.
 */
public enum HostState {
    /** Host constructed, no remote call made yet */
    NEW,

    /** Instance is being created, looked up or waited for */
    PROVISIONING,

    /** Instance is reachable at its network address */
    READY,

    /** Provisioning failed; only stop() remains meaningful */
    FAILED,

    /** Host was stopped */
    STOPPED;

    /**
     * Returns true if the host will not change state again except through stop().
     */
    public boolean isTerminal() {
        return this == FAILED || this == STOPPED;
    }
}
