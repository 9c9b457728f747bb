package io.surfworks.accelforge.accelerator;

/**
 * State of the remote session of an {@link Accelerator}.
 */
public enum SessionState {
    /** No configuration accepted yet */
    UNCONFIGURED,

    /** A configuration was accepted; process() may be called */
    CONFIGURED,

    /** Accelerator was stopped */
    STOPPED
}
