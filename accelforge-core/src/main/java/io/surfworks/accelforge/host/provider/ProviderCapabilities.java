package io.surfworks.accelforge.host.provider;

/**
 * Capabilities of a provider adapter.
 *
 * @param supportsPause  Whether {@link ProviderAdapter#pause} really suspends the instance.
 *                       When false, a PAUSE stop policy is carried out as a termination.
 * @param supportsResume Whether a paused instance can be started again when reused
 * @param supportsList   Whether instances can be enumerated
 */
public record ProviderCapabilities(
        boolean supportsPause,
        boolean supportsResume,
        boolean supportsList
) {

    /**
     * Capabilities of a provider able to pause, resume and list.
     */
    public static ProviderCapabilities full() {
        return new ProviderCapabilities(true, true, true);
    }

    /**
     * Capabilities of a provider that only supports terminate for teardown.
     */
    public static ProviderCapabilities terminateOnly() {
        return new ProviderCapabilities(false, true, true);
    }
}
