package io.surfworks.accelforge.host;

/**
 * Point-in-time snapshot of a {@link Host}.
 *
 * @param hostType      provider key (may be null for an address-only host)
 * @param state         lifecycle state
 * @param identityKind  how the instance was found
 * @param instanceId    provider instance ID, null until known
 * @param address       network address, null until resolved
 * @param stopPolicy    default stop policy
 * @param ownsLifecycle whether stop() may terminate or pause the instance
 */
public record HostInfo(
        String hostType,
        HostState state,
        HostIdentity.Kind identityKind,
        String instanceId,
        String address,
        StopPolicy stopPolicy,
        boolean ownsLifecycle
) {
}
