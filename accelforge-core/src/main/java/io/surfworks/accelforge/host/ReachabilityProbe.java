package io.surfworks.accelforge.host;

import java.time.Duration;

/**
 * Low-level reachability check of a host address.
 */
@FunctionalInterface
public interface ReachabilityProbe {

    /**
     * Returns true if the address accepts connections.
     *
     * @param address host name or IP address
     * @param timeout maximum time a single attempt may take
     */
    boolean isReachable(String address, Duration timeout);
}
