package io.surfworks.accelforge.host.provider;

import java.util.List;
import java.util.Optional;

/**
 * Service Provider Interface for cloud providers hosting accelerator instances.
 * One implementation per provider; selected by key through {@link ProviderRegistry}.
 *
 * <p>Adapters are responsible for:
 * <ul>
 *   <li>Creating, finding and listing compute instances</li>
 *   <li>Reporting normalized instance status and network address</li>
 *   <li>Terminating, pausing and resuming instances</li>
 * </ul>
 *
 * <p>Adapters never poll or wait; the {@code Host} state machine owns waiting.
 * Implementations must be thread-safe.
 */
public interface ProviderAdapter extends AutoCloseable {

    /**
     * Returns the provider key of this adapter (e.g., "openstack", "ovh").
     */
    String name();

    /**
     * Returns the capabilities of this adapter.
     */
    ProviderCapabilities capabilities();

    /**
     * Creates a new instance. Returns as soon as the provider accepted the request.
     *
     * @param spec what to create
     * @return reference to the new instance
     * @throws ProviderException if creation fails
     */
    InstanceRef create(HostSpec spec) throws ProviderException;

    /**
     * Looks up an existing instance.
     *
     * @param instanceId provider instance ID
     * @return the instance, or empty if the provider does not know it
     * @throws ProviderException if the lookup itself fails
     */
    Optional<InstanceRef> find(String instanceId) throws ProviderException;

    /**
     * Gets the current status of an instance.
     *
     * @throws ProviderException if status retrieval fails
     */
    InstanceStatus status(InstanceRef instance) throws ProviderException;

    /**
     * Gets the network address (IP or host name) of a running instance.
     *
     * @throws ProviderException if the instance has no usable address
     */
    String address(InstanceRef instance) throws ProviderException;

    /**
     * Terminates and deletes an instance.
     *
     * @throws ProviderException if termination fails
     */
    void terminate(InstanceRef instance) throws ProviderException;

    /**
     * Pauses an instance, keeping it for later reuse.
     * Adapters whose {@link ProviderCapabilities#supportsPause()} is false may terminate instead.
     *
     * @throws ProviderException if pausing fails
     */
    void pause(InstanceRef instance) throws ProviderException;

    /**
     * Starts a paused instance again.
     *
     * @throws ProviderException if the instance cannot be started
     */
    void resume(InstanceRef instance) throws ProviderException;

    /**
     * Lists instances whose name starts with the given prefix.
     *
     * @param namePrefix prefix to match, or null/empty for all instances
     * @throws ProviderException if listing fails
     */
    List<InstanceRef> list(String namePrefix) throws ProviderException;

    /**
     * Closes this adapter and releases any resources.
     */
    @Override
    void close();
}
