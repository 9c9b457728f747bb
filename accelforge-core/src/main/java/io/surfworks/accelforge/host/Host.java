package io.surfworks.accelforge.host;

import io.surfworks.accelforge.host.provider.HostSpec;
import io.surfworks.accelforge.host.provider.InstanceNotFoundException;
import io.surfworks.accelforge.host.provider.InstanceRef;
import io.surfworks.accelforge.host.provider.InstanceStatus;
import io.surfworks.accelforge.host.provider.ProviderAdapter;
import io.surfworks.accelforge.host.provider.ProviderException;
import io.surfworks.accelforge.host.provider.ProviderRegistry;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lifecycle of one remote accelerator host.
 *
 * <p>Depending on its {@link HostIdentity}, a host creates an instance, reuses an instance by ID,
 * or only talks to a running host at a known address. In the last case the host never calls the
 * provider and {@link #stop} cannot terminate or pause anything.
 *
 * <p>{@link #ensureReady} and {@link #stop} are serialized on one lock. A stop requested while
 * provisioning wakes the readiness wait up, which then fails, and the stop proceeds with the
 * partially created instance.
 *
 * <pre>{@code
 * try (Host host = Host.create(HostParameters.builder().hostType("ovh").build(config))) {
 *     String address = host.ensureReady();
 *     ...
 * }
 * }</pre>
 */
public final class Host implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(Host.class.getName());
    private static final Duration MAX_PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final HostParameters parameters;
    private final ProviderAdapter provider;
    private final boolean closeProvider;
    private final ReachabilityProbe probe;
    private final ReentrantLock lock = new ReentrantLock();
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile HostState state = HostState.NEW;
    private volatile InstanceRef instance;
    private volatile String address;
    private volatile ProvisioningException failure;
    private boolean released;
    private boolean keepWarned;
    private Thread exitHook;

    /**
     * Creates a host using the given provider adapter and reachability probe.
     * The adapter is not closed by this host.
     *
     * @param parameters resolved host parameters
     * @param provider   provider adapter; may be null only for an address-only host
     * @param probe      reachability probe
     */
    public Host(HostParameters parameters, ProviderAdapter provider, ReachabilityProbe probe) {
        this(parameters, provider, probe, false);
    }

    private Host(HostParameters parameters, ProviderAdapter provider, ReachabilityProbe probe,
                 boolean closeProvider) {
        this.parameters = Objects.requireNonNull(parameters, "parameters cannot be null");
        this.probe = Objects.requireNonNull(probe, "probe cannot be null");
        if (provider == null && parameters.ownsLifecycle()) {
            throw new IllegalArgumentException("A provider is required for host identity " +
                    parameters.identity().kind());
        }
        this.provider = provider;
        this.closeProvider = closeProvider;
    }

    /**
     * Creates a host with the registered adapter for its host type and a TCP probe on the
     * configured port. The adapter is closed with the host.
     */
    public static Host create(HostParameters parameters) {
        ProviderAdapter adapter = parameters.ownsLifecycle()
                ? ProviderRegistry.create(parameters.providerSettings())
                : null;
        return new Host(parameters, adapter, new TcpReachabilityProbe(parameters.port()), true);
    }

    public HostParameters parameters() {
        return parameters;
    }

    public HostState state() {
        return state;
    }

    public boolean ownsLifecycle() {
        return parameters.ownsLifecycle();
    }

    /**
     * Returns the network address once the host is ready.
     */
    public Optional<String> address() {
        return Optional.ofNullable(address);
    }

    /**
     * Returns the provider instance ID, when known.
     */
    public Optional<String> instanceId() {
        InstanceRef ref = instance;
        if (ref != null) {
            return Optional.of(ref.id());
        }
        if (parameters.identity().kind() == HostIdentity.Kind.INSTANCE_ID) {
            return Optional.of(parameters.identity().value());
        }
        return Optional.empty();
    }

    public HostInfo info() {
        return new HostInfo(
                parameters.hostType(),
                state,
                parameters.identity().kind(),
                instanceId().orElse(null),
                address,
                parameters.stopPolicy(),
                parameters.ownsLifecycle()
        );
    }

    /**
     * Waits for the host with the configured provisioning timeout.
     *
     * @see #ensureReady(Duration)
     */
    public String ensureReady() throws ProvisioningException {
        return ensureReady(parameters.provisioningTimeout());
    }

    /**
     * Creates or finds the instance if needed and waits until it is reachable.
     * Returns immediately once the host is ready.
     *
     * @param timeout maximum time to wait
     * @return the network address of the host
     * @throws ProvisioningException if the instance cannot be created or found, enters an error
     *                               status, or is not reachable within the timeout
     * @throws IllegalStateException if the host was stopped
     */
    public String ensureReady(Duration timeout) throws ProvisioningException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        lock.lock();
        try {
            switch (state) {
                case READY:
                    return address;
                case FAILED:
                    throw new ProvisioningException("Host provisioning already failed", failure);
                case STOPPED:
                    throw new IllegalStateException("Host is stopped");
                default:
                    break;
            }

            state = HostState.PROVISIONING;
            try {
                String resolved = provision(timeout);
                address = resolved;
                state = HostState.READY;
                LOG.info("Host ready at " + resolved);
                return resolved;
            } catch (ProvisioningException e) {
                failure = e;
                state = HostState.FAILED;
                throw e;
            } catch (RuntimeException e) {
                failure = new ProvisioningException("Unexpected provisioning failure", e);
                state = HostState.FAILED;
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the host.
     *
     * <p>The effective policy is {@code explicitPolicy}, or the default stop policy when null.
     * A host that does not own its instance never calls the provider. Provider failures are
     * logged, never thrown. Calling stop again has no further effect, except that a host kept
     * running may still be terminated or paused by a later explicit policy.
     *
     * @param explicitPolicy policy to apply, or null for the default one
     */
    public void stop(StopPolicy explicitPolicy) {
        abortProvisioning();
        lock.lock();
        try {
            StopPolicy policy = explicitPolicy != null ? explicitPolicy : parameters.stopPolicy();
            state = HostState.STOPPED;
            removeExitHook();

            if (!parameters.ownsLifecycle() || released) {
                return;
            }

            if (policy == StopPolicy.KEEP) {
                InstanceRef kept = instance;
                if (kept != null && !keepWarned) {
                    keepWarned = true;
                    LOG.warning("Instance '" + kept.id() + "' is still running");
                }
                return;
            }

            InstanceRef target = instance != null ? instance : lookupForStop();
            if (target == null) {
                return;
            }
            try {
                if (policy == StopPolicy.PAUSE && provider.capabilities().supportsPause()) {
                    provider.pause(target);
                    LOG.info("Instance '" + target.id() + "' has been stopped");
                } else {
                    if (policy == StopPolicy.PAUSE) {
                        LOG.fine("Provider " + provider.name() + " cannot pause, terminating instead");
                    }
                    provider.terminate(target);
                    LOG.info("Instance '" + target.id() + "' has been terminated");
                }
                released = true;
            } catch (ProviderException | RuntimeException e) {
                LOG.log(Level.WARNING, "Unable to stop instance '" + target.id() + "'", e);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes a provisioning wait in progress fail with a {@link ProvisioningException} at its next
     * poll, without waiting for the host lock. Owners that serialize their own calls to
     * {@link #ensureReady} call this before taking their lock to stop the host. Once called, the
     * host can no longer be provisioned.
     */
    public void abortProvisioning() {
        stopSignal.countDown();
    }

    /**
     * Stops the host with its default policy and closes the provider adapter it created.
     */
    @Override
    public void close() {
        stop(null);
        if (closeProvider && provider != null) {
            provider.close();
        }
    }

    /**
     * Registers a JVM shutdown hook that stops this host with its default policy.
     * The hook is removed when the host is stopped.
     */
    public Host stopOnExit() {
        lock.lock();
        try {
            if (exitHook == null && state != HostState.STOPPED) {
                exitHook = new Thread(() -> stop(null), "accelforge-host-exit");
                Runtime.getRuntime().addShutdownHook(exitHook);
            }
        } finally {
            lock.unlock();
        }
        return this;
    }

    private String provision(Duration timeout) throws ProvisioningException {
        long deadline = System.nanoTime() + timeout.toNanos();
        HostIdentity identity = parameters.identity();

        switch (identity.kind()) {
            case NONE -> instance = createInstance();
            case INSTANCE_ID -> instance = reuseInstance(identity.value());
            case ADDRESS -> {
                return waitReachable(identity.value(), deadline, timeout);
            }
        }
        return waitProviderReady(deadline, timeout);
    }

    private InstanceRef createInstance() throws ProvisioningException {
        String name = parameters.hostNamePrefix() + "-" + UUID.randomUUID().toString().substring(0, 8);
        String userData;
        try {
            userData = UserData.generate(parameters.initScript());
        } catch (IOException e) {
            throw new ProvisioningException("Unable to read init script " + parameters.initScript(), e);
        }

        LOG.info("Configuring " + parameters.hostType() + " instance...");
        try {
            InstanceRef created = provider.create(new HostSpec(
                    name,
                    parameters.instanceType(),
                    parameters.image(),
                    parameters.keyPair(),
                    parameters.securityGroup(),
                    userData
            ));
            LOG.info("Created instance '" + created.id() + "'");
            return created;
        } catch (ProviderException e) {
            throw new ProvisioningException("Unable to create " + parameters.hostType() + " instance", e);
        }
    }

    private InstanceRef reuseInstance(String instanceId) throws ProvisioningException {
        try {
            InstanceRef found = provider.find(instanceId)
                    .orElseThrow(() -> new InstanceNotFoundException(instanceId));
            if (provider.status(found) == InstanceStatus.STOPPED) {
                if (!provider.capabilities().supportsResume()) {
                    throw new ProvisioningException("Instance '" + instanceId + "' is stopped and " +
                            provider.name() + " cannot start it again");
                }
                LOG.info("Starting stopped instance '" + instanceId + "'");
                provider.resume(found);
            }
            return found;
        } catch (ProviderException e) {
            throw new ProvisioningException("Unable to reuse instance '" + instanceId + "'", e);
        }
    }

    private String waitProviderReady(long deadline, Duration timeout) throws ProvisioningException {
        LOG.info("Waiting instance provisioning...");
        String resolved = null;
        InstanceStatus status = null;
        while (true) {
            try {
                status = provider.status(instance);
                if (status.isUnrecoverable()) {
                    throw new ProvisioningException(
                            "Instance '" + instance.id() + "' entered " + status + " status");
                }
                if (status == InstanceStatus.READY) {
                    if (resolved == null) {
                        resolved = provider.address(instance);
                    }
                    if (probe.isReachable(resolved, probeTimeout(deadline))) {
                        return resolved;
                    }
                }
            } catch (ProviderException e) {
                throw new ProvisioningException("Unable to get status of instance '" + instance.id() + "'", e);
            }
            awaitNextPoll(deadline, timeout, "last status: " + status);
        }
    }

    private String waitReachable(String target, long deadline, Duration timeout) throws ProvisioningException {
        LOG.info("Waiting for host " + target + "...");
        while (!probe.isReachable(target, probeTimeout(deadline))) {
            awaitNextPoll(deadline, timeout, "host " + target + " unreachable");
        }
        return target;
    }

    private void awaitNextPoll(long deadline, Duration timeout, String detail) throws ProvisioningException {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new ProvisioningException("Timed out after " + timeout.toSeconds() +
                    "s waiting for host (" + detail + ")");
        }
        long wait = Math.min(parameters.pollInterval().toNanos(), remaining);
        try {
            if (stopSignal.await(wait, TimeUnit.NANOSECONDS)) {
                throw new ProvisioningException("Host stopped while provisioning");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted while waiting for host", e);
        }
    }

    private static Duration probeTimeout(long deadline) {
        long remaining = Math.max(1, deadline - System.nanoTime());
        return Duration.ofNanos(Math.min(remaining, MAX_PROBE_TIMEOUT.toNanos()));
    }

    private InstanceRef lookupForStop() {
        if (parameters.identity().kind() != HostIdentity.Kind.INSTANCE_ID) {
            return null;
        }
        String instanceId = parameters.identity().value();
        try {
            return provider.find(instanceId).orElse(null);
        } catch (ProviderException | RuntimeException e) {
            LOG.log(Level.WARNING, "Unable to look up instance '" + instanceId + "' for stop", e);
            return null;
        }
    }

    private void removeExitHook() {
        Thread hook = exitHook;
        exitHook = null;
        if (hook == null || Thread.currentThread() == hook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.fine("JVM shutdown in progress, exit hook left registered");
        }
    }

    @Override
    public String toString() {
        return "Host[" + parameters.hostType() + ", " + state + ", " +
                instanceId().orElse(address == null ? "-" : address) + "]";
    }
}
