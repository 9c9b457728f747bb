package io.surfworks.accelforge.testing;

import io.surfworks.accelforge.host.provider.HostSpec;
import io.surfworks.accelforge.host.provider.InstanceRef;
import io.surfworks.accelforge.host.provider.InstanceStatus;
import io.surfworks.accelforge.host.provider.ProviderAdapter;
import io.surfworks.accelforge.host.provider.ProviderCapabilities;
import io.surfworks.accelforge.host.provider.ProviderException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mock provider adapter for unit testing.
 *
 * <p>Keeps instances in memory and records every call for assertions.
 * Created instances report the configured provisioning statuses on successive
 * {@link #status} calls, the last one repeating.
 */
public final class MockProviderAdapter implements ProviderAdapter {

    private final AtomicInteger instanceCounter = new AtomicInteger(0);
    private final Map<String, MockInstance> instances = new LinkedHashMap<>();
    private final List<String> calls = new ArrayList<>();
    private final List<HostSpec> createdSpecs = new ArrayList<>();

    private ProviderCapabilities capabilities = ProviderCapabilities.full();
    private List<InstanceStatus> provisioningStatuses = List.of(InstanceStatus.READY);
    private ProviderException createException;
    private ProviderException stopException;
    private boolean closed;

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public synchronized ProviderCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public synchronized InstanceRef create(HostSpec spec) throws ProviderException {
        calls.add("create:" + spec.name());
        if (createException != null) {
            throw createException;
        }
        String id = "mock-i-" + instanceCounter.incrementAndGet();
        InstanceRef ref = new InstanceRef(id, spec.name());
        instances.put(id, new MockInstance(ref, "10.0.0." + instanceCounter.get(), provisioningStatuses));
        createdSpecs.add(spec);
        return ref;
    }

    @Override
    public synchronized Optional<InstanceRef> find(String instanceId) {
        calls.add("find:" + instanceId);
        MockInstance instance = instances.get(instanceId);
        return instance == null ? Optional.empty() : Optional.of(instance.ref);
    }

    @Override
    public synchronized InstanceStatus status(InstanceRef instance) throws ProviderException {
        calls.add("status:" + instance.id());
        return get(instance).nextStatus();
    }

    @Override
    public synchronized String address(InstanceRef instance) throws ProviderException {
        calls.add("address:" + instance.id());
        return get(instance).address;
    }

    @Override
    public synchronized void terminate(InstanceRef instance) throws ProviderException {
        calls.add("terminate:" + instance.id());
        if (stopException != null) {
            throw stopException;
        }
        instances.remove(instance.id());
    }

    @Override
    public synchronized void pause(InstanceRef instance) throws ProviderException {
        calls.add("pause:" + instance.id());
        if (stopException != null) {
            throw stopException;
        }
        get(instance).forceStatus(InstanceStatus.STOPPED);
    }

    @Override
    public synchronized void resume(InstanceRef instance) throws ProviderException {
        calls.add("resume:" + instance.id());
        get(instance).forceStatus(InstanceStatus.READY);
    }

    @Override
    public synchronized List<InstanceRef> list(String namePrefix) {
        calls.add("list:" + namePrefix);
        List<InstanceRef> result = new ArrayList<>();
        for (MockInstance instance : instances.values()) {
            String name = instance.ref.name();
            if (namePrefix == null || (name != null && name.startsWith(namePrefix))) {
                result.add(instance.ref);
            }
        }
        return result;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    // ===== Test configuration methods =====

    public synchronized MockProviderAdapter setCapabilities(ProviderCapabilities capabilities) {
        this.capabilities = capabilities;
        return this;
    }

    /**
     * Sets the statuses reported by successive status() calls on created instances.
     */
    public synchronized MockProviderAdapter setProvisioningStatuses(InstanceStatus... statuses) {
        if (statuses.length == 0) {
            throw new IllegalArgumentException("At least one status is required");
        }
        this.provisioningStatuses = List.of(statuses);
        return this;
    }

    /**
     * Configures create() to throw an exception.
     */
    public synchronized MockProviderAdapter setCreateException(ProviderException exception) {
        this.createException = exception;
        return this;
    }

    /**
     * Configures terminate() and pause() to throw an exception.
     */
    public synchronized MockProviderAdapter setStopException(ProviderException exception) {
        this.stopException = exception;
        return this;
    }

    /**
     * Adds an existing instance, as if created outside of the test.
     */
    public synchronized MockProviderAdapter addInstance(String id, String name, String address,
                                                        InstanceStatus status) {
        instances.put(id, new MockInstance(new InstanceRef(id, name), address, List.of(status)));
        return this;
    }

    // ===== Test assertion methods =====

    /**
     * Returns all calls received, as {@code operation:argument} strings.
     */
    public synchronized List<String> getCalls() {
        return List.copyOf(calls);
    }

    /**
     * Returns the number of calls of one operation (e.g., "terminate").
     */
    public synchronized int getCallCount(String operation) {
        return (int) calls.stream().filter(c -> c.startsWith(operation + ":")).count();
    }

    public synchronized List<HostSpec> getCreatedSpecs() {
        return List.copyOf(createdSpecs);
    }

    public synchronized boolean hasInstance(String id) {
        return instances.containsKey(id);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private MockInstance get(InstanceRef ref) throws ProviderException {
        MockInstance instance = instances.get(ref.id());
        if (instance == null) {
            throw new ProviderException("Instance not found: " + ref.id());
        }
        return instance;
    }

    /**
     * Internal mock instance tracking.
     */
    private static final class MockInstance {
        final InstanceRef ref;
        final String address;
        List<InstanceStatus> statuses;
        int polls;

        MockInstance(InstanceRef ref, String address, List<InstanceStatus> statuses) {
            this.ref = ref;
            this.address = address;
            this.statuses = statuses;
        }

        InstanceStatus nextStatus() {
            InstanceStatus status = statuses.get(Math.min(polls, statuses.size() - 1));
            polls++;
            return status;
        }

        void forceStatus(InstanceStatus status) {
            statuses = List.of(status);
            polls = 0;
        }
    }
}
