package io.surfworks.accelforge.host;

import io.surfworks.accelforge.host.provider.InstanceNotFoundException;
import io.surfworks.accelforge.host.provider.InstanceStatus;
import io.surfworks.accelforge.host.provider.ProviderCapabilities;
import io.surfworks.accelforge.host.provider.ProviderException;
import io.surfworks.accelforge.testing.MockProviderAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Host lifecycle, run against MockProviderAdapter.
 */
class HostTest {

    private static final ReachabilityProbe ALWAYS = (address, timeout) -> true;
    private static final ReachabilityProbe NEVER = (address, timeout) -> false;

    private MockProviderAdapter provider;

    @BeforeEach
    void setUp() {
        provider = new MockProviderAdapter();
    }

    private static HostParameters.Builder parameters() {
        return HostParameters.builder()
                .hostType("mock")
                .instanceType("small")
                .image("fpga-image")
                .pollInterval(Duration.ofMillis(10))
                .provisioningTimeout(Duration.ofSeconds(5));
    }

    // ===== Provisioning =====

    @Test
    void createsInstanceAndBecomesReady() throws ProvisioningException {
        provider.setProvisioningStatuses(InstanceStatus.PENDING, InstanceStatus.PENDING, InstanceStatus.READY);
        Host host = new Host(parameters().build(), provider, ALWAYS);
        assertEquals(HostState.NEW, host.state());

        String address = host.ensureReady();

        assertEquals("10.0.0.1", address);
        assertEquals(HostState.READY, host.state());
        assertEquals("mock-i-1", host.instanceId().orElseThrow());
        assertEquals(3, provider.getCallCount("status"));
        assertTrue(provider.getCreatedSpecs().get(0).name().startsWith("accelforge-"));
        assertTrue(provider.getCreatedSpecs().get(0).userData().contains(UserData.INITIALIZED_FLAG));
    }

    @Test
    void ensureReadyIsIdempotentOnceReady() throws ProvisioningException {
        Host host = new Host(parameters().build(), provider, ALWAYS);

        host.ensureReady();
        host.ensureReady();

        assertEquals(1, provider.getCallCount("create"));
    }

    @Test
    void waitsForReachabilityAfterReadyStatus() throws ProvisioningException {
        int[] probes = {0};
        Host host = new Host(parameters().build(), provider, (address, timeout) -> ++probes[0] >= 3);

        assertEquals("10.0.0.1", host.ensureReady());
        assertEquals(3, probes[0]);
        assertEquals(1, provider.getCallCount("address"), "address is resolved once");
    }

    @Test
    void addressHostNeverCallsProvider() throws ProvisioningException {
        Host host = new Host(HostParameters.builder().hostIp("192.168.1.20").build(), provider, ALWAYS);

        assertEquals("192.168.1.20", host.ensureReady());
        host.stop(StopPolicy.TERMINATE);

        assertFalse(host.ownsLifecycle());
        assertTrue(provider.getCalls().isEmpty());
        assertEquals(HostState.STOPPED, host.state());
    }

    @Test
    void addressHostWorksWithoutProvider() throws ProvisioningException {
        Host host = new Host(HostParameters.builder().hostIp("192.168.1.20").build(), null, ALWAYS);
        assertEquals("192.168.1.20", host.ensureReady());
    }

    @Test
    void ownedHostRequiresProvider() {
        assertThrows(IllegalArgumentException.class, () -> new Host(parameters().build(), null, ALWAYS));
    }

    @Test
    void errorStatusFailsBeforeTimeout() {
        provider.setProvisioningStatuses(InstanceStatus.PENDING, InstanceStatus.ERROR);
        Host host = new Host(parameters().provisioningTimeout(Duration.ofMinutes(10)).build(), provider, ALWAYS);

        ProvisioningException e = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            return assertThrows(ProvisioningException.class, host::ensureReady);
        });

        assertTrue(e.getMessage().contains("ERROR"));
        assertEquals(HostState.FAILED, host.state());
    }

    @Test
    void failedHostRethrowsAndCanStillBeStopped() {
        provider.setProvisioningStatuses(InstanceStatus.ERROR);
        Host host = new Host(parameters().build(), provider, ALWAYS);
        ProvisioningException first = assertThrows(ProvisioningException.class, host::ensureReady);

        ProvisioningException second = assertThrows(ProvisioningException.class, host::ensureReady);
        assertSame(first, second.getCause());
        assertEquals(1, provider.getCallCount("create"));

        host.stop(null);
        assertEquals(1, provider.getCallCount("terminate"));
        assertFalse(provider.hasInstance("mock-i-1"));
    }

    @Test
    void unreachableAddressTimesOut() {
        Host host = new Host(HostParameters.builder()
                .hostIp("192.168.1.20")
                .pollInterval(Duration.ofMillis(10))
                .provisioningTimeout(Duration.ofMillis(100))
                .build(), null, NEVER);

        ProvisioningException e = assertThrows(ProvisioningException.class, host::ensureReady);
        assertTrue(e.getMessage().contains("Timed out"));
        assertEquals(HostState.FAILED, host.state());
    }

    @Test
    void createFailureIsProvisioningFailure() {
        provider.setCreateException(new ProviderException("quota exceeded"));
        Host host = new Host(parameters().build(), provider, ALWAYS);

        ProvisioningException e = assertThrows(ProvisioningException.class, host::ensureReady);
        assertEquals("quota exceeded", e.getCause().getMessage());
        assertTrue(host.instanceId().isEmpty());
    }

    // ===== Reuse =====

    @Test
    void unknownInstanceIdFails() {
        Host host = new Host(parameters().instanceId("i-123").build(), provider, ALWAYS);

        ProvisioningException e = assertThrows(ProvisioningException.class, host::ensureReady);

        assertInstanceOf(InstanceNotFoundException.class, e.getCause());
        assertEquals("i-123", ((InstanceNotFoundException) e.getCause()).instanceId());
        assertEquals(HostState.FAILED, host.state());
        assertDoesNotThrow(() -> host.stop(StopPolicy.TERMINATE));
        assertEquals(0, provider.getCallCount("terminate"));
    }

    @Test
    void reusesRunningInstance() throws ProvisioningException {
        provider.addInstance("i-7", "accelforge-old", "10.9.9.9", InstanceStatus.READY);
        Host host = new Host(parameters().instanceId("i-7").build(), provider, ALWAYS);

        assertEquals("10.9.9.9", host.ensureReady());
        assertEquals(0, provider.getCallCount("create"));
        assertEquals(0, provider.getCallCount("resume"));
    }

    @Test
    void resumesStoppedInstance() throws ProvisioningException {
        provider.addInstance("i-7", "accelforge-old", "10.9.9.9", InstanceStatus.STOPPED);
        Host host = new Host(parameters().instanceId("i-7").build(), provider, ALWAYS);

        assertEquals("10.9.9.9", host.ensureReady());
        assertEquals(1, provider.getCallCount("resume"));
    }

    @Test
    void stoppedInstanceFailsFastWhenProviderCannotResume() {
        provider.addInstance("i-7", "accelforge-old", "10.9.9.9", InstanceStatus.STOPPED);
        provider.setCapabilities(new ProviderCapabilities(false, false, true));
        Host host = new Host(parameters().instanceId("i-7").build(), provider, ALWAYS);

        ProvisioningException e = assertThrows(ProvisioningException.class, host::ensureReady);

        assertTrue(e.getMessage().contains("i-7"));
        assertEquals(HostState.FAILED, host.state());
        assertEquals(1, provider.getCallCount("status"), "no polling of a stopped instance");
        assertEquals(0, provider.getCallCount("resume"));
    }

    @Test
    void reusedInstanceIsKeptByDefault() throws ProvisioningException {
        provider.addInstance("i-7", "accelforge-old", "10.9.9.9", InstanceStatus.READY);
        Host host = new Host(parameters().instanceId("i-7").build(), provider, ALWAYS);
        host.ensureReady();

        host.close();

        assertTrue(provider.hasInstance("i-7"));
        assertFalse(provider.isClosed(), "adapter passed in is not closed by the host");
    }

    @Test
    void reusedInstanceTerminatedWithoutProvisioning() {
        provider.addInstance("i-7", "accelforge-old", "10.9.9.9", InstanceStatus.READY);
        Host host = new Host(parameters().instanceId("i-7").build(), provider, ALWAYS);

        host.stop(StopPolicy.TERMINATE);

        assertFalse(provider.hasInstance("i-7"));
    }

    // ===== Stop =====

    @Test
    void stopIsIdempotent() throws ProvisioningException {
        Host host = new Host(parameters().build(), provider, ALWAYS);
        host.ensureReady();

        host.stop(null);
        host.stop(null);
        host.close();

        assertEquals(1, provider.getCallCount("terminate"));
        assertEquals(HostState.STOPPED, host.state());
        assertThrows(IllegalStateException.class, host::ensureReady);
    }

    @Test
    void stopBeforeProvisioningDoesNothing() {
        Host host = new Host(parameters().build(), provider, ALWAYS);

        host.stop(null);

        assertTrue(provider.getCalls().isEmpty());
        assertEquals(HostState.STOPPED, host.state());
    }

    @Test
    void pauseWhenSupported() throws ProvisioningException {
        Host host = new Host(parameters().build(), provider, ALWAYS);
        host.ensureReady();

        host.stop(StopPolicy.PAUSE);

        assertEquals(1, provider.getCallCount("pause"));
        assertEquals(0, provider.getCallCount("terminate"));
        assertTrue(provider.hasInstance("mock-i-1"));
    }

    @Test
    void pauseFallsBackToTerminate() throws ProvisioningException {
        provider.setCapabilities(ProviderCapabilities.terminateOnly());
        Host host = new Host(parameters().build(), provider, ALWAYS);
        host.ensureReady();

        host.stop(StopPolicy.PAUSE);

        assertEquals(0, provider.getCallCount("pause"));
        assertEquals(1, provider.getCallCount("terminate"));
    }

    @Test
    void keepThenExplicitTerminate() throws ProvisioningException {
        Host host = new Host(parameters().build(), provider, ALWAYS);
        host.ensureReady();

        host.stop(StopPolicy.KEEP);
        assertTrue(provider.hasInstance("mock-i-1"));

        host.stop(StopPolicy.TERMINATE);
        assertFalse(provider.hasInstance("mock-i-1"));
    }

    @Test
    void stopFailureIsNotThrown() throws ProvisioningException {
        Host host = new Host(parameters().build(), provider, ALWAYS);
        host.ensureReady();
        provider.setStopException(new ProviderException("API down"));

        assertDoesNotThrow(() -> host.stop(StopPolicy.TERMINATE));
        assertEquals(HostState.STOPPED, host.state());
        assertTrue(provider.hasInstance("mock-i-1"));
    }

    @Test
    void stopDuringProvisioningAbortsWait() throws InterruptedException {
        provider.setProvisioningStatuses(InstanceStatus.PENDING);
        Host host = new Host(parameters().provisioningTimeout(Duration.ofMinutes(10)).build(), provider, ALWAYS);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread provisioning = new Thread(() -> {
            try {
                host.ensureReady();
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        provisioning.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> provider.getCallCount("status") >= 1);
        host.stop(StopPolicy.TERMINATE);
        provisioning.join(5000);

        assertInstanceOf(ProvisioningException.class, failure.get());
        assertEquals(HostState.STOPPED, host.state());
        assertEquals(1, provider.getCallCount("terminate"));
    }

    @Test
    void abortProvisioningFailsWaitWithoutStopping() throws InterruptedException {
        Host host = new Host(parameters().provisioningTimeout(Duration.ofMinutes(10)).build(), provider, NEVER);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread provisioning = new Thread(() -> {
            try {
                host.ensureReady();
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        provisioning.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> provider.getCallCount("status") >= 1);
        host.abortProvisioning();
        provisioning.join(5000);

        assertInstanceOf(ProvisioningException.class, failure.get());
        assertEquals(HostState.FAILED, host.state());
        assertEquals(0, provider.getCallCount("terminate"));

        host.stop(StopPolicy.TERMINATE);
        assertEquals(1, provider.getCallCount("terminate"));
    }

    @Test
    void infoDescribesHost() throws ProvisioningException {
        Host host = new Host(parameters().build(), provider, ALWAYS);
        host.ensureReady();

        HostInfo info = host.info();

        assertEquals("mock", info.hostType());
        assertEquals(HostState.READY, info.state());
        assertEquals(HostIdentity.Kind.NONE, info.identityKind());
        assertEquals("mock-i-1", info.instanceId());
        assertEquals("10.0.0.1", info.address());
        assertEquals(StopPolicy.TERMINATE, info.stopPolicy());
        assertTrue(info.ownsLifecycle());
    }
}
