package io.surfworks.accelforge.host;

import io.surfworks.accelforge.config.Configuration;
import io.surfworks.accelforge.host.provider.InstanceStatus;
import io.surfworks.accelforge.host.provider.ProviderCapabilities;
import io.surfworks.accelforge.testing.MockProviderAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HostDiscovery.
 */
class HostDiscoveryTest {

    private MockProviderAdapter provider;
    private Configuration config;

    @BeforeEach
    void setUp() {
        provider = new MockProviderAdapter()
                .addInstance("i-1", "accelforge-aaa", "10.0.0.1", InstanceStatus.READY)
                .addInstance("i-2", "other-bbb", "10.0.0.2", InstanceStatus.READY)
                .addInstance("i-3", "lab-ccc", "10.0.0.3", InstanceStatus.STOPPED);
        config = Configuration.builder()
                .set("host", "host_type", "mock")
                .set("host.mock", "client_id", "cid")
                .build();
    }

    @Test
    void listsWithDefaultPrefix() {
        List<HostDiscovery.DiscoveredHost> hosts = HostDiscovery.list(config, null, s -> provider);

        assertEquals(1, hosts.size());
        assertEquals("mock", hosts.get(0).hostType());
        assertEquals("i-1", hosts.get(0).instance().id());
        assertTrue(provider.isClosed());
    }

    @Test
    void listsWithConfiguredOrExplicitPrefix() {
        Configuration lab = config.with("host.mock", "host_name_prefix", "lab");

        assertEquals("i-3", HostDiscovery.list(lab, null, s -> provider).get(0).instance().id());
        assertEquals("i-2", HostDiscovery.list(config, "other", s -> provider).get(0).instance().id());
    }

    @Test
    void providerWithoutCredentialsIsSkipped() {
        Configuration anonymous = config.with("host.mock", "client_id", null);

        assertTrue(HostDiscovery.list(anonymous, null, s -> provider).isEmpty());
        assertTrue(provider.getCalls().isEmpty());
    }

    @Test
    void providerWithoutListIsSkipped() {
        provider.setCapabilities(new ProviderCapabilities(true, true, false));

        assertTrue(HostDiscovery.list(config, null, s -> provider).isEmpty());
        assertEquals(0, provider.getCallCount("list"));
    }

    @Test
    void failingProviderIsLoggedAndSkipped() {
        List<HostDiscovery.DiscoveredHost> hosts = HostDiscovery.list(config, null, s -> {
            throw new IllegalStateException("no network");
        });
        assertTrue(hosts.isEmpty());
    }
}
