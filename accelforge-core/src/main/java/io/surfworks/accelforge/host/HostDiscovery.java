package io.surfworks.accelforge.host;

import io.surfworks.accelforge.config.Configuration;
import io.surfworks.accelforge.host.provider.InstanceRef;
import io.surfworks.accelforge.host.provider.ProviderAdapter;
import io.surfworks.accelforge.host.provider.ProviderException;
import io.surfworks.accelforge.host.provider.ProviderRegistry;
import io.surfworks.accelforge.host.provider.ProviderSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enumerates existing accelerator instances.
 */
public final class HostDiscovery {

    private static final Logger LOG = Logger.getLogger(HostDiscovery.class.getName());

    private HostDiscovery() {
    }

    /**
     * An instance found on a provider.
     *
     * @param hostType provider key
     * @param instance instance reference
     */
    public record DiscoveredHost(String hostType, InstanceRef instance) {
    }

    /**
     * Lists instances of every provider that has a {@code host.<type>} section with credentials.
     *
     * @param config     configuration holding provider sections
     * @param namePrefix instance name prefix; null uses the configured host name prefix
     * @return instances found; providers that fail are logged and skipped
     */
    public static List<DiscoveredHost> list(Configuration config, String namePrefix) {
        return list(config, namePrefix, ProviderRegistry::create);
    }

    static List<DiscoveredHost> list(Configuration config, String namePrefix,
                                     Function<ProviderSettings, ProviderAdapter> factory) {
        List<DiscoveredHost> found = new ArrayList<>();
        for (String hostType : configuredHostTypes(config)) {
            ProviderSettings settings;
            try {
                settings = HostParameters.builder().hostType(hostType).providerSettings(config);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Skipping provider " + hostType, e);
                continue;
            }
            if (settings.clientId() == null) {
                continue;
            }

            String prefix = namePrefix != null ? namePrefix
                    : config.resolve(HostParameters.SECTION + "." + hostType, "host_name_prefix", null,
                    HostParameters.DEFAULT_NAME_PREFIX);
            try (ProviderAdapter adapter = factory.apply(settings)) {
                if (!adapter.capabilities().supportsList()) {
                    continue;
                }
                for (InstanceRef ref : adapter.list(prefix)) {
                    found.add(new DiscoveredHost(hostType, ref));
                }
            } catch (ProviderException | RuntimeException e) {
                LOG.log(Level.WARNING, "Unable to list instances of " + hostType, e);
            }
        }
        return found;
    }

    private static List<String> configuredHostTypes(Configuration config) {
        List<String> types = new ArrayList<>();
        String defaultType = config.resolve(HostParameters.SECTION, "host_type", null);
        if (defaultType != null) {
            types.add(defaultType.toLowerCase());
        }
        String prefix = HostParameters.SECTION + ".";
        for (String section : config.sectionNames()) {
            if (section.startsWith(prefix)) {
                String type = section.substring(prefix.length()).toLowerCase();
                if (!types.contains(type) && ProviderRegistry.isRegistered(type)) {
                    types.add(type);
                }
            }
        }
        return types;
    }
}
