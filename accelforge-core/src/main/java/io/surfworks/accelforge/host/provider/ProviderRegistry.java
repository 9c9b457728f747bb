package io.surfworks.accelforge.host.provider;

import io.surfworks.accelforge.host.provider.openstack.OpenStackProvider;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of provider adapter implementations, keyed by host type.
 *
 * <p>Thread-safe. Adapters are created on demand via factory functions. The built-in
 * providers are registered when the class is initialized.
 */
public final class ProviderRegistry {

    private static final Map<String, Function<ProviderSettings, ProviderAdapter>> FACTORIES =
            new ConcurrentHashMap<>();

    static {
        registerBuiltIns();
    }

    private ProviderRegistry() {} // Utility class

    /**
     * Registers a provider factory.
     *
     * @param hostType Provider key (e.g., "openstack")
     * @param factory  Factory function that creates adapter instances from settings
     */
    public static void register(String hostType, Function<ProviderSettings, ProviderAdapter> factory) {
        FACTORIES.put(hostType.toLowerCase(), factory);
    }

    /**
     * Unregisters a provider.
     */
    public static void unregister(String hostType) {
        FACTORIES.remove(hostType.toLowerCase());
    }

    /**
     * Checks if a provider is registered.
     */
    public static boolean isRegistered(String hostType) {
        return hostType != null && FACTORIES.containsKey(hostType.toLowerCase());
    }

    /**
     * Creates a new adapter for the host type named in the settings.
     *
     * @throws IllegalArgumentException if the host type is not registered
     */
    public static ProviderAdapter create(ProviderSettings settings) {
        Function<ProviderSettings, ProviderAdapter> factory = FACTORIES.get(settings.hostType());
        if (factory == null) {
            throw new IllegalArgumentException(
                    "Host type '" + settings.hostType() + "' not registered. Available: " + available());
        }
        return factory.apply(settings);
    }

    /**
     * Gets list of available host types.
     */
    public static List<String> available() {
        return List.copyOf(FACTORIES.keySet());
    }

    /**
     * Restores the built-in registrations (mainly for testing).
     */
    public static void reset() {
        FACTORIES.clear();
        registerBuiltIns();
    }

    private static void registerBuiltIns() {
        register(OpenStackProvider.NAME, OpenStackProvider::new);
        register(OpenStackProvider.OVH_NAME, OpenStackProvider::ovh);
    }
}
