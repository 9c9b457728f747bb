package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration sent to the remote accelerator by {@link Accelerator#start}.
 *
 * @param parameters configuration parameters, merged over the configured defaults
 * @param datafile   file uploaded with the configuration (may be null)
 * @param hostEnv    extra entries of the {@code env} object sent to the host
 */
public record ConfigurationRequest(ObjectNode parameters, Path datafile, Map<String, String> hostEnv) {

    public ConfigurationRequest {
        parameters = parameters == null ? JsonParameters.empty() : parameters.deepCopy();
        hostEnv = hostEnv == null ? Map.of() : Map.copyOf(hostEnv);
    }

    /**
     * A request that only applies the configured defaults.
     */
    public static ConfigurationRequest defaults() {
        return new ConfigurationRequest(null, null, null);
    }

    public static ConfigurationRequest of(ObjectNode parameters) {
        return new ConfigurationRequest(parameters, null, null);
    }

    public ConfigurationRequest withDatafile(Path file) {
        return new ConfigurationRequest(parameters, file, hostEnv);
    }

    @Override
    public ObjectNode parameters() {
        return parameters.deepCopy();
    }
}
