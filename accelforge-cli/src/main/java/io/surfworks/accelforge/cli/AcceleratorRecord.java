package io.surfworks.accelforge.cli;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Named accelerator saved by {@code create} and rebuilt by the other commands.
 *
 * @param name        name given with {@code --name}
 * @param accelerator accelerator product name, selects the {@code configuration.<accelerator>} defaults
 * @param configFile  configuration file given with {@code --config}, or null for the search path
 * @param hostType    provider key, or null when taken from the configuration
 * @param instanceId  instance to reuse; filled in once {@code start} provisioned one
 * @param hostIp      address of an already running host
 * @param stopMode    stop policy applied by {@code stop}, in short form
 * @param hostOptions extra host parameters, applied to the host type's section
 * @param accelize    accelerator credentials ({@code client_id}, {@code secret_id})
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AcceleratorRecord(
        String name,
        String accelerator,
        String configFile,
        String hostType,
        String instanceId,
        String hostIp,
        String stopMode,
        Map<String, String> hostOptions,
        Map<String, String> accelize
) {

    public AcceleratorRecord {
        Objects.requireNonNull(name, "name cannot be null");
        hostOptions = hostOptions == null ? Map.of() : Map.copyOf(new TreeMap<>(hostOptions));
        accelize = accelize == null ? Map.of() : Map.copyOf(accelize);
    }

    /**
     * Returns the name under which the accelerator reads its parameter defaults.
     */
    public String acceleratorName() {
        return accelerator != null ? accelerator : name;
    }

    /**
     * Returns true once a host exists that {@code stop} may have to release.
     */
    public boolean hasHost() {
        return instanceId != null || hostIp != null;
    }

    public AcceleratorRecord withInstanceId(String newInstanceId) {
        return new AcceleratorRecord(name, accelerator, configFile, hostType, newInstanceId, hostIp,
                stopMode, hostOptions, accelize);
    }

    public AcceleratorRecord withStopMode(String newStopMode) {
        return new AcceleratorRecord(name, accelerator, configFile, hostType, instanceId, hostIp,
                newStopMode, hostOptions, accelize);
    }
}
