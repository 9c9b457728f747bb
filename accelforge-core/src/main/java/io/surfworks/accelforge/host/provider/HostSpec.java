package io.surfworks.accelforge.host.provider;

import java.util.Objects;

/**
 * What to create when a host has no existing instance.
 *
 * @param name          instance name
 * @param instanceType  provider instance type or flavor
 * @param image         image ID to boot from
 * @param keyPair       SSH key pair name (may be null)
 * @param securityGroup security group name (may be null)
 * @param userData      cloud-init user data script (may be null)
 */
public record HostSpec(
        String name,
        String instanceType,
        String image,
        String keyPair,
        String securityGroup,
        String userData
) {

    public HostSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(instanceType, "instanceType cannot be null");
        Objects.requireNonNull(image, "image cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }
}
