package io.surfworks.accelforge.host.provider;

import java.util.Objects;

/**
 * Reference to a provider instance.
 *
 * @param id   provider-assigned instance ID
 * @param name instance name (may be null when the provider does not expose one)
 */
public record InstanceRef(String id, String name) {

    public InstanceRef {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
    }

    public static InstanceRef of(String id) {
        return new InstanceRef(id, null);
    }
}
