package io.surfworks.accelforge.host;

import java.util.Objects;

/**
 * How a host finds its remote instance.
 *
 * @param kind  identity kind
 * @param value instance ID or network address; null for {@link Kind#NONE}
 */
public record HostIdentity(Kind kind, String value) {

    /**
     * Identity kinds.
     */
    public enum Kind {
        /** No instance yet; the host must create one */
        NONE,

        /** Reuse an existing instance with full lifecycle control */
        INSTANCE_ID,

        /** Reuse a running host by address; no control over the instance */
        ADDRESS
    }

    public HostIdentity {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (kind == Kind.NONE) {
            if (value != null) {
                throw new IllegalArgumentException("NONE identity cannot carry a value");
            }
        } else if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(kind + " identity requires a value");
        }
    }

    public static HostIdentity create() {
        return new HostIdentity(Kind.NONE, null);
    }

    public static HostIdentity instanceId(String instanceId) {
        return new HostIdentity(Kind.INSTANCE_ID, instanceId);
    }

    public static HostIdentity address(String address) {
        return new HostIdentity(Kind.ADDRESS, address);
    }

    /**
     * Returns true if a host with this identity may terminate or pause the instance.
     */
    public boolean ownsLifecycle() {
        return kind != Kind.ADDRESS;
    }

    /**
     * Returns true if the instance existed before the host was constructed.
     */
    public boolean isReuse() {
        return kind != Kind.NONE;
    }
}
