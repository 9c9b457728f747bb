package io.surfworks.accelforge.host;

import io.surfworks.accelforge.config.Configuration;
import io.surfworks.accelforge.config.ConfigurationException;
import io.surfworks.accelforge.host.provider.ProviderSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Resolved parameters of a {@link Host}.
 *
 * <p>Built with {@link #builder()}: values set on the builder override the {@code host.<type>}
 * section of the configuration, which overrides the {@code host} section.
 *
 * @param hostType            provider key, may be null for an address-only host
 * @param identity            how the instance is found
 * @param stopPolicy          stop policy used when stop() is called without one
 * @param providerSettings    credentials handed to the provider adapter, null for an address-only host
 * @param instanceType        flavor of a created instance
 * @param image               image of a created instance
 * @param keyPair             SSH key pair name (may be null)
 * @param securityGroup       security group name (may be null)
 * @param hostNamePrefix      prefix of created instance names
 * @param initScript          bash script run on first boot (may be null)
 * @param provisioningTimeout maximum time ensureReady() waits for the host
 * @param pollInterval        delay between status and reachability checks
 * @param port                TCP port probed for reachability
 */
public record HostParameters(
        String hostType,
        HostIdentity identity,
        StopPolicy stopPolicy,
        ProviderSettings providerSettings,
        String instanceType,
        String image,
        String keyPair,
        String securityGroup,
        String hostNamePrefix,
        Path initScript,
        Duration provisioningTimeout,
        Duration pollInterval,
        int port
) {

    /** Configuration section of host parameters */
    public static final String SECTION = "host";

    /** Default time to wait for a host to become ready */
    public static final Duration DEFAULT_PROVISIONING_TIMEOUT = Duration.ofSeconds(360);

    /** Default delay between readiness checks */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    /** Default prefix of created instance names */
    public static final String DEFAULT_NAME_PREFIX = "accelforge";

    public HostParameters {
        Objects.requireNonNull(identity, "identity cannot be null");
        Objects.requireNonNull(stopPolicy, "stopPolicy cannot be null");
        Objects.requireNonNull(provisioningTimeout, "provisioningTimeout cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");

        if (identity.kind() != HostIdentity.Kind.ADDRESS && providerSettings == null) {
            throw new IllegalArgumentException("host_type is required unless a host address is given");
        }
        if (identity.kind() == HostIdentity.Kind.NONE && (instanceType == null || image == null)) {
            throw new IllegalArgumentException("instance_type and image are required to create a host");
        }
        if (provisioningTimeout.isNegative() || provisioningTimeout.isZero()) {
            throw new IllegalArgumentException("provisioningTimeout must be positive");
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        hostNamePrefix = hostNamePrefix == null ? DEFAULT_NAME_PREFIX : hostNamePrefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true if the host may terminate or pause its instance.
     */
    public boolean ownsLifecycle() {
        return identity.ownsLifecycle();
    }

    /**
     * Returns a copy with a different identity, keeping the stop policy.
     */
    public HostParameters withIdentity(HostIdentity newIdentity) {
        return new HostParameters(hostType, newIdentity, stopPolicy, providerSettings, instanceType,
                image, keyPair, securityGroup, hostNamePrefix, initScript, provisioningTimeout,
                pollInterval, port);
    }

    public HostParameters withStopPolicy(StopPolicy policy) {
        return new HostParameters(hostType, identity, policy, providerSettings, instanceType,
                image, keyPair, securityGroup, hostNamePrefix, initScript, provisioningTimeout,
                pollInterval, port);
    }

    /**
     * Builder for HostParameters. Every setter is an explicit override of the configuration.
     */
    public static final class Builder {
        private String hostType;
        private String instanceId;
        private String hostIp;
        private StopPolicy stopPolicy;
        private String region;
        private String clientId;
        private String secretId;
        private String projectId;
        private String authUrl;
        private String interfaceName;
        private Boolean usePrivateIp;
        private String instanceType;
        private String image;
        private String keyPair;
        private String securityGroup;
        private String hostNamePrefix;
        private Path initScript;
        private Duration provisioningTimeout;
        private Duration pollInterval;
        private Integer port;

        public Builder hostType(String hostType) {
            this.hostType = hostType;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder hostIp(String hostIp) {
            this.hostIp = hostIp;
            return this;
        }

        public Builder stopPolicy(StopPolicy stopPolicy) {
            this.stopPolicy = stopPolicy;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder secretId(String secretId) {
            this.secretId = secretId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder authUrl(String authUrl) {
            this.authUrl = authUrl;
            return this;
        }

        public Builder interfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        public Builder usePrivateIp(boolean usePrivateIp) {
            this.usePrivateIp = usePrivateIp;
            return this;
        }

        public Builder instanceType(String instanceType) {
            this.instanceType = instanceType;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder keyPair(String keyPair) {
            this.keyPair = keyPair;
            return this;
        }

        public Builder securityGroup(String securityGroup) {
            this.securityGroup = securityGroup;
            return this;
        }

        public Builder hostNamePrefix(String hostNamePrefix) {
            this.hostNamePrefix = hostNamePrefix;
            return this;
        }

        public Builder initScript(Path initScript) {
            this.initScript = initScript;
            return this;
        }

        public Builder provisioningTimeout(Duration provisioningTimeout) {
            this.provisioningTimeout = provisioningTimeout;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Builds parameters from the explicit values only.
         */
        public HostParameters build() {
            return build(Configuration.empty());
        }

        /**
         * Resolves every parameter against the configuration and builds.
         *
         * @throws ConfigurationException if a configured value is invalid
         */
        public HostParameters build(Configuration config) {
            Objects.requireNonNull(config, "config cannot be null");

            String type = config.resolve(SECTION, "host_type", hostType);
            String section = type == null ? SECTION : SECTION + "." + type.toLowerCase();

            HostIdentity identity = resolveIdentity(config, section);
            StopPolicy policy = stopPolicy;
            if (policy == null) {
                try {
                    policy = StopPolicy.parse(config.resolve(section, "stop_mode", null));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(e.getMessage(), e);
                }
            }
            if (policy == null) {
                policy = identity.isReuse() ? StopPolicy.KEEP : StopPolicy.TERMINATE;
            }

            ProviderSettings settings = type == null ? null : providerSettings(config);

            String script = config.resolve(section, "init_script", initScript == null ? null : initScript.toString());

            try {
                return new HostParameters(
                        type,
                        identity,
                        policy,
                        settings,
                        config.resolve(section, "instance_type", instanceType),
                        config.resolve(section, "image", image),
                        config.resolve(section, "key_pair", keyPair),
                        config.resolve(section, "security_group", securityGroup),
                        config.resolve(section, "host_name_prefix", hostNamePrefix),
                        script == null ? null : Path.of(script),
                        config.resolveDuration(section, "provisioning_timeout", provisioningTimeout,
                                DEFAULT_PROVISIONING_TIMEOUT),
                        config.resolveDuration(section, "poll_interval", pollInterval, DEFAULT_POLL_INTERVAL),
                        config.resolveInt(section, "port", port, TcpReachabilityProbe.DEFAULT_PORT)
                );
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid host parameters: " + e.getMessage(), e);
            }
        }

        /**
         * Resolves only the provider settings of the builder's host type.
         *
         * @throws IllegalStateException if no host type is set or configured
         */
        public ProviderSettings providerSettings(Configuration config) {
            String type = config.resolve(SECTION, "host_type", hostType);
            if (type == null) {
                throw new IllegalStateException("No host type set or configured");
            }
            String section = SECTION + "." + type.toLowerCase();
            return new ProviderSettings(
                    type,
                    config.resolve(section, "region", region),
                    config.resolve(section, "client_id", clientId),
                    config.resolve(section, "secret_id", secretId),
                    config.resolve(section, "project_id", projectId),
                    config.resolve(section, "auth_url", authUrl),
                    config.resolve(section, "interface", interfaceName),
                    config.resolveBoolean(section, "use_private_ip", usePrivateIp, false),
                    config.resolveDuration(section, "request_timeout", null,
                            ProviderSettings.DEFAULT_REQUEST_TIMEOUT)
            );
        }

        private HostIdentity resolveIdentity(Configuration config, String section) {
            // An explicit identity of either kind beats any configured one
            if (instanceId != null) {
                return HostIdentity.instanceId(instanceId);
            }
            if (hostIp != null) {
                return HostIdentity.address(hostIp);
            }
            String id = config.resolve(section, "instance_id", null);
            if (id != null) {
                return HostIdentity.instanceId(id);
            }
            String ip = config.resolve(section, "host_ip", null);
            if (ip != null) {
                return HostIdentity.address(ip);
            }
            return HostIdentity.create();
        }
    }
}
