package io.surfworks.accelforge.host.provider;

import java.time.Duration;
import java.util.Objects;

/**
 * Credentials and endpoint settings handed to a provider adapter factory.
 *
 * @param hostType       provider key, as registered in {@link ProviderRegistry}
 * @param region         provider region
 * @param clientId       access key / user name
 * @param secretId       secret key / password
 * @param projectId      project or tenant (may be null)
 * @param authUrl        authentication endpoint override (may be null)
 * @param interfaceName  endpoint interface to pick from the service catalog (may be null)
 * @param usePrivateIp   use the private address instead of the public one
 * @param requestTimeout timeout of individual API requests
 */
public record ProviderSettings(
        String hostType,
        String region,
        String clientId,
        String secretId,
        String projectId,
        String authUrl,
        String interfaceName,
        boolean usePrivateIp,
        Duration requestTimeout
) {

    /** Default API request timeout */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    public ProviderSettings {
        Objects.requireNonNull(hostType, "hostType cannot be null");
        hostType = hostType.toLowerCase();
        requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
    }

    /**
     * Returns a new settings instance with the given auth URL.
     */
    public ProviderSettings withAuthUrl(String url) {
        return new ProviderSettings(hostType, region, clientId, secretId, projectId,
                url, interfaceName, usePrivateIp, requestTimeout);
    }

    @Override
    public String toString() {
        // Never print the secret
        return "ProviderSettings[hostType=" + hostType + ", region=" + region
                + ", clientId=" + clientId + ", projectId=" + projectId
                + ", authUrl=" + authUrl + "]";
    }
}
