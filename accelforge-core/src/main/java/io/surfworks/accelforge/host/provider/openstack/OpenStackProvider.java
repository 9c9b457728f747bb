package io.surfworks.accelforge.host.provider.openstack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.accelforge.host.provider.HostSpec;
import io.surfworks.accelforge.host.provider.InstanceRef;
import io.surfworks.accelforge.host.provider.InstanceStatus;
import io.surfworks.accelforge.host.provider.ProviderAdapter;
import io.surfworks.accelforge.host.provider.ProviderCapabilities;
import io.surfworks.accelforge.host.provider.ProviderException;
import io.surfworks.accelforge.host.provider.ProviderSettings;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * OpenStack provider using the Keystone v3 and Nova compute REST APIs.
 *
 * <p>OpenStack has no instance pause that preserves billing semantics across providers,
 * so {@link #pause} terminates the server and {@link ProviderCapabilities#supportsPause()}
 * is false.
 *
 * <p>API documentation:
 * https://docs.openstack.org/api-ref/identity/v3/ and
 * https://docs.openstack.org/api-ref/compute/
 */
public final class OpenStackProvider implements ProviderAdapter {

    /** Provider key of a generic OpenStack cloud */
    public static final String NAME = "openstack";

    /** Provider key of OVH public cloud */
    public static final String OVH_NAME = "ovh";

    /** OVH Keystone endpoint */
    public static final String OVH_AUTH_URL = "https://auth.cloud.ovh.net/v3";

    private static final Logger LOG = Logger.getLogger(OpenStackProvider.class.getName());
    private static final String TOKEN_HEADER = "X-Auth-Token";

    private final String name;
    private final ProviderSettings settings;
    private final HttpClient httpClient;
    private final ObjectMapper jsonMapper;
    private volatile Session session;
    private volatile boolean closed;

    /**
     * Authenticated token plus the compute endpoint picked from the service catalog.
     */
    record Session(String token, String computeUrl) {
    }

    /**
     * Creates a generic OpenStack provider.
     */
    public OpenStackProvider(ProviderSettings settings) {
        this(NAME, settings);
    }

    OpenStackProvider(String name, ProviderSettings settings) {
        if (settings.authUrl() == null || settings.authUrl().isBlank()) {
            throw new IllegalArgumentException("OpenStack provider requires an auth URL");
        }
        this.name = name;
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.requestTimeout())
                .build();
        this.jsonMapper = new ObjectMapper();
        this.closed = false;
    }

    /**
     * Creates an OVH provider, defaulting the auth URL to OVH Keystone.
     */
    public static OpenStackProvider ovh(ProviderSettings settings) {
        ProviderSettings resolved = settings.authUrl() == null ? settings.withAuthUrl(OVH_AUTH_URL) : settings;
        return new OpenStackProvider(OVH_NAME, resolved);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderCapabilities capabilities() {
        return ProviderCapabilities.terminateOnly();
    }

    @Override
    public InstanceRef create(HostSpec spec) throws ProviderException {
        ensureOpen();

        ObjectNode body = jsonMapper.createObjectNode();
        ObjectNode server = body.putObject("server");
        server.put("name", spec.name());
        server.put("imageRef", spec.image());
        server.put("flavorRef", resolveFlavor(spec.instanceType()));
        if (spec.keyPair() != null) {
            server.put("key_name", spec.keyPair());
        }
        if (spec.securityGroup() != null) {
            server.putArray("security_groups").addObject().put("name", spec.securityGroup());
        }
        if (spec.userData() != null) {
            server.put("user_data", Base64.getEncoder()
                    .encodeToString(spec.userData().getBytes(StandardCharsets.UTF_8)));
        }
        server.putObject("metadata").put("accelforge", spec.name());

        HttpResponse<String> response = send("POST", "/servers", body);
        if (response.statusCode() != 202 && response.statusCode() != 200) {
            throw new ProviderException("OpenStack server creation failed (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
        JsonNode created = readJson(response).path("server");
        String id = created.path("id").asText(null);
        if (id == null) {
            throw new ProviderException("OpenStack did not return a server ID: " + response.body());
        }
        LOG.fine("Requested OpenStack server " + id + " (" + spec.name() + ")");
        return new InstanceRef(id, spec.name());
    }

    @Override
    public Optional<InstanceRef> find(String instanceId) throws ProviderException {
        ensureOpen();
        return fetchServer(instanceId).map(server ->
                new InstanceRef(server.path("id").asText(instanceId), server.path("name").asText(null)));
    }

    @Override
    public InstanceStatus status(InstanceRef instance) throws ProviderException {
        ensureOpen();
        JsonNode server = fetchServer(instance.id())
                .orElseThrow(() -> new ProviderException("Server not found: " + instance.id()));
        InstanceStatus status = mapStatus(server.path("status").asText(""));
        if (status == InstanceStatus.ERROR && server.has("fault")) {
            LOG.warning("Server " + instance.id() + " in error: " + server.path("fault").path("message").asText());
        }
        return status;
    }

    @Override
    public String address(InstanceRef instance) throws ProviderException {
        ensureOpen();
        JsonNode server = fetchServer(instance.id())
                .orElseThrow(() -> new ProviderException("Server not found: " + instance.id()));
        String address = selectAddress(server.path("addresses"), settings.usePrivateIp());
        if (address == null) {
            throw new ProviderException("No IPv4 address found for server " + instance.id());
        }
        return address;
    }

    @Override
    public void terminate(InstanceRef instance) throws ProviderException {
        ensureOpen();
        HttpResponse<String> response = send("DELETE", "/servers/" + instance.id(), null);
        if (response.statusCode() == 404) {
            return;
        }
        if (response.statusCode() != 204 && response.statusCode() != 202) {
            throw new ProviderException("Failed to delete server " + instance.id() + " (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
    }

    @Override
    public void pause(InstanceRef instance) throws ProviderException {
        terminate(instance);
    }

    @Override
    public void resume(InstanceRef instance) throws ProviderException {
        ensureOpen();
        ObjectNode body = jsonMapper.createObjectNode();
        body.putNull("os-start");
        HttpResponse<String> response = send("POST", "/servers/" + instance.id() + "/action", body);
        // 409 means the server is already running
        if (response.statusCode() != 202 && response.statusCode() != 409) {
            throw new ProviderException("Failed to start server " + instance.id() + " (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
    }

    @Override
    public List<InstanceRef> list(String namePrefix) throws ProviderException {
        ensureOpen();
        String path = "/servers";
        if (namePrefix != null && !namePrefix.isEmpty()) {
            path += "?name=" + URLEncoder.encode("^" + namePrefix, StandardCharsets.UTF_8);
        }
        HttpResponse<String> response = send("GET", path, null);
        if (response.statusCode() != 200) {
            throw new ProviderException("Failed to list servers (HTTP " +
                    response.statusCode() + "): " + response.body());
        }

        List<InstanceRef> instances = new ArrayList<>();
        for (JsonNode server : readJson(response).path("servers")) {
            String serverName = server.path("name").asText("");
            if (namePrefix == null || serverName.startsWith(namePrefix)) {
                instances.add(new InstanceRef(server.path("id").asText(), serverName));
            }
        }
        return instances;
    }

    @Override
    public void close() {
        closed = true;
        session = null;
    }

    /**
     * Maps a Nova server status to the normalized status.
     */
    static InstanceStatus mapStatus(String novaStatus) {
        return switch (novaStatus.toUpperCase()) {
            case "ACTIVE" -> InstanceStatus.READY;
            case "BUILD", "REBUILD", "REBOOT", "HARD_REBOOT", "RESIZE", "VERIFY_RESIZE",
                    "MIGRATING", "PASSWORD" -> InstanceStatus.PENDING;
            case "SHUTOFF", "SUSPENDED", "PAUSED", "SHELVED", "SHELVED_OFFLOADED" -> InstanceStatus.STOPPED;
            default -> InstanceStatus.ERROR;
        };
    }

    /**
     * Picks an IPv4 address from a Nova {@code addresses} object.
     * Floating addresses are public, fixed addresses are private. Without type
     * information the first IPv4 address of the first network is used.
     */
    static String selectAddress(JsonNode addresses, boolean usePrivateIp) {
        String wantedType = usePrivateIp ? "fixed" : "floating";
        String fallback = null;
        Iterator<Map.Entry<String, JsonNode>> networks = addresses.fields();
        while (networks.hasNext()) {
            for (JsonNode address : networks.next().getValue()) {
                if (address.path("version").asInt(4) != 4) {
                    continue;
                }
                String addr = address.path("addr").asText(null);
                if (wantedType.equals(address.path("OS-EXT-IPS:type").asText(null))) {
                    return addr;
                }
                if (fallback == null) {
                    fallback = addr;
                }
            }
        }
        return fallback;
    }

    /**
     * Accepts a flavor ID or a flavor name; names are resolved to IDs.
     */
    private String resolveFlavor(String instanceType) throws ProviderException {
        HttpResponse<String> response = send("GET", "/flavors", null);
        if (response.statusCode() != 200) {
            throw new ProviderException("Failed to list flavors (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
        for (JsonNode flavor : readJson(response).path("flavors")) {
            if (instanceType.equals(flavor.path("id").asText()) || instanceType.equals(flavor.path("name").asText())) {
                return flavor.path("id").asText();
            }
        }
        throw new ProviderException("Flavor '" + instanceType + "' not found in region " + settings.region());
    }

    private Optional<JsonNode> fetchServer(String instanceId) throws ProviderException {
        HttpResponse<String> response = send("GET", "/servers/" + instanceId, null);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            throw new ProviderException("Failed to get server " + instanceId + " (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
        return Optional.of(readJson(response).path("server"));
    }

    /**
     * Sends a compute API request, authenticating first and once more on HTTP 401.
     */
    private HttpResponse<String> send(String method, String path, JsonNode body) throws ProviderException {
        HttpResponse<String> response = sendOnce(session(), method, path, body);
        if (response.statusCode() == 401) {
            session = null;
            response = sendOnce(session(), method, path, body);
        }
        return response;
    }

    private HttpResponse<String> sendOnce(Session current, String method, String path, JsonNode body)
            throws ProviderException {
        try {
            HttpRequest.BodyPublisher publisher = body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(jsonMapper.writeValueAsString(body));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(current.computeUrl() + path))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .header(TOKEN_HEADER, current.token())
                    .method(method, publisher)
                    .timeout(settings.requestTimeout())
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ProviderException("OpenStack request " + method + " " + path + " failed", e);
        }
    }

    private Session session() throws ProviderException {
        Session current = session;
        if (current == null) {
            synchronized (this) {
                current = session;
                if (current == null) {
                    current = authenticate();
                    session = current;
                }
            }
        }
        return current;
    }

    private Session authenticate() throws ProviderException {
        if (settings.clientId() == null || settings.secretId() == null) {
            throw new ProviderException("OpenStack credentials (client_id, secret_id) are required");
        }

        ObjectNode body = jsonMapper.createObjectNode();
        ObjectNode identity = body.putObject("auth").putObject("identity");
        identity.putArray("methods").add("password");
        ObjectNode user = identity.putObject("password").putObject("user");
        user.put("name", settings.clientId());
        user.put("password", settings.secretId());
        user.putObject("domain").put("id", "default");
        if (settings.projectId() != null) {
            ((ObjectNode) body.get("auth")).putObject("scope").putObject("project").put("id", settings.projectId());
        }

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(identityUrl() + "/auth/tokens"))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonMapper.writeValueAsString(body)))
                    .timeout(settings.requestTimeout())
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 201 && response.statusCode() != 200) {
                throw new ProviderException("OpenStack authentication failed (HTTP " +
                        response.statusCode() + ")");
            }
            String token = response.headers().firstValue("X-Subject-Token")
                    .orElseThrow(() -> new ProviderException("OpenStack did not return a token"));
            String computeUrl = computeEndpoint(readJson(response).path("token").path("catalog"));
            return new Session(token, computeUrl);

        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ProviderException("Failed to authenticate to OpenStack", e);
        }
    }

    private String computeEndpoint(JsonNode catalog) throws ProviderException {
        String wantedInterface = settings.interfaceName() == null ? "public" : settings.interfaceName();
        for (JsonNode service : catalog) {
            if (!"compute".equals(service.path("type").asText())) {
                continue;
            }
            for (JsonNode endpoint : service.path("endpoints")) {
                boolean regionMatches = settings.region() == null
                        || settings.region().equals(endpoint.path("region").asText())
                        || settings.region().equals(endpoint.path("region_id").asText());
                if (regionMatches && wantedInterface.equals(endpoint.path("interface").asText())) {
                    return stripTrailingSlash(endpoint.path("url").asText());
                }
            }
        }
        throw new ProviderException("No compute endpoint for region '" + settings.region()
                + "' and interface '" + wantedInterface + "'");
    }

    private String identityUrl() {
        String url = stripTrailingSlash(settings.authUrl());
        return url.endsWith("/v3") ? url : url + "/v3";
    }

    private JsonNode readJson(HttpResponse<String> response) throws ProviderException {
        try {
            return jsonMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderException("Unable to parse OpenStack response", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private void ensureOpen() throws ProviderException {
        if (closed) {
            throw new ProviderException("Provider is closed");
        }
    }
}
