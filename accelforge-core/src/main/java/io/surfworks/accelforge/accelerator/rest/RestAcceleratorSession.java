package io.surfworks.accelforge.accelerator.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.accelforge.accelerator.AcceleratorSession;
import io.surfworks.accelforge.accelerator.ConfigurationResult;
import io.surfworks.accelforge.accelerator.ProcessResult;
import io.surfworks.accelforge.accelerator.RemoteExecutionException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Session with the REST service of an accelerator host.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code /v1.0/configuration/}: create (multipart) and list configurations</li>
 *   <li>{@code /v1.0/process/}: create (multipart), read until processed, delete</li>
 *   <li>{@code /v1.0/stop/}: stop the accelerator</li>
 * </ul>
 *
 * <p>Create requests are {@code multipart/form-data} with a {@code parameters} field holding the
 * JSON document and an optional {@code datafile} file field. Responses carry {@code id},
 * {@code url}, {@code inerror} and {@code parametersresult}, the latter being the accelerator's
 * JSON answer whose {@code app.status} is non-zero on failure.
 */
public final class RestAcceleratorSession implements AcceleratorSession {

    private static final Logger LOG = Logger.getLogger(RestAcceleratorSession.class.getName());

    /** Default delay between reads of a pending process */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(1200);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper jsonMapper;
    private final Duration pollInterval;
    private volatile String configurationUrl;

    /**
     * Creates a session for a host address ({@code 10.0.0.5}, {@code host:8080}
     * or a full {@code http(s)://} URL).
     */
    public RestAcceleratorSession(String address) {
        this(address, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(), DEFAULT_POLL_INTERVAL);
    }

    public RestAcceleratorSession(String address, HttpClient httpClient, Duration pollInterval) {
        this.baseUrl = formatUrl(address);
        this.httpClient = httpClient;
        this.jsonMapper = new ObjectMapper();
        this.pollInterval = pollInterval;
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Returns the URL of the configuration processing jobs are attached to.
     */
    public Optional<String> configurationUrl() {
        return Optional.ofNullable(configurationUrl);
    }

    @Override
    public ConfigurationResult configure(ObjectNode parameters, Path datafile) throws RemoteExecutionException {
        Multipart form = new Multipart()
                .field("parameters", parameters.toString())
                .file("datafile", datafile);
        JsonNode created = post("/v1.0/configuration/", form);

        ObjectNode result = parametersResult(created);
        raiseForStatus(result, "Failed to configure accelerator: ");

        JsonNode read = getJson("/v1.0/configuration/" + created.path("id").asText() + "/");
        if (read.path("inerror").asBoolean(false)) {
            throw new RemoteExecutionException("Cannot start the configuration " + read.path("url").asText());
        }

        String url = created.path("url").asText(null);
        configurationUrl = url;
        return new ConfigurationResult(url, result);
    }

    @Override
    public ProcessResult execute(ObjectNode parameters, Path fileIn, Path fileOut, Duration timeout)
            throws RemoteExecutionException {
        String configuration = configurationUrl;
        if (configuration == null) {
            throw new RemoteExecutionException("No configuration to process with");
        }

        Multipart form = new Multipart()
                .field("parameters", parameters.toString())
                .field("configuration", configuration)
                .file("datafile", fileIn);
        JsonNode created = post("/v1.0/process/", form);
        if (!created.has("id")) {
            throw new RemoteExecutionException(
                    "Processing failed with no message (host application did not run): " + created);
        }
        String processPath = "/v1.0/process/" + created.path("id").asText() + "/";

        try {
            JsonNode read = created;
            long deadline = timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
            while (!read.path("processed").asBoolean(false)) {
                if (timeout != null && System.nanoTime() - deadline > 0) {
                    throw new RemoteExecutionException("Processing timed out after " + timeout);
                }
                sleep(pollInterval);
                read = getJson(processPath);
            }

            if (read.path("inerror").asBoolean(false)) {
                throw new RemoteExecutionException("Failed to process data: " + read.path("parametersresult"));
            }
            ObjectNode response = parametersResult(read);
            raiseForStatus(response, "Processing failed: ");

            if (fileOut != null) {
                download(read.path("datafileresult").asText(null), fileOut);
            }
            return ProcessResult.fromResponse(response);
        } finally {
            delete(processPath);
        }
    }

    @Override
    public void teardown() throws RemoteExecutionException {
        HttpResponse<String> response = send(request("/v1.0/stop/").GET().build());
        if (response.statusCode() / 100 != 2) {
            throw new RemoteExecutionException("Accelerator stop failed (HTTP " + response.statusCode() + ")");
        }
        configurationUrl = null;
    }

    @Override
    public Optional<String> resume() throws RemoteExecutionException {
        JsonNode results = getJson("/v1.0/configuration/").path("results");
        if (!results.isArray() || results.isEmpty()) {
            return Optional.empty();
        }
        JsonNode last = results.get(0);
        if (last.path("used").asInt(0) == 0) {
            return Optional.empty();
        }
        configurationUrl = last.path("url").asText(null);
        return Optional.ofNullable(configurationUrl);
    }

    static String formatUrl(String address) {
        String url = address.strip();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "http://" + url;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private ObjectNode parametersResult(JsonNode response) throws RemoteExecutionException {
        JsonNode value = response.path("parametersresult");
        try {
            JsonNode parsed = value.isTextual() ? jsonMapper.readTree(value.asText()) : value;
            if (parsed instanceof ObjectNode object) {
                return object;
            }
        } catch (IOException e) {
            throw new RemoteExecutionException("Invalid result returned by host: " + value.asText(), e);
        }
        throw new RemoteExecutionException("No result returned by host");
    }

    private static void raiseForStatus(ObjectNode result, String message) throws RemoteExecutionException {
        JsonNode status = result.path("app").path("status");
        if (status.isMissingNode()) {
            throw new RemoteExecutionException(message + "No result returned");
        }
        if (status.asInt() != 0) {
            throw new RemoteExecutionException(message + result.path("app").path("msg").asText());
        }
    }

    private JsonNode post(String path, Multipart form) throws RemoteExecutionException {
        HttpRequest request;
        try {
            request = request(path)
                    .header("Content-Type", "multipart/form-data; boundary=" + form.boundary)
                    .POST(form.publisher())
                    .build();
        } catch (FileNotFoundException e) {
            throw new RemoteExecutionException("Could not find file to upload", e);
        }
        HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2) {
            throw new RemoteExecutionException("POST " + path + " failed (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
        return readJson(response);
    }

    private JsonNode getJson(String path) throws RemoteExecutionException {
        HttpResponse<String> response = send(request(path).GET().build());
        if (response.statusCode() != 200) {
            throw new RemoteExecutionException("GET " + path + " failed (HTTP " +
                    response.statusCode() + "): " + response.body());
        }
        return readJson(response);
    }

    private void delete(String path) {
        try {
            send(request(path).DELETE().build());
        } catch (RemoteExecutionException e) {
            LOG.log(Level.FINE, "Unable to delete " + path, e);
        }
    }

    private void download(String url, Path fileOut) throws RemoteExecutionException {
        if (url == null || url.isEmpty()) {
            throw new RemoteExecutionException("Host returned no result file");
        }
        URI uri = url.startsWith("http") ? URI.create(url) : URI.create(baseUrl + url);
        try {
            HttpResponse<Path> response = httpClient.send(
                    HttpRequest.newBuilder(uri).timeout(REQUEST_TIMEOUT).GET().build(),
                    HttpResponse.BodyHandlers.ofFile(fileOut));
            if (response.statusCode() != 200) {
                throw new RemoteExecutionException("Unable to download result file (HTTP " +
                        response.statusCode() + ")");
            }
        } catch (IOException e) {
            throw new RemoteExecutionException("Unable to download result file to " + fileOut, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteExecutionException("Interrupted while downloading result file", e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .timeout(REQUEST_TIMEOUT);
    }

    private HttpResponse<String> send(HttpRequest request) throws RemoteExecutionException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteExecutionException("Request to " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteExecutionException("Interrupted during request to " + request.uri(), e);
        }
    }

    private JsonNode readJson(HttpResponse<String> response) throws RemoteExecutionException {
        try {
            return jsonMapper.readTree(response.body());
        } catch (IOException e) {
            throw new RemoteExecutionException("Response not valid: " + response.body(), e);
        }
    }

    private static void sleep(Duration duration) throws RemoteExecutionException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteExecutionException("Interrupted while waiting for processing", e);
        }
    }

    /**
     * multipart/form-data body with text fields and file fields streamed from disk.
     */
    static final class Multipart {
        final String boundary = "accelforge-" + UUID.randomUUID();
        private final List<Part> parts = new ArrayList<>();

        private record Part(String name, String value, Path file) {
        }

        Multipart field(String name, String value) {
            parts.add(new Part(name, value, null));
            return this;
        }

        Multipart file(String name, Path file) {
            if (file != null) {
                parts.add(new Part(name, null, file));
            }
            return this;
        }

        HttpRequest.BodyPublisher publisher() throws FileNotFoundException {
            List<HttpRequest.BodyPublisher> publishers = new ArrayList<>();
            for (Part part : parts) {
                if (part.file() == null) {
                    publishers.add(utf8("--" + boundary + "\r\n" +
                            "Content-Disposition: form-data; name=\"" + part.name() + "\"\r\n\r\n" +
                            part.value() + "\r\n"));
                } else {
                    publishers.add(utf8("--" + boundary + "\r\n" +
                            "Content-Disposition: form-data; name=\"" + part.name() +
                            "\"; filename=\"" + part.file().getFileName() + "\"\r\n" +
                            "Content-Type: application/octet-stream\r\n\r\n"));
                    publishers.add(HttpRequest.BodyPublishers.ofFile(part.file()));
                    publishers.add(utf8("\r\n"));
                }
            }
            publishers.add(utf8("--" + boundary + "--\r\n"));
            return HttpRequest.BodyPublishers.concat(publishers.toArray(new HttpRequest.BodyPublisher[0]));
        }

        private static HttpRequest.BodyPublisher utf8(String text) {
            return HttpRequest.BodyPublishers.ofByteArray(text.getBytes(StandardCharsets.UTF_8));
        }
    }
}
