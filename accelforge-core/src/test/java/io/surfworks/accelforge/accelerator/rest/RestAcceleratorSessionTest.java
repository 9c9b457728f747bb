package io.surfworks.accelforge.accelerator.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.surfworks.accelforge.accelerator.ConfigurationResult;
import io.surfworks.accelforge.accelerator.ProcessResult;
import io.surfworks.accelforge.accelerator.RemoteExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RestAcceleratorSession against an in-process accelerator host.
 */
class RestAcceleratorSessionTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private HttpServer server;
    private RestAcceleratorSession session;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> uploads = new CopyOnWriteArrayList<>();
    private final AtomicInteger processReads = new AtomicInteger();

    private volatile int configureStatus = 0;
    private volatile boolean processInError = false;
    private volatile int readsUntilProcessed = 2;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        session = new RestAcceleratorSession("127.0.0.1:" + server.getAddress().getPort() + "/",
                HttpClient.newHttpClient(), Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String route = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
        requests.add(route);
        if (exchange.getRequestMethod().equals("POST")) {
            uploads.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        }

        switch (route) {
            case "POST /v1.0/configuration/" -> respond(exchange, 201, """
                    {"id": 5, "url": "http://host/v1.0/configuration/5/",
                     "parametersresult": "{\\"app\\": {\\"status\\": %d, \\"msg\\": \\"bad bitstream\\"}}"}
                    """.formatted(configureStatus));
            case "GET /v1.0/configuration/5/" -> respond(exchange, 200,
                    "{\"id\": 5, \"url\": \"http://host/v1.0/configuration/5/\", \"inerror\": false}");
            case "GET /v1.0/configuration/" -> respond(exchange, 200,
                    "{\"results\": [{\"url\": \"http://host/v1.0/configuration/7/\", \"used\": 1}]}");
            case "POST /v1.0/process/" -> respond(exchange, 201, "{\"id\": 9, \"processed\": false}");
            case "GET /v1.0/process/9/" -> {
                boolean processed = processReads.incrementAndGet() >= readsUntilProcessed;
                ObjectNode body = JSON.createObjectNode();
                body.put("id", 9);
                body.put("processed", processed);
                body.put("inerror", processed && processInError);
                body.put("datafileresult", "/media/out.bin");
                body.put("parametersresult", "{\"app\": {\"status\": 0, \"specific\": {\"r\": 1}}}");
                respond(exchange, 200, body.toString());
            }
            case "GET /media/out.bin" -> respond(exchange, 200, "RESULT");
            case "DELETE /v1.0/process/9/" -> respond(exchange, 204, null);
            case "GET /v1.0/stop/" -> respond(exchange, 200, "{}");
            default -> respond(exchange, 404, "{}");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private static ObjectNode parameters(String text) throws IOException {
        return (ObjectNode) JSON.readTree(text);
    }

    @Test
    void formatUrl() {
        assertEquals("http://10.0.0.1", RestAcceleratorSession.formatUrl("10.0.0.1"));
        assertEquals("https://host:8443", RestAcceleratorSession.formatUrl(" https://host:8443/ "));
        assertTrue(session.baseUrl().startsWith("http://127.0.0.1:"));
    }

    @Test
    void configureUploadsParametersAndDatafile() throws Exception {
        Path datafile = Files.writeString(tempDir.resolve("bitstream.dat"), "DATAFILE-CONTENT");

        ConfigurationResult result = session.configure(parameters("{\"app\": {\"reset\": true}}"), datafile);

        assertEquals("http://host/v1.0/configuration/5/", result.configurationUrl());
        assertEquals(0, result.response().path("app").path("status").asInt());
        assertEquals("http://host/v1.0/configuration/5/", session.configurationUrl().orElseThrow());
        assertTrue(requests.contains("GET /v1.0/configuration/5/"));

        String upload = uploads.get(0);
        assertTrue(upload.contains("name=\"parameters\""));
        assertTrue(upload.contains("{\"app\":{\"reset\":true}}"));
        assertTrue(upload.contains("filename=\"bitstream.dat\""));
        assertTrue(upload.contains("DATAFILE-CONTENT"));
    }

    @Test
    void configureRaisesHostMessage() {
        configureStatus = 1;

        RemoteExecutionException e = assertThrows(RemoteExecutionException.class, () ->
                session.configure(parameters("{}"), null));
        assertTrue(e.getMessage().contains("bad bitstream"));
        assertTrue(session.configurationUrl().isEmpty());
    }

    @Test
    void missingDatafileFails() {
        assertThrows(RemoteExecutionException.class, () ->
                session.configure(parameters("{}"), tempDir.resolve("missing.dat")));
    }

    @Test
    void executeBeforeConfigureFails() {
        assertThrows(RemoteExecutionException.class, () ->
                session.execute(parameters("{}"), null, null, null));
        assertTrue(requests.isEmpty());
    }

    @Test
    void executePollsDownloadsAndDeletes() throws Exception {
        session.configure(parameters("{}"), null);
        Path input = Files.writeString(tempDir.resolve("in.bin"), "INPUT");
        Path output = tempDir.resolve("out.bin");

        ProcessResult result = session.execute(parameters("{}"), input, output, Duration.ofSeconds(10));

        assertEquals(1, result.specific().path("r").asInt());
        assertEquals("RESULT", Files.readString(output));
        assertEquals(2, processReads.get());
        assertTrue(requests.contains("DELETE /v1.0/process/9/"));
        assertTrue(uploads.get(1).contains("name=\"configuration\""));
        assertTrue(uploads.get(1).contains("INPUT"));
    }

    @Test
    void executeTimesOutAndStillDeletes() throws Exception {
        session.configure(parameters("{}"), null);
        readsUntilProcessed = Integer.MAX_VALUE;

        RemoteExecutionException e = assertThrows(RemoteExecutionException.class, () ->
                session.execute(parameters("{}"), null, null, Duration.ofMillis(100)));

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(requests.contains("DELETE /v1.0/process/9/"));
    }

    @Test
    void executeInErrorFails() throws Exception {
        session.configure(parameters("{}"), null);
        processInError = true;

        assertThrows(RemoteExecutionException.class, () ->
                session.execute(parameters("{}"), null, null, null));
        assertTrue(requests.contains("DELETE /v1.0/process/9/"));
    }

    @Test
    void teardownClearsConfiguration() throws Exception {
        session.configure(parameters("{}"), null);

        session.teardown();

        assertTrue(requests.contains("GET /v1.0/stop/"));
        assertTrue(session.configurationUrl().isEmpty());
    }

    @Test
    void resumeUsesLastUsedConfiguration() throws Exception {
        assertEquals("http://host/v1.0/configuration/7/", session.resume().orElseThrow());
        assertEquals("http://host/v1.0/configuration/7/", session.configurationUrl().orElseThrow());
    }
}
