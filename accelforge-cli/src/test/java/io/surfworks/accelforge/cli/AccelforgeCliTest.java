package io.surfworks.accelforge.cli;

import io.surfworks.accelforge.accelerator.Accelerator;
import io.surfworks.accelforge.host.Host;
import io.surfworks.accelforge.testing.MockAcceleratorSession;
import io.surfworks.accelforge.testing.MockProviderAdapter;
import io.surfworks.accelforge.testing.MockSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AccelforgeCli, run against the mock provider and session.
 */
class AccelforgeCliTest {

    @TempDir
    Path tempDir;

    private MockProviderAdapter provider;
    private MockSessionFactory sessions;
    private AcceleratorStore store;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private AccelforgeCli cli;
    private Path configFile;

    @BeforeEach
    void setUp() {
        provider = new MockProviderAdapter();
        // A real host keeps its configuration between CLI invocations
        sessions = new MockSessionFactory(session -> session.setActiveConfiguration("mock://configuration/1"));
        store = new AcceleratorStore(tempDir.resolve("accelerators"));
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        configFile = tempDir.resolve("accelerator.json");
        cli = new AccelforgeCli(
                store,
                (name, parameters, config) -> new Accelerator(
                        name, new Host(parameters, provider, (address, timeout) -> true), sessions, config),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return cli.run(args);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private int createDemo(String... extra) {
        List<String> args = new ArrayList<>(List.of(
                "create", "-n", "demo", "-a", "my_accel", "-c", configFile.toString(),
                "--host-type", "mock", "--instance-type=small", "--image=fpga-image"));
        args.addAll(List.of(extra));
        return run(args.toArray(new String[0]));
    }

    // ===== Global options =====

    @Test
    void noArgumentsPrintsHelp() {
        assertEquals(0, run());
        assertTrue(output().contains("Usage: accelforge <command>"));
    }

    @Test
    void versionFlag() {
        assertEquals(0, run("--version"));
        assertTrue(output().startsWith("accelforge "));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("explode"));
        assertTrue(errors().contains("Unknown command: explode"));
    }

    // ===== create =====

    @Test
    void createSavesRecordWithoutProvisioning() throws IOException {
        assertEquals(0, createDemo());

        AcceleratorRecord record = store.load("demo").orElseThrow();
        assertEquals("my_accel", record.accelerator());
        assertEquals("mock", record.hostType());
        assertEquals("term", record.stopMode());
        assertEquals(Map.of("instance_type", "small", "image", "fpga-image"), record.hostOptions());
        assertTrue(provider.getCalls().isEmpty());
    }

    @Test
    void createWithHostIpDefaultsToKeep() throws IOException {
        assertEquals(0, run("create", "-n", "lab", "-c", configFile.toString(), "--host-ip", "10.1.2.3"));

        assertEquals("keep", store.load("lab").orElseThrow().stopMode());
    }

    @Test
    void createWithoutHostSettingsFails() {
        assertEquals(1, run("create", "-n", "broken", "-c", configFile.toString()));

        assertTrue(errors().contains("host_type is required"));
        assertFalse(Files.exists(store.directory().resolve("broken.json")));
    }

    @Test
    void createRejectsInvalidStopMode() {
        assertEquals(1, createDemo("--stop-mode", "explode"));
        assertTrue(errors().contains("Invalid stop policy"));
    }

    // ===== start / process / stop =====

    @Test
    void startProvisionsAndRecordsInstance() throws IOException {
        createDemo("--accelize-client-id", "cid", "--accelize-secret-id", "sid");

        assertEquals(0, run("start", "-n", "demo", "-j", "{\"app\": {\"reset\": true}}"));

        AcceleratorRecord record = store.load("demo").orElseThrow();
        assertEquals("mock-i-1", record.instanceId());
        assertTrue(provider.hasInstance("mock-i-1"), "start keeps the host running");

        MockAcceleratorSession session = sessions.getSessions().get(0);
        assertEquals(1, session.getConfigurations().size());
        assertTrue(session.getConfigurations().get(0).path("app").path("reset").asBoolean());
        assertEquals("cid", session.getConfigurations().get(0).path("env").path("client_id").asText());
        assertEquals(0, session.getTeardownCount());
    }

    @Test
    void processReusesStartedHost() throws IOException {
        createDemo();
        run("start", "-n", "demo");

        assertEquals(0, run("process", "-n", "demo", "-j", "{\"app\": {\"specific\": {\"answer\": 42}}}"));

        assertEquals(1, provider.getCallCount("create"), "no second instance");
        assertTrue(provider.getCallCount("find") >= 1);
        MockAcceleratorSession session = sessions.getSessions().get(1);
        assertEquals(1, session.getProcessed().size());
        assertTrue(output().contains("\"answer\" : 42"));
    }

    @Test
    void processWithoutActiveConfigurationFails() throws IOException {
        sessions = new MockSessionFactory();
        cli = new AccelforgeCli(
                store,
                (name, parameters, config) -> new Accelerator(
                        name, new Host(parameters, provider, (address, timeout) -> true), sessions, config),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        run("create", "-n", "lab", "-c", configFile.toString(), "--host-ip", "10.1.2.3");

        assertEquals(1, run("process", "-n", "lab"));

        assertTrue(errors().contains("Run 'accelforge start' first"));
        assertTrue(sessions.getSessions().get(0).getProcessed().isEmpty());
    }

    @Test
    void stopAppliesSavedStopModeAndForgetsRecord() throws IOException {
        createDemo();
        run("start", "-n", "demo");

        assertEquals(0, run("stop", "-n", "demo"));

        assertFalse(provider.hasInstance("mock-i-1"));
        assertEquals(1, provider.getCallCount("terminate"));
        assertTrue(store.load("demo").isEmpty());
        MockAcceleratorSession last = sessions.getSessions().get(sessions.getSessions().size() - 1);
        assertEquals(1, last.getTeardownCount());
    }

    @Test
    void stopWithKeepLeavesInstanceRunning() throws IOException {
        createDemo();
        run("start", "-n", "demo");

        assertEquals(0, run("stop", "-n", "demo", "--stop-mode", "keep"));

        assertTrue(provider.hasInstance("mock-i-1"));
        assertEquals(0, provider.getCallCount("terminate"));
        assertTrue(store.load("demo").isEmpty());
    }

    @Test
    void stopBeforeStartOnlyForgetsRecord() throws IOException {
        createDemo();

        assertEquals(0, run("stop", "-n", "demo"));

        assertTrue(provider.getCalls().isEmpty());
        assertTrue(sessions.getSessions().isEmpty());
        assertTrue(store.load("demo").isEmpty());
    }

    @Test
    void commandOnUnknownNameFails() {
        assertEquals(1, run("start", "-n", "ghost"));
        assertTrue(errors().contains("No accelerator found for '--name ghost'"));
    }

    // ===== list / clear / config =====

    @Test
    void listAndClear() throws IOException {
        createDemo();
        run("create", "-n", "lab", "-c", configFile.toString(), "--host-ip", "10.1.2.3");

        assertEquals(0, run("list"));
        assertTrue(output().contains("demo"));
        assertTrue(output().contains("10.1.2.3"));

        assertEquals(0, run("clear"));
        assertTrue(output().contains("Cleared 2 accelerator(s)."));
        assertTrue(store.list().isEmpty());
    }

    @Test
    void configSetWritesSubsectionAndMasksSecrets() throws IOException {
        assertEquals(0, run("config", "-c", configFile.toString(), "--set", "host.openstack.region=GRA5"));
        assertEquals(0, run("config", "-c", configFile.toString(), "--set", "host.openstack.secret_id=s3cr3t"));

        String content = Files.readString(configFile);
        assertTrue(content.contains("\"host.openstack\""));
        assertTrue(content.contains("GRA5"));
        assertTrue(output().contains("region = GRA5"));
        assertTrue(output().contains("secret_id = ****"));
        assertFalse(output().contains("s3cr3t"));
    }

    @Test
    void configSetRejectsMissingSection() {
        assertEquals(1, run("config", "-c", configFile.toString(), "--set", "region=GRA5"));
        assertTrue(errors().contains("Invalid format"));
    }

    @Test
    void extraOptionsConvertDashes() {
        Map<String, String> options = AccelforgeCli.extraOptions(
                new String[]{"--name", "x", "--instance-type=c2-7", "--region=GRA5", "plain=value"});

        assertEquals(Map.of("instance_type", "c2-7", "region", "GRA5"), options);
    }
}
