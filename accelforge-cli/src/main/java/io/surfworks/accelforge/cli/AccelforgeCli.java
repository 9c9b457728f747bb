package io.surfworks.accelforge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.accelforge.accelerator.Accelerator;
import io.surfworks.accelforge.accelerator.ConfigurationRequest;
import io.surfworks.accelforge.accelerator.ConfigurationResult;
import io.surfworks.accelforge.accelerator.JsonParameters;
import io.surfworks.accelforge.accelerator.NotConfiguredException;
import io.surfworks.accelforge.accelerator.ProcessRequest;
import io.surfworks.accelforge.accelerator.ProcessResult;
import io.surfworks.accelforge.accelerator.RemoteExecutionException;
import io.surfworks.accelforge.config.Configuration;
import io.surfworks.accelforge.config.ConfigurationException;
import io.surfworks.accelforge.config.ConfigurationLoader;
import io.surfworks.accelforge.host.HostDiscovery;
import io.surfworks.accelforge.host.HostParameters;
import io.surfworks.accelforge.host.ProvisioningException;
import io.surfworks.accelforge.host.StopPolicy;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accelforge CLI - Remote FPGA accelerator tool.
 *
 * <p>Commands:
 * <ul>
 *   <li>create - Save a named accelerator and its host parameters</li>
 *   <li>start - Provision the host and configure the accelerator</li>
 *   <li>process - Run one job on a started accelerator</li>
 *   <li>stop - Stop the accelerator and release its host</li>
 *   <li>list - List saved accelerators or provider instances</li>
 *   <li>clear - Forget every saved accelerator</li>
 *   <li>config - Show/set configuration</li>
 * </ul>
 *
 * <p>Every command runs in its own JVM: a started host is kept running between commands and
 * only {@code stop} applies the saved stop mode.
 */
public class AccelforgeCli {

    private static final String VERSION = "0.1.0";
    private static final String DEFAULT_NAME = "default";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Builds the accelerator of a saved record.
     */
    @FunctionalInterface
    interface AcceleratorFactory {
        Accelerator create(String name, HostParameters parameters, Configuration config);
    }

    private final AcceleratorStore store;
    private final AcceleratorFactory factory;
    private final PrintStream out;
    private final PrintStream err;

    public AccelforgeCli() {
        this(new AcceleratorStore(AcceleratorStore.DEFAULT_DIR), Accelerator::create, System.out, System.err);
    }

    AccelforgeCli(AcceleratorStore store, AcceleratorFactory factory, PrintStream out, PrintStream err) {
        this.store = store;
        this.factory = factory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new AccelforgeCli().run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command.
     *
     * @return process exit code
     */
    public int run(String[] args) {
        if (args.length == 0) {
            printHelp();
            return 0;
        }

        String command = args[0];

        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("accelforge " + VERSION);
            return 0;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
        if (hasFlag(commandArgs, "--verbose")) {
            enableVerboseLogging();
        }

        try {
            switch (command) {
                case "create" -> handleCreate(commandArgs);
                case "start" -> handleStart(commandArgs);
                case "process" -> handleProcess(commandArgs);
                case "stop" -> handleStop(commandArgs);
                case "list" -> handleList(commandArgs);
                case "clear" -> handleClear(commandArgs);
                case "config" -> handleConfig(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'accelforge --help' for usage.");
                    return 1;
                }
            }
            return 0;
        } catch (ProvisioningException e) {
            err.println("Host error: " + e.getMessage());
            return 1;
        } catch (RemoteExecutionException e) {
            err.println("Accelerator error: " + e.getMessage());
            return 1;
        } catch (ConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void handleCreate(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            printCreateHelp();
            return;
        }

        String name = getFlagValue(args, "--name", "-n", DEFAULT_NAME);
        String stopMode = getFlagValue(args, "--stop-mode", null, null);
        // Validates the value before anything is saved
        StopPolicy.parse(stopMode);

        Map<String, String> accelize = new LinkedHashMap<>();
        putIfSet(accelize, "client_id", getFlagValue(args, "--accelize-client-id", null, null));
        putIfSet(accelize, "secret_id", getFlagValue(args, "--accelize-secret-id", null, null));

        AcceleratorRecord record = new AcceleratorRecord(
                name,
                getFlagValue(args, "--accelerator", "-a", null),
                getFlagValue(args, "--config", "-c", null),
                getFlagValue(args, "--host-type", null, null),
                getFlagValue(args, "--instance-id", null, null),
                getFlagValue(args, "--host-ip", null, null),
                stopMode,
                extraOptions(args),
                accelize
        );

        // Resolving the parameters now reports missing host settings at create time
        Configuration config = configuration(record);
        HostParameters parameters = hostParameters(record, config, null);
        record = record.withStopMode(parameters.stopPolicy().shortName());

        store.save(record);
        out.println("Accelerator '" + name + "' created" +
                (parameters.hostType() != null ? " on " + parameters.hostType() : "") +
                " (stop mode: " + record.stopMode() + ")");
    }

    private void handleStart(String[] args)
            throws IOException, ProvisioningException, RemoteExecutionException {
        if (hasFlag(args, "--help")) {
            printStartHelp();
            return;
        }

        AcceleratorRecord record = loadRecord(args);
        String stopMode = getFlagValue(args, "--stop-mode", null, null);
        if (stopMode != null) {
            record = record.withStopMode(StopPolicy.parse(stopMode).shortName());
        }

        ConfigurationRequest request = ConfigurationRequest.of(parameters(args));
        String datafile = getFlagValue(args, "--datafile", "-i", null);
        if (datafile != null) {
            request = request.withDatafile(Path.of(datafile));
        }

        Configuration config = configuration(record);
        Accelerator accelerator = factory.create(record.acceleratorName(),
                hostParameters(record, config, StopPolicy.KEEP), config);
        try {
            ConfigurationResult result = accelerator.start(request);
            printResult(args, result.response(), "Accelerator '" + record.name() + "' started");
        } finally {
            // Saved even when start failed, so that stop can release a created instance
            if (record.hostIp() == null) {
                record = record.withInstanceId(accelerator.host().instanceId().orElse(record.instanceId()));
            }
            store.save(record);
            accelerator.close();
        }
    }

    private void handleProcess(String[] args)
            throws IOException, ProvisioningException, RemoteExecutionException {
        if (hasFlag(args, "--help")) {
            printProcessHelp();
            return;
        }

        AcceleratorRecord record = loadRecord(args);
        String fileIn = getFlagValue(args, "--file-in", "-i", null);
        String fileOut = getFlagValue(args, "--file-out", "-o", null);
        String timeout = getFlagValue(args, "--timeout", null, null);

        ProcessRequest request = new ProcessRequest(
                parameters(args),
                fileIn == null ? null : Path.of(fileIn),
                fileOut == null ? null : Path.of(fileOut),
                timeout == null ? null : Duration.ofSeconds(Long.parseLong(timeout))
        );

        Configuration config = configuration(record);
        try (Accelerator accelerator = factory.create(record.acceleratorName(),
                hostParameters(record, config, StopPolicy.KEEP), config)) {
            if (!accelerator.resume()) {
                throw new NotConfiguredException("Accelerator '" + record.name() +
                        "' has no active configuration. Run 'accelforge start' first.");
            }
            ProcessResult result = accelerator.process(request);
            if (hasFlag(args, "--json")) {
                out.println(JSON.writeValueAsString(result.response()));
            } else {
                out.println(JSON.writeValueAsString(result.specific()));
                if (fileOut != null) {
                    out.println("Result written to " + fileOut);
                }
            }
        }
    }

    private void handleStop(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            printStopHelp();
            return;
        }

        AcceleratorRecord record = loadRecord(args);
        StopPolicy policy = StopPolicy.parse(getFlagValue(args, "--stop-mode", null, record.stopMode()));
        if (policy == null) {
            policy = StopPolicy.TERMINATE;
        }

        if (record.hasHost()) {
            Configuration config = configuration(record);
            Accelerator accelerator = factory.create(record.acceleratorName(),
                    hostParameters(record, config, policy), config);
            try {
                if (policy != StopPolicy.KEEP) {
                    // Attaches to the running configuration so that it is torn down too
                    accelerator.resume();
                }
            } catch (ProvisioningException | RemoteExecutionException e) {
                err.println("Warning: accelerator not reachable, stopping host only (" + e.getMessage() + ")");
            } finally {
                accelerator.close();
            }
        }

        store.delete(record.name());
        out.println("Accelerator '" + record.name() + "' stopped (stop mode: " + policy.shortName() + ")");
    }

    private void handleList(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: accelforge list [--instances] [--prefix <prefix>] [--config <file>] [--json]");
            out.println();
            out.println("Options:");
            out.println("  --instances      List instances of every configured provider");
            out.println("  --prefix <p>     Instance name prefix (default: configured host_name_prefix)");
            out.println("  --config <file>  Configuration file");
            out.println("  --json           Output as JSON");
            return;
        }

        boolean json = hasFlag(args, "--json");

        if (hasFlag(args, "--instances")) {
            String configFile = getFlagValue(args, "--config", "-c", null);
            Configuration config = configFile != null
                    ? ConfigurationLoader.load(Path.of(configFile))
                    : ConfigurationLoader.load();
            List<HostDiscovery.DiscoveredHost> hosts =
                    HostDiscovery.list(config, getFlagValue(args, "--prefix", null, null));
            if (json) {
                out.println(JSON.writeValueAsString(hosts));
                return;
            }
            if (hosts.isEmpty()) {
                out.println("No instances found.");
                return;
            }
            out.printf("%-12s %-40s %s%n", "HOST TYPE", "INSTANCE ID", "NAME");
            out.println("-".repeat(80));
            for (HostDiscovery.DiscoveredHost host : hosts) {
                out.printf("%-12s %-40s %s%n", host.hostType(), host.instance().id(),
                        host.instance().name() != null ? host.instance().name() : "");
            }
            return;
        }

        List<AcceleratorRecord> records = store.list();
        if (json) {
            out.println(JSON.writeValueAsString(records));
            return;
        }
        if (records.isEmpty()) {
            out.println("No accelerators found.");
            return;
        }
        out.printf("%-16s %-16s %-12s %-40s %s%n", "NAME", "ACCELERATOR", "HOST TYPE", "HOST", "STOP MODE");
        out.println("-".repeat(96));
        for (AcceleratorRecord record : records) {
            String host = record.hostIp() != null ? record.hostIp()
                    : record.instanceId() != null ? record.instanceId() : "(not started)";
            out.printf("%-16s %-16s %-12s %-40s %s%n",
                    record.name(),
                    record.accelerator() != null ? record.accelerator() : "-",
                    record.hostType() != null ? record.hostType() : "-",
                    host,
                    record.stopMode());
        }
    }

    private void handleClear(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: accelforge clear");
            out.println();
            out.println("Forget every saved accelerator. Running hosts are not stopped.");
            return;
        }
        int deleted = store.clear();
        out.println("Cleared " + deleted + " accelerator(s).");
    }

    private void handleConfig(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: accelforge config [--set <section>.<key>=<value>] [--config <file>] [--json]");
            out.println();
            out.println("Options:");
            out.println("  --set            Set a configuration value, an empty value removes it");
            out.println("  --config <file>  Configuration file (default: ~/.config/accelforge/accelerator.json)");
            out.println("  --json           Output as JSON");
            out.println();
            out.println("Examples:");
            out.println("  accelforge config --set host.host_type=openstack");
            out.println("  accelforge config --set host.openstack.region=GRA5");
            out.println("  accelforge config --set accelize.client_id=XXXX");
            return;
        }

        String configFile = getFlagValue(args, "--config", "-c", null);
        Path file = configFile != null ? Path.of(configFile) : Configuration.configFile();
        Configuration config = ConfigurationLoader.load(file);

        String setValue = getFlagValue(args, "--set", null, null);
        if (setValue != null) {
            String[] parts = setValue.split("=", 2);
            int dot = parts[0].lastIndexOf('.');
            if (parts.length != 2 || dot <= 0 || dot == parts[0].length() - 1) {
                throw new IllegalArgumentException("Invalid format. Use --set <section>.<key>=<value>");
            }
            String value = parts[1].isEmpty() ? null : parts[1];
            config = config.with(parts[0].substring(0, dot), parts[0].substring(dot + 1), value);
            ConfigurationLoader.save(config, file);
            out.println("Configuration updated.");
        }

        if (hasFlag(args, "--json")) {
            ObjectNode root = JSON.createObjectNode();
            for (String section : config.sectionNames()) {
                ObjectNode values = root.putObject(section);
                config.section(section).forEach((key, value) -> values.put(key, mask(key, value)));
            }
            out.println(JSON.writeValueAsString(root));
            return;
        }

        out.println("Configuration: " + file);
        out.println("-".repeat(40));
        if (config.sectionNames().isEmpty()) {
            out.println("(empty)");
        }
        for (String section : config.sectionNames()) {
            out.println("[" + section + "]");
            config.section(section).forEach((key, value) -> out.println("  " + key + " = " + mask(key, value)));
        }
    }

    // ===== Helper methods =====

    private AcceleratorRecord loadRecord(String[] args) throws IOException {
        String name = getFlagValue(args, "--name", "-n", DEFAULT_NAME);
        return store.load(name).orElseThrow(() -> new IllegalArgumentException(
                "No accelerator found for '--name " + name + "'. " +
                        "Run 'accelforge create' before using other commands."));
    }

    /**
     * Loads the record's configuration and applies the options given at create time on top.
     */
    static Configuration configuration(AcceleratorRecord record) {
        Configuration config = record.configFile() != null
                ? ConfigurationLoader.load(Path.of(record.configFile()))
                : ConfigurationLoader.load();

        String hostType = config.resolve(HostParameters.SECTION, "host_type", record.hostType());
        String hostSection = hostType == null
                ? HostParameters.SECTION
                : HostParameters.SECTION + "." + hostType.toLowerCase();
        Configuration.Builder builder = config.toBuilder();
        record.hostOptions().forEach((key, value) -> builder.set(hostSection, key, value));
        record.accelize().forEach((key, value) -> builder.set("accelize", key, value));
        return builder.build();
    }

    static HostParameters hostParameters(AcceleratorRecord record, Configuration config, StopPolicy policy) {
        return HostParameters.builder()
                .hostType(record.hostType())
                .instanceId(record.instanceId())
                .hostIp(record.hostIp())
                .stopPolicy(policy != null ? policy : StopPolicy.parse(record.stopMode()))
                .build(config);
    }

    private static ObjectNode parameters(String[] args) {
        String parameters = getFlagValue(args, "--parameters", "-j", null);
        return parameters == null ? JsonParameters.empty() : JsonParameters.parse(parameters);
    }

    /**
     * Collects {@code --key=value} arguments; dashes in keys become underscores.
     */
    static Map<String, String> extraOptions(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 2) {
                options.put(arg.substring(2, eq).replace('-', '_'), arg.substring(eq + 1));
            }
        }
        return options;
    }

    private void printResult(String[] args, JsonNode response, String summary) throws IOException {
        if (hasFlag(args, "--json")) {
            out.println(JSON.writeValueAsString(response));
        } else {
            out.println(summary);
        }
    }

    private static void putIfSet(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String mask(String key, String value) {
        return key.contains("secret") || key.contains("password") ? "****" : value;
    }

    private static void enableVerboseLogging() {
        Logger logger = Logger.getLogger("io.surfworks.accelforge");
        logger.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
        logger.setUseParentHandlers(false);
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag, String shortFlag, String defaultValue) {
        List<String> argList = new ArrayList<>(Arrays.asList(args));
        int index = argList.indexOf(flag);
        if (index < 0 && shortFlag != null) {
            index = argList.indexOf(shortFlag);
        }
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return defaultValue;
    }

    // ===== Help output =====

    private void printHelp() {
        out.println("Accelforge CLI - Remote FPGA accelerator tool");
        out.println();
        out.println("Usage: accelforge <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  create   Save a named accelerator and its host parameters");
        out.println("  start    Provision the host and configure the accelerator");
        out.println("  process  Run one job on a started accelerator");
        out.println("  stop     Stop the accelerator and release its host");
        out.println("  list     List saved accelerators or provider instances");
        out.println("  clear    Forget every saved accelerator");
        out.println("  config   Show/set configuration");
        out.println();
        out.println("Options:");
        out.println("  -h, --help    Show help for a command");
        out.println("  -v, --version Show version");
        out.println("  --verbose     Log progress details");
        out.println();
        out.println("Examples:");
        out.println("  accelforge create -n demo -a my_accelerator --host-type openstack");
        out.println("  accelforge start -n demo");
        out.println("  accelforge process -n demo -i data.bin -o result.bin");
        out.println("  accelforge stop -n demo --stop-mode term");
    }

    private void printCreateHelp() {
        out.println("Usage: accelforge create [options] [--<host_parameter>=<value>...]");
        out.println();
        out.println("Save a named accelerator. Nothing is provisioned until 'start'.");
        out.println();
        out.println("Options:");
        out.println("  -n, --name <name>            Accelerator name (default: default)");
        out.println("  -a, --accelerator <name>     Accelerator product name");
        out.println("  -c, --config <file>          Configuration file");
        out.println("  --host-type <type>           Provider (openstack, ovh, ...)");
        out.println("  --instance-id <id>           Reuse an existing instance");
        out.println("  --host-ip <address>          Use a running host, never stopped by accelforge");
        out.println("  --stop-mode <mode>           term, stop or keep");
        out.println("  --accelize-client-id <id>    Accelerator client ID");
        out.println("  --accelize-secret-id <id>    Accelerator secret ID");
        out.println();
        out.println("Any other host parameter can be given as --<name>=<value>, for example");
        out.println("  --region=GRA5 --instance-type=c2-7 --image=fpga-image");
    }

    private void printStartHelp() {
        out.println("Usage: accelforge start [options]");
        out.println();
        out.println("Provision the host if needed and configure the accelerator.");
        out.println();
        out.println("Options:");
        out.println("  -n, --name <name>             Accelerator name (default: default)");
        out.println("  -i, --datafile <file>         Configuration data file");
        out.println("  -j, --parameters <json|file>  Configuration parameters");
        out.println("  --stop-mode <mode>            Replace the saved stop mode");
        out.println("  --json                        Print the full host response");
    }

    private void printProcessHelp() {
        out.println("Usage: accelforge process [options]");
        out.println();
        out.println("Run one job with the configuration set by 'start'.");
        out.println();
        out.println("Options:");
        out.println("  -n, --name <name>             Accelerator name (default: default)");
        out.println("  -i, --file-in <file>          Input file");
        out.println("  -o, --file-out <file>         Output file");
        out.println("  -j, --parameters <json|file>  Process parameters");
        out.println("  --timeout <seconds>           Job timeout");
        out.println("  --json                        Print the full host response");
    }

    private void printStopHelp() {
        out.println("Usage: accelforge stop [options]");
        out.println();
        out.println("Stop the accelerator, apply the stop mode to its host and forget it.");
        out.println();
        out.println("Options:");
        out.println("  -n, --name <name>    Accelerator name (default: default)");
        out.println("  --stop-mode <mode>   term, stop or keep (default: saved stop mode)");
    }
}
