package io.surfworks.accelforge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads and saves {@link Configuration} as JSON.
 *
 * <p>The document is an object whose fields are sections:
 * <pre>{@code
 * {
 *   "host":           { "host_type": "openstack", "stop_mode": "term" },
 *   "host.openstack": { "region": "GRA5", "client_id": "...", "secret_id": "..." },
 *   "accelize":       { "client_id": "...", "secret_id": "..." },
 *   "configuration":  { "parameters": "{\"app\": {\"reset\": true}}" }
 * }
 * }</pre>
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Explicit file passed by the caller</li>
 *   <li>{@code accelerator.json} in the working directory</li>
 *   <li>{@code ~/.config/accelforge/accelerator.json}</li>
 *   <li>Defaults (empty configuration)</li>
 * </ol>
 */
public final class ConfigurationLoader {

    private static final Logger LOG = Logger.getLogger(ConfigurationLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private ConfigurationLoader() {
    }

    /**
     * Loads configuration from the first file found in the search path.
     *
     * <p>If no config file exists, returns an empty configuration.
     */
    public static Configuration load() {
        for (Path candidate : searchPath()) {
            if (Files.isRegularFile(candidate)) {
                return load(candidate);
            }
        }
        return Configuration.empty();
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration, or an empty one if the file does not exist
     * @throws ConfigurationException if the file exists but cannot be parsed
     */
    public static Configuration load(Path configFile) {
        if (!Files.exists(configFile)) {
            return Configuration.empty();
        }
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            Configuration config = fromJson(root);
            LOG.fine("Loaded configuration from " + configFile);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration file " + configFile, e);
        }
    }

    /**
     * Builds a configuration from a parsed JSON document.
     */
    public static Configuration fromJson(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return Configuration.empty();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration root must be a JSON object");
        }

        Configuration.Builder builder = Configuration.builder();
        Iterator<Map.Entry<String, JsonNode>> sections = root.fields();
        while (sections.hasNext()) {
            Map.Entry<String, JsonNode> section = sections.next();
            if (!section.getValue().isObject()) {
                throw new ConfigurationException("Section '" + section.getKey() + "' must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> values = section.getValue().fields();
            while (values.hasNext()) {
                Map.Entry<String, JsonNode> value = values.next();
                builder.set(section.getKey(), value.getKey(), asText(value.getValue()));
            }
        }
        return builder.build();
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(Configuration config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        for (String name : config.sectionNames()) {
            ObjectNode section = root.putObject(name);
            config.section(name).forEach(section::put);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    static List<Path> searchPath() {
        return List.of(
                Path.of(System.getProperty("user.dir"), Configuration.CONFIG_FILE),
                Configuration.configFile()
        );
    }

    private static String asText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isContainerNode()) {
            return node.toString();
        }
        return node.asText();
    }
}
