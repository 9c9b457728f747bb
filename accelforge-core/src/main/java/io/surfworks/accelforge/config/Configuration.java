package io.surfworks.accelforge.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, pre-resolved accelforge configuration.
 *
 * <p>A configuration is a set of named sections, each mapping keys to string values.
 * A section whose name contains a dot (e.g. {@code host.openstack}) is a subsection of the
 * part before the first dot ({@code host}). Lookups follow this precedence:
 * <ol>
 *   <li>explicit argument given by the caller (highest priority)</li>
 *   <li>subsection value</li>
 *   <li>parent section value</li>
 *   <li>default (lowest priority)</li>
 * </ol>
 *
 * <p>Instances are created by {@link ConfigurationLoader} or {@link #builder()} and passed
 * explicitly to the components that need them; there is no ambient lookup.
 */
public final class Configuration {

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "accelforge"
    );

    /** Config file name, also searched in the working directory */
    public static final String CONFIG_FILE = "accelerator.json";

    private static final Configuration EMPTY = new Configuration(Map.of());
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, Map<String, String>> sections;

    private Configuration(Map<String, Map<String, String>> sections) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        sections.forEach((name, values) -> copy.put(name, Map.copyOf(values)));
        this.sections = Map.copyOf(copy);
    }

    /**
     * Returns a configuration with no sections; every lookup yields its default.
     */
    public static Configuration empty() {
        return EMPTY;
    }

    /**
     * Returns the default config file path in the user's home directory.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a value with the explicit argument taking precedence over the configuration.
     *
     * @param section          section name, possibly a subsection ({@code host.ovh})
     * @param key              parameter name
     * @param explicitOverride value passed by the caller, or null
     * @return the resolved value, or null if nothing is set
     */
    public String resolve(String section, String key, String explicitOverride) {
        return resolve(section, key, explicitOverride, null);
    }

    /**
     * Resolves a value, falling back to {@code defaultValue} when neither the caller nor
     * the configuration provide one.
     */
    public String resolve(String section, String key, String explicitOverride, String defaultValue) {
        Objects.requireNonNull(section, "section cannot be null");
        Objects.requireNonNull(key, "key cannot be null");

        if (explicitOverride != null) {
            return explicitOverride;
        }
        String value = lookup(section, key);
        if (value == null) {
            int dot = section.indexOf('.');
            if (dot > 0) {
                value = lookup(section.substring(0, dot), key);
            }
        }
        return value != null ? value : defaultValue;
    }

    /**
     * Resolves a boolean; accepts {@code true/false}, {@code yes/no} and {@code 1/0}.
     */
    public boolean resolveBoolean(String section, String key, Boolean explicitOverride, boolean defaultValue) {
        if (explicitOverride != null) {
            return explicitOverride;
        }
        String value = resolve(section, key, null);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase()) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new ConfigurationException(
                    "Invalid boolean for '" + section + "." + key + "': " + value);
        };
    }

    public int resolveInt(String section, String key, Integer explicitOverride, int defaultValue) {
        if (explicitOverride != null) {
            return explicitOverride;
        }
        String value = resolve(section, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Invalid integer for '" + section + "." + key + "': " + value, e);
        }
    }

    /**
     * Resolves a duration expressed in (possibly fractional) seconds.
     */
    public Duration resolveDuration(String section, String key, Duration explicitOverride, Duration defaultValue) {
        if (explicitOverride != null) {
            return explicitOverride;
        }
        String value = resolve(section, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "Invalid duration (seconds) for '" + section + "." + key + "': " + value, e);
        }
    }

    /**
     * Resolves a value holding a JSON object literal.
     *
     * @return the parsed object, or an empty object when the key is not set
     */
    public ObjectNode resolveJson(String section, String key) {
        String value = resolve(section, key, null);
        if (value == null || value.isBlank()) {
            return JSON.createObjectNode();
        }
        try {
            if (JSON.readTree(value) instanceof ObjectNode object) {
                return object;
            }
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    "Invalid JSON object for '" + section + "." + key + "'", e);
        }
        throw new ConfigurationException("Value of '" + section + "." + key + "' is not a JSON object");
    }

    /**
     * Returns the raw values of a single section (no parent fallback).
     */
    public Map<String, String> section(String name) {
        return sections.getOrDefault(name, Map.of());
    }

    public Set<String> sectionNames() {
        return sections.keySet();
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    /**
     * Returns a copy of this configuration with one value replaced.
     * A null value removes the key.
     */
    public Configuration with(String section, String key, String value) {
        Builder builder = toBuilder();
        if (value == null) {
            builder.remove(section, key);
        } else {
            builder.set(section, key, value);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        sections.forEach((name, values) -> values.forEach((k, v) -> builder.set(name, k, v)));
        return builder;
    }

    private String lookup(String section, String key) {
        Map<String, String> values = sections.get(section);
        if (values == null) {
            return null;
        }
        String value = values.get(key);
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Configuration other && sections.equals(other.sections);
    }

    @Override
    public int hashCode() {
        return sections.hashCode();
    }

    @Override
    public String toString() {
        return "Configuration" + sections;
    }

    /**
     * Builder for Configuration. Null or empty values are ignored so that
     * "not set" never shadows a parent section.
     */
    public static final class Builder {
        private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        public Builder set(String section, String key, String value) {
            if (value == null || value.isEmpty()) {
                return this;
            }
            sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(key, value);
            return this;
        }

        public Builder section(String section, Map<String, String> values) {
            values.forEach((k, v) -> set(section, k, v));
            return this;
        }

        Builder remove(String section, String key) {
            Map<String, String> values = sections.get(section);
            if (values != null) {
                values.remove(key);
                if (values.isEmpty()) {
                    sections.remove(section);
                }
            }
            return this;
        }

        public Configuration build() {
            return new Configuration(sections);
        }
    }
}
