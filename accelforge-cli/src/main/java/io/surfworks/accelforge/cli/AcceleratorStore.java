package io.surfworks.accelforge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.surfworks.accelforge.config.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Saves named accelerators as one JSON file each.
 */
public final class AcceleratorStore {

    /** Default directory of saved accelerators */
    public static final Path DEFAULT_DIR = Configuration.CONFIG_DIR.resolve("accelerators");

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper jsonMapper;

    public AcceleratorStore(Path directory) {
        this.directory = directory;
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path directory() {
        return directory;
    }

    public void save(AcceleratorRecord record) throws IOException {
        Files.createDirectories(directory);
        jsonMapper.writeValue(file(record.name()).toFile(), record);
    }

    public Optional<AcceleratorRecord> load(String name) throws IOException {
        Path file = file(name);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(jsonMapper.readValue(file.toFile(), AcceleratorRecord.class));
    }

    /**
     * @return true if a record was deleted
     */
    public boolean delete(String name) throws IOException {
        return Files.deleteIfExists(file(name));
    }

    /**
     * Returns every saved record, sorted by name.
     */
    public List<AcceleratorRecord> list() throws IOException {
        List<AcceleratorRecord> records = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return records;
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).sorted().toList()) {
                records.add(jsonMapper.readValue(file.toFile(), AcceleratorRecord.class));
            }
        }
        return records;
    }

    /**
     * Deletes every saved record.
     *
     * @return number of records deleted
     */
    public int clear() throws IOException {
        int deleted = 0;
        for (AcceleratorRecord record : list()) {
            if (delete(record.name())) {
                deleted++;
            }
        }
        return deleted;
    }

    private Path file(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid accelerator name: '" + name + "'");
        }
        return directory.resolve(name + SUFFIX);
    }
}
