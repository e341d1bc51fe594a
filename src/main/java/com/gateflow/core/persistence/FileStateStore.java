package com.gateflow.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link StateStore} that keeps one pretty-printed JSON file per key.
 * <p>
 * Layout:
 * <pre>
 *   {directory}/
 *   ├── docsearch-login-pipeline.json
 *   ├── docsearch-login-gate1-output.json
 *   └── ...
 * </pre>
 * Writes go to a uniquely named temp file in the same directory which is then atomically
 * moved over the target, so concurrent writers never share a temp file and readers see
 * either the old or the new record.
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileStateStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void write(String key, Object value) {
        Path target = fileFor(key);
        Path tmp = directory.resolve(key + "." + UUID.randomUUID().toString().substring(0, 8) + ".tmp");
        try {
            Files.createDirectories(directory);
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote state record {} ({} chars)", key, json.length());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StateStoreException(key, "Failed to write state record", e);
        }
    }

    @Override
    public <T> Optional<T> read(String key, Class<T> type) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), type));
        } catch (IOException e) {
            throw new StateStoreException(key, "Failed to read state record", e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(fileFor(key));
    }

    @Override
    public List<String> listKeys(String suffix) {
        List<String> keys = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return keys;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                String key = name.substring(0, name.length() - EXTENSION.length());
                if (suffix == null || key.endsWith(suffix)) {
                    keys.add(key);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException(directory.toString(), "Failed to list state records", e);
        }
        keys.sort(String::compareTo);
        return keys;
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            throw new StateStoreException(key, "Failed to delete state record", e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(String key) {
        if (key == null || key.isBlank() || key.contains("/") || key.contains("\\") || key.contains("..")) {
            throw new IllegalArgumentException("Invalid state key: " + key);
        }
        return directory.resolve(key + EXTENSION);
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
