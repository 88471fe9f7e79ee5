package com.silentrisk.vault.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * One JSON document per key in a single directory. Shared by the file-backed registries.
 */
@Slf4j
public class JsonFileStorage<T> {

    private static final String SUFFIX = ".json";

    private final Path storageDir;
    private final Class<T> type;
    private final ObjectMapper mapper;

    public JsonFileStorage(String path, String table, Class<T> type) throws IOException {
        this.storageDir = Paths.get(path).resolve(table);
        Files.createDirectories(storageDir);
        this.type = type;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(String key, T value) {
        Path filePath = file(key);
        try {
            mapper.writeValue(filePath.toFile(), value);
        } catch (IOException e) {
            log.error("Failed to write {} to {}", type.getSimpleName(), filePath, e);
            throw new RuntimeException("Failed to write " + type.getSimpleName() + " for key: " + key, e);
        }
    }

    public T read(String key) {
        Path filePath = file(key);
        if (!Files.exists(filePath)) {
            return null;
        }
        try {
            return mapper.readValue(filePath.toFile(), type);
        } catch (IOException e) {
            log.error("Failed to read {} from {}", type.getSimpleName(), filePath, e);
            throw new RuntimeException("Failed to read " + type.getSimpleName() + " for key: " + key, e);
        }
    }

    public boolean exists(String key) {
        return Files.exists(file(key));
    }

    public void delete(String key) {
        Path filePath = file(key);
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            log.error("Failed to delete {}", filePath, e);
            throw new RuntimeException("Failed to delete " + type.getSimpleName() + " for key: " + key, e);
        }
    }

    public List<T> readAll() {
        List<T> values = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(storageDir, "*" + SUFFIX)) {
            for (Path filePath : files) {
                values.add(mapper.readValue(filePath.toFile(), type));
            }
        } catch (IOException e) {
            log.error("Failed to list {} documents in {}", type.getSimpleName(), storageDir, e);
            throw new RuntimeException("Failed to list " + type.getSimpleName() + " documents", e);
        }
        return values;
    }

    public long count() {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(storageDir, "*" + SUFFIX)) {
            long count = 0;
            for (Path ignored : files) {
                count++;
            }
            return count;
        } catch (IOException e) {
            log.error("Failed to count documents in {}", storageDir, e);
            throw new RuntimeException("Failed to count " + type.getSimpleName() + " documents", e);
        }
    }

    private Path file(String key) {
        return storageDir.resolve(key + SUFFIX);
    }

}
