package com.bko.planner.storage;

import com.bko.planner.config.PlannerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * JSON and text artifacts under the configured output directory. Paths are relative to that
 * directory and may not escape it.
 */
@Service
@Slf4j
public class ArtifactStore {

    static final String DEFAULT_DIRECTORY = "planner-output";

    private final Path root;
    private final ObjectMapper objectMapper;

    public ArtifactStore(PlannerProperties properties, ObjectMapper objectMapper) {
        String configuredRoot = properties.getStorage().getOutputDir();
        Path rootPath = StringUtils.hasText(configuredRoot)
                ? Paths.get(configuredRoot)
                : Paths.get(System.getProperty("user.dir"), DEFAULT_DIRECTORY);
        this.root = rootPath.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    public Path writeJson(String path, Object value) {
        Path file = resolvePath(path);
        try {
            createParent(file);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
            log.debug("Wrote {}.", toRelative(file));
            return file;
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to write " + path, ex);
        }
    }

    public <T> Optional<T> readJson(String path, Class<T> type) {
        Path file = resolvePath(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to read " + path, ex);
        }
    }

    public Path writeText(String path, String content) {
        Path file = resolvePath(path);
        try {
            createParent(file);
            Files.writeString(file, content == null ? "" : content);
            return file;
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to write " + path, ex);
        }
    }

    public Optional<String> readText(String path) {
        Path file = resolvePath(path);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to read " + path, ex);
        }
    }

    Path resolvePath(String path) {
        if (!StringUtils.hasText(path)) {
            throw new ArtifactStorageException("Artifact path is required.");
        }
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new ArtifactStorageException("Invalid artifact path: " + path);
        }
        return target;
    }

    private void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private String toRelative(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
