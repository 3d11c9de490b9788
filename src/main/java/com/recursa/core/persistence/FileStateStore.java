package com.recursa.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateStore} that keeps one JSON document per task in a directory.
 * <p>
 * Layout:
 * <pre>
 *   {directory}/
 *   ├── {task}.json       latest persisted state
 *   └── {task}.json.tmp   in-flight write, only present during (or after a crash in) a persist
 * </pre>
 * Each persist writes and syncs the temp file, then renames it over the
 * document, so a crash leaves either the old or the new document readable.
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final StateDocumentMapper mapper;
    private final ConcurrentHashMap<String, Object> taskLocks = new ConcurrentHashMap<>();

    public FileStateStore(Path directory) {
        this(directory, new StateDocumentMapper());
    }

    public FileStateStore(Path directory, StateDocumentMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.mapper = mapper;
    }

    @Override
    public void persist(String taskId, PersistedTaskState state) {
        String json = mapper.write(state);
        synchronized (lockFor(taskId)) {
            Path target = documentPath(taskId);
            Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
            try {
                Files.createDirectories(directory);
                Files.writeString(tmpFile, json, StandardCharsets.UTF_8);
                try (FileChannel channel = FileChannel.open(tmpFile, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
                moveIntoPlace(tmpFile, target);
                log.debug("Persisted task '{}' v{} to {}", taskId, state.version(), target);
            } catch (IOException e) {
                throw new StateStoreException("Failed to persist state of task " + taskId + " to " + target, e);
            }
        }
    }

    @Override
    public Optional<PersistedTaskState> load(String taskId) {
        Path file = documentPath(taskId);
        synchronized (lockFor(taskId)) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try {
                return Optional.of(mapper.read(Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new StateStoreException("Failed to read state of task " + taskId + " from " + file, e);
            }
        }
    }

    @Override
    public List<String> listTaskIds() {
        List<String> taskIds = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return taskIds;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                try {
                    JsonNode node = mapper.objectMapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
                    String taskId = node.path("taskId").asText("");
                    if (!taskId.isEmpty()) {
                        taskIds.add(taskId);
                    }
                } catch (IOException e) {
                    log.warn("Skipping unreadable task document {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list task documents in {}", directory, e);
        }
        taskIds.sort(String::compareTo);
        return taskIds;
    }

    @Override
    public void delete(String taskId) {
        synchronized (lockFor(taskId)) {
            try {
                Files.deleteIfExists(documentPath(taskId));
            } catch (IOException e) {
                throw new StateStoreException("Failed to delete state of task " + taskId, e);
            }
        }
    }

    public Path directory() {
        return directory;
    }

    Path documentPath(String taskId) {
        return directory.resolve(fileNameFor(taskId) + SUFFIX);
    }

    static String fileNameFor(String taskId) {
        return taskId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private void moveIntoPlace(Path tmpFile, Path target) throws IOException {
        try {
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported in {}, falling back to plain replace", directory);
            Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Object lockFor(String taskId) {
        return taskLocks.computeIfAbsent(taskId, k -> new Object());
    }
}
