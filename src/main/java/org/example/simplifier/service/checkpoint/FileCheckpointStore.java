package org.example.simplifier.service.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.simplifier.config.RewriteProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores checkpoints as JSON files under {@code <baseDir>/<jobId>/}:
 * {@code meta.json}, {@code chapter_<i>_meta.json} and {@code chapter_<i>_windows.json}.
 * Writes go to a temp file first and are moved into place, so a crash never leaves a half-written record.
 */
@Component
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final TypeReference<List<String>> WINDOW_LIST = new TypeReference<>() {};

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileCheckpointStore(RewriteProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getCheckpoint().getDir()), objectMapper);
    }

    public FileCheckpointStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<DocumentMetadata> loadMetadata(String jobId) {
        return read(jobDir(jobId).resolve("meta.json"), DocumentMetadata.class);
    }

    @Override
    public boolean saveMetadata(String jobId, DocumentMetadata metadata) {
        return write(jobDir(jobId).resolve("meta.json"), metadata);
    }

    @Override
    public Optional<ChapterCheckpoint> loadChapter(String jobId, int chapterIndex) {
        return read(chapterMetaPath(jobId, chapterIndex), ChapterCheckpoint.class);
    }

    @Override
    public boolean saveChapter(String jobId, int chapterIndex, ChapterCheckpoint checkpoint) {
        return write(chapterMetaPath(jobId, chapterIndex), checkpoint);
    }

    @Override
    public List<String> loadWindows(String jobId, int chapterIndex) {
        Path path = chapterWindowsPath(jobId, chapterIndex);
        if (!Files.isRegularFile(path)) {
            return List.of();
        }
        try {
            List<String> windows = objectMapper.readValue(path.toFile(), WINDOW_LIST);
            return windows == null ? List.of() : List.copyOf(windows);
        } catch (IOException e) {
            log.warn("Unreadable checkpoint {}, ignoring it: {}", path, e.getMessage());
            return List.of();
        }
    }

    @Override
    public boolean saveWindows(String jobId, int chapterIndex, List<String> rewrittenWindows) {
        return write(chapterWindowsPath(jobId, chapterIndex), rewrittenWindows);
    }

    @Override
    public void invalidate(String jobId) {
        Path dir = jobDir(jobId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
            log.info("Invalidated checkpoints for job {}", jobId);
        } catch (IOException e) {
            log.warn("Failed to invalidate checkpoints for job {}: {}", jobId, e.getMessage());
        }
    }

    Path jobDir(String jobId) {
        return baseDir.resolve(jobId);
    }

    private Path chapterMetaPath(String jobId, int chapterIndex) {
        return jobDir(jobId).resolve("chapter_" + chapterIndex + "_meta.json");
    }

    private Path chapterWindowsPath(String jobId, int chapterIndex) {
        return jobDir(jobId).resolve("chapter_" + chapterIndex + "_windows.json");
    }

    private <T> Optional<T> read(Path path, Class<T> type) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            log.warn("Unreadable checkpoint {}, ignoring it: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean write(Path path, Object value) {
        Path temp = null;
        try {
            Files.createDirectories(path.getParent());
            temp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to save checkpoint {}: {}", path, e.getMessage());
            deleteQuietly(temp);
            return false;
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp checkpoint {}", temp, e);
        }
    }
}
