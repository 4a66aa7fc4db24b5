package com.newsvault.backend.storage.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsvault.backend.config.PipelineProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Content archive on the local file system. Each key maps to one JSON file below the root directory.
 */
@Service
@Slf4j
public class FileSystemContentArchive implements ContentArchive {

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSystemContentArchive(PipelineProperties properties, ObjectMapper objectMapper) throws IOException {
        this(Paths.get(properties.getArchive().getRootDirectory()), objectMapper);
    }

    FileSystemContentArchive(Path root, ObjectMapper objectMapper) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        Files.createDirectories(this.root);
        log.info("📁 Content archive rooted at {}", this.root);
    }

    @Override
    public ArchivePutResult put(String key, ArchiveRecord document) {
        Path target;
        try {
            target = resolve(key);
        } catch (IllegalArgumentException e) {
            return ArchivePutResult.failed(e.getMessage());
        }

        try {
            Files.createDirectories(target.getParent());
            // Write then move so a reader never sees a half-written document
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            try {
                Files.writeString(temp, objectMapper.writeValueAsString(document), StandardCharsets.UTF_8);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("📁 Archived {}", key);
            return ArchivePutResult.stored(target.toString());
        } catch (IOException e) {
            log.error("❌ Failed to archive {}: {}", key, e.getMessage());
            return ArchivePutResult.failed(e.getMessage());
        }
    }

    @Override
    public List<String> exists(String keyPrefix) {
        int slash = keyPrefix.lastIndexOf('/');
        String dirPart = slash >= 0 ? keyPrefix.substring(0, slash) : "";

        Path dir = dirPart.isEmpty() ? root : resolve(dirPart);
        if (!Files.isDirectory(dir)) return List.of();

        List<String> keys = new ArrayList<>();
        try (Stream<Path> files = Files.walk(dir)) {
            files.filter(Files::isRegularFile)
                    .map(this::toKey)
                    .filter(key -> !key.substring(key.lastIndexOf('/') + 1).startsWith("."))
                    .filter(key -> key.startsWith(keyPrefix))
                    .sorted()
                    .forEach(keys::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list archive prefix " + keyPrefix, e);
        }
        return keys;
    }

    @Override
    public Optional<ArchiveRecord> get(String key) {
        Path file = resolve(key);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), ArchiveRecord.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read archived document " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete archived document " + key, e);
        }
    }

    @Override
    public int deleteDaysBefore(LocalDate cutoffDate) {
        int removed = 0;
        for (Path dayDir : dayDirectories()) {
            LocalDate day = dayOf(dayDir);
            if (day == null || !day.isBefore(cutoffDate)) continue;
            removed += deleteTree(dayDir);
        }
        if (removed > 0) {
            log.info("🗑️ Removed {} archived documents older than {}", removed, cutoffDate);
        }
        return removed;
    }

    @Override
    public boolean healthCheck() {
        return Files.isDirectory(root) && Files.isWritable(root);
    }

    private List<Path> dayDirectories() {
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> dirs = Files.walk(root, 3)) {
            return dirs.filter(Files::isDirectory)
                    .filter(dir -> root.relativize(dir).getNameCount() == 3)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list archive partitions", e);
        }
    }

    private LocalDate dayOf(Path dayDir) {
        Path relative = root.relativize(dayDir);
        try {
            return LocalDate.of(
                    Integer.parseInt(relative.getName(0).toString()),
                    Integer.parseInt(relative.getName(1).toString()),
                    Integer.parseInt(relative.getName(2).toString()));
        } catch (NumberFormatException | DateTimeException e) {
            log.debug("Ignoring non-date directory {}", relative);
            return null;
        }
    }

    private int deleteTree(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            int files = 0;
            for (Path path : ordered) {
                if (Files.isRegularFile(path)) files++;
                Files.deleteIfExists(path);
            }
            return files;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete archive partition " + dir, e);
        }
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Archive key escapes root: " + key);
        }
        return resolved;
    }

    private String toKey(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
