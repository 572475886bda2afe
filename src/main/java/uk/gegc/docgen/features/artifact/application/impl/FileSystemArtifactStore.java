package uk.gegc.docgen.features.artifact.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;
import uk.gegc.docgen.features.artifact.application.ArtifactStore;
import uk.gegc.docgen.features.artifact.domain.ArtifactNotFoundException;
import uk.gegc.docgen.features.artifact.domain.ArtifactStorageException;
import uk.gegc.docgen.features.artifact.domain.model.Artifact;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    private final Path basePath;
    private final Duration ttl;
    private final Clock clock;

    public FileSystemArtifactStore(Path basePath, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be zero or positive");
        }
        this.basePath = basePath.toAbsolutePath().normalize();
        this.ttl = ttl;
        this.clock = clock;
        try {
            Files.createDirectories(this.basePath);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to create artifact base path " + this.basePath, e);
        }
        log.info("Artifact store initialised at {} with TTL {}", this.basePath, ttl);
    }

    @Override
    public Artifact createNew() {
        String id = UUID.randomUUID().toString();
        Path path = basePath.resolve(id);
        try {
            Files.createDirectory(path);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to create artifact directory " + path, e);
        }
        log.debug("Created artifact {}", id);
        return new Artifact(id, path);
    }

    @Override
    public Path writeFile(Artifact artifact, String filename, byte[] data) {
        if (!isPlainFilename(filename)) {
            throw new IllegalArgumentException("Invalid artifact filename: " + filename);
        }
        Path target = artifact.resolve(filename);
        try {
            return Files.write(target, data == null ? new byte[0] : data);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to write artifact file " + target, e);
        }
    }

    @Override
    public Path getArtifactPath(String artifactId, String filename) {
        if (!isArtifactId(artifactId) || !isPlainFilename(filename)) {
            throw new ArtifactNotFoundException(artifactId, filename);
        }
        Path path = basePath.resolve(artifactId).resolve(filename).normalize();
        if (!path.startsWith(basePath) || !Files.isRegularFile(path)) {
            throw new ArtifactNotFoundException(artifactId, filename);
        }
        return path;
    }

    @Override
    public void discard(Artifact artifact) {
        try {
            deleteDirectory(artifact.path());
            log.debug("Discarded artifact {}", artifact.id());
        } catch (IOException e) {
            log.warn("Failed to discard artifact {}, leaving it to the janitor: {}", artifact.id(), e.getMessage());
        }
    }

    @Override
    public int purgeExpired() {
        log.debug("Running artifact cleanup in {}", basePath);
        Instant now = clock.instant();
        int removed = 0;

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(basePath)) {
            for (Path entry : entries) {
                try {
                    if (purgeIfExpired(entry, now)) {
                        removed++;
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to clean up artifact entry {}: {}", entry.getFileName(), e.toString());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list artifact directory {} for cleanup", basePath, e);
        }

        if (removed > 0) {
            log.info("Artifact cleanup removed {} expired artifact(s)", removed);
        }
        return removed;
    }

    private boolean purgeIfExpired(Path entry, Instant now) throws IOException {
        if (!Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        Instant lastModified = Files.getLastModifiedTime(entry, LinkOption.NOFOLLOW_LINKS).toInstant();
        Duration age = Duration.between(lastModified, now);
        if (age.compareTo(ttl) <= 0) {
            return false;
        }
        log.info("Deleting expired artifact directory {} (age {})", entry, age);
        return deleteDirectory(entry);
    }

    /**
     * Removes one artifact directory and everything in it.
     *
     * @return {@code false} if the directory was already gone
     */
    protected boolean deleteDirectory(Path directory) throws IOException {
        return FileSystemUtils.deleteRecursively(directory);
    }

    private static boolean isArtifactId(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        try {
            return UUID.fromString(id).toString().equals(id);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isPlainFilename(String filename) {
        return filename != null
                && !filename.isBlank()
                && !filename.equals(".")
                && !filename.equals("..")
                && filename.indexOf('/') < 0
                && filename.indexOf('\\') < 0
                && filename.indexOf('\0') < 0;
    }
}
