package uk.gegc.docgen.features.artifact.application.impl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import uk.gegc.docgen.features.artifact.domain.ArtifactNotFoundException;
import uk.gegc.docgen.features.artifact.domain.ArtifactStorageException;
import uk.gegc.docgen.features.artifact.domain.model.Artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileSystemArtifactStore")
class FileSystemArtifactStoreTest {

    @TempDir
    Path baseDir;

    private FileSystemArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(baseDir, Duration.ofMinutes(15), Clock.systemUTC());
    }

    @Nested
    @DisplayName("createNew")
    class CreateNew {

        @Test
        @DisplayName("returns pairwise distinct ids, each backed by an existing directory")
        void distinctIdsWithDirectories() {
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < 50; i++) {
                Artifact artifact = store.createNew();

                assertThat(ids.add(artifact.id())).isTrue();
                assertThat(artifact.path()).isDirectory();
                assertThat(artifact.path().getParent()).isEqualTo(baseDir.toAbsolutePath().normalize());
            }
        }

        @Test
        @DisplayName("creates the base path when it does not exist yet")
        void createsBasePath() {
            Path nested = baseDir.resolve("a").resolve("b");

            new FileSystemArtifactStore(nested, Duration.ofMinutes(1), Clock.systemUTC());

            assertThat(nested).isDirectory();
        }

        @Test
        @DisplayName("fails with a storage error when the base path is not a directory")
        void basePathIsFile() throws IOException {
            Path file = Files.writeString(baseDir.resolve("not-a-dir"), "x");

            assertThatThrownBy(() -> new FileSystemArtifactStore(file, Duration.ofMinutes(1), Clock.systemUTC()))
                    .isInstanceOf(ArtifactStorageException.class);
        }
    }

    @Nested
    @DisplayName("writeFile / getArtifactPath")
    class WriteAndResolve {

        @Test
        @DisplayName("binary payloads read back byte-identical")
        void binaryRoundTrip() throws IOException {
            // Given
            byte[] payload = new byte[4096];
            new Random(42).nextBytes(payload);
            Artifact artifact = store.createNew();

            // When
            store.writeFile(artifact, "blob.bin", payload);
            Path resolved = store.getArtifactPath(artifact.id(), "blob.bin");

            // Then
            assertThat(Files.readAllBytes(resolved)).isEqualTo(payload);
        }

        @Test
        @DisplayName("writing the same filename twice overwrites")
        void overwrite() throws IOException {
            Artifact artifact = store.createNew();

            store.writeFile(artifact, "summary.md", "first".getBytes());
            store.writeFile(artifact, "summary.md", "second".getBytes());

            assertThat(Files.readString(store.getArtifactPath(artifact.id(), "summary.md"))).isEqualTo("second");
        }

        @Test
        @DisplayName("rejects filenames that escape the artifact directory")
        void writeRejectsTraversal() {
            Artifact artifact = store.createNew();

            assertThatThrownBy(() -> store.writeFile(artifact, "../escape.md", new byte[0]))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("unknown artifact id is not found")
        void unknownArtifact() {
            String id = UUID.randomUUID().toString();

            assertThatThrownBy(() -> store.getArtifactPath(id, "summary.md"))
                    .isInstanceOf(ArtifactNotFoundException.class);
        }

        @Test
        @DisplayName("missing file in an existing artifact is not found")
        void missingFile() {
            Artifact artifact = store.createNew();

            assertThatThrownBy(() -> store.getArtifactPath(artifact.id(), "missing.pdf"))
                    .isInstanceOf(ArtifactNotFoundException.class);
        }

        @Test
        @DisplayName("non-UUID ids and traversal filenames are not found")
        void traversalIsNotFound() throws IOException {
            Files.writeString(baseDir.resolve("secret.txt"), "top secret");
            Artifact artifact = store.createNew();

            assertThatThrownBy(() -> store.getArtifactPath("..", "secret.txt"))
                    .isInstanceOf(ArtifactNotFoundException.class);
            assertThatThrownBy(() -> store.getArtifactPath(artifact.id(), "../secret.txt"))
                    .isInstanceOf(ArtifactNotFoundException.class);
            assertThatThrownBy(() -> store.getArtifactPath(artifact.id(), ".."))
                    .isInstanceOf(ArtifactNotFoundException.class);
        }

        @Test
        @DisplayName("the artifact directory itself is not a file")
        void directoryIsNotAFile() {
            Artifact artifact = store.createNew();

            assertThatThrownBy(() -> store.getArtifactPath(artifact.id(), "."))
                    .isInstanceOf(ArtifactNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("discard")
    class Discard {

        @Test
        @DisplayName("removes the artifact and its files")
        void removesDirectory() {
            Artifact artifact = store.createNew();
            store.writeFile(artifact, "a.md", "x".getBytes());

            store.discard(artifact);

            assertThat(artifact.path()).doesNotExist();
            assertThatThrownBy(() -> store.getArtifactPath(artifact.id(), "a.md"))
                    .isInstanceOf(ArtifactNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("purgeExpired")
    class PurgeExpired {

        @Test
        @DisplayName("removes only directories older than the TTL")
        void selectiveByAge() throws IOException {
            // Given: the clock sits a few seconds back so truncated filesystem timestamps
            // of freshly created directories never look older than the TTL
            Clock clock = Clock.fixed(Instant.now().minusSeconds(5), ZoneOffset.UTC);
            FileSystemArtifactStore shortLived = new FileSystemArtifactStore(baseDir, Duration.ofMillis(10), clock);

            Artifact old = shortLived.createNew();
            Files.setLastModifiedTime(old.path(), FileTime.from(Instant.now().minus(Duration.ofHours(1))));
            Artifact fresh = shortLived.createNew();

            // When
            int removed = shortLived.purgeExpired();

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(old.path()).doesNotExist();
            assertThat(fresh.path()).isDirectory();
        }

        @Test
        @DisplayName("never removes plain files, however old")
        void keepsNonDirectories() throws IOException {
            // Given
            Clock clock = Clock.fixed(Instant.now(), ZoneOffset.UTC);
            FileSystemArtifactStore shortLived = new FileSystemArtifactStore(baseDir, Duration.ofMillis(10), clock);
            Path stray = Files.writeString(baseDir.resolve("stray.txt"), "keep me");
            Files.setLastModifiedTime(stray, FileTime.from(Instant.now().minus(Duration.ofDays(3))));

            // When
            int removed = shortLived.purgeExpired();

            // Then
            assertThat(removed).isZero();
            assertThat(stray).exists();
        }

        @Test
        @DisplayName("expired artifacts become not found")
        void expiredBecomesNotFound() throws IOException {
            // Given
            Artifact artifact = store.createNew();
            store.writeFile(artifact, "summary.pdf", new byte[]{1, 2, 3});
            Files.setLastModifiedTime(artifact.path(), FileTime.from(Instant.now().minus(Duration.ofHours(1))));

            // When
            store.purgeExpired();

            // Then
            assertThatThrownBy(() -> store.getArtifactPath(artifact.id(), "summary.pdf"))
                    .isInstanceOf(ArtifactNotFoundException.class);
        }

        @Test
        @DisplayName("a directory that cannot be deleted is logged and skipped, the rest are still removed")
        void failingEntryDoesNotStopSweep() throws IOException {
            // Given
            Clock clock = Clock.fixed(Instant.now(), ZoneOffset.UTC);
            Path[] failing = new Path[1];
            FileSystemArtifactStore flaky = new FileSystemArtifactStore(baseDir, Duration.ofMinutes(15), clock) {
                @Override
                protected boolean deleteDirectory(Path directory) throws IOException {
                    if (directory.equals(failing[0])) {
                        throw new IOException("Permission denied");
                    }
                    return super.deleteDirectory(directory);
                }
            };
            Artifact first = flaky.createNew();
            Artifact stuck = flaky.createNew();
            Artifact third = flaky.createNew();
            failing[0] = stuck.path();
            for (Artifact artifact : new Artifact[]{first, stuck, third}) {
                Files.setLastModifiedTime(artifact.path(), FileTime.from(Instant.now().minus(Duration.ofHours(1))));
            }

            Logger storeLogger = (Logger) LoggerFactory.getLogger(FileSystemArtifactStore.class);
            ListAppender<ILoggingEvent> logAppender = new ListAppender<>();
            logAppender.start();
            storeLogger.addAppender(logAppender);

            // When
            int removed;
            try {
                removed = flaky.purgeExpired();
            } finally {
                storeLogger.detachAppender(logAppender);
            }

            // Then
            assertThat(removed).isEqualTo(2);
            assertThat(first.path()).doesNotExist();
            assertThat(third.path()).doesNotExist();
            assertThat(stuck.path()).isDirectory();
            assertThat(logAppender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage())
                                .contains("Failed to clean up artifact entry")
                                .contains(stuck.id());
                    });
        }

        @Test
        @DisplayName("repeated sweeps are idempotent")
        void idempotent() throws IOException {
            Artifact artifact = store.createNew();
            Files.setLastModifiedTime(artifact.path(), FileTime.from(Instant.now().minus(Duration.ofHours(1))));

            assertThat(store.purgeExpired()).isEqualTo(1);
            assertThat(store.purgeExpired()).isZero();
        }
    }
}
