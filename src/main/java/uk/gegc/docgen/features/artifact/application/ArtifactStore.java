package uk.gegc.docgen.features.artifact.application;

import uk.gegc.docgen.features.artifact.domain.model.Artifact;

import java.nio.file.Path;

/**
 * Ephemeral, filesystem-backed storage for generated files.
 *
 * <p>Each artifact is one directory named by a freshly generated id. Artifacts are never deleted by
 * callers; they expire once their directory is older than the configured TTL and are reclaimed by
 * {@link #purgeExpired()}, which the janitor runs periodically.
 */
public interface ArtifactStore {

    /**
     * Allocate a new id and create its directory.
     *
     * @throws uk.gegc.docgen.features.artifact.domain.ArtifactStorageException if the directory cannot be created
     */
    Artifact createNew();

    /**
     * Write (or overwrite) a file inside an artifact. No cleanup is attempted on failure.
     *
     * @return the path that was written
     * @throws IllegalArgumentException if the filename is not a plain file name
     * @throws uk.gegc.docgen.features.artifact.domain.ArtifactStorageException on IO failure
     */
    Path writeFile(Artifact artifact, String filename, byte[] data);

    /**
     * Resolve an existing file.
     *
     * @throws uk.gegc.docgen.features.artifact.domain.ArtifactNotFoundException if the artifact or file does not
     *                                                                          exist, whether it never existed or
     *                                                                          has already expired
     */
    Path getArtifactPath(String artifactId, String filename);

    /**
     * Remove an artifact straight away. Used to withdraw an artifact whose content could not be completed.
     */
    void discard(Artifact artifact);

    /**
     * One janitor sweep: delete every artifact directory older than the TTL.
     * Failures on individual entries are logged and skipped.
     *
     * @return number of artifact directories removed
     */
    int purgeExpired();
}
