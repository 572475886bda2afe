package uk.gegc.docgen.features.artifact.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "docgen.artifacts")
public class ArtifactStoreProperties {

    /**
     * Directory holding one sub-directory per artifact.
     */
    @NotNull
    private Path basePath = Path.of(System.getProperty("java.io.tmpdir"), "docgen");

    /**
     * Age, measured from the artifact directory's last modification, after which it is reclaimed.
     */
    @NotNull
    private Duration ttl = Duration.ofMinutes(15);

    @NotNull
    private Duration janitorInterval = Duration.ofMinutes(5);

    private boolean janitorEnabled = true;
}
