package uk.gegc.docgen.features.artifact.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import uk.gegc.docgen.features.artifact.application.ArtifactStore;
import uk.gegc.docgen.features.artifact.application.impl.FileSystemArtifactStore;
import uk.gegc.docgen.features.artifact.application.scheduler.ArtifactJanitor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ArtifactStoreProperties.class)
public class ArtifactStoreConfig {

    @Bean
    public ArtifactStore artifactStore(ArtifactStoreProperties properties, Clock clock) {
        return new FileSystemArtifactStore(properties.getBasePath(), properties.getTtl(), clock);
    }

    /**
     * Single dedicated thread, kept apart from request handling.
     */
    @Bean
    public ThreadPoolTaskScheduler artifactJanitorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("artifact-janitor-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ArtifactJanitor artifactJanitor(ArtifactStore artifactStore,
                                           ThreadPoolTaskScheduler artifactJanitorScheduler,
                                           ArtifactStoreProperties properties,
                                           Clock clock) {
        return new ArtifactJanitor(
                artifactStore,
                artifactJanitorScheduler,
                properties.getJanitorInterval(),
                properties.isJanitorEnabled(),
                clock
        );
    }
}
