package uk.gegc.docgen.features.artifact.application.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import uk.gegc.docgen.features.artifact.application.ArtifactStore;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic job reclaiming expired artifacts.
 *
 * <p>Runs on its own scheduler thread at a fixed delay, so request handling never waits on it.
 * Started and stopped with the application context; {@link #stop()} cancels the schedule.
 */
@Slf4j
public class ArtifactJanitor implements SmartLifecycle {

    private final ArtifactStore artifactStore;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final boolean autoStartup;
    private final Clock clock;

    private ScheduledFuture<?> scheduledSweep;

    public ArtifactJanitor(ArtifactStore artifactStore,
                           TaskScheduler taskScheduler,
                           Duration interval,
                           boolean autoStartup,
                           Clock clock) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Janitor interval must be positive");
        }
        this.artifactStore = artifactStore;
        this.taskScheduler = taskScheduler;
        this.interval = interval;
        this.autoStartup = autoStartup;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        scheduledSweep = taskScheduler.scheduleWithFixedDelay(this::sweep, clock.instant().plus(interval), interval);
        log.info("Artifact janitor started, sweeping every {}", interval);
    }

    @Override
    public synchronized void stop() {
        if (scheduledSweep != null) {
            scheduledSweep.cancel(false);
            scheduledSweep = null;
            log.info("Artifact janitor stopped");
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduledSweep != null && !scheduledSweep.isCancelled();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * One sweep. Exceptions are logged and never propagated, so the schedule keeps recurring.
     */
    public void sweep() {
        try {
            artifactStore.purgeExpired();
        } catch (Exception e) {
            log.error("Error during scheduled artifact cleanup", e);
        }
    }
}
