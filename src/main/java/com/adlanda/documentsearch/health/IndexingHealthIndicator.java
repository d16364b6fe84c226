package com.adlanda.documentsearch.health;

import com.adlanda.documentsearch.model.FolderIndexingSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for folder indexing runs.
 *
 * Reports the status of the last run, including:
 * - Whether the run completed
 * - Number of documents found, indexed and failed
 * - Number of chunks written
 * - Timestamp of the run, or the error if it could not run at all
 *
 * Before any run the indicator is UP with lastRun=never; startup indexing is optional.
 */
@Component
public class IndexingHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null)
    );

    /**
     * Records a completed run. Individual document failures are reported as
     * details, they do not make the indicator DOWN.
     */
    public void markHealthy(FolderIndexingSummary summary) {
        state.set(new HealthState(true, summary, null, Instant.now()));
    }

    /**
     * Marks the indexing run as failed with the given error message.
     */
    public void markUnhealthy(String error) {
        state.set(new HealthState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastRun", current.timestamp() != null ? current.timestamp().toString() : "never");

            if (current.summary() != null) {
                builder.withDetail("folder", current.summary().folder())
                       .withDetail("documentsFound", current.summary().documentsFound())
                       .withDetail("documentsIndexed", current.summary().succeeded())
                       .withDetail("documentsFailed", current.summary().failed())
                       .withDetail("chunksIndexed", current.summary().totalChunks());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    private record HealthState(
            boolean healthy,
            FolderIndexingSummary summary,
            String error,
            Instant timestamp
    ) {}
}
