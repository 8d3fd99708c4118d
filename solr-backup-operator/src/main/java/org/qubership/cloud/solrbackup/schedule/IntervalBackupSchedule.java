package org.qubership.cloud.solrbackup.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Fixed delay schedule: the reference truncated to the second plus the delay.
 */
public class IntervalBackupSchedule implements BackupSchedule {
    private static final Duration MIN_DELAY = Duration.ofSeconds(1);

    private final String expression;
    private final Duration delay;

    IntervalBackupSchedule(String expression, Duration delay) {
        this.expression = expression;
        Duration truncated = delay.truncatedTo(ChronoUnit.SECONDS);
        this.delay = truncated.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : truncated;
    }

    @Override
    public Instant next(Instant reference) {
        return reference.truncatedTo(ChronoUnit.SECONDS).plus(delay);
    }

    @Override
    public String expression() {
        return expression;
    }

    public Duration getDelay() {
        return delay;
    }

    @Override
    public String toString() {
        return "IntervalBackupSchedule{" + expression + " -> " + delay + "}";
    }
}
