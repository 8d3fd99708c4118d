package org.qubership.cloud.solrbackup.schedule;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;

@ApplicationScoped
public class RecurrenceEvaluator {

    public BackupSchedule parse(String expression) {
        return BackupScheduleParser.parse(expression);
    }

    public Instant nextDue(BackupSchedule schedule, Instant reference) {
        return schedule.next(reference);
    }

    /**
     * A run is due once {@code now} reaches the first trigger time after {@code reference}, ties included.
     *
     * @param reference start of the latest run, or the creation time of the request when it never ran
     */
    public boolean isDue(BackupSchedule schedule, Instant reference, Instant now) {
        return !now.isBefore(nextDue(schedule, reference));
    }
}
