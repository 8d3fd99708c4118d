package org.qubership.cloud.solrbackup.model;

import java.time.Instant;

/**
 * Progress of one collection inside a backup run. {@link Finished} is terminal.
 */
public interface CollectionOutcome {

    boolean isFinished();

    static CollectionOutcome pending() {
        return new Pending();
    }

    record Pending() implements CollectionOutcome {
        @Override
        public boolean isFinished() {
            return false;
        }
    }

    /**
     * @param lastError error of the latest status poll, null when the poll succeeded
     */
    record Running(String asyncRequestId, Instant startTime, String lastError) implements CollectionOutcome {
        @Override
        public boolean isFinished() {
            return false;
        }

        public Running withLastError(String error) {
            return new Running(asyncRequestId, startTime, error);
        }
    }

    /**
     * @param startTime      submission time, or the time of the failed submission attempt
     * @param asyncRequestId null when the backup could not even be submitted
     * @param message        failure details, null on success
     * @param backupId       backup point written by a successful backup, null when Solr did not report it
     */
    record Finished(Instant startTime, Instant finishTime, boolean successful,
                    String asyncRequestId, String message, Integer backupId) implements CollectionOutcome {

        public Finished(Instant startTime, Instant finishTime, boolean successful, String asyncRequestId, String message) {
            this(startTime, finishTime, successful, asyncRequestId, message, null);
        }

        @Override
        public boolean isFinished() {
            return true;
        }

        public static Finished submitFailed(Instant now, String message) {
            return new Finished(now, now, false, null, message);
        }
    }
}
