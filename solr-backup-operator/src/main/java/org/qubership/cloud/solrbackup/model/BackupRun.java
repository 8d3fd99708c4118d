package org.qubership.cloud.solrbackup.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One backup attempt over a fixed, ordered set of collections. The result is present exactly when the run is finished.
 */
public record BackupRun(long sequence, String solrVersion, Instant startTime,
                        List<CollectionRun> collections, Optional<RunResult> result) {

    public static final Comparator<BackupRun> OLDEST_FIRST = Comparator
            .comparing(BackupRun::startTime)
            .thenComparingLong(BackupRun::sequence);

    public BackupRun {
        collections = List.copyOf(collections);
    }

    public static BackupRun start(long sequence, String solrVersion, Instant startTime, List<CollectionRun> collections) {
        return new BackupRun(sequence, solrVersion, startTime, collections, Optional.empty());
    }

    public boolean isFinished() {
        return result.isPresent();
    }

    public boolean allCollectionsFinished() {
        return collections.stream().allMatch(CollectionRun::isFinished);
    }

    /**
     * Replaces the collections and finishes the run once every collection has a terminal outcome.
     */
    public BackupRun withCollections(List<CollectionRun> updated, Instant now) {
        if (updated.stream().allMatch(CollectionRun::isFinished)) {
            boolean successful = updated.stream().allMatch(CollectionRun::isSuccessful);
            return new BackupRun(sequence, solrVersion, startTime, updated, Optional.of(new RunResult(now, successful)));
        }
        return new BackupRun(sequence, solrVersion, startTime, updated, Optional.empty());
    }
}
