package org.qubership.cloud.solrbackup.model;

import java.util.List;
import java.util.Optional;

/**
 * Domain view of a status record: the latest run, the completed runs oldest first, and the last assigned sequence.
 */
public record BackupHistoryState(Optional<BackupRun> current, List<BackupRun> history, long lastSequence) {

    public BackupHistoryState {
        history = List.copyOf(history);
    }

    public static BackupHistoryState empty() {
        return new BackupHistoryState(Optional.empty(), List.of(), 0);
    }
}
