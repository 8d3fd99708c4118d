package org.qubership.cloud.solrbackup.model;

import java.util.List;

public record RetentionResult(List<BackupRun> kept, List<BackupRun> evicted) {
}
