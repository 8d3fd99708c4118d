package org.qubership.cloud.solrbackup.model;

import java.time.Instant;

/**
 * A backup point stored in the repository under an incremental backup name.
 */
public record BackupPoint(int backupId, Instant timestamp) {
}
