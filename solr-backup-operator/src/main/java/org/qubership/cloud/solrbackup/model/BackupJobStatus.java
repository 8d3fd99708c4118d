package org.qubership.cloud.solrbackup.model;

/**
 * State of an asynchronous backup as reported by Solr.
 *
 * @param backupId id of the backup point written by the backup, null while running or when Solr does not report it
 */
public record BackupJobStatus(BackupJobState state, Integer backupId) {

    public static BackupJobStatus of(BackupJobState state) {
        return new BackupJobStatus(state, null);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
