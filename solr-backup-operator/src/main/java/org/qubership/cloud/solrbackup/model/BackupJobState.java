package org.qubership.cloud.solrbackup.model;

public enum BackupJobState {
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
