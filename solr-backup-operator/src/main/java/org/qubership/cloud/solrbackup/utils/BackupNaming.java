package org.qubership.cloud.solrbackup.utils;

public final class BackupNaming {

    private BackupNaming() {
    }

    /**
     * Name of the incremental backup of a collection in the Solr repository, shared by all runs of a request.
     */
    public static String collectionBackupName(String backupName, String collection) {
        return backupName + "-" + collection;
    }

    /**
     * Solr async request id of one collection backup in one run.
     */
    public static String asyncRequestId(String backupName, String collection, long sequence) {
        return collectionBackupName(backupName, collection) + "-" + sequence;
    }
}
