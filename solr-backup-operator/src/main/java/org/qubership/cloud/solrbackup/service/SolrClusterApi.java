package org.qubership.cloud.solrbackup.service;

import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.model.BackupJobStatus;
import org.qubership.cloud.solrbackup.model.BackupPoint;

import java.util.List;

/**
 * Administrative operations of one SolrCloud used by backups. Every method throws {@link SolrApiException} on failure.
 */
public interface SolrClusterApi {

    /**
     * Submits an asynchronous incremental backup of a collection.
     *
     * @return the handle to poll the backup with
     */
    String startBackup(String collection, String repository, String location, String backupName, String asyncRequestId);

    /**
     * Reads the state of a submitted backup. Polling does not change anything on the Solr side, so it can be repeated.
     */
    BackupJobStatus pollBackup(String asyncRequestId);

    /**
     * Removes the stored status of a finished asynchronous request.
     */
    void clearAsyncStatus(String asyncRequestId);

    /**
     * @return backup points stored under {@code backupName}, oldest first
     */
    List<BackupPoint> listBackups(String backupName, String repository, String location);

    void deleteBackup(String backupName, String repository, String location, int backupId);

    String getSolrVersion();

    List<String> listCollections();
}
