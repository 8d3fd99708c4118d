package org.qubership.cloud.solrbackup.service;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.model.BackupJobState;
import org.qubership.cloud.solrbackup.model.BackupJobStatus;
import org.qubership.cloud.solrbackup.model.BackupRunContext;
import org.qubership.cloud.solrbackup.model.CollectionOutcome;
import org.qubership.cloud.solrbackup.model.CollectionRun;

import java.time.Instant;

import static org.qubership.cloud.solrbackup.utils.BackupNaming.asyncRequestId;

/**
 * Advances the backup of one collection by at most one Solr call: pending backups are submitted, running backups
 * are polled, finished backups are left alone. Retries happen only through the next reconciliation.
 */
@Slf4j
@ApplicationScoped
public class CollectionBackupStepper {

    public CollectionRun step(CollectionRun collectionRun, long sequence, BackupRunContext context, Instant now) {
        CollectionOutcome outcome = collectionRun.outcome();
        if (outcome instanceof CollectionOutcome.Pending) {
            return trigger(collectionRun, sequence, context, now);
        }
        if (outcome instanceof CollectionOutcome.Running running) {
            return poll(collectionRun, running, context, now);
        }
        return collectionRun;
    }

    private CollectionRun trigger(CollectionRun collectionRun, long sequence, BackupRunContext context, Instant now) {
        String collection = collectionRun.collection();
        try {
            String handle = context.solrClusterApi().startBackup(
                    collection,
                    context.repository(),
                    context.location(),
                    collectionRun.backupName(),
                    asyncRequestId(context.backupName(), collection, sequence));
            log.info("Backup of collection {} for {} (run {}) started with async id {}",
                    collection, context.backupName(), sequence, handle);
            return collectionRun.withOutcome(new CollectionOutcome.Running(handle, now, null));
        } catch (SolrApiException e) {
            log.error("Backup of collection {} for {} (run {}) could not be started: {}",
                    collection, context.backupName(), sequence, e.getMessage());
            return collectionRun.withOutcome(CollectionOutcome.Finished.submitFailed(now, e.getMessage()));
        }
    }

    private CollectionRun poll(CollectionRun collectionRun, CollectionOutcome.Running running, BackupRunContext context, Instant now) {
        BackupJobStatus status;
        try {
            status = context.solrClusterApi().pollBackup(running.asyncRequestId());
        } catch (SolrApiException e) {
            log.warn("Status of backup {} of collection {} is unavailable, will poll again: {}",
                    running.asyncRequestId(), collectionRun.collection(), e.getMessage());
            return collectionRun.withOutcome(running.withLastError(e.getMessage()));
        }
        if (!status.isTerminal()) {
            log.debug("Backup {} of collection {} is still running", running.asyncRequestId(), collectionRun.collection());
            return running.lastError() == null ? collectionRun : collectionRun.withOutcome(running.withLastError(null));
        }
        boolean successful = status.state() == BackupJobState.SUCCEEDED;
        log.info("Backup {} of collection {} finished, successful: {}", running.asyncRequestId(), collectionRun.collection(), successful);
        return collectionRun.withOutcome(new CollectionOutcome.Finished(
                running.startTime(), now, successful, running.asyncRequestId(),
                successful ? null : "Solr reported the backup as failed", status.backupId()));
    }
}
