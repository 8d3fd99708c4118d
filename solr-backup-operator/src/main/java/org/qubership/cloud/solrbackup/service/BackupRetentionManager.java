package org.qubership.cloud.solrbackup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.FailsafeException;
import net.jodah.failsafe.RetryPolicy;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.model.BackupPoint;
import org.qubership.cloud.solrbackup.model.BackupRun;
import org.qubership.cloud.solrbackup.model.BackupRunContext;
import org.qubership.cloud.solrbackup.model.CollectionOutcome;
import org.qubership.cloud.solrbackup.model.CollectionRun;
import org.qubership.cloud.solrbackup.model.EvictionReport;
import org.qubership.cloud.solrbackup.model.RetentionResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps at most {@code maxSaved} completed runs. Artifacts of evicted runs are deleted best-effort:
 * a failed deletion is reported but never keeps a run in the history.
 */
@Slf4j
@ApplicationScoped
public class BackupRetentionManager {
    private static final String LIST_OPERATION = "listBackups";
    private static final String DELETE_OPERATION = "deleteBackup";

    private final int deleteRetries;
    private final Duration deleteDelay;

    @Inject
    public BackupRetentionManager(@ConfigProperty(name = "solr-backup.retention.delete.retries", defaultValue = "2") int deleteRetries,
                                  @ConfigProperty(name = "solr-backup.retention.delete.delay", defaultValue = "1S") Duration deleteDelay) {
        this.deleteRetries = deleteRetries;
        this.deleteDelay = deleteDelay;
    }

    /**
     * Splits the history into the {@code maxSaved} most recent runs and the older rest, both oldest first.
     * Runs are ordered by start time, then by sequence.
     */
    public RetentionResult trim(List<BackupRun> history, int maxSaved) {
        if (maxSaved < 1) {
            throw new IllegalArgumentException("maxSaved must be at least 1 but was " + maxSaved);
        }
        List<BackupRun> sorted = history.stream().sorted(BackupRun.OLDEST_FIRST).toList();
        int evictCount = Math.max(0, sorted.size() - maxSaved);
        return new RetentionResult(sorted.subList(evictCount, sorted.size()), sorted.subList(0, evictCount));
    }

    /**
     * Deletes the backup points of successful collections of the evicted runs and clears the async statuses Solr
     * keeps for them. Evicted runs were persisted as finished by an earlier pass, so their statuses are no longer polled.
     */
    public EvictionReport evict(List<BackupRun> evicted, BackupRunContext context) {
        int deleted = 0;
        List<String> failures = new ArrayList<>();
        for (BackupRun run : evicted) {
            log.info("Evict backup run {} of {} started at {}", run.sequence(), context.backupName(), run.startTime());
            for (CollectionRun collectionRun : run.collections()) {
                if (!(collectionRun.outcome() instanceof CollectionOutcome.Finished finished)) {
                    continue;
                }
                if (finished.successful()) {
                    try {
                        List<Integer> backupIds = backupIdsOf(collectionRun, finished, context);
                        if (backupIds.isEmpty()) {
                            failures.add(reportFailure(run, collectionRun, String.format(
                                    "no backup point of %s was taken between %s and %s",
                                    collectionRun.backupName(), finished.startTime(), finished.finishTime())));
                        } else {
                            deleted += deleteBackupPoints(collectionRun.backupName(), backupIds, context);
                        }
                    } catch (SolrApiException | FailsafeException e) {
                        failures.add(reportFailure(run, collectionRun, e.getMessage()));
                    }
                }
                clearAsyncStatus(collectionRun, finished, context);
            }
        }
        return new EvictionReport(deleted, failures);
    }

    /**
     * Backup points written by a collection backup: the id reported by Solr, otherwise the points whose Solr
     * timestamp falls within the backup's start and finish.
     */
    private List<Integer> backupIdsOf(CollectionRun collectionRun, CollectionOutcome.Finished finished,
                                      BackupRunContext context) {
        if (finished.backupId() != null) {
            return List.of(finished.backupId());
        }
        SolrClusterApi api = context.solrClusterApi();
        String backupName = collectionRun.backupName();
        List<BackupPoint> points = Failsafe.with(buildRetryPolicy(backupName, LIST_OPERATION))
                .get(() -> api.listBackups(backupName, context.repository(), context.location()));
        return points.stream()
                .filter(point -> !point.timestamp().isBefore(finished.startTime())
                        && !point.timestamp().isAfter(finished.finishTime()))
                .map(BackupPoint::backupId)
                .toList();
    }

    private int deleteBackupPoints(String backupName, List<Integer> backupIds, BackupRunContext context) {
        SolrClusterApi api = context.solrClusterApi();
        for (Integer backupId : backupIds) {
            Failsafe.with(buildRetryPolicy(backupName, DELETE_OPERATION))
                    .run(() -> api.deleteBackup(backupName, context.repository(), context.location(), backupId));
        }
        return backupIds.size();
    }

    private void clearAsyncStatus(CollectionRun collectionRun, CollectionOutcome.Finished finished, BackupRunContext context) {
        if (finished.asyncRequestId() == null) {
            return;
        }
        try {
            context.solrClusterApi().clearAsyncStatus(finished.asyncRequestId());
        } catch (SolrApiException e) {
            log.warn("Failed to clear async status {} of collection {}: {}",
                    finished.asyncRequestId(), collectionRun.collection(), e.getMessage());
        }
    }

    private static String reportFailure(BackupRun run, CollectionRun collectionRun, String reason) {
        String failure = String.format("Failed to delete backup of collection %s from run %d: %s",
                collectionRun.collection(), run.sequence(), reason);
        log.error(failure);
        return failure;
    }

    private RetryPolicy<Object> buildRetryPolicy(String name, String operation) {
        return new RetryPolicy<>()
                .handle(SolrApiException.class)
                .withMaxRetries(deleteRetries)
                .withDelay(deleteDelay)
                .onFailedAttempt(e -> log.warn("Attempt of {} failed for {}: {}",
                        operation, name, e.getLastFailure().getMessage()))
                .onRetry(e -> log.info("Retrying {} for {}...", operation, name))
                .onFailure(e -> log.error("Request limit exceeded for {} of {}", operation, name));
    }
}
