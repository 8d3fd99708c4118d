package org.qubership.cloud.solrbackup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.qubership.cloud.solrbackup.converter.BackupStatusConverter;
import org.qubership.cloud.solrbackup.entity.BackupRecurrence;
import org.qubership.cloud.solrbackup.entity.SolrBackup;
import org.qubership.cloud.solrbackup.entity.SolrBackupSpec;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;
import org.qubership.cloud.solrbackup.exceptions.InconsistentBackupStateException;
import org.qubership.cloud.solrbackup.exceptions.InvalidScheduleException;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.model.BackupHistoryState;
import org.qubership.cloud.solrbackup.model.BackupRun;
import org.qubership.cloud.solrbackup.model.BackupRunContext;
import org.qubership.cloud.solrbackup.model.CollectionOutcome;
import org.qubership.cloud.solrbackup.model.CollectionRun;
import org.qubership.cloud.solrbackup.model.EvictionReport;
import org.qubership.cloud.solrbackup.model.RetentionResult;
import org.qubership.cloud.solrbackup.schedule.BackupSchedule;
import org.qubership.cloud.solrbackup.schedule.RecurrenceEvaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.qubership.cloud.solrbackup.utils.BackupNaming.collectionBackupName;

/**
 * Performs one reconciliation pass of a backup request: decides whether a new run is due, advances the run in
 * progress, applies retention and computes the next scheduled time. The result is the new status; the request
 * itself is not modified apart from spec normalization.
 */
@Slf4j
@ApplicationScoped
public class SolrBackupReconciler {
    private final RecurrenceEvaluator recurrenceEvaluator;
    private final BackupRunCoordinator coordinator;
    private final BackupRetentionManager retentionManager;
    private final BackupStatusConverter statusConverter;
    private final SolrClusterApiProvider clusterApiProvider;
    private final Optional<Duration> runTimeout;

    @Inject
    public SolrBackupReconciler(RecurrenceEvaluator recurrenceEvaluator,
                                BackupRunCoordinator coordinator,
                                BackupRetentionManager retentionManager,
                                BackupStatusConverter statusConverter,
                                SolrClusterApiProvider clusterApiProvider,
                                @ConfigProperty(name = "solr-backup.run.timeout") Optional<Duration> runTimeout) {
        this.recurrenceEvaluator = recurrenceEvaluator;
        this.coordinator = coordinator;
        this.retentionManager = retentionManager;
        this.statusConverter = statusConverter;
        this.clusterApiProvider = clusterApiProvider;
        this.runTimeout = runTimeout;
    }

    public SolrBackupStatus reconcile(SolrBackup backup, Instant now) {
        String name = backup.getName();
        SolrBackupSpec spec = backup.getSpec();
        spec.withDefaults();

        BackupHistoryState state;
        try {
            state = statusConverter.toDomain(name, backup.getStatus());
        } catch (InconsistentBackupStateException e) {
            log.error("Skip reconciliation of {}: {}", name, e.getMessage());
            return withErrorMessage(backup.getStatus(), e.getMessage());
        }

        List<String> errors = new ArrayList<>();
        Optional<BackupSchedule> schedule = parseSchedule(name, spec.getRecurrence(), errors);
        BackupRunContext context = new BackupRunContext(name, spec.getRepositoryName(), spec.getLocation(),
                clusterApiProvider.forCloud(spec.getSolrCloud()));
        Instant createdAt = backup.getCreationTimestamp() != null ? backup.getCreationTimestamp() : now;

        Optional<BackupRun> current = state.current();
        List<BackupRun> history = new ArrayList<>(state.history());
        long lastSequence = state.lastSequence();

        boolean inProgress = current.isPresent() && !current.get().isFinished();
        if (!inProgress && isRunDue(name, spec, schedule, state, createdAt, now, errors)) {
            Optional<BackupRun> started = startRun(spec, context, lastSequence + 1, now, errors);
            if (started.isPresent()) {
                current = started;
                lastSequence = started.get().sequence();
            }
        }

        if (current.isPresent() && !current.get().isFinished()) {
            BackupRun run;
            try {
                run = advanceOrExpire(current.get(), context, now);
            } catch (InconsistentBackupStateException e) {
                log.error("Skip reconciliation of {}: {}", name, e.getMessage());
                return withErrorMessage(backup.getStatus(), e.getMessage());
            }
            current = Optional.of(run);
            if (run.isFinished()) {
                history.add(run);
                history = applyRetention(spec, history, context, errors);
            }
        }

        Instant nextScheduledTime = nextScheduledTime(name, spec, schedule, current, createdAt, errors);
        String errorMessage = errors.isEmpty() ? null : String.join("; ", errors);
        return statusConverter.toStatus(current, history, lastSequence, nextScheduledTime, errorMessage);
    }

    private Optional<BackupSchedule> parseSchedule(String name, BackupRecurrence recurrence, List<String> errors) {
        if (recurrence == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(recurrenceEvaluator.parse(recurrence.getSchedule()));
        } catch (InvalidScheduleException e) {
            log.error("Recurrence of {} is invalid: {}", name, e.getMessage());
            errors.add(e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isRunDue(String name, SolrBackupSpec spec, Optional<BackupSchedule> schedule, BackupHistoryState state,
                             Instant createdAt, Instant now, List<String> errors) {
        BackupRecurrence recurrence = spec.getRecurrence();
        if (recurrence == null) {
            return state.lastSequence() == 0 && state.current().isEmpty();
        }
        if (!recurrence.isEnabled() || schedule.isEmpty()) {
            return false;
        }
        try {
            return recurrenceEvaluator.isDue(schedule.get(), referenceTime(state.current(), createdAt), now);
        } catch (InvalidScheduleException e) {
            log.error("Recurrence of {} cannot be evaluated: {}", name, e.getMessage());
            errors.add(e.getMessage());
            return false;
        }
    }

    private Optional<BackupRun> startRun(SolrBackupSpec spec, BackupRunContext context, long sequence, Instant now,
                                         List<String> errors) {
        try {
            List<String> collections = spec.getCollections().isEmpty()
                    ? context.solrClusterApi().listCollections()
                    : spec.getCollections();
            if (collections.isEmpty()) {
                String error = "No collections to back up in SolrCloud " + spec.getSolrCloud();
                log.warn("Backup run of {} is not started: {}", context.backupName(), error);
                errors.add(error);
                return Optional.empty();
            }
            String solrVersion = context.solrClusterApi().getSolrVersion();
            List<CollectionRun> collectionRuns = collections.stream()
                    .map(collection -> new CollectionRun(collection,
                            collectionBackupName(context.backupName(), collection), CollectionOutcome.pending()))
                    .toList();
            log.info("Start backup run {} of {} for collections {} (Solr {})",
                    sequence, context.backupName(), collections, solrVersion);
            return Optional.of(BackupRun.start(sequence, solrVersion, now, collectionRuns));
        } catch (SolrApiException e) {
            log.error("Backup run of {} is not started: {}", context.backupName(), e.getMessage());
            errors.add(e.getMessage());
            return Optional.empty();
        }
    }

    private BackupRun advanceOrExpire(BackupRun run, BackupRunContext context, Instant now) {
        if (runTimeout.isPresent() && now.isAfter(run.startTime().plus(runTimeout.get()))) {
            log.warn("Backup run {} of {} is open longer than {}, failing unfinished collections",
                    run.sequence(), context.backupName(), runTimeout.get());
            return coordinator.failUnfinished(run, now, "Backup run timed out after " + runTimeout.get());
        }
        return coordinator.advance(run, context, now);
    }

    private List<BackupRun> applyRetention(SolrBackupSpec spec, List<BackupRun> history, BackupRunContext context,
                                           List<String> errors) {
        RetentionResult retention = retentionManager.trim(history, spec.maxSaved());
        if (!retention.evicted().isEmpty()) {
            EvictionReport report = retentionManager.evict(retention.evicted(), context);
            log.info("Evicted {} backup runs of {}, deleted {} backup points",
                    retention.evicted().size(), context.backupName(), report.deletedBackupPoints());
            errors.addAll(report.failures());
        }
        return retention.kept();
    }

    private Instant nextScheduledTime(String name, SolrBackupSpec spec, Optional<BackupSchedule> schedule,
                                      Optional<BackupRun> current, Instant createdAt, List<String> errors) {
        BackupRecurrence recurrence = spec.getRecurrence();
        if (recurrence == null || !recurrence.isEnabled() || schedule.isEmpty()) {
            return null;
        }
        try {
            return recurrenceEvaluator.nextDue(schedule.get(), referenceTime(current, createdAt));
        } catch (InvalidScheduleException e) {
            log.error("Next run of {} cannot be scheduled: {}", name, e.getMessage());
            if (!errors.contains(e.getMessage())) {
                errors.add(e.getMessage());
            }
            return null;
        }
    }

    private static Instant referenceTime(Optional<BackupRun> current, Instant createdAt) {
        return current.map(BackupRun::startTime).orElse(createdAt);
    }

    private static SolrBackupStatus withErrorMessage(SolrBackupStatus previous, String errorMessage) {
        SolrBackupStatus status = previous != null ? previous : new SolrBackupStatus();
        status.setErrorMessage(errorMessage);
        return status;
    }
}
