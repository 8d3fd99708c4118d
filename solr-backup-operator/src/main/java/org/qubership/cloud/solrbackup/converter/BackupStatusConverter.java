package org.qubership.cloud.solrbackup.converter;

import jakarta.enterprise.context.ApplicationScoped;
import org.qubership.cloud.solrbackup.entity.CollectionBackupStatus;
import org.qubership.cloud.solrbackup.entity.IndividualSolrBackupStatus;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;
import org.qubership.cloud.solrbackup.exceptions.InconsistentBackupStateException;
import org.qubership.cloud.solrbackup.model.BackupHistoryState;
import org.qubership.cloud.solrbackup.model.BackupRun;
import org.qubership.cloud.solrbackup.model.CollectionOutcome;
import org.qubership.cloud.solrbackup.model.CollectionRun;
import org.qubership.cloud.solrbackup.model.RunResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps the persisted status of a backup request to the run model and back.
 * Reading never repairs a status: impossible combinations are rejected with {@link InconsistentBackupStateException}.
 */
@ApplicationScoped
public class BackupStatusConverter {

    public BackupHistoryState toDomain(String backupName, SolrBackupStatus status) {
        if (status == null) {
            return BackupHistoryState.empty();
        }
        long lastSequence = status.getLastSequence();
        Optional<BackupRun> current = Optional.empty();
        IndividualSolrBackupStatus currentStatus = status.getCurrent();
        if (currentStatus != null && currentStatus.getStartTimestamp() != null) {
            current = Optional.of(toRun(backupName, currentStatus, lastSequence));
        }
        List<BackupRun> history = new ArrayList<>();
        if (status.getHistory() != null) {
            for (IndividualSolrBackupStatus entry : status.getHistory()) {
                BackupRun run = toRun(backupName, entry, 0);
                if (!run.isFinished()) {
                    throw new InconsistentBackupStateException(backupName,
                            "history entry started at " + entry.getStartTimestamp() + " is not finished");
                }
                history.add(run);
            }
        }
        return new BackupHistoryState(current, history, lastSequence);
    }

    public SolrBackupStatus toStatus(Optional<BackupRun> current, List<BackupRun> history, long lastSequence,
                                     Instant nextScheduledTime, String errorMessage) {
        return SolrBackupStatus.builder()
                .current(current.map(this::toIndividualStatus).orElseGet(IndividualSolrBackupStatus::new))
                .history(new ArrayList<>(history.stream().map(this::toIndividualStatus).toList()))
                .lastSequence(lastSequence)
                .nextScheduledTime(nextScheduledTime)
                .errorMessage(errorMessage)
                .build();
    }

    private BackupRun toRun(String backupName, IndividualSolrBackupStatus status, long defaultSequence) {
        if (status.getStartTimestamp() == null) {
            throw new InconsistentBackupStateException(backupName, "backup run without start timestamp");
        }
        long sequence = status.getSequence() != null ? status.getSequence() : defaultSequence;
        List<CollectionRun> collections = new ArrayList<>();
        if (status.getCollectionBackupStatuses() != null) {
            for (CollectionBackupStatus collectionStatus : status.getCollectionBackupStatuses()) {
                collections.add(toCollectionRun(backupName, collectionStatus));
            }
        }

        Optional<RunResult> result = Optional.empty();
        if (status.isFinished()) {
            if (status.getSuccessful() == null || status.getFinishTimestamp() == null) {
                throw new InconsistentBackupStateException(backupName,
                        "finished run " + sequence + " has no result or finish timestamp");
            }
            if (!collections.stream().allMatch(CollectionRun::isFinished)) {
                throw new InconsistentBackupStateException(backupName,
                        "finished run " + sequence + " has unfinished collections");
            }
            result = Optional.of(new RunResult(status.getFinishTimestamp(), status.getSuccessful()));
        } else if (status.getSuccessful() != null) {
            throw new InconsistentBackupStateException(backupName,
                    "unfinished run " + sequence + " has a result");
        }
        return new BackupRun(sequence, status.getSolrVersion(), status.getStartTimestamp(), collections, result);
    }

    private CollectionRun toCollectionRun(String backupName, CollectionBackupStatus status) {
        CollectionOutcome outcome;
        if (status.isFinished()) {
            if (status.getSuccessful() == null || status.getFinishTimestamp() == null) {
                throw new InconsistentBackupStateException(backupName,
                        "finished backup of collection " + status.getCollection() + " has no result or finish timestamp");
            }
            outcome = new CollectionOutcome.Finished(status.getStartTimestamp(), status.getFinishTimestamp(),
                    status.getSuccessful(), status.getAsyncRequestId(), status.getErrorMessage(), status.getBackupId());
        } else if (status.getSuccessful() != null) {
            throw new InconsistentBackupStateException(backupName,
                    "unfinished backup of collection " + status.getCollection() + " has a result");
        } else if (status.isInProgress()) {
            if (status.getAsyncRequestId() == null) {
                throw new InconsistentBackupStateException(backupName,
                        "backup of collection " + status.getCollection() + " is in progress without async request id");
            }
            outcome = new CollectionOutcome.Running(status.getAsyncRequestId(), status.getStartTimestamp(), status.getErrorMessage());
        } else {
            outcome = CollectionOutcome.pending();
        }
        return new CollectionRun(status.getCollection(), status.getBackupName(), outcome);
    }

    private IndividualSolrBackupStatus toIndividualStatus(BackupRun run) {
        return IndividualSolrBackupStatus.builder()
                .sequence(run.sequence())
                .solrVersion(run.solrVersion())
                .startTimestamp(run.startTime())
                .collectionBackupStatuses(new ArrayList<>(run.collections().stream().map(this::toCollectionStatus).toList()))
                .finished(run.isFinished())
                .finishTimestamp(run.result().map(RunResult::finishTime).orElse(null))
                .successful(run.result().map(RunResult::successful).orElse(null))
                .build();
    }

    private CollectionBackupStatus toCollectionStatus(CollectionRun collectionRun) {
        CollectionBackupStatus.CollectionBackupStatusBuilder builder = CollectionBackupStatus.builder()
                .collection(collectionRun.collection())
                .backupName(collectionRun.backupName());
        CollectionOutcome outcome = collectionRun.outcome();
        if (outcome instanceof CollectionOutcome.Running running) {
            builder.inProgress(true)
                    .asyncRequestId(running.asyncRequestId())
                    .startTimestamp(running.startTime())
                    .errorMessage(running.lastError());
        } else if (outcome instanceof CollectionOutcome.Finished finished) {
            builder.finished(true)
                    .successful(finished.successful())
                    .asyncRequestId(finished.asyncRequestId())
                    .startTimestamp(finished.startTime())
                    .finishTimestamp(finished.finishTime())
                    .errorMessage(finished.message())
                    .backupId(finished.backupId());
        }
        return builder.build();
    }
}
