package org.qubership.cloud.solrbackup.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.qubership.cloud.solrbackup.exceptions.InconsistentBackupStateException;
import org.qubership.cloud.solrbackup.model.BackupRun;
import org.qubership.cloud.solrbackup.model.BackupRunContext;
import org.qubership.cloud.solrbackup.model.CollectionOutcome;
import org.qubership.cloud.solrbackup.model.CollectionRun;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Drives a backup run: one stepper call per unfinished collection per invocation, then aggregates the outcome.
 * A run finishes exactly when all of its collections have finished and is successful only if all of them succeeded.
 */
@Slf4j
@ApplicationScoped
public class BackupRunCoordinator {
    private final CollectionBackupStepper stepper;
    private final AsyncOperations asyncOperations;

    @Inject
    public BackupRunCoordinator(CollectionBackupStepper stepper, AsyncOperations asyncOperations) {
        this.stepper = stepper;
        this.asyncOperations = asyncOperations;
    }

    public BackupRun advance(BackupRun run, BackupRunContext context, Instant now) {
        if (run.isFinished()) {
            if (!run.allCollectionsFinished()) {
                throw new InconsistentBackupStateException(context.backupName(),
                        "run " + run.sequence() + " is finished but has unfinished collections");
            }
            return run;
        }

        List<CompletableFuture<CollectionRun>> futures = run.collections().stream()
                .map(collectionRun -> collectionRun.isFinished()
                        ? CompletableFuture.completedFuture(collectionRun)
                        : CompletableFuture.supplyAsync(
                                        () -> stepper.step(collectionRun, run.sequence(), context, now),
                                        asyncOperations.getCollectionPool())
                                .exceptionally(throwable -> {
                                    log.error("Unexpected failure while backing up collection {} for {}",
                                            collectionRun.collection(), context.backupName(), throwable);
                                    return collectionRun;
                                }))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<CollectionRun> updated = futures.stream().map(CompletableFuture::join).toList();

        BackupRun advanced = run.withCollections(updated, now);
        advanced.result().ifPresent(result -> log.info("Backup run {} of {} finished, successful: {}",
                advanced.sequence(), context.backupName(), result.successful()));
        return advanced;
    }

    /**
     * Fails every unfinished collection of the run and finishes it.
     */
    public BackupRun failUnfinished(BackupRun run, Instant now, String reason) {
        if (run.isFinished()) {
            return run;
        }
        List<CollectionRun> updated = run.collections().stream()
                .map(collectionRun -> collectionRun.isFinished()
                        ? collectionRun
                        : collectionRun.withOutcome(failed(collectionRun.outcome(), now, reason)))
                .toList();
        return run.withCollections(updated, now);
    }

    private static CollectionOutcome failed(CollectionOutcome outcome, Instant now, String reason) {
        if (outcome instanceof CollectionOutcome.Running running) {
            return new CollectionOutcome.Finished(running.startTime(), now, false, running.asyncRequestId(), reason);
        }
        return CollectionOutcome.Finished.submitFailed(now, reason);
    }
}
