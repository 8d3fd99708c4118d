package org.qubership.cloud.solrbackup.service;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.cdi.SchedulerLock;
import net.javacrumbs.shedlock.core.LockAssert;
import org.qubership.cloud.solrbackup.entity.SolrBackup;
import org.qubership.cloud.solrbackup.entity.SolrBackupSpec;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;
import org.qubership.cloud.solrbackup.exceptions.RequestValidationException;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupNotFoundException;
import org.qubership.cloud.solrbackup.repositories.pg.jpa.SolrBackupRepository;
import org.qubership.cloud.solrbackup.schedule.RecurrenceEvaluator;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;
import static org.qubership.cloud.solrbackup.Constants.RESOURCE_NAME_PATTERN;

@Slf4j
@ApplicationScoped
public class SolrBackupService {
    private static final int MAX_NAME_LENGTH = 63;

    private final SolrBackupRepository solrBackupRepository;
    private final SolrBackupReconciler reconciler;
    private final RecurrenceEvaluator recurrenceEvaluator;
    private final ReconciliationLocks locks;
    private final Clock clock;

    @Inject
    public SolrBackupService(SolrBackupRepository solrBackupRepository,
                             SolrBackupReconciler reconciler,
                             RecurrenceEvaluator recurrenceEvaluator,
                             ReconciliationLocks locks,
                             Clock clock) {
        this.solrBackupRepository = solrBackupRepository;
        this.reconciler = reconciler;
        this.recurrenceEvaluator = recurrenceEvaluator;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Creates the backup request or replaces its spec, keeping the status, then reconciles it once.
     */
    public SolrBackup createOrUpdate(String name, SolrBackupSpec spec) {
        validate(name, spec);
        spec.withDefaults();
        SolrBackup solrBackup = locks.withLock(name, () -> {
            Optional<SolrBackup> existing = solrBackupRepository.findByIdOptional(name);
            SolrBackup toSave;
            if (existing.isPresent()) {
                log.info("Update spec of Solr backup {}", name);
                toSave = existing.get();
                toSave.setSpec(spec);
            } else {
                log.info("Create Solr backup {} of SolrCloud {}", name, spec.getSolrCloud());
                toSave = SolrBackup.builder()
                        .name(name)
                        .creationTimestamp(clock.instant())
                        .spec(spec)
                        .build();
            }
            return solrBackupRepository.save(toSave);
        });
        reconcile(name);
        return get(name);
    }

    public SolrBackup get(String name) {
        return solrBackupRepository.findByIdOptional(name)
                .orElseThrow(() -> new SolrBackupNotFoundException(name));
    }

    public List<SolrBackup> list() {
        return solrBackupRepository.findAllOrderedByName();
    }

    /**
     * Removes the backup request. Backups already stored in the Solr repository are left in place.
     */
    public void delete(String name) {
        locks.withLock(name, () -> {
            if (!solrBackupRepository.remove(name)) {
                throw new SolrBackupNotFoundException(name);
            }
            log.info("Solr backup {} deleted", name);
            return null;
        });
        locks.forget(name);
    }

    public SolrBackupStatus reconcile(String name) {
        return locks.withLock(name, () -> {
            SolrBackup solrBackup = get(name);
            SolrBackupStatus status = reconciler.reconcile(solrBackup, clock.instant());
            solrBackup.setStatus(status);
            solrBackupRepository.save(solrBackup);
            return status;
        });
    }

    @Scheduled(every = "${solr-backup.reconcile.interval}", concurrentExecution = SKIP)
    @SchedulerLock(name = "reconcileSolrBackups")
    protected void reconcileAll() {
        LockAssert.assertLocked();
        List<SolrBackup> solrBackups = solrBackupRepository.listAll();
        log.debug("Reconcile {} Solr backups", solrBackups.size());
        solrBackups.forEach(solrBackup -> {
            try {
                reconcile(solrBackup.getName());
            } catch (RuntimeException e) {
                log.error("Reconciliation of Solr backup {} failed", solrBackup.getName(), e);
            }
        });
    }

    private void validate(String name, SolrBackupSpec spec) {
        if (name == null || name.length() > MAX_NAME_LENGTH || !name.matches(RESOURCE_NAME_PATTERN)) {
            throw new RequestValidationException("name",
                    "must match " + RESOURCE_NAME_PATTERN + " and be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (spec.getSolrCloud() == null || spec.getSolrCloud().isBlank()) {
            throw new RequestValidationException("solrCloud", "must not be blank");
        }
        if (spec.getRecurrence() != null) {
            recurrenceEvaluator.parse(spec.getRecurrence().getSchedule());
        }
    }
}
