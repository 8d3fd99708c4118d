package org.qubership.cloud.solrbackup.service;

import net.javacrumbs.shedlock.core.LockAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.qubership.cloud.solrbackup.entity.BackupRecurrence;
import org.qubership.cloud.solrbackup.entity.SolrBackup;
import org.qubership.cloud.solrbackup.entity.SolrBackupSpec;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;
import org.qubership.cloud.solrbackup.exceptions.InvalidScheduleException;
import org.qubership.cloud.solrbackup.exceptions.RequestValidationException;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.exceptions.SolrBackupNotFoundException;
import org.qubership.cloud.solrbackup.repositories.pg.jpa.SolrBackupRepository;
import org.qubership.cloud.solrbackup.schedule.RecurrenceEvaluator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrBackupServiceTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    SolrBackupRepository solrBackupRepository;

    @Mock
    SolrBackupReconciler reconciler;

    SolrBackupService solrBackupService;

    @BeforeEach
    void setUp() {
        solrBackupService = new SolrBackupService(solrBackupRepository, reconciler, new RecurrenceEvaluator(),
                new ReconciliationLocks(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createStoresNormalizedSpecAndReconciles() {
        SolrBackup[] stored = new SolrBackup[1];
        when(solrBackupRepository.findByIdOptional("nightly"))
                .thenReturn(Optional.empty())
                .thenAnswer(invocation -> Optional.of(stored[0]));
        when(solrBackupRepository.save(any(SolrBackup.class))).thenAnswer(invocation -> {
            stored[0] = invocation.getArgument(0);
            return stored[0];
        });
        SolrBackupStatus status = new SolrBackupStatus();
        when(reconciler.reconcile(any(SolrBackup.class), any(Instant.class))).thenReturn(status);

        SolrBackup result = solrBackupService.createOrUpdate("nightly", SolrBackupSpec.builder().solrCloud("example").build());

        assertEquals("nightly", result.getName());
        assertEquals(NOW, result.getCreationTimestamp());
        assertEquals("legacy_local_repository", result.getSpec().getRepositoryName());
        assertSame(status, result.getStatus());
        verify(reconciler).reconcile(stored[0], NOW);
    }

    @Test
    void updateKeepsStatusAndCreationTime() {
        SolrBackupStatus previous = SolrBackupStatus.builder().lastSequence(7).build();
        SolrBackup existing = SolrBackup.builder().name("nightly").creationTimestamp(NOW.minusSeconds(3600))
                .spec(SolrBackupSpec.builder().solrCloud("example").build()).status(previous).build();
        when(solrBackupRepository.findByIdOptional("nightly")).thenReturn(Optional.of(existing));
        when(solrBackupRepository.save(any(SolrBackup.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(reconciler.reconcile(existing, NOW)).thenReturn(previous);

        SolrBackupSpec spec = SolrBackupSpec.builder().solrCloud("other")
                .recurrence(BackupRecurrence.builder().schedule("@daily").build()).build();
        SolrBackup result = solrBackupService.createOrUpdate("nightly", spec);

        ArgumentCaptor<SolrBackup> captor = ArgumentCaptor.forClass(SolrBackup.class);
        verify(solrBackupRepository, atLeastOnce()).save(captor.capture());
        assertEquals("other", captor.getValue().getSpec().getSolrCloud());
        assertEquals(NOW.minusSeconds(3600), result.getCreationTimestamp());
        assertEquals(7, result.getStatus().getLastSequence());
    }

    @Test
    void invalidNameIsRejected() {
        SolrBackupSpec spec = SolrBackupSpec.builder().solrCloud("example").build();

        assertThrows(RequestValidationException.class, () -> solrBackupService.createOrUpdate("Nightly_Backup", spec));
        verify(solrBackupRepository, never()).save(any());
    }

    @Test
    void invalidScheduleIsRejected() {
        SolrBackupSpec spec = SolrBackupSpec.builder().solrCloud("example")
                .recurrence(BackupRecurrence.builder().schedule("@sometimes").build()).build();

        assertThrows(InvalidScheduleException.class, () -> solrBackupService.createOrUpdate("nightly", spec));
        verify(solrBackupRepository, never()).save(any());
    }

    @Test
    void getMissingBackupFails() {
        when(solrBackupRepository.findByIdOptional("nightly")).thenReturn(Optional.empty());

        assertThrows(SolrBackupNotFoundException.class, () -> solrBackupService.get("nightly"));
    }

    @Test
    void deleteMissingBackupFails() {
        when(solrBackupRepository.remove("nightly")).thenReturn(false);

        assertThrows(SolrBackupNotFoundException.class, () -> solrBackupService.delete("nightly"));
    }

    @Test
    void reconcilePersistsNewStatus() {
        SolrBackup existing = SolrBackup.builder().name("nightly").creationTimestamp(NOW)
                .spec(SolrBackupSpec.builder().solrCloud("example").build()).build();
        SolrBackupStatus status = SolrBackupStatus.builder().lastSequence(1).build();
        when(solrBackupRepository.findByIdOptional("nightly")).thenReturn(Optional.of(existing));
        when(reconciler.reconcile(existing, NOW)).thenReturn(status);

        assertSame(status, solrBackupService.reconcile("nightly"));
        verify(solrBackupRepository).save(existing);
        assertSame(status, existing.getStatus());
    }

    @Test
    void reconcileAllContinuesAfterFailure() {
        SolrBackup broken = SolrBackup.builder().name("broken").creationTimestamp(NOW)
                .spec(SolrBackupSpec.builder().solrCloud("gone").build()).build();
        SolrBackup healthy = SolrBackup.builder().name("healthy").creationTimestamp(NOW)
                .spec(SolrBackupSpec.builder().solrCloud("example").build()).build();
        when(solrBackupRepository.listAll()).thenReturn(List.of(broken, healthy));
        when(solrBackupRepository.findByIdOptional("broken")).thenReturn(Optional.of(broken));
        when(solrBackupRepository.findByIdOptional("healthy")).thenReturn(Optional.of(healthy));
        when(reconciler.reconcile(broken, NOW)).thenThrow(new SolrApiException("LIST", "unreachable"));
        when(reconciler.reconcile(healthy, NOW)).thenReturn(new SolrBackupStatus());

        LockAssert.TestHelper.makeAllAssertsPass(true);
        try {
            solrBackupService.reconcileAll();
        } finally {
            LockAssert.TestHelper.makeAllAssertsPass(false);
        }

        verify(solrBackupRepository).save(healthy);
        verify(solrBackupRepository, never()).save(broken);
    }
}
