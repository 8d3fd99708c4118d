package org.qubership.cloud.solrbackup.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.qubership.cloud.solrbackup.converter.BackupStatusConverter;
import org.qubership.cloud.solrbackup.entity.BackupRecurrence;
import org.qubership.cloud.solrbackup.entity.CollectionBackupStatus;
import org.qubership.cloud.solrbackup.entity.IndividualSolrBackupStatus;
import org.qubership.cloud.solrbackup.entity.SolrBackup;
import org.qubership.cloud.solrbackup.entity.SolrBackupSpec;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;
import org.qubership.cloud.solrbackup.exceptions.InvalidScheduleException;
import org.qubership.cloud.solrbackup.schedule.RecurrenceEvaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.spy;

@ExtendWith(MockitoExtension.class)
class SolrBackupReconcilerTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    SolrClusterApiProvider clusterApiProvider;

    InMemorySolrCluster cluster;
    AsyncOperations asyncOperations;

    @BeforeEach
    void setUp() {
        cluster = new InMemorySolrCluster();
        asyncOperations = new AsyncOperations(2);
        lenient().when(clusterApiProvider.forCloud("example")).thenReturn(cluster);
    }

    @AfterEach
    void tearDown() {
        asyncOperations.shutdown();
    }

    @Test
    void recurringBackupKeepsMaxSavedRuns() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 3));

        runSeconds(reconciler, backup, 0, 45);

        SolrBackupStatus status = backup.getStatus();
        assertEquals(3, status.getHistory().size());
        assertTrue(status.getLastSequence() >= 4);
        assertEquals(List.of(2L, 3L, 4L), status.getHistory().stream().map(IndividualSolrBackupStatus::getSequence).toList());
        assertTrue(status.getHistory().stream().allMatch(entry -> Boolean.TRUE.equals(entry.getSuccessful())));
        // run 1 is evicted together with its backup points
        assertEquals(2, cluster.deleteCalls);
        assertEquals(6, cluster.pointCount());
        assertEquals(List.of("example-books-1", "example-films-1"), cluster.clearedStatuses);
        assertNull(status.getErrorMessage());
    }

    @Test
    void evictionUsesRecordedBackupIdsWhenSolrClockLags() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 1));
        cluster.clockSkew = Duration.ofMillis(-500);

        runSeconds(reconciler, backup, 0, 45);

        SolrBackupStatus status = backup.getStatus();
        assertEquals(1, status.getHistory().size());
        assertEquals(6, cluster.deleteCalls);
        assertEquals(2, cluster.pointCount());
        assertNull(status.getErrorMessage());
    }

    @Test
    void unmatchedBackupPointsAreReported() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 1));
        cluster.clockSkew = Duration.ofMillis(-500);
        cluster.reportBackupIds = false;

        // the pass at second 41 finishes run 4 and evicts run 3
        runSeconds(reconciler, backup, 0, 42);

        SolrBackupStatus status = backup.getStatus();
        assertEquals(1, status.getHistory().size());
        assertEquals(0, cluster.deleteCalls);
        assertTrue(status.getErrorMessage().contains("collection books from run 3: no backup point of example-books"));
    }

    @Test
    void finishedBackupIsPolledAgainWhenStatusWasNotSaved() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(oneShot("books"));
        cluster.holdJobs = true;
        runSeconds(reconciler, backup, 0, 2);

        cluster.holdJobs = false;
        SolrBackupStatus lost = reconciler.reconcile(backup, T0.plusSeconds(2));
        assertTrue(lost.getCurrent().isFinished());

        SolrBackupStatus status = reconciler.reconcile(backup, T0.plusSeconds(3));

        assertTrue(status.getCurrent().isFinished());
        assertEquals(Boolean.TRUE, status.getCurrent().getSuccessful());
        assertTrue(cluster.clearedStatuses.isEmpty());
    }

    @Test
    void firstRecurringRunStartsOneIntervalAfterCreation() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 3));

        runSeconds(reconciler, backup, 0, 10);

        assertEquals(0, backup.getStatus().getLastSequence());
        assertEquals(T0.plusSeconds(10), backup.getStatus().getNextScheduledTime());

        runSeconds(reconciler, backup, 10, 11);

        assertEquals(1, backup.getStatus().getLastSequence());
        assertEquals(T0.plusSeconds(10), backup.getStatus().getCurrent().getStartTimestamp());
        assertEquals(T0.plusSeconds(20), backup.getStatus().getNextScheduledTime());
    }

    @Test
    void disablingRecurrenceLetsRunningRunFinish() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 3));
        cluster.holdJobs = true;
        runSeconds(reconciler, backup, 0, 12);
        assertEquals(1, backup.getStatus().getLastSequence());
        assertFalse(backup.getStatus().getCurrent().isFinished());

        backup.getSpec().getRecurrence().setDisabled(true);
        cluster.holdJobs = false;
        runSeconds(reconciler, backup, 12, 60);

        SolrBackupStatus status = backup.getStatus();
        assertEquals(1, status.getLastSequence());
        assertTrue(status.getCurrent().isFinished());
        assertEquals(Boolean.TRUE, status.getCurrent().getSuccessful());
        assertEquals(1, status.getHistory().size());
        assertNull(status.getNextScheduledTime());
    }

    @Test
    void failedStartOfOneCollectionFailsTheRun() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(oneShot("books", "films"));
        cluster.failingStart.add("films");

        runSeconds(reconciler, backup, 0, 1);
        IndividualSolrBackupStatus current = backup.getStatus().getCurrent();
        assertFalse(current.isFinished());
        CollectionBackupStatus films = current.getCollectionBackupStatuses().get(1);
        assertTrue(films.isFinished());
        assertEquals(Boolean.FALSE, films.getSuccessful());
        assertNotNull(films.getErrorMessage());

        runSeconds(reconciler, backup, 1, 2);
        current = backup.getStatus().getCurrent();
        assertTrue(current.isFinished());
        assertEquals(Boolean.FALSE, current.getSuccessful());
        assertEquals(Boolean.TRUE, current.getCollectionBackupStatuses().get(0).getSuccessful());
    }

    @Test
    void oneShotBackupRunsOnce() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(oneShot("books"));

        runSeconds(reconciler, backup, 0, 30);

        SolrBackupStatus status = backup.getStatus();
        assertEquals(1, status.getLastSequence());
        assertEquals(1, cluster.startedRequests.size());
        assertEquals(List.of("example-books-1"), cluster.startedRequests);
        assertEquals(1, status.getHistory().size());
        assertEquals(status.getCurrent(), status.getHistory().get(0));
        assertNull(status.getNextScheduledTime());
        assertEquals("9.4.1", status.getCurrent().getSolrVersion());
    }

    @Test
    void emptyCollectionListBacksUpAllCollections() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(oneShot());

        runSeconds(reconciler, backup, 0, 1);

        assertEquals(List.of("books", "films"), backup.getStatus().getCurrent().getCollectionBackupStatuses().stream()
                .map(CollectionBackupStatus::getCollection).toList());
    }

    @Test
    void noRunWithoutCollections() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(oneShot());
        cluster.collections.clear();

        runSeconds(reconciler, backup, 0, 1);

        assertEquals(0, backup.getStatus().getLastSequence());
        assertNotNull(backup.getStatus().getErrorMessage());
        assertNull(backup.getStatus().getCurrent().getStartTimestamp());

        cluster.collections.add("books");
        runSeconds(reconciler, backup, 1, 2);

        assertEquals(1, backup.getStatus().getLastSequence());
        assertNull(backup.getStatus().getErrorMessage());
    }

    @Test
    void invalidScheduleIsReportedAndRunningRunStillAdvances() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 3));
        cluster.holdJobs = true;
        runSeconds(reconciler, backup, 0, 11);

        backup.getSpec().getRecurrence().setSchedule("every now and then");
        cluster.holdJobs = false;
        runSeconds(reconciler, backup, 11, 40);

        SolrBackupStatus status = backup.getStatus();
        assertTrue(status.getErrorMessage().contains("every now and then"));
        assertNull(status.getNextScheduledTime());
        assertEquals(1, status.getLastSequence());
        assertTrue(status.getCurrent().isFinished());
    }

    @Test
    void scheduleThatNeverFiresIsReportedAndRunningRunStillAdvances() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(recurring("@every 10s", 3));
        cluster.holdJobs = true;
        runSeconds(reconciler, backup, 0, 11);

        backup.getSpec().getRecurrence().setSchedule("0 0 30 2 *");
        cluster.holdJobs = false;
        runSeconds(reconciler, backup, 11, 20);

        SolrBackupStatus status = backup.getStatus();
        assertTrue(status.getErrorMessage().contains("0 0 30 2 *"));
        assertNull(status.getNextScheduledTime());
        assertEquals(1, status.getLastSequence());
        assertTrue(status.getCurrent().isFinished());
        assertEquals(1, status.getHistory().size());
    }

    @Test
    void scheduleEvaluationFailureIsReportedOnce() {
        RecurrenceEvaluator evaluator = spy(new RecurrenceEvaluator());
        InvalidScheduleException failure = new InvalidScheduleException("@every 10s", "no trigger time");
        doThrow(failure).when(evaluator).nextDue(any(), any());
        SolrBackupReconciler reconciler = reconciler(Optional.empty(), evaluator);
        SolrBackup backup = backup(recurring("@every 10s", 3));

        SolrBackupStatus status = reconciler.reconcile(backup, T0.plusSeconds(30));

        assertEquals(failure.getMessage(), status.getErrorMessage());
        assertEquals(0, status.getLastSequence());
        assertNull(status.getNextScheduledTime());
    }

    @Test
    void inconsistentStatusIsReportedAndKept() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackup backup = backup(oneShot("books"));
        IndividualSolrBackupStatus broken = IndividualSolrBackupStatus.builder()
                .sequence(1L).startTimestamp(T0).finished(true).successful(true).finishTimestamp(T0)
                .collectionBackupStatuses(new ArrayList<>(List.of(CollectionBackupStatus.builder().collection("books").build())))
                .build();
        SolrBackupStatus previous = SolrBackupStatus.builder().current(broken).lastSequence(1).build();
        backup.setStatus(previous);

        SolrBackupStatus status = reconciler.reconcile(backup, T0.plusSeconds(1));

        assertSame(broken, status.getCurrent());
        assertNotNull(status.getErrorMessage());
        assertTrue(cluster.startedRequests.isEmpty());
    }

    @Test
    void runLongerThanTimeoutIsFailed() {
        SolrBackupReconciler reconciler = reconciler(Optional.of(Duration.ofSeconds(5)));
        SolrBackup backup = backup(oneShot("books"));
        cluster.holdJobs = true;

        runSeconds(reconciler, backup, 0, 7);

        IndividualSolrBackupStatus current = backup.getStatus().getCurrent();
        assertTrue(current.isFinished());
        assertEquals(Boolean.FALSE, current.getSuccessful());
        assertEquals(T0.plusSeconds(6), current.getFinishTimestamp());
    }

    @Test
    void deprecatedPersistenceIsDroppedOnReconcile() {
        SolrBackupReconciler reconciler = reconciler(Optional.empty());
        SolrBackupSpec spec = oneShot("books");
        spec.setRepositoryName(null);
        SolrBackup backup = backup(spec);

        reconciler.reconcile(backup, T0);

        assertEquals("legacy_local_repository", backup.getSpec().getRepositoryName());
        assertNull(backup.getSpec().getPersistence());
    }

    private SolrBackupReconciler reconciler(Optional<Duration> runTimeout) {
        return reconciler(runTimeout, new RecurrenceEvaluator());
    }

    private SolrBackupReconciler reconciler(Optional<Duration> runTimeout, RecurrenceEvaluator evaluator) {
        return new SolrBackupReconciler(
                evaluator,
                new BackupRunCoordinator(new CollectionBackupStepper(), asyncOperations),
                new BackupRetentionManager(0, Duration.ofMillis(1)),
                new BackupStatusConverter(),
                clusterApiProvider,
                runTimeout);
    }

    private void runSeconds(SolrBackupReconciler reconciler, SolrBackup backup, int fromSecond, int toSecond) {
        for (int second = fromSecond; second < toSecond; second++) {
            Instant now = T0.plusSeconds(second);
            cluster.now = now;
            backup.setStatus(reconciler.reconcile(backup, now));
        }
    }

    private static SolrBackup backup(SolrBackupSpec spec) {
        return SolrBackup.builder()
                .name("example")
                .creationTimestamp(T0)
                .spec(spec)
                .build();
    }

    private static SolrBackupSpec recurring(String schedule, int maxSaved) {
        return SolrBackupSpec.builder()
                .solrCloud("example")
                .repositoryName("s3")
                .collections(new ArrayList<>(List.of("books", "films")))
                .recurrence(BackupRecurrence.builder().schedule(schedule).maxSaved(maxSaved).build())
                .build();
    }

    private static SolrBackupSpec oneShot(String... collections) {
        return SolrBackupSpec.builder()
                .solrCloud("example")
                .repositoryName("s3")
                .collections(new ArrayList<>(List.of(collections)))
                .build();
    }
}
