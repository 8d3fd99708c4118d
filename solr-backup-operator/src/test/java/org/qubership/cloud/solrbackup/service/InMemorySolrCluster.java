package org.qubership.cloud.solrbackup.service;

import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.model.BackupJobState;
import org.qubership.cloud.solrbackup.model.BackupJobStatus;
import org.qubership.cloud.solrbackup.model.BackupPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SolrCloud stand-in whose backups complete on the first poll. Backup points are stamped with {@link #now}
 * shifted by {@link #clockSkew}.
 */
class InMemorySolrCluster implements SolrClusterApi {
    Instant now = Instant.EPOCH;
    Duration clockSkew = Duration.ZERO;
    boolean reportBackupIds = true;
    String version = "9.4.1";
    List<String> collections = new ArrayList<>(List.of("books", "films"));

    final Set<String> failingStart = new HashSet<>();
    final Set<String> failingBackup = new HashSet<>();
    final Map<String, BackupJobState> jobs = new HashMap<>();
    final Map<String, Integer> backupIds = new HashMap<>();
    final List<String> clearedStatuses = new ArrayList<>();
    final Map<String, List<BackupPoint>> points = new HashMap<>();
    final List<String> startedRequests = new ArrayList<>();
    int deleteCalls;
    boolean holdJobs;
    private int nextBackupId;

    @Override
    public synchronized String startBackup(String collection, String repository, String location, String backupName, String asyncRequestId) {
        if (failingStart.contains(collection)) {
            throw new SolrApiException("BACKUP", 400, "collection " + collection + " is unavailable", null);
        }
        startedRequests.add(asyncRequestId);
        jobs.put(asyncRequestId, failingBackup.contains(collection) ? BackupJobState.FAILED : BackupJobState.SUCCEEDED);
        if (!failingBackup.contains(collection)) {
            backupIds.put(asyncRequestId, nextBackupId);
            points.computeIfAbsent(backupName, n -> new ArrayList<>()).add(new BackupPoint(nextBackupId++, now.plus(clockSkew)));
        }
        return asyncRequestId;
    }

    @Override
    public synchronized BackupJobStatus pollBackup(String asyncRequestId) {
        if (holdJobs) {
            return BackupJobStatus.of(BackupJobState.RUNNING);
        }
        BackupJobState state = jobs.getOrDefault(asyncRequestId, BackupJobState.FAILED);
        return new BackupJobStatus(state, reportBackupIds ? backupIds.get(asyncRequestId) : null);
    }

    @Override
    public synchronized void clearAsyncStatus(String asyncRequestId) {
        clearedStatuses.add(asyncRequestId);
        jobs.remove(asyncRequestId);
    }

    @Override
    public synchronized List<BackupPoint> listBackups(String backupName, String repository, String location) {
        return List.copyOf(points.getOrDefault(backupName, List.of()));
    }

    @Override
    public synchronized void deleteBackup(String backupName, String repository, String location, int backupId) {
        deleteCalls++;
        points.getOrDefault(backupName, new ArrayList<>()).removeIf(point -> point.backupId() == backupId);
    }

    @Override
    public String getSolrVersion() {
        return version;
    }

    @Override
    public List<String> listCollections() {
        return List.copyOf(collections);
    }

    synchronized int pointCount() {
        return points.values().stream().mapToInt(List::size).sum();
    }
}
