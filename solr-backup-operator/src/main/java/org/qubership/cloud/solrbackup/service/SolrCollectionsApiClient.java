package org.qubership.cloud.solrbackup.service;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import lombok.extern.slf4j.Slf4j;
import org.qubership.cloud.solrbackup.dto.solr.SolrAsyncResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrCollectionListResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrListBackupResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrRequestStatusResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrResponse;
import org.qubership.cloud.solrbackup.dto.solr.SolrSystemInfoResponse;
import org.qubership.cloud.solrbackup.exceptions.SolrApiException;
import org.qubership.cloud.solrbackup.model.BackupJobState;
import org.qubership.cloud.solrbackup.model.BackupJobStatus;
import org.qubership.cloud.solrbackup.model.BackupPoint;
import org.qubership.cloud.solrbackup.rest.SolrCollectionsRestClient;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link SolrClusterApi} over the Solr Collections API of one SolrCloud.
 */
@Slf4j
public class SolrCollectionsApiClient implements SolrClusterApi {
    static final String STATE_COMPLETED = "completed";
    static final String STATE_FAILED = "failed";
    static final String STATE_NOT_FOUND = "notfound";

    private final String solrCloud;
    private final SolrCollectionsRestClient restClient;

    public SolrCollectionsApiClient(String solrCloud, SolrCollectionsRestClient restClient) {
        this.solrCloud = solrCloud;
        this.restClient = restClient;
    }

    @Override
    public String startBackup(String collection, String repository, String location, String backupName, String asyncRequestId) {
        log.info("Request SolrCloud {} to back up collection {} as {} to repository {} (async id {})",
                solrCloud, collection, backupName, repository, asyncRequestId);
        SolrAsyncResponse response = call("BACKUP",
                () -> restClient.backup(collection, backupName, repository, location, asyncRequestId));
        return response.getRequestid() != null ? response.getRequestid() : asyncRequestId;
    }

    @Override
    public BackupJobStatus pollBackup(String asyncRequestId) {
        SolrRequestStatusResponse response = call("REQUESTSTATUS", () -> restClient.requestStatus(asyncRequestId));
        String state = response.getStatus() == null ? null : response.getStatus().getState();
        if (state == null) {
            throw new SolrApiException("REQUESTSTATUS", "no state reported for async request " + asyncRequestId);
        }
        BackupJobState jobState = switch (state) {
            case STATE_COMPLETED -> BackupJobState.SUCCEEDED;
            case STATE_FAILED, STATE_NOT_FOUND -> BackupJobState.FAILED;
            default -> BackupJobState.RUNNING;
        };
        if (!jobState.isTerminal()) {
            return BackupJobStatus.of(jobState);
        }
        Integer backupId = response.getResponse() == null ? null : response.getResponse().getBackupId();
        log.info("Async request {} on SolrCloud {} finished with state {} (backup id {}): {}",
                asyncRequestId, solrCloud, state, backupId, response.getStatus().getMsg());
        return new BackupJobStatus(jobState, jobState == BackupJobState.SUCCEEDED ? backupId : null);
    }

    @Override
    public void clearAsyncStatus(String asyncRequestId) {
        log.debug("Request SolrCloud {} to clear status of async request {}", solrCloud, asyncRequestId);
        call("DELETESTATUS", () -> restClient.deleteStatus(asyncRequestId));
    }

    @Override
    public List<BackupPoint> listBackups(String backupName, String repository, String location) {
        SolrListBackupResponse response = call("LISTBACKUP", () -> restClient.listBackup(backupName, repository, location));
        if (response.getBackups() == null) {
            return List.of();
        }
        return response.getBackups().stream()
                .map(point -> toBackupPoint(backupName, point))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(BackupPoint::timestamp).thenComparingInt(BackupPoint::backupId))
                .toList();
    }

    @Override
    public void deleteBackup(String backupName, String repository, String location, int backupId) {
        log.info("Request SolrCloud {} to delete backup point {} of {} in repository {}", solrCloud, backupId, backupName, repository);
        call("DELETEBACKUP", () -> restClient.deleteBackup(backupName, repository, location, backupId));
    }

    @Override
    public String getSolrVersion() {
        SolrSystemInfoResponse response = call("SYSTEM_INFO", restClient::systemInfo);
        if (response.getLucene() == null || response.getLucene().getSolrSpecVersion() == null) {
            throw new SolrApiException("SYSTEM_INFO", "solr-spec-version is not reported by SolrCloud " + solrCloud);
        }
        return response.getLucene().getSolrSpecVersion();
    }

    @Override
    public List<String> listCollections() {
        SolrCollectionListResponse response = call("LIST", restClient::listCollections);
        return response.getCollections() == null ? List.of() : List.copyOf(response.getCollections());
    }

    private BackupPoint toBackupPoint(String backupName, SolrListBackupResponse.SolrBackupPoint point) {
        if (point.getStartTime() == null) {
            log.warn("Skip backup point {} of {} without start time", point.getBackupId(), backupName);
            return null;
        }
        try {
            return new BackupPoint(point.getBackupId(), Instant.parse(point.getStartTime()));
        } catch (DateTimeParseException e) {
            log.warn("Skip backup point {} of {} with unreadable start time '{}'", point.getBackupId(), backupName, point.getStartTime());
            return null;
        }
    }

    private <T extends SolrResponse> T call(String operation, Supplier<T> request) {
        T response;
        try {
            response = request.get();
        } catch (SolrApiException e) {
            throw new SolrApiException(operation, e.getHttpStatus(), e.getDetails(), e);
        } catch (WebApplicationException e) {
            throw new SolrApiException(operation, e.getResponse().getStatus(), e.getMessage(), e);
        } catch (ProcessingException e) {
            throw new SolrApiException(operation, "SolrCloud " + solrCloud + " is unreachable: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new SolrApiException(operation, "empty response from SolrCloud " + solrCloud);
        }
        if (response.isFailed()) {
            throw new SolrApiException(operation, response.describeFailure());
        }
        return response;
    }
}
