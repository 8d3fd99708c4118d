package org.qubership.cloud.solrbackup.dto.solr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolrRequestStatusResponse extends SolrResponse {
    private RequestStatus status;
    private BackupResult response;

    /**
     * A reported state wins over error fields, which Solr also fills for failed async requests.
     */
    @Override
    public boolean isFailed() {
        if (status != null && status.getState() != null) {
            return false;
        }
        return super.isFailed();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RequestStatus {
        /**
         * One of submitted, running, completed, failed, notfound.
         */
        private String state;
        private String msg;
    }

    /**
     * Result of a completed incremental backup.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BackupResult {
        private String collection;
        private Integer backupId;
        private String startTime;
    }
}
