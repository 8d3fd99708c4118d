package org.qubership.cloud.solrbackup.dto.solr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SolrListBackupResponse extends SolrResponse {
    private String collection;
    private List<SolrBackupPoint> backups = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SolrBackupPoint {
        private int backupId;
        private String startTime;
        private String indexVersion;
        private Double indexSizeMB;
    }
}
