package org.qubership.cloud.solrbackup.dto.v1;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.qubership.cloud.solrbackup.entity.SolrBackupSpec;
import org.qubership.cloud.solrbackup.entity.SolrBackupStatus;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Solr backup with its desired and observed state")
public class SolrBackupResponse {
    private String name;
    private Instant creationTimestamp;
    private SolrBackupSpec spec;
    private SolrBackupStatus status;
}
