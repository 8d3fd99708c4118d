package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndividualSolrBackupStatus {
    private Long sequence;
    private String solrVersion;
    private Instant startTimestamp;
    @Builder.Default
    private List<CollectionBackupStatus> collectionBackupStatuses = new ArrayList<>();
    private Instant finishTimestamp;
    private Boolean successful;
    private boolean finished;
}
