package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Observed state of a backup request. The fields of the most recent run are inlined at the top level.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolrBackupStatus {

    @JsonUnwrapped
    @Builder.Default
    private IndividualSolrBackupStatus current = new IndividualSolrBackupStatus();

    @Schema(description = "The scheduled time for the next backup to occur")
    private Instant nextScheduledTime;

    @Builder.Default
    @Schema(description = "Completed backups, oldest first")
    private List<IndividualSolrBackupStatus> history = new ArrayList<>();

    @Schema(description = "Sequence number of the most recently started backup")
    private long lastSequence;

    @Schema(description = "Error of the last reconciliation, if any")
    private String errorMessage;
}
