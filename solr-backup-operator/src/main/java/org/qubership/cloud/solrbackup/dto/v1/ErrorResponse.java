package org.qubership.cloud.solrbackup.dto.v1;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Error returned by the Solr backup API")
public class ErrorResponse {
    @Schema(example = "SOLR-BACKUP-4004")
    private String code;
    @Schema(example = "Solr backup not found")
    private String reason;
    private String message;
    private int status;
}
