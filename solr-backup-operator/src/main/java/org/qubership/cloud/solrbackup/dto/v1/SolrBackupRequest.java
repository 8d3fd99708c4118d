package org.qubership.cloud.solrbackup.dto.v1;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.qubership.cloud.solrbackup.entity.BackupRecurrence;
import org.qubership.cloud.solrbackup.entity.PersistenceSource;

import java.util.ArrayList;
import java.util.List;

import static org.qubership.cloud.solrbackup.Constants.REPOSITORY_NAME_PATTERN;
import static org.qubership.cloud.solrbackup.Constants.RESOURCE_NAME_PATTERN;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Desired state of a Solr backup")
public class SolrBackupRequest {

    @NotBlank
    @Size(max = 63)
    @Pattern(regexp = RESOURCE_NAME_PATTERN)
    @Schema(description = "Name of the SolrCloud to back up", required = true, example = "example")
    private String solrCloud;

    @Size(max = 100)
    @Pattern(regexp = REPOSITORY_NAME_PATTERN)
    @Schema(description = "Backup repository configured in Solr, legacy_local_repository when omitted", example = "gcs-backups")
    private String repositoryName;

    @Builder.Default
    @Schema(description = "Collections to back up, all collections of the cloud when empty")
    private List<@NotBlank String> collections = new ArrayList<>();

    @Schema(description = "Location inside the backup repository", example = "/backups/recurring")
    private String location;

    @Valid
    private BackupRecurrence recurrence;

    @Deprecated
    @Schema(description = "Deprecated, accepted and ignored", deprecated = true)
    private PersistenceSource persistence;
}
