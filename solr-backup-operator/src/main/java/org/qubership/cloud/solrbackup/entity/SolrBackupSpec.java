package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

import static org.qubership.cloud.solrbackup.Constants.DEFAULT_MAX_SAVED;
import static org.qubership.cloud.solrbackup.Constants.LEGACY_LOCAL_REPOSITORY;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolrBackupSpec {

    @Schema(description = "Name of the SolrCloud to back up", required = true, example = "example")
    private String solrCloud;

    @Schema(description = "Backup repository configured in Solr", example = "gcs-backups")
    private String repositoryName;

    @Builder.Default
    @Schema(description = "Collections to back up, all collections of the cloud when empty")
    private List<String> collections = new ArrayList<>();

    @Schema(description = "Location inside the backup repository", example = "/backups/recurring")
    private String location;

    private BackupRecurrence recurrence;

    /**
     * @deprecated removed feature, cleared by {@link #withDefaults()}
     */
    @Deprecated
    private PersistenceSource persistence;

    /**
     * Normalizes the spec in place.
     *
     * @return true if anything was changed
     */
    public boolean withDefaults() {
        boolean changed = false;
        if (persistence != null) {
            persistence = null;
            changed = true;
        }
        if (repositoryName == null || repositoryName.isBlank()) {
            repositoryName = LEGACY_LOCAL_REPOSITORY;
            changed = true;
        }
        if (collections == null) {
            collections = new ArrayList<>();
            changed = true;
        }
        if (recurrence != null && recurrence.getMaxSaved() == null) {
            recurrence.setMaxSaved(DEFAULT_MAX_SAVED);
            changed = true;
        }
        return changed;
    }

    public int maxSaved() {
        if (recurrence == null || recurrence.getMaxSaved() == null) {
            return DEFAULT_MAX_SAVED;
        }
        return recurrence.getMaxSaved();
    }
}
