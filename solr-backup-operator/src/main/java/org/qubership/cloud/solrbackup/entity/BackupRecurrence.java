package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recurrence of the backup")
public class BackupRecurrence {

    @NotBlank
    @Schema(description = "Standard CRON (optionally prefixed with CRON_TZ=<zone>), a predefined schedule such as @daily, or an interval such as @every 10h30m",
            required = true, example = "CRON_TZ=Asia/Seoul 0 6 * * ?")
    private String schedule;

    @Min(1)
    @Schema(description = "Number of backup points kept at any given time", example = "5")
    private Integer maxSaved;

    @Schema(description = "Disables new recurring backups, a backup in progress is not affected", example = "false")
    private boolean disabled;

    @JsonIgnore
    public boolean isEnabled() {
        return !disabled;
    }
}
