package org.qubership.cloud.solrbackup.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollectionBackupStatus {
    private String collection;
    private String backupName;
    private String asyncRequestId;
    private boolean inProgress;
    private Instant startTimestamp;
    private Instant finishTimestamp;
    private boolean finished;
    private Boolean successful;
    private String errorMessage;
    private Integer backupId;
}
