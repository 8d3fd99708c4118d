package org.qubership.cloud.solrbackup.exceptions;

import lombok.Getter;

@Getter
public class InvalidScheduleException extends SolrBackupException {
    private final String schedule;

    public InvalidScheduleException(String schedule, String reason) {
        super(SolrBackupErrorCodes.SOLR_BACKUP_4002, SolrBackupErrorCodes.SOLR_BACKUP_4002.getDetail(schedule, reason));
        this.schedule = schedule;
    }

    public InvalidScheduleException(String schedule, String reason, Throwable cause) {
        super(SolrBackupErrorCodes.SOLR_BACKUP_4002, SolrBackupErrorCodes.SOLR_BACKUP_4002.getDetail(schedule, reason), cause);
        this.schedule = schedule;
    }
}
