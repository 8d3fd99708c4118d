package org.qubership.cloud.solrbackup.exceptions;

import lombok.Getter;

@Getter
public enum SolrBackupErrorCodes {
    SOLR_BACKUP_4001("SOLR-BACKUP-4001", "Request validation error", "Validation error for %s: %s"),
    SOLR_BACKUP_4002("SOLR-BACKUP-4002", "Invalid backup schedule", "Schedule '%s' is invalid: %s"),
    SOLR_BACKUP_4004("SOLR-BACKUP-4004", "Solr backup not found", "Solr backup with name '%s' is not found"),
    SOLR_BACKUP_4009("SOLR-BACKUP-4009", "Inconsistent backup state", "Backup status of '%s' is inconsistent: %s"),
    SOLR_BACKUP_5002("SOLR-BACKUP-5002", "Solr API call failed", "Solr %s call failed: %s"),
    SOLR_BACKUP_5000("SOLR-BACKUP-5000", "Unexpected backup error", "%s");

    private final String code;
    private final String title;
    private final String detail;

    SolrBackupErrorCodes(String code, String title, String detail) {
        this.code = code;
        this.title = title;
        this.detail = detail;
    }

    public String getDetail(Object... args) {
        return String.format(detail, args);
    }
}
