package org.qubership.cloud.solrbackup.exceptions;

public class InconsistentBackupStateException extends SolrBackupException {
    public InconsistentBackupStateException(String backupName, String reason) {
        super(SolrBackupErrorCodes.SOLR_BACKUP_4009, SolrBackupErrorCodes.SOLR_BACKUP_4009.getDetail(backupName, reason));
    }
}
