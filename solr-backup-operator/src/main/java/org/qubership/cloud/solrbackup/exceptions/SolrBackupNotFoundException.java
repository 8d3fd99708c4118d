package org.qubership.cloud.solrbackup.exceptions;

public class SolrBackupNotFoundException extends SolrBackupException {
    public SolrBackupNotFoundException(String backupName) {
        super(SolrBackupErrorCodes.SOLR_BACKUP_4004, SolrBackupErrorCodes.SOLR_BACKUP_4004.getDetail(backupName));
    }
}
