package org.qubership.cloud.solrbackup.exceptions;

import lombok.Getter;

@Getter
public class RequestValidationException extends SolrBackupException {
    private final String field;

    public RequestValidationException(String field, String reason) {
        super(SolrBackupErrorCodes.SOLR_BACKUP_4001, SolrBackupErrorCodes.SOLR_BACKUP_4001.getDetail(field, reason));
        this.field = field;
    }
}
