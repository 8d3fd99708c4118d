package org.qubership.cloud.solrbackup.exceptions;

import lombok.Getter;

/**
 * Failure of a call to the Solr admin API: transport error, non-2xx response or a Solr error body.
 */
@Getter
public class SolrApiException extends SolrBackupException {
    private final String operation;
    private final Integer httpStatus;
    private final String details;

    public SolrApiException(String operation, String details) {
        this(operation, null, details, null);
    }

    public SolrApiException(String operation, String details, Throwable cause) {
        this(operation, null, details, cause);
    }

    public SolrApiException(String operation, Integer httpStatus, String details, Throwable cause) {
        super(SolrBackupErrorCodes.SOLR_BACKUP_5002, SolrBackupErrorCodes.SOLR_BACKUP_5002.getDetail(operation, details), cause);
        this.operation = operation;
        this.httpStatus = httpStatus;
        this.details = details;
    }
}
