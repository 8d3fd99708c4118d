package org.qubership.cloud.solrbackup.exceptions;

import lombok.Getter;

@Getter
public class SolrBackupException extends RuntimeException {
    private final SolrBackupErrorCodes errorCode;

    public SolrBackupException(SolrBackupErrorCodes errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public SolrBackupException(SolrBackupErrorCodes errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
