package org.qubership.cloud.solrbackup;

public final class SolrBackupApiPath {
    public static final String SOLR_BACKUPS_PATH_V1 = "/api/v1/solr-backups";

    private SolrBackupApiPath() {
    }
}
