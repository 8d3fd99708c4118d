package org.qubership.cloud.solrbackup.model;

import org.qubership.cloud.solrbackup.service.SolrClusterApi;

/**
 * Everything a run needs to talk to its cluster: the request identity, where backups go, and the API itself.
 */
public record BackupRunContext(String backupName, String repository, String location, SolrClusterApi solrClusterApi) {
}
