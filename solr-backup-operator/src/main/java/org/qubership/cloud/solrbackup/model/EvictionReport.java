package org.qubership.cloud.solrbackup.model;

import java.util.List;

public record EvictionReport(int deletedBackupPoints, List<String> failures) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
