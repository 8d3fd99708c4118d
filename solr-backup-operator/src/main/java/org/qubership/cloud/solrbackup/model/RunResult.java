package org.qubership.cloud.solrbackup.model;

import java.time.Instant;

public record RunResult(Instant finishTime, boolean successful) {
}
