package org.qubership.cloud.solrbackup.schedule;

import java.time.Instant;

public interface BackupSchedule {

    /**
     * @return the first trigger time strictly after {@code reference}
     */
    Instant next(Instant reference);

    /**
     * @return the expression this schedule was parsed from
     */
    String expression();
}
