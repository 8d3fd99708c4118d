package org.qubership.cloud.solrbackup.schedule;

import org.qubership.cloud.solrbackup.exceptions.InvalidScheduleException;
import org.quartz.CronExpression;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Calendar schedule evaluated by Quartz {@link CronExpression}s. With several expressions the schedule fires at
 * the earliest of their trigger times.
 */
public class CronBackupSchedule implements BackupSchedule {
    private final String expression;
    private final List<CronExpression> cronExpressions;

    CronBackupSchedule(String expression, List<CronExpression> cronExpressions) {
        this.expression = expression;
        this.cronExpressions = List.copyOf(cronExpressions);
    }

    @Override
    public Instant next(Instant reference) {
        Date from = Date.from(reference);
        Date next = cronExpressions.stream()
                .map(cronExpression -> nextValidTimeAfter(cronExpression, from))
                .filter(Objects::nonNull)
                .min(Date::compareTo)
                .orElseThrow(() -> new InvalidScheduleException(expression, "no trigger time after " + reference));
        return next.toInstant();
    }

    private static Date nextValidTimeAfter(CronExpression cronExpression, Date from) {
        synchronized (cronExpression) {
            return cronExpression.getNextValidTimeAfter(from);
        }
    }

    @Override
    public String expression() {
        return expression;
    }

    String quartzExpression() {
        return cronExpressions.stream().map(CronExpression::getCronExpression).collect(Collectors.joining(" | "));
    }

    @Override
    public String toString() {
        return "CronBackupSchedule{" + expression + " -> " + quartzExpression()
                + " " + cronExpressions.get(0).getTimeZone().getID() + "}";
    }
}
