package org.qubership.cloud.solrbackup.schedule;

import org.qubership.cloud.solrbackup.exceptions.InvalidScheduleException;
import org.quartz.CronExpression;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the schedule grammars of a backup recurrence:
 * <ul>
 *     <li>five field cron {@code min hour dom month dow}, optionally prefixed with {@code CRON_TZ=<zone>} or {@code TZ=<zone>}</li>
 *     <li>predefined schedules: {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly}, {@code @daily}, {@code @midnight}, {@code @hourly}</li>
 *     <li>intervals: {@code @every <duration>}, e.g. {@code @every 10h30m}</li>
 * </ul>
 * Cron expressions are evaluated in UTC unless a zone is given. When both day-of-month and day-of-week are
 * restricted, a day matching either of them fires. Expressions that never fire are rejected.
 */
public final class BackupScheduleParser {
    private static final String EVERY_PREFIX = "@every ";
    private static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private static final Map<String, String> PREDEFINED = Map.of(
            "@yearly", "0 0 0 1 1 ?",
            "@annually", "0 0 0 1 1 ?",
            "@monthly", "0 0 0 1 * ?",
            "@weekly", "0 0 0 ? * SUN",
            "@daily", "0 0 0 * * ?",
            "@midnight", "0 0 0 * * ?",
            "@hourly", "0 0 * * * ?"
    );

    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|μs|ms|s|m|h)");
    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "μs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L
    );
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern RANGE_TO_SEVEN = Pattern.compile("(\\d+)-7");

    private BackupScheduleParser() {
    }

    public static BackupSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "schedule is empty");
        }
        String schedule = expression.trim();
        ZoneId zone = DEFAULT_ZONE;
        if (schedule.startsWith("CRON_TZ=") || schedule.startsWith("TZ=")) {
            int space = schedule.indexOf(' ');
            if (space < 0) {
                throw new InvalidScheduleException(expression, "missing schedule after time zone");
            }
            String zoneId = schedule.substring(schedule.indexOf('=') + 1, space);
            try {
                zone = ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                throw new InvalidScheduleException(expression, "unknown time zone " + zoneId, e);
            }
            schedule = schedule.substring(space + 1).trim();
        }

        if (schedule.startsWith(EVERY_PREFIX)) {
            return new IntervalBackupSchedule(expression, parseDuration(expression, schedule.substring(EVERY_PREFIX.length()).trim()));
        }
        if (schedule.startsWith("@")) {
            String quartz = PREDEFINED.get(schedule);
            if (quartz == null) {
                throw new InvalidScheduleException(expression, "unrecognized descriptor " + schedule);
            }
            return cron(expression, List.of(quartz), zone);
        }
        return cron(expression, toQuartz(expression, schedule), zone);
    }

    static Duration parseDuration(String expression, String value) {
        if (value.isEmpty()) {
            throw new InvalidScheduleException(expression, "missing interval duration");
        }
        if ("0".equals(value)) {
            return Duration.ZERO;
        }
        Matcher matcher = DURATION_PART.matcher(value);
        int position = 0;
        BigDecimal nanos = BigDecimal.ZERO;
        while (position < value.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new InvalidScheduleException(expression, "invalid duration " + value);
            }
            BigDecimal amount = new BigDecimal(matcher.group(1).endsWith(".") ? matcher.group(1) + "0" : matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)))));
            position = matcher.end();
        }
        try {
            return Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new InvalidScheduleException(expression, "duration " + value + " is too long", e);
        }
    }

    private static List<String> toQuartz(String expression, String schedule) {
        String[] fields = schedule.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException(expression, "expected 5 fields but found " + fields.length);
        }
        String minutes = fields[0];
        String hours = fields[1];
        String dayOfMonth = "?".equals(fields[2]) ? "*" : fields[2];
        String month = fields[3].toUpperCase(Locale.ROOT);
        String dayOfWeek = "?".equals(fields[4]) ? "*" : toQuartzDayOfWeek(fields[4].toUpperCase(Locale.ROOT));

        if ("*".equals(dayOfWeek)) {
            return List.of(String.join(" ", "0", minutes, hours, dayOfMonth, month, "?"));
        }
        if ("*".equals(dayOfMonth)) {
            return List.of(String.join(" ", "0", minutes, hours, "?", month, dayOfWeek));
        }
        // Quartz cannot restrict both days at once, cron fires when either matches
        return List.of(
                String.join(" ", "0", minutes, hours, dayOfMonth, month, "?"),
                String.join(" ", "0", minutes, hours, "?", month, dayOfWeek));
    }

    /**
     * Cron numbers days of week 0-7 with Sunday as 0 and 7, Quartz uses 1-7 with Sunday as 1. Step values are kept.
     * A range ending at 7 keeps Saturday as its Quartz upper bound and adds Sunday when the range reaches it.
     */
    private static String toQuartzDayOfWeek(String field) {
        List<String> parts = new ArrayList<>();
        for (String part : field.split(",")) {
            int slash = part.indexOf('/');
            String range = slash < 0 ? part : part.substring(0, slash);
            String step = slash < 0 ? "" : part.substring(slash);
            Matcher toSeven = RANGE_TO_SEVEN.matcher(range);
            if (toSeven.matches() && Integer.parseInt(toSeven.group(1)) < 7) {
                int from = Integer.parseInt(toSeven.group(1));
                parts.add((from == 6 ? "7" : (from + 1) + "-7") + step);
                int stepSize = step.isEmpty() ? 1 : parseStep(step);
                if (from != 0 && (7 - from) % stepSize == 0) {
                    parts.add("1");
                }
                continue;
            }
            Matcher matcher = NUMBER.matcher(range);
            StringBuilder converted = new StringBuilder();
            while (matcher.find()) {
                int day = Integer.parseInt(matcher.group());
                matcher.appendReplacement(converted, String.valueOf(day % 7 + 1));
            }
            matcher.appendTail(converted);
            parts.add(converted + step);
        }
        return String.join(",", parts);
    }

    private static int parseStep(String step) {
        try {
            return Math.max(1, Integer.parseInt(step.substring(1)));
        } catch (NumberFormatException e) {
            // left for Quartz to reject
            return 1;
        }
    }

    private static CronBackupSchedule cron(String expression, List<String> quartzExpressions, ZoneId zone) {
        List<CronExpression> cronExpressions = new ArrayList<>();
        for (String quartz : quartzExpressions) {
            try {
                CronExpression cronExpression = new CronExpression(quartz);
                cronExpression.setTimeZone(TimeZone.getTimeZone(zone));
                cronExpressions.add(cronExpression);
            } catch (ParseException e) {
                throw new InvalidScheduleException(expression, e.getMessage(), e);
            }
        }
        CronBackupSchedule schedule = new CronBackupSchedule(expression, cronExpressions);
        // throws when the expression has no trigger time at all, e.g. February 30
        schedule.next(Instant.now());
        return schedule;
    }
}
