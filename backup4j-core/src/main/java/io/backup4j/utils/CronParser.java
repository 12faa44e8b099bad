package io.backup4j.utils;

import io.backup4j.core.exception.CronValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.TimeZone;

/**
 * Parses the five-field schedule cron ({@code minute hour day-of-month month day-of-week}) into
 * a {@link CronSchedule} backed by Quartz {@link CronExpression}s.
 * <p>
 * Quartz needs a seconds field and exactly one of day-of-month / day-of-week set to {@code ?};
 * {@link #normalizeCron(String)} bridges the two dialects. When both day fields are restricted
 * it yields two Quartz expressions, one per day field. Day-of-week numbers follow the Unix
 * convention (0 or 7 = Sunday) and are shifted to Quartz's 1-7 range.
 */
public final class CronParser {
    public static final int FIELD_COUNT = 5;

    private CronParser() {
    }

    /**
     * Validate and compile a five-field expression.
     *
     * @param cron     five whitespace-separated fields
     * @param timezone IANA zone the expression is evaluated in; system default when null
     * @throws CronValidationException when the field count is not five or Quartz rejects a field
     */
    public static CronSchedule parse(String cron, ZoneId timezone) {
        TimeZone zone = TimeZone.getTimeZone(timezone != null ? timezone : ZoneId.systemDefault());
        List<CronExpression> compiled = new ArrayList<>(2);
        for (String quartz : normalizeCron(cron)) {
            CronExpression exp;
            try {
                exp = new CronExpression(quartz);
            } catch (ParseException e) {
                throw new CronValidationException(cron, e.getMessage(), e);
            }
            exp.setTimeZone(zone);
            compiled.add(exp);
        }
        return new CronSchedule(cron.trim(), compiled);
    }

    /**
     * Throws {@link CronValidationException} unless {@code cron} is a valid five-field cron.
     */
    public static void validate(String cron) {
        parse(cron, null);
    }

    /**
     * Next fire time strictly after {@code from}, or {@code null} when the expression never
     * fires again.
     */
    public static Instant nextRunAt(CronSchedule schedule, Instant from) {
        return schedule.nextRunAfter(from);
    }

    public static Instant nextRunAt(String cron, ZoneId timezone, Instant from) {
        return nextRunAt(parse(cron, timezone), from);
    }

    /**
     * Convert a five-field cron into six-field Quartz crons by prepending seconds "0".
     *
     * @return one expression, or two when both day fields are restricted
     */
    public static List<String> normalizeCron(String cron) {
        if (cron == null) {
            throw new CronValidationException(null, "expression must not be null");
        }
        String s = cron.trim();
        if (s.isEmpty()) {
            throw new CronValidationException(cron, "expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length != FIELD_COUNT) {
            throw new CronValidationException(cron,
                    "expected " + FIELD_COUNT + " fields (minute hour day-of-month month day-of-week), got " + parts.length);
        }

        String min = parts[0];
        String hour = parts[1];
        String dom = parts[2];
        String month = parts[3];
        String dow = toQuartzDayOfWeek(parts[4]);

        if (isUnrestricted(dow)) {
            return List.of(String.join(" ", "0", min, hour, isUnrestricted(dom) ? "*" : dom, month, "?"));
        }
        if (isUnrestricted(dom)) {
            return List.of(String.join(" ", "0", min, hour, "?", month, dow));
        }
        return List.of(
                String.join(" ", "0", min, hour, dom, month, "?"),
                String.join(" ", "0", min, hour, "?", month, dow)
        );
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    // Unix cron numbers Sunday as 0 (or 7); Quartz uses 1 = Sunday .. 7 = Saturday.
    private static String toQuartzDayOfWeek(String field) {
        StringBuilder out = new StringBuilder(field.length());
        int i = 0;
        while (i < field.length()) {
            char c = field.charAt(i);
            if (Character.isDigit(c) && (i == 0 || "-,".indexOf(field.charAt(i - 1)) >= 0)) {
                int j = i;
                while (j < field.length() && Character.isDigit(field.charAt(j))) {
                    j++;
                }
                int n = Integer.parseInt(field.substring(i, j));
                out.append(n == 7 ? 1 : n + 1);
                i = j;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
