package io.backup4j.utils;

import org.quartz.CronExpression;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * A compiled five-field cron.
 *
 * <p>Usually backed by a single Quartz expression. When both day-of-month and day-of-week are
 * restricted, a day matches if either field matches, so the schedule holds one expression per
 * day field and fires on whichever comes first.
 */
public final class CronSchedule {
    private final String expression;
    private final List<CronExpression> alternatives;

    CronSchedule(String expression, List<CronExpression> alternatives) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("alternatives must not be empty");
        }
        this.alternatives = List.copyOf(alternatives);
    }

    /**
     * The five-field source expression.
     */
    public String expression() {
        return expression;
    }

    /**
     * Next fire time strictly after {@code from}, or {@code null} when it never fires again.
     */
    public Instant nextRunAfter(Instant from) {
        Date after = Date.from(from);
        Instant earliest = null;
        for (CronExpression exp : alternatives) {
            Date next = exp.getNextValidTimeAfter(after);
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    @Override
    public String toString() {
        return expression;
    }
}
