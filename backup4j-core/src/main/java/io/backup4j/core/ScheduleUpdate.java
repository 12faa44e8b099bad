package io.backup4j.core;

import java.time.Instant;

/**
 * Partial change to a schedule. Only non-null fields are applied.
 *
 * <p>This is an API-layer object; the store translates it into an actual database update.
 */
public final class ScheduleUpdate {

    private final String name;
    private final String sourceId;
    private final String destinationId;
    private final Integer keepN;
    private final String cron;
    private final Boolean active;
    private final Instant nextRun;

    private ScheduleUpdate(Builder b) {
        this.name = (b.name == null || b.name.isBlank()) ? null : b.name;
        this.sourceId = b.sourceId;
        this.destinationId = b.destinationId;
        this.keepN = b.keepN;
        this.cron = b.cron;
        this.active = b.active;
        this.nextRun = b.nextRun;
    }

    public String name() {
        return name;
    }

    public String sourceId() {
        return sourceId;
    }

    public String destinationId() {
        return destinationId;
    }

    public Integer keepN() {
        return keepN;
    }

    public String cron() {
        return cron;
    }

    public Boolean active() {
        return active;
    }

    public Instant nextRun() {
        return nextRun;
    }

    /**
     * Returns true if applying this update would change nothing.
     */
    public boolean isEmpty() {
        return name == null
                && sourceId == null
                && destinationId == null
                && keepN == null
                && cron == null
                && active == null
                && nextRun == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.name = name;
        b.sourceId = sourceId;
        b.destinationId = destinationId;
        b.keepN = keepN;
        b.cron = cron;
        b.active = active;
        b.nextRun = nextRun;
        return b;
    }

    public static final class Builder {
        private String name;
        private String sourceId;
        private String destinationId;
        private Integer keepN;
        private String cron;
        private Boolean active;
        private Instant nextRun;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder destinationId(String destinationId) {
            this.destinationId = destinationId;
            return this;
        }

        public Builder keepN(int keepN) {
            this.keepN = keepN;
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder nextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public ScheduleUpdate build() {
            return new ScheduleUpdate(this);
        }
    }

    @Override
    public String toString() {
        return "ScheduleUpdate{name=" + name
                + ", sourceId=" + sourceId
                + ", destinationId=" + destinationId
                + ", keepN=" + keepN
                + ", cron=" + cron
                + ", active=" + active
                + ", nextRun=" + nextRun + "}";
    }
}
