package com.restopos.kitchen.entities.kitchen;

import com.google.common.base.MoreObjects;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * The calendar day the kitchen is currently operating in, as a half open interval [start, end) in the clock's zone.
 * <p>
 * Capacity counting, backlog selection and late detection only look at orders created within the current operating
 * day, so orders left over from previous days (for example after a crash) never consume today's capacity.
 */
@ThreadSafe public class OperatingDay {

    private final LocalDate date;
    private final Instant start;
    private final Instant end;

    private OperatingDay(LocalDate date, ZoneId zone) {
        this.date = date;
        this.start = date.atStartOfDay(zone).toInstant();
        this.end = date.plusDays(1).atStartOfDay(zone).toInstant();
    }

    public static OperatingDay of(Clock clock) {
        return new OperatingDay(LocalDate.now(clock), clock.getZone());
    }

    public static OperatingDay of(LocalDate date, ZoneId zone) {
        return new OperatingDay(date, zone);
    }

    public LocalDate getDate() {
        return date;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override public boolean equals(Object other) {
        if (other == this)
            return true;
        if (!(other instanceof OperatingDay))
            return false;
        OperatingDay that = (OperatingDay) other;
        return Objects.equals(start, that.start) && Objects.equals(end, that.end);
    }

    @Override public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override public String toString() {
        return MoreObjects.toStringHelper(OperatingDay.class).add("date", date).add("start", start).add("end", end).toString();
    }
}
