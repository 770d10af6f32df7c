package com.domogeek.calendarservice.model;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Time range queried on the remote calendar, in UTC instants.
 */
public record EventWindow(Instant start, Instant end) {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    public EventWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
    }

    /**
     * Local midnight to local 23:59:59 of {@code day}. Uses local wall-clock
     * bounds so DST transition days are covered entirely.
     */
    public static EventWindow forDay(CivilDate day) {
        Instant start = day.startOfDay().toInstant();
        Instant end = day.date().atTime(END_OF_DAY).atZone(day.zone()).toInstant();
        return new EventWindow(start, end);
    }
}
