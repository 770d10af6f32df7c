package com.domogeek.calendarservice.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A calendar day in a reference time zone, always taken at local midnight.
 * <p>
 * Two instances are equal when they name the same day in the same zone;
 * time-of-day never takes part in the comparison. Every factory converts its
 * input into the reference zone before dropping the time, so
 * {@code 2019-12-31T23:30Z} is {@code 2020-01-01} in {@code Europe/Paris}.
 *
 * @param date the local date in {@code zone}
 * @param zone the reference zone
 */
public record CivilDate(LocalDate date, ZoneId zone) implements Comparable<CivilDate> {

    public CivilDate {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(zone, "zone");
    }

    public static CivilDate of(int year, int month, int day, ZoneId zone) {
        return new CivilDate(LocalDate.of(year, month, day), zone);
    }

    public static CivilDate of(LocalDate date, ZoneId zone) {
        return new CivilDate(date, zone);
    }

    public static CivilDate of(ZonedDateTime dateTime, ZoneId zone) {
        return new CivilDate(dateTime.withZoneSameInstant(zone).toLocalDate(), zone);
    }

    public static CivilDate of(OffsetDateTime dateTime, ZoneId zone) {
        return of(dateTime.atZoneSameInstant(zone), zone);
    }

    public static CivilDate of(Instant instant, ZoneId zone) {
        return new CivilDate(LocalDate.ofInstant(instant, zone), zone);
    }

    /**
     * The day on which this day's midnight falls in {@code other}. Identity when
     * the zones match.
     */
    public CivilDate normalizedTo(ZoneId other) {
        return zone.equals(other) ? this : of(startOfDay(), other);
    }

    public ZonedDateTime startOfDay() {
        return date.atStartOfDay(zone);
    }

    public CivilDate plusDays(long days) {
        return new CivilDate(date.plusDays(days), zone);
    }

    public int year() {
        return date.getYear();
    }

    public DayOfWeek dayOfWeek() {
        return date.getDayOfWeek();
    }

    @Override
    public int compareTo(CivilDate other) {
        return date.compareTo(other.date);
    }

    @Override
    public String toString() {
        return date.toString();
    }
}
