package com.domogeek.calendarservice.service;

/*
 * 10/12/2026 - 2:31 PM
 * @author domogeek
 */

import com.domogeek.calendarservice.caldav.CalendarOverrideClient;
import com.domogeek.calendarservice.model.CalendarEvent;
import com.domogeek.calendarservice.model.CivilDate;
import com.domogeek.calendarservice.model.EventWindow;
import com.domogeek.common.exception.CalendarLookupException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Answers holiday, weekday and working-day questions for a date.
 * <p>
 * A day is a holiday when it is in the fixed French list or, if a remote
 * calendar is configured, when that calendar has an event on the day whose
 * summary contains the configured pattern. The remote calendar can only add
 * holidays. Any failure of the remote lookup is logged and the fixed list
 * alone decides, so {@code isHoliday} answers for every date.
 * <p>
 * Remote results are never cached: each {@code isHoliday} call on an
 * override-enabled oracle queries the remote calendar once.
 */
@Slf4j
public class HolidayOracle {

    private final HolidaySetService holidaySet;
    private final ZoneId zone;
    private final Clock clock;
    private final CalendarOverrideClient overrideClient;
    private final String calendarPath;
    private final String summaryPattern;

    /**
     * Oracle backed by the fixed holiday list only.
     */
    public HolidayOracle(HolidaySetService holidaySet, Clock clock) {
        this(holidaySet, clock, null, null, null);
    }

    /**
     * @param overrideClient remote calendar, or {@code null} to disable the override path
     * @param calendarPath   calendar collection queried on the remote server
     * @param summaryPattern substring marking an event as a holiday
     */
    public HolidayOracle(HolidaySetService holidaySet, Clock clock,
                         CalendarOverrideClient overrideClient, String calendarPath, String summaryPattern) {
        this.holidaySet = Objects.requireNonNull(holidaySet, "holidaySet");
        this.zone = holidaySet.zone();
        this.clock = clock.withZone(zone);
        this.overrideClient = overrideClient;
        this.calendarPath = calendarPath;
        this.summaryPattern = summaryPattern;
        if (overrideClient != null && (summaryPattern == null || summaryPattern.isEmpty())) {
            throw new IllegalArgumentException("summary pattern is required when a remote calendar is configured");
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // HOLIDAYS
    // ═══════════════════════════════════════════════════════════════════════════

    public boolean isHoliday(CivilDate date) {
        CivilDate day = date.normalizedTo(zone);
        if (holidaySet.contains(day)) {
            return true;
        }
        try {
            return isHolidayFromOverride(day);
        } catch (CalendarLookupException e) {
            log.error("Unable to check holidays from remote calendar for {}: {}", day, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected failure checking holidays from remote calendar for {}", day, e);
            return false;
        }
    }

    public boolean isHoliday(LocalDate date) {
        return isHoliday(CivilDate.of(date, zone));
    }

    public boolean isHoliday(ZonedDateTime dateTime) {
        return isHoliday(CivilDate.of(dateTime, zone));
    }

    public boolean isHoliday(Instant instant) {
        return isHoliday(CivilDate.of(instant, zone));
    }

    /**
     * Looks {@code date} up on the remote calendar only.
     *
     * @return {@code false} when no remote calendar is configured
     * @throws CalendarLookupException when the remote query fails
     */
    public boolean isHolidayFromOverride(CivilDate date) {
        if (overrideClient == null) {
            return false;
        }
        CivilDate day = date.normalizedTo(zone);
        List<CalendarEvent> events = overrideClient.queryEvents(calendarPath, EventWindow.forDay(day));
        for (CalendarEvent event : events) {
            if (event.summaryContains(summaryPattern)) {
                log.debug("Remote event '{}' marks {} as a holiday", event.summary(), day);
                return true;
            }
        }
        return false;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // WEEKDAYS & WORKING DAYS
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Monday to Friday, holidays not considered.
     */
    public boolean isWeekday(CivilDate date) {
        DayOfWeek day = date.normalizedTo(zone).dayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public boolean isWeekday(LocalDate date) {
        return isWeekday(CivilDate.of(date, zone));
    }

    public boolean isWeekday(ZonedDateTime dateTime) {
        return isWeekday(CivilDate.of(dateTime, zone));
    }

    public boolean isWeekday(Instant instant) {
        return isWeekday(CivilDate.of(instant, zone));
    }

    public boolean isWorkingDay(CivilDate date) {
        return isWeekday(date) && !isHoliday(date);
    }

    public boolean isWorkingDay(LocalDate date) {
        return isWorkingDay(CivilDate.of(date, zone));
    }

    public boolean isWorkingDay(ZonedDateTime dateTime) {
        return isWorkingDay(CivilDate.of(dateTime, zone));
    }

    public boolean isWorkingDay(Instant instant) {
        return isWorkingDay(CivilDate.of(instant, zone));
    }

    public boolean isWorkingDayNow() {
        return isWorkingDay(today());
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ═══════════════════════════════════════════════════════════════════════════

    public CivilDate today() {
        return CivilDate.of(now(), zone);
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    public ZoneId zone() {
        return zone;
    }

    public boolean isOverrideEnabled() {
        return overrideClient != null;
    }

    public HolidaySetService holidaySet() {
        return holidaySet;
    }
}
