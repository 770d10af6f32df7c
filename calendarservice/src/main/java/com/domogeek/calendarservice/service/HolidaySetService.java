package com.domogeek.calendarservice.service;

import com.domogeek.calendarservice.model.CivilDate;
import com.domogeek.calendarservice.model.Holiday;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * French public holidays of a year: eight fixed dates plus Easter Monday and
 * Ascension.
 * <p>
 * Nothing is cached; the set is rebuilt on every call and never mutated.
 */
@Service
public class HolidaySetService {

    /** Ascension Thursday, counted from Easter Sunday. */
    static final int ASCENSION_OFFSET = 39;
    static final int EASTER_MONDAY_OFFSET = 1;

    private final EasterCalculator easterCalculator;
    private final ZoneId zone;

    public HolidaySetService(EasterCalculator easterCalculator, ZoneId calendarZone) {
        this.easterCalculator = easterCalculator;
        this.zone = calendarZone;
    }

    /**
     * The 10 holidays of {@code year}. Ascension can fall on
     * May 1 or May 8 (Easter on March 23 or 30), so two entries may share a date.
     */
    public List<CivilDate> holidaysFor(int year) {
        return namedHolidaysFor(year).stream()
                .map(Holiday::date)
                .toList();
    }

    /**
     * Same dates as {@link #holidaysFor(int)}, deduplicated, as an unmodifiable set.
     */
    public Set<CivilDate> holidaySetFor(int year) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(holidaysFor(year)));
    }

    /**
     * Holidays of {@code year} with their French names.
     */
    public List<Holiday> namedHolidaysFor(int year) {
        CivilDate easter = easterCalculator.computeEaster(year);

        return List.of(
                new Holiday(fixed(year, Month.JANUARY, 1), "Jour de l'an"),
                new Holiday(easter.plusDays(EASTER_MONDAY_OFFSET), "Lundi de Pâques"),
                new Holiday(fixed(year, Month.MAY, 1), "Fête du Travail"),
                new Holiday(fixed(year, Month.MAY, 8), "Victoire 1945"),
                new Holiday(easter.plusDays(ASCENSION_OFFSET), "Ascension"),
                new Holiday(fixed(year, Month.JULY, 14), "Fête nationale"),
                new Holiday(fixed(year, Month.AUGUST, 15), "Assomption"),
                new Holiday(fixed(year, Month.NOVEMBER, 1), "Toussaint"),
                new Holiday(fixed(year, Month.NOVEMBER, 11), "Armistice 1918"),
                new Holiday(fixed(year, Month.DECEMBER, 25), "Noël"));
    }

    public boolean contains(CivilDate date) {
        CivilDate day = date.normalizedTo(zone);
        return holidaySetFor(day.year()).contains(day);
    }

    public boolean contains(LocalDate date) {
        return contains(CivilDate.of(date, zone));
    }

    public boolean contains(ZonedDateTime dateTime) {
        return contains(CivilDate.of(dateTime, zone));
    }

    public boolean contains(Instant instant) {
        return contains(CivilDate.of(instant, zone));
    }

    /**
     * French name of the holiday falling on {@code date}, if any.
     */
    public Optional<String> holidayName(CivilDate date) {
        CivilDate day = date.normalizedTo(zone);
        String names = namedHolidaysFor(day.year()).stream()
                .filter(holiday -> holiday.date().equals(day))
                .map(Holiday::name)
                .collect(Collectors.joining(" / "));
        return names.isEmpty() ? Optional.empty() : Optional.of(names);
    }

    public ZoneId zone() {
        return zone;
    }

    private CivilDate fixed(int year, Month month, int dayOfMonth) {
        return CivilDate.of(LocalDate.of(year, month, dayOfMonth), zone);
    }
}
