package com.domogeek.calendarservice.service;

/*
 * 10/12/2026 - 8:55 AM
 * @author domogeek
 */

import com.domogeek.calendarservice.model.CivilDate;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.Month;
import java.time.ZoneId;

/**
 * Computes Easter Sunday with the anonymous Gregorian algorithm
 * (Meeus/Jones/Butcher).
 * <p>
 * Any year yields a date, but only Gregorian years (1583 on) give the
 * ecclesiastical Easter.
 */
@Service
public class EasterCalculator {

    /** First full year of the Gregorian calendar. */
    public static final int FIRST_GREGORIAN_YEAR = 1583;

    private final ZoneId zone;

    public EasterCalculator(ZoneId calendarZone) {
        this.zone = calendarZone;
    }

    /**
     * Easter Sunday of {@code year}, at midnight in the calendar zone.
     */
    public CivilDate computeEaster(int year) {
        int dayOfMarch = easterDayOfMarch(year);

        // March 31 plus a signed offset: April dates fall out of date arithmetic
        LocalDate anchor = LocalDate.of(year, Month.MARCH, 31);
        return CivilDate.of(anchor.plusDays(dayOfMarch - 31L), zone);
    }

    /**
     * Easter Sunday counted in days from March 1st (22 = March 22, 32 = April 1).
     */
    static int easterDayOfMarch(int year) {
        int a = year % 19;                       // position in the Metonic cycle
        int b = year / 100;                      // century
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;                 // lunar correction
        int h = (19 * a + b - d - g + 15) % 30;  // epact
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7; // days to the following Sunday
        int m = (a + 11 * h + 22 * l) / 451;
        return h + l - 7 * m + 22;
    }
}
