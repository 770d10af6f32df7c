package com.domogeek.calendarservice.controller;

/*
 * 10/15/2026 - 10:20 AM
 * @author domogeek
 */

import com.domogeek.calendarservice.dto.CalendarDayDto;
import com.domogeek.calendarservice.dto.HolidayDto;
import com.domogeek.calendarservice.metrics.CalendarMetrics;
import com.domogeek.calendarservice.model.CivilDate;
import com.domogeek.calendarservice.service.EasterCalculator;
import com.domogeek.calendarservice.service.HolidayOracle;
import com.domogeek.common.dto.ApiResponse;
import com.domogeek.common.exception.InvalidDateException;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * REST controller for the working day calendar.
 */
@Slf4j
@RestController
@RequestMapping("/calendar")
@RequiredArgsConstructor
@Tag(name = "Calendar", description = "French public holidays and working days")
public class CalendarController {

    static final int MAX_YEAR = 9999;

    private final HolidayOracle holidayOracle;
    private final CalendarMetrics metrics;

    @GetMapping
    @Operation(summary = "Calendar status of today, or of the given date")
    public ResponseEntity<CalendarDayDto> day(
            @Parameter(description = "Day to evaluate (yyyy-MM-dd), today when omitted")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Timer.Sample sample = metrics.startTimer();
        int status = HttpStatus.INTERNAL_SERVER_ERROR.value();

        try {
            ZonedDateTime moment;
            if (date == null) {
                moment = holidayOracle.now();
            } else {
                checkYear(date.getYear(), date.toString());
                moment = date.atStartOfDay(holidayOracle.zone());
            }
            CivilDate day = CivilDate.of(moment, holidayOracle.zone());

            boolean holiday = holidayOracle.isHoliday(day);
            boolean weekday = holidayOracle.isWeekday(day);
            CalendarDayDto body = CalendarDayDto.builder()
                    .day(moment.toOffsetDateTime())
                    .workingDay(weekday && !holiday)
                    .ferie(holiday)
                    .holiday(holiday)
                    .weekday(weekday)
                    .build();

            log.debug("Calendar status for {}: {}", day, body);
            status = HttpStatus.OK.value();
            return ResponseEntity.ok(body);

        } catch (InvalidDateException e) {
            status = HttpStatus.BAD_REQUEST.value();
            throw e;
        } finally {
            metrics.recordRequest(sample, "calendar", "GET", status);
        }
    }

    @GetMapping("/holidays/{year}")
    @Operation(summary = "Fixed public holidays of a year")
    public ResponseEntity<ApiResponse<List<HolidayDto>>> holidays(@PathVariable int year) {
        Timer.Sample sample = metrics.startTimer();
        int status = HttpStatus.INTERNAL_SERVER_ERROR.value();

        try {
            checkYear(year, String.valueOf(year));

            List<HolidayDto> holidays = holidayOracle.holidaySet().namedHolidaysFor(year).stream()
                    .map(holiday -> HolidayDto.builder()
                            .date(holiday.date().date())
                            .name(holiday.name())
                            .dayOfWeek(holiday.date().dayOfWeek())
                            .build())
                    .toList();

            status = HttpStatus.OK.value();
            return ResponseEntity.ok(ApiResponse.success(holidays));

        } catch (InvalidDateException e) {
            status = HttpStatus.BAD_REQUEST.value();
            throw e;
        } finally {
            metrics.recordRequest(sample, "holidays", "GET", status);
        }
    }

    private static void checkYear(int year, String value) {
        if (year < EasterCalculator.FIRST_GREGORIAN_YEAR || year > MAX_YEAR) {
            throw new InvalidDateException(value, "year must be between "
                    + EasterCalculator.FIRST_GREGORIAN_YEAR + " and " + MAX_YEAR + ": " + value);
        }
    }
}
