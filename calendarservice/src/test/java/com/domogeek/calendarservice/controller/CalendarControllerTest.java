package com.domogeek.calendarservice.controller;

import com.domogeek.calendarservice.metrics.CalendarMetrics;
import com.domogeek.calendarservice.model.CivilDate;
import com.domogeek.calendarservice.service.EasterCalculator;
import com.domogeek.calendarservice.service.HolidayOracle;
import com.domogeek.calendarservice.service.HolidaySetService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CalendarController.class)
class CalendarControllerTest {

    private static final ZoneId PARIS = ZoneId.of("Europe/Paris");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HolidayOracle holidayOracle;

    @MockBean
    private CalendarMetrics metrics;

    @BeforeEach
    void setUp() {
        when(holidayOracle.zone()).thenReturn(PARIS);
    }

    // ==================== DAY STATUS ====================

    @Nested
    @DisplayName("GET /calendar")
    class DayStatus {

        @Test
        void day_Holiday() throws Exception {
            CivilDate newYear = CivilDate.of(2019, 1, 1, PARIS);
            when(holidayOracle.isHoliday(eq(newYear))).thenReturn(true);
            when(holidayOracle.isWeekday(eq(newYear))).thenReturn(true);

            mockMvc.perform(get("/calendar").param("date", "2019-01-01"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.day").value(startsWith("2019-01-01T00:00")))
                    .andExpect(jsonPath("$.working_day").value(false))
                    .andExpect(jsonPath("$.ferie").value(true))
                    .andExpect(jsonPath("$.holiday").value(true))
                    .andExpect(jsonPath("$.weekday").value(true));
        }

        @Test
        void day_WorkingDay() throws Exception {
            when(holidayOracle.isHoliday(any(CivilDate.class))).thenReturn(false);
            when(holidayOracle.isWeekday(any(CivilDate.class))).thenReturn(true);

            mockMvc.perform(get("/calendar").param("date", "2019-01-02"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.working_day").value(true))
                    .andExpect(jsonPath("$.ferie").value(false))
                    .andExpect(jsonPath("$.holiday").value(false));
        }

        @Test
        void day_WeekendIsNotWorkingDay() throws Exception {
            when(holidayOracle.isHoliday(any(CivilDate.class))).thenReturn(false);
            when(holidayOracle.isWeekday(any(CivilDate.class))).thenReturn(false);

            mockMvc.perform(get("/calendar").param("date", "2019-01-12"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.working_day").value(false))
                    .andExpect(jsonPath("$.weekday").value(false));
        }

        @Test
        @DisplayName("Without a date the current day of the oracle clock is evaluated")
        void day_DefaultsToToday() throws Exception {
            when(holidayOracle.now()).thenReturn(ZonedDateTime.of(2020, 7, 14, 9, 30, 0, 0, PARIS));
            when(holidayOracle.isHoliday(any(CivilDate.class))).thenReturn(true);
            when(holidayOracle.isWeekday(any(CivilDate.class))).thenReturn(true);

            mockMvc.perform(get("/calendar"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.day").value(startsWith("2020-07-14T09:30")))
                    .andExpect(jsonPath("$.holiday").value(true));

            verify(holidayOracle).isHoliday(CivilDate.of(2020, 7, 14, PARIS));
        }

        @Test
        void day_UnparsableDate() throws Exception {
            mockMvc.perform(get("/calendar").param("date", "2019-13-45"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("DMG-4002"))
                    .andExpect(jsonPath("$.error.field").value("date"));
        }

        @Test
        void day_YearBeforeGregorianCalendar() throws Exception {
            mockMvc.perform(get("/calendar").param("date", "1500-01-01"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("DMG-4001"));

            verify(metrics).recordRequest(any(), eq("calendar"), eq("GET"), eq(400));
        }

        @Test
        void day_RecordsSuccessfulRequest() throws Exception {
            when(holidayOracle.isHoliday(any(CivilDate.class))).thenReturn(false);
            when(holidayOracle.isWeekday(any(CivilDate.class))).thenReturn(true);

            mockMvc.perform(get("/calendar").param("date", "2019-01-02"))
                    .andExpect(status().isOk());

            verify(metrics).recordRequest(any(), eq("calendar"), eq("GET"), eq(200));
        }

        @Test
        void day_UnexpectedFailure() throws Exception {
            when(holidayOracle.isHoliday(any(CivilDate.class))).thenThrow(new IllegalStateException("boom"));

            mockMvc.perform(get("/calendar").param("date", "2019-01-02"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("DMG-9999"))
                    .andExpect(jsonPath("$.error.traceId").isNotEmpty());

            verify(metrics).recordRequest(any(), eq("calendar"), eq("GET"), eq(500));
        }
    }

    // ==================== HOLIDAY LIST ====================

    @Nested
    @DisplayName("GET /calendar/holidays/{year}")
    class HolidayList {

        @Test
        void holidays_ListsFixedHolidays() throws Exception {
            when(holidayOracle.holidaySet()).thenReturn(new HolidaySetService(new EasterCalculator(PARIS), PARIS));

            mockMvc.perform(get("/calendar/holidays/2020"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.length()").value(10))
                    .andExpect(jsonPath("$.data[0].date").value("2020-01-01"))
                    .andExpect(jsonPath("$.data[0].name").value("Jour de l'an"))
                    .andExpect(jsonPath("$.data[1].date").value("2020-04-13"))
                    .andExpect(jsonPath("$.data[1].dayOfWeek").value("MONDAY"))
                    .andExpect(jsonPath("$.data[4].name").value("Ascension"))
                    .andExpect(jsonPath("$.data[4].date").value("2020-05-21"));
        }

        @Test
        void holidays_YearOutOfRange() throws Exception {
            mockMvc.perform(get("/calendar/holidays/10000"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("DMG-4001"));

            verify(metrics).recordRequest(any(), eq("holidays"), eq("GET"), eq(400));
        }

        @Test
        void holidays_NotANumber() throws Exception {
            mockMvc.perform(get("/calendar/holidays/next"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("DMG-4002"));
        }
    }
}
