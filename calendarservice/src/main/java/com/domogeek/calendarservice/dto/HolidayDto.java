package com.domogeek.calendarservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * A fixed public holiday
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HolidayDto {

    private LocalDate date;
    private String name;
    private DayOfWeek dayOfWeek;
}
