package com.domogeek.calendarservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Calendar status of a day. {@code ferie} and {@code holiday} carry the same
 * value; both names are kept for existing consumers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalendarDayDto {

    private OffsetDateTime day;

    @JsonProperty("working_day")
    private boolean workingDay;

    private boolean ferie;

    private boolean holiday;

    private boolean weekday;
}
