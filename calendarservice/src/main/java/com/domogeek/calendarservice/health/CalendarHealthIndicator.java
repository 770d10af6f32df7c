package com.domogeek.calendarservice.health;

import com.domogeek.calendarservice.service.HolidayOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * The fixed holiday engine has no external dependency; it is up once wired.
 */
@Component
@RequiredArgsConstructor
public class CalendarHealthIndicator implements HealthIndicator {

    private final HolidayOracle holidayOracle;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("zone", holidayOracle.zone().getId())
                .withDetail("today", holidayOracle.today().toString())
                .build();
    }
}
