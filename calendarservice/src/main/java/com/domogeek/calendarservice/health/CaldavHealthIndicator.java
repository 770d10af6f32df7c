package com.domogeek.calendarservice.health;

import com.domogeek.calendarservice.service.HolidayOracle;
import com.domogeek.common.exception.CalendarLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Runs a live remote calendar lookup for today.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaldavHealthIndicator implements HealthIndicator {

    private static final long SLOW_THRESHOLD_MS = 5000;

    private final HolidayOracle holidayOracle;

    @Override
    public Health health() {
        if (!holidayOracle.isOverrideEnabled()) {
            return Health.up().withDetail("enabled", false).build();
        }

        try {
            long start = System.currentTimeMillis();
            boolean holiday = holidayOracle.isHolidayFromOverride(holidayOracle.today());
            long latency = System.currentTimeMillis() - start;

            if (latency > SLOW_THRESHOLD_MS) {
                return Health.down().withDetail("status", "SLOW").withDetail("latency_ms", latency).withDetail("threshold_ms", SLOW_THRESHOLD_MS).build();
            }

            return Health.up().withDetail("enabled", true).withDetail("latency_ms", latency).withDetail("holiday_today", holiday).build();

        } catch (CalendarLookupException e) {
            log.error("Caldav health check failed: {}", e.getMessage());
            Health.Builder down = Health.down().withDetail("error", e.getMessage());
            if (e.getStatusCode() != null) {
                down.withDetail("status_code", e.getStatusCode());
            }
            return down.build();
        } catch (RuntimeException e) {
            log.error("Caldav health check failed", e);
            return Health.down(e).build();
        }
    }
}
