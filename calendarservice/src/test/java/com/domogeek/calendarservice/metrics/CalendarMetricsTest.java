package com.domogeek.calendarservice.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarMetricsTest {

    private SimpleMeterRegistry registry;
    private CalendarMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CalendarMetrics(registry);
    }

    @Test
    void recordRequest_TagsStatusCode() {
        metrics.recordRequest(metrics.startTimer(), "calendar", "GET", 200);
        metrics.recordRequest(metrics.startTimer(), "calendar", "GET", 200);
        metrics.recordRequest(metrics.startTimer(), "calendar", "GET", 400);

        assertThat(registry.get("domogeek.calendar.request.total").tag("code", "200").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("domogeek.calendar.request.total").tag("code", "400").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("domogeek.calendar.request.duration").tag("endpoint", "calendar").tag("code", "400").timer().count())
                .isEqualTo(1);
    }

    @Test
    void recordCaldavLookup_CountsByOutcome() {
        metrics.recordCaldavLookup(metrics.startTimer(), true);
        metrics.recordCaldavLookup(metrics.startTimer(), false);
        metrics.recordValidationAttempt(false);

        assertThat(registry.get("domogeek.caldav.lookups.total").tag("status", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("domogeek.caldav.lookups.total").tag("status", "failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("domogeek.caldav.lookup.duration").timer().count()).isEqualTo(2);
        assertThat(registry.get("domogeek.caldav.validation.attempts").tag("status", "failed").counter().count()).isEqualTo(1.0);
    }
}
