package com.domogeek.calendarservice.metrics;

/*
 * 10/15/2026 - 4:12 PM
 * @author domogeek
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Calendar request and remote calendar meters.
 */
@Component
public class CalendarMetrics {

    private final MeterRegistry registry;

    // Counters
    private final Counter caldavLookupSuccessCounter;
    private final Counter caldavLookupFailedCounter;
    private final Counter validationSuccessCounter;
    private final Counter validationFailedCounter;

    // Timers
    private final Timer caldavLookupTimer;

    public CalendarMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.caldavLookupSuccessCounter = Counter.builder("domogeek.caldav.lookups.total").description("Remote calendar lookups").tag("status", "success").register(registry);

        this.caldavLookupFailedCounter = Counter.builder("domogeek.caldav.lookups.total").description("Remote calendar lookups").tag("status", "failed").register(registry);

        this.validationSuccessCounter = Counter.builder("domogeek.caldav.validation.attempts").description("Remote calendar validation attempts").tag("status", "success").register(registry);

        this.validationFailedCounter = Counter.builder("domogeek.caldav.validation.attempts").description("Remote calendar validation attempts").tag("status", "failed").register(registry);

        this.caldavLookupTimer = Timer.builder("domogeek.caldav.lookup.duration").description("Remote calendar lookup duration").publishPercentileHistogram().register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    /**
     * Counts a calendar endpoint call by HTTP status code and records its duration.
     */
    public void recordRequest(Timer.Sample sample, String endpoint, String method, int statusCode) {
        String code = String.valueOf(statusCode);
        registry.counter("domogeek.calendar.request.total", "endpoint", endpoint, "method", method, "code", code).increment();
        sample.stop(Timer.builder("domogeek.calendar.request.duration")
                .description("Calendar request duration")
                .tag("endpoint", endpoint)
                .tag("code", code)
                .publishPercentileHistogram()
                .register(registry));
    }

    public void recordCaldavLookup(Timer.Sample sample, boolean success) {
        sample.stop(caldavLookupTimer);
        if (success) {
            caldavLookupSuccessCounter.increment();
        } else {
            caldavLookupFailedCounter.increment();
        }
    }

    public void recordValidationAttempt(boolean success) {
        if (success) {
            validationSuccessCounter.increment();
        } else {
            validationFailedCounter.increment();
        }
    }
}
