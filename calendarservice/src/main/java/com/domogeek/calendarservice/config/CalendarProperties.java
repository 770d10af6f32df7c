package com.domogeek.calendarservice.config;

import com.domogeek.common.exception.CalendarConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Type-safe configuration properties for the calendar service.
 * Maps to YAML properties under the 'calendar' prefix.
 */
@ConfigurationProperties(prefix = "calendar")
public record CalendarProperties(
        String zone,
        Caldav caldav,
        StartupRetry startupRetry
) {

    public static final String DEFAULT_ZONE = "Europe/Paris";

    /**
     * Constructor with null-safe defaults. An unknown zone id fails binding,
     * which keeps the service from starting.
     */
    public CalendarProperties {
        if (zone == null || zone.isBlank()) {
            zone = DEFAULT_ZONE;
        }
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new CalendarConfigurationException("calendar.zone", "unable to load time location '" + zone + "'", e);
        }
        if (caldav == null) {
            caldav = new Caldav(null, null, null, null, null, null, null);
        }
        if (startupRetry == null) {
            startupRetry = new StartupRetry(null, 0, null, 0);
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // CALDAV OVERRIDE CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Remote calendar whose matching events are extra holidays. A blank URL
     * disables the override path.
     */
    public record Caldav(
            String url,
            String path,
            String summaryPattern,
            String username,
            String password,
            Duration connectTimeout,
            Duration readTimeout
    ) {
        public Caldav {
            if (path == null) path = "";
            if (summaryPattern == null || summaryPattern.isEmpty()) summaryPattern = "Holidays";
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(5);
            if (readTimeout == null) readTimeout = Duration.ofSeconds(10);
        }

        public boolean enabled() {
            return url != null && !url.isBlank();
        }

        public boolean hasCredentials() {
            return username != null && !username.isBlank();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // STARTUP VALIDATION RETRY
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Back-off of the startup connectivity check. {@code maxAttempts} of 0
     * retries forever.
     */
    public record StartupRetry(
            Duration initialInterval,
            double multiplier,
            Duration maxInterval,
            int maxAttempts
    ) {
        public StartupRetry {
            if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
                initialInterval = Duration.ofMillis(100);
            }
            if (multiplier < 1.0) multiplier = 2.0;
            if (maxInterval == null) maxInterval = Duration.ofMinutes(5);
            if (maxInterval.compareTo(initialInterval) < 0) maxInterval = initialInterval;
            if (maxAttempts < 0) maxAttempts = 0;
        }

        public boolean unbounded() {
            return maxAttempts == 0;
        }
    }
}
