package com.domogeek.calendarservice.config;

import com.domogeek.common.exception.CalendarConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarPropertiesTest {

    @Test
    void defaults() {
        CalendarProperties properties = new CalendarProperties(null, null, null);

        assertThat(properties.zoneId()).isEqualTo(ZoneId.of("Europe/Paris"));
        assertThat(properties.caldav().enabled()).isFalse();
        assertThat(properties.caldav().summaryPattern()).isEqualTo("Holidays");
        assertThat(properties.caldav().path()).isEmpty();
        assertThat(properties.startupRetry().unbounded()).isTrue();
        assertThat(properties.startupRetry().initialInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(properties.startupRetry().multiplier()).isEqualTo(2.0);
    }

    @Test
    void invalidZoneFailsBinding() {
        assertThatThrownBy(() -> new CalendarProperties("Europe/Atlantis", null, null))
                .isInstanceOf(CalendarConfigurationException.class)
                .hasMessageContaining("calendar.zone")
                .hasMessageContaining("Europe/Atlantis")
                .satisfies(e -> assertThat(((CalendarConfigurationException) e).getErrorCode()).isEqualTo("DMG-1001"));
    }

    @Test
    void caldav_EnabledWithUrl() {
        CalendarProperties.Caldav caldav = new CalendarProperties.Caldav(
                "https://dav.example", "/calendars/home/", "", "domogeek", null, null, null);

        assertThat(caldav.enabled()).isTrue();
        assertThat(caldav.hasCredentials()).isTrue();
        assertThat(caldav.summaryPattern()).isEqualTo("Holidays");
        assertThat(caldav.readTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void startupRetry_ClampsValues() {
        CalendarProperties.StartupRetry retry = new CalendarProperties.StartupRetry(
                Duration.ofSeconds(2), 0.5, Duration.ofSeconds(1), -3);

        assertThat(retry.multiplier()).isEqualTo(2.0);
        assertThat(retry.maxInterval()).isEqualTo(Duration.ofSeconds(2));
        assertThat(retry.unbounded()).isTrue();
    }
}
