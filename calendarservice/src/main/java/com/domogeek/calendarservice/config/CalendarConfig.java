package com.domogeek.calendarservice.config;

import com.domogeek.calendarservice.caldav.CalendarOverrideClient;
import com.domogeek.calendarservice.service.HolidayOracle;
import com.domogeek.calendarservice.service.HolidaySetService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the holiday engine. The zone is resolved once here and injected into
 * every component.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CalendarProperties.class)
public class CalendarConfig {

    @Bean
    public ZoneId calendarZone(CalendarProperties properties) {
        ZoneId zone = properties.zoneId();
        log.info("Civil calendar time zone: {}", zone);
        return zone;
    }

    @Bean
    public Clock calendarClock(ZoneId calendarZone) {
        return Clock.system(calendarZone);
    }

    @Bean
    public HolidayOracle holidayOracle(HolidaySetService holidaySetService,
                                       Clock calendarClock,
                                       ObjectProvider<CalendarOverrideClient> overrideClient,
                                       CalendarProperties properties) {
        CalendarOverrideClient client = overrideClient.getIfAvailable();
        if (client == null) {
            log.info("No caldav url configured, holidays come from the fixed list only");
            return new HolidayOracle(holidaySetService, calendarClock);
        }

        CalendarProperties.Caldav caldav = properties.caldav();
        log.info("Caldav override enabled: path='{}', summary pattern='{}'", caldav.path(), caldav.summaryPattern());
        return new HolidayOracle(holidaySetService, calendarClock, client, caldav.path(), caldav.summaryPattern());
    }
}
