package com.domogeek.calendarservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Calendar Service
 *
 * Tells whether a day is a French public holiday and a working day,
 * optionally extended by a CalDAV calendar.
 *
 * Port: 8080
 */
@SpringBootApplication(scanBasePackages = {
    "com.domogeek.calendarservice",
    "com.domogeek.common"
})
public class CalendarServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalendarServiceApplication.class, args);
    }
}
