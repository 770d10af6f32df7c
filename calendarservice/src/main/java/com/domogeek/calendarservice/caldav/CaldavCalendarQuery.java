package com.domogeek.calendarservice.caldav;

import com.domogeek.calendarservice.model.EventWindow;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * CalDAV {@code calendar-query} REPORT bodies (RFC 4791, section 7.8).
 */
final class CaldavCalendarQuery {

    static final String DAV_NS = "DAV:";
    static final String CALDAV_NS = "urn:ietf:params:xml:ns:caldav";

    private static final DateTimeFormatter UTC_DATE_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final String EVENT_RANGE_QUERY = """
            <?xml version="1.0" encoding="utf-8"?>
            <C:calendar-query xmlns:D="%s" xmlns:C="%s">
              <D:prop>
                <D:getetag/>
                <C:calendar-data/>
              </D:prop>
              <C:filter>
                <C:comp-filter name="VCALENDAR">
                  <C:comp-filter name="VEVENT">
                    <C:time-range start="%s" end="%s"/>
                  </C:comp-filter>
                </C:comp-filter>
              </C:filter>
            </C:calendar-query>
            """;

    private CaldavCalendarQuery() {
    }

    /**
     * Query matching every VEVENT overlapping {@code window}.
     */
    static String eventsIn(EventWindow window) {
        return EVENT_RANGE_QUERY.formatted(DAV_NS, CALDAV_NS,
                UTC_DATE_TIME.format(window.start()),
                UTC_DATE_TIME.format(window.end()));
    }
}
