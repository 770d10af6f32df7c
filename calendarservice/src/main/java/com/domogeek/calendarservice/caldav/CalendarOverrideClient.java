package com.domogeek.calendarservice.caldav;

import com.domogeek.calendarservice.model.CalendarEvent;
import com.domogeek.calendarservice.model.EventWindow;
import com.domogeek.common.exception.CalendarConnectivityException;
import com.domogeek.common.exception.CalendarLookupException;

import java.util.List;

/**
 * Remote calendar able to list the events overlapping a time window.
 * Implementations must be safe for concurrent use.
 */
public interface CalendarOverrideClient {

    /**
     * Events of the calendar at {@code calendarPath} overlapping {@code window}.
     *
     * @throws CalendarLookupException on transport or protocol failure
     */
    List<CalendarEvent> queryEvents(String calendarPath, EventWindow window);

    /**
     * Checks that the server is reachable and serves calendars at {@code calendarPath}.
     *
     * @throws CalendarConnectivityException when it does not
     */
    void validateServer(String calendarPath);
}
