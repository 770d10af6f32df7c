package com.domogeek.calendarservice.model;

/**
 * An event returned by the remote calendar.
 *
 * @param uid     the iCalendar UID, or {@code null} when the server omitted it
 * @param summary the event summary, or {@code null} when the event has none
 */
public record CalendarEvent(String uid, String summary) {

    public static CalendarEvent withSummary(String summary) {
        return new CalendarEvent(null, summary);
    }

    public boolean summaryContains(String pattern) {
        return summary != null && summary.contains(pattern);
    }
}
