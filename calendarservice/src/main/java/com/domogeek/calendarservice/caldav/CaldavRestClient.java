package com.domogeek.calendarservice.caldav;

/*
 * 10/14/2026 - 11:07 AM
 * @author domogeek
 */

import com.domogeek.calendarservice.metrics.CalendarMetrics;
import com.domogeek.calendarservice.model.CalendarEvent;
import com.domogeek.calendarservice.model.EventWindow;
import com.domogeek.common.exception.CalendarConnectivityException;
import com.domogeek.common.exception.CalendarLookupException;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.List;

/**
 * {@link CalendarOverrideClient} speaking CalDAV over a Spring {@link RestClient}.
 * <p>
 * Events are listed with a {@code REPORT calendar-query} restricted to the
 * window (the server does the overlap filtering and any recurrence
 * expansion). The server is validated with {@code OPTIONS}: it must advertise
 * {@code calendar-access} in its {@code DAV} header.
 * <p>
 * Calendar paths are taken as already encoded and appended to the server URL
 * verbatim; they are never expanded as URI templates.
 */
@Slf4j
public class CaldavRestClient implements CalendarOverrideClient {

    static final HttpMethod REPORT = HttpMethod.valueOf("REPORT");
    static final String CALENDAR_ACCESS = "calendar-access";

    private final RestClient restClient;
    private final CaldavResponseParser parser;
    private final CalendarMetrics metrics;
    private final String endpoint;

    /**
     * @param endpoint server URL the calendar paths are resolved against
     */
    public CaldavRestClient(RestClient restClient, CalendarMetrics metrics, String endpoint) {
        this.restClient = restClient;
        this.parser = new CaldavResponseParser();
        this.metrics = metrics;
        this.endpoint = endpoint;
    }

    @Override
    public List<CalendarEvent> queryEvents(String calendarPath, EventWindow window) {
        Timer.Sample sample = metrics.startTimer();
        boolean success = false;

        try {
            log.debug("Querying caldav events: path={}, start={}, end={}", calendarPath, window.start(), window.end());

            String body = restClient.method(REPORT)
                    .uri(resolve(calendarPath))
                    .header("Depth", "1")
                    .contentType(MediaType.APPLICATION_XML)
                    .accept(MediaType.APPLICATION_XML, MediaType.TEXT_XML)
                    .body(CaldavCalendarQuery.eventsIn(window))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw new CalendarLookupException(calendarPath,
                                "caldav server returned " + response.getStatusCode().value(),
                                response.getStatusCode().value());
                    })
                    .body(String.class);

            List<CalendarEvent> events = parser.parseMultistatus(calendarPath, body);
            log.debug("Fetched {} caldav events from {}", events.size(), calendarPath);
            success = true;
            return events;

        } catch (RestClientException e) {
            throw new CalendarLookupException(calendarPath, "unable to list events from caldav: " + e.getMessage(), e);
        } catch (CalendarLookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalendarLookupException(calendarPath, "unable to list events from caldav: " + e, e);
        } finally {
            metrics.recordCaldavLookup(sample, success);
        }
    }

    @Override
    public void validateServer(String calendarPath) {
        ResponseEntity<Void> response;
        try {
            response = restClient.options()
                    .uri(resolve(calendarPath))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException | IllegalArgumentException e) {
            throw new CalendarConnectivityException(
                    "bad caldav configuration, unable to validate connexion: " + e.getMessage(), e);
        }

        HttpHeaders headers = response.getHeaders();
        List<String> dav = headers.get("DAV");
        if (dav == null || dav.stream().noneMatch(value -> value.contains(CALENDAR_ACCESS))) {
            throw new CalendarConnectivityException(
                    "server at " + endpoint + " does not advertise " + CALENDAR_ACCESS + " for " + calendarPath);
        }
        log.info("Validated caldav server {} (DAV: {})", endpoint, String.join(", ", dav));
    }

    /**
     * {@code endpoint + calendarPath} as an absolute URI, percent-escapes kept as given.
     *
     * @throws IllegalArgumentException when the result is not a valid URI
     */
    URI resolve(String calendarPath) {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        if (calendarPath == null || calendarPath.isEmpty()) {
            return URI.create(base);
        }
        return URI.create(calendarPath.startsWith("/") ? base + calendarPath : base + "/" + calendarPath);
    }
}
