package com.domogeek.calendarservice.caldav;

import com.domogeek.calendarservice.model.CalendarEvent;
import com.domogeek.common.exception.CalendarLookupException;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.component.CalendarComponent;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts VEVENTs from a CalDAV {@code multistatus} response: every
 * {@code calendar-data} element holds one iCalendar object, parsed with ical4j.
 */
class CaldavResponseParser {

    List<CalendarEvent> parseMultistatus(String calendarPath, String multistatus) {
        if (multistatus == null || multistatus.isBlank()) {
            throw new CalendarLookupException(calendarPath, "empty response from caldav server");
        }

        Document document = readXml(calendarPath, multistatus);
        NodeList calendarData = document.getElementsByTagNameNS(CaldavCalendarQuery.CALDAV_NS, "calendar-data");

        List<CalendarEvent> events = new ArrayList<>();
        for (int i = 0; i < calendarData.getLength(); i++) {
            String ics = calendarData.item(i).getTextContent();
            if (ics == null || ics.isBlank()) {
                continue;
            }
            events.addAll(parseCalendar(calendarPath, ics.strip()));
        }
        return events;
    }

    List<CalendarEvent> parseCalendar(String calendarPath, String ics) {
        Calendar calendar;
        try {
            calendar = new CalendarBuilder().build(new StringReader(ics));
        } catch (IOException | ParserException e) {
            throw new CalendarLookupException(calendarPath, "unable to parse calendar data: " + e.getMessage(), e);
        }

        List<CalendarEvent> events = new ArrayList<>();
        for (CalendarComponent component : calendar.<CalendarComponent>getComponents(Component.VEVENT)) {
            Property uid = component.getProperty(Property.UID);
            Property summary = component.getProperty(Property.SUMMARY);
            events.add(new CalendarEvent(
                    uid != null ? uid.getValue() : null,
                    summary != null ? summary.getValue() : null));
        }
        return events;
    }

    private Document readXml(String calendarPath, String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new CalendarLookupException(calendarPath, "malformed multistatus response: " + e.getMessage(), e);
        }
    }
}
