package com.domogeek.calendarservice.model;

/**
 * A public holiday of the fixed list.
 */
public record Holiday(CivilDate date, String name) {
}
