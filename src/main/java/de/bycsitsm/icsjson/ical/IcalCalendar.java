package de.bycsitsm.icsjson.ical;

import java.util.List;

/**
 * A decoded {@code VCALENDAR} block.
 *
 * @param events the events of the calendar, undated events first and the rest by start time
 */
public record IcalCalendar(List<IcalEvent> events) {

    public IcalCalendar {
        events = List.copyOf(events);
    }
}
