package de.bycsitsm.icsjson.ical;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Comparator;

/**
 * Represents a decoded {@code VEVENT} block.
 *
 * @param uid         the {@code UID} property, or an empty string if absent
 * @param start       the {@code DTSTART} instant, or {@code null} if the event has none
 * @param end         the {@code DTEND} instant, or {@code null} if the event has none
 * @param summary     the {@code SUMMARY} property, or an empty string if absent
 * @param location    the {@code LOCATION} property, or an empty string if absent
 * @param description the {@code DESCRIPTION} property, or an empty string if absent
 */
public record IcalEvent(
        String uid,
        @Nullable Instant start,
        @Nullable Instant end,
        String summary,
        String location,
        String description
) {

    /**
     * Orders events without a start time first, then chronologically by start time.
     */
    public static final Comparator<IcalEvent> START_ORDER = (a, b) -> {
        if (a.start() == null && b.start() == null) {
            return 0;
        }
        if (a.start() == null) {
            return -1;
        }
        if (b.start() == null) {
            return 1;
        }
        return a.start().compareTo(b.start());
    };

    /**
     * Collects the properties of an event while its block is being read.
     */
    static final class Builder {

        private String uid = "";
        private @Nullable Instant start;
        private @Nullable Instant end;
        private String summary = "";
        private String location = "";
        private String description = "";

        Builder uid(String uid) {
            this.uid = uid;
            return this;
        }

        Builder start(Instant start) {
            this.start = start;
            return this;
        }

        Builder end(Instant end) {
            this.end = end;
            return this;
        }

        Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        Builder location(String location) {
            this.location = location;
            return this;
        }

        Builder description(String description) {
            this.description = description;
            return this;
        }

        IcalEvent build() {
            return new IcalEvent(uid, start, end, summary, location, description);
        }
    }
}
