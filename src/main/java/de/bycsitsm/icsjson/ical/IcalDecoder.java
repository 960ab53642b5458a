package de.bycsitsm.icsjson.ical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.Reader;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes a {@code VCALENDAR} block and the {@code VEVENT} blocks inside it.
 * <p>
 * Lines before {@code BEGIN:VCALENDAR} are skipped, but the first {@code BEGIN} has to
 * open the calendar. Inside the calendar, {@code BEGIN:VEVENT} starts an event and
 * {@code END:VCALENDAR} finishes decoding; everything else is ignored. Inside an
 * event, {@code UID}, {@code DTSTART}, {@code DTEND}, {@code SUMMARY}, {@code LOCATION}
 * and {@code DESCRIPTION} are kept verbatim (timestamps are parsed) and the block must
 * be closed by {@code END:VEVENT}.
 * <p>
 * Any error ends decoding. Instances hold no state between calls but a single call
 * must not share its reader with another thread.
 */
@Component
public class IcalDecoder {

    private static final Logger log = LoggerFactory.getLogger(IcalDecoder.class);

    static final String BEGIN = "BEGIN";
    static final String END = "END";
    static final String VCALENDAR = "VCALENDAR";
    static final String VEVENT = "VEVENT";

    /** {@code YYYYMMDDThhmmssZ}, always UTC. */
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .appendLiteral('T')
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .appendLiteral('Z')
            .toFormatter(Locale.ROOT)
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);

    private enum State {
        /** No {@code BEGIN:VCALENDAR} seen yet. */
        START,
        /** Between {@code BEGIN:VCALENDAR} and {@code END:VCALENDAR}. */
        IN_CALENDAR,
        /** {@code END:VCALENDAR} seen. */
        DONE
    }

    private final int maxLineLength;

    public IcalDecoder(IcalProperties properties) {
        this.maxLineLength = properties.maxLineLength();
    }

    /**
     * Decodes a calendar from the given reader, which is read up to and including the
     * {@code END:VCALENDAR} line. The reader is not closed.
     *
     * @param in the iCalendar text
     * @return the calendar, with undated events first and the rest ordered by start time
     * @throws IcalException if the data is malformed, truncated or cannot be read
     */
    public IcalCalendar decode(Reader in) {
        var lines = new IcalLineReader(in, maxLineLength);
        var events = new ArrayList<IcalEvent>();

        var state = State.START;
        while (state != State.DONE) {
            var line = lines.readLine();
            state = switch (state) {
                case START -> beforeCalendar(line, lines);
                case IN_CALENDAR -> inCalendar(line, lines, events);
                case DONE -> State.DONE;
            };
        }

        events.sort(IcalEvent.START_ORDER);
        return new IcalCalendar(events);
    }

    private State beforeCalendar(IcalLine line, IcalLineReader lines) {
        if (line.is(BEGIN, VCALENDAR)) {
            return State.IN_CALENDAR;
        }
        if (line.key().equals(BEGIN) || line.is(END, VCALENDAR)) {
            throw new IcalException(IcalException.Kind.STRUCTURE,
                    "line " + lines.lineNumber() + ": missing BEGIN:VCALENDAR");
        }
        return State.START;
    }

    private State inCalendar(IcalLine line, IcalLineReader lines, List<IcalEvent> events) {
        return switch (line.key()) {
            case BEGIN -> {
                if (line.value().equals(VEVENT)) {
                    events.add(decodeEvent(lines));
                } else {
                    log.debug("Ignoring BEGIN:{} on line {}", line.value(), lines.lineNumber());
                }
                yield State.IN_CALENDAR;
            }
            case END -> line.value().equals(VCALENDAR) ? State.DONE : State.IN_CALENDAR;
            default -> State.IN_CALENDAR;
        };
    }

    private IcalEvent decodeEvent(IcalLineReader lines) {
        var event = new IcalEvent.Builder();
        while (true) {
            var line = lines.readLine();
            switch (line.key()) {
                case END -> {
                    if (!line.value().equals(VEVENT)) {
                        throw new IcalException(IcalException.Kind.STRUCTURE,
                                "line " + lines.lineNumber() + ": unexpected END value: " + line.value());
                    }
                    var decoded = event.build();
                    log.debug("Decoded event '{}' ending on line {}", decoded.uid(), lines.lineNumber());
                    return decoded;
                }
                case "UID" -> event.uid(line.value());
                case "DTSTART" -> event.start(parseTimestamp(line, lines));
                case "DTEND" -> event.end(parseTimestamp(line, lines));
                case "SUMMARY" -> event.summary(line.value());
                case "LOCATION" -> event.location(line.value());
                case "DESCRIPTION" -> event.description(line.value());
                default -> {
                    // unsupported property
                }
            }
        }
    }

    private Instant parseTimestamp(IcalLine line, IcalLineReader lines) {
        try {
            return LocalDateTime.parse(line.value(), TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IcalException(IcalException.Kind.VALUE_FORMAT,
                    "line " + lines.lineNumber() + ": bad timestamp for " + line.key() + ": " + line.value(), e);
        }
    }
}
