package de.bycsitsm.icsjson.ical;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Service layer for iCalendar decoding. Validates inputs, turns bytes into text using
 * the configured charset and delegates to {@link IcalDecoder}.
 */
@Service
public class IcalService {

    private static final Logger log = LoggerFactory.getLogger(IcalService.class);

    private final IcalDecoder icalDecoder;
    private final IcalProperties icalProperties;

    public IcalService(IcalDecoder icalDecoder, IcalProperties icalProperties) {
        this.icalDecoder = icalDecoder;
        this.icalProperties = icalProperties;
    }

    /**
     * Decodes a calendar from a byte stream. The stream is read up to the
     * {@code END:VCALENDAR} line and is not closed.
     *
     * @param in     the iCalendar data
     * @param source a description of where the data comes from, used for logging
     * @return the decoded calendar
     * @throws IcalException if the stream is missing or the data cannot be decoded
     */
    public IcalCalendar decode(InputStream in, String source) {
        if (in == null) {
            throw new IcalException(IcalException.Kind.IO, "Input stream must not be null.");
        }

        log.info("Decoding calendar from {}", source);
        var reader = new BufferedReader(new InputStreamReader(in, icalProperties.charset()));
        try {
            var calendar = icalDecoder.decode(reader);
            log.info("Decoded {} event(s) from {}", calendar.events().size(), source);
            return calendar;
        } catch (IcalException e) {
            log.debug("Failed to decode calendar from {}: {}", source, e.getMessage());
            throw e;
        }
    }

    /**
     * Decodes a calendar from a file.
     *
     * @param path the iCalendar file
     * @return the decoded calendar
     * @throws IcalException if the file cannot be read or its contents cannot be decoded
     */
    public IcalCalendar decode(Path path) {
        if (path == null) {
            throw new IcalException(IcalException.Kind.IO, "Path must not be null.");
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new IcalException(IcalException.Kind.IO, "Cannot read calendar file " + path + ".");
        }

        try (var in = Files.newInputStream(path)) {
            return decode(in, path.toString());
        } catch (IOException e) {
            throw new IcalException(IcalException.Kind.IO,
                    "Failed to read calendar file " + path + ": " + e.getMessage(), e);
        }
    }
}
