package de.bycsitsm.icsjson.ical;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Configuration properties for iCalendar decoding and output.
 *
 * @param maxLineLength the longest physical line accepted, in characters
 * @param charset       the character set of the input
 * @param indentOutput  whether printed JSON is indented
 */
@ConfigurationProperties(prefix = "ics")
public record IcalProperties(
        @DefaultValue("4096") int maxLineLength,
        @DefaultValue("UTF-8") Charset charset,
        @DefaultValue("true") boolean indentOutput
) {

    public static final int DEFAULT_MAX_LINE_LENGTH = 4096;

    public IcalProperties {
        if (maxLineLength <= 0) {
            maxLineLength = DEFAULT_MAX_LINE_LENGTH;
        }
        if (charset == null) {
            charset = StandardCharsets.UTF_8;
        }
    }

    /**
     * Returns the properties used when nothing is configured.
     */
    public static IcalProperties defaults() {
        return new IcalProperties(DEFAULT_MAX_LINE_LENGTH, StandardCharsets.UTF_8, true);
    }
}
