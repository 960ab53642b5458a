package de.bycsitsm.icsjson.ical;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Reads logical {@code KEY:VALUE} lines from iCalendar text, unwrapping folded lines.
 * <p>
 * A physical line that starts with a single space continues the previous one: the
 * space is dropped and the rest is appended. Physical lines end at {@code \n}, with
 * an optional {@code \r} before it. Blank lines, lines longer than the configured
 * maximum and lines without a colon are rejected, and running out of input while a
 * line is expected is an error, since a calendar has to be closed explicitly.
 */
class IcalLineReader {

    private static final char CONTINUATION = ' ';

    private final BufferedReader reader;
    private final int maxLineLength;
    private final StringBuilder logicalLine = new StringBuilder(75);
    private final StringBuilder physicalLine = new StringBuilder(75);

    /** Number of physical lines consumed so far. */
    private int lineNumber;

    /** Physical line number where the most recent logical line started. */
    private int logicalLineNumber;

    IcalLineReader(Reader in, int maxLineLength) {
        this.reader = in instanceof BufferedReader buffered ? buffered : new BufferedReader(in);
        this.maxLineLength = maxLineLength;
    }

    /**
     * Reads the next logical line and splits it on its first colon.
     *
     * @return the key and value of the line
     * @throws IcalException if the input ends, cannot be read, or the line is malformed
     */
    IcalLine readLine() {
        try {
            logicalLine.setLength(0);
            logicalLineNumber = lineNumber + 1;
            do {
                readPhysicalLine();
                if (physicalLine.isEmpty()) {
                    throw new IcalException(IcalException.Kind.LINE_FORMAT,
                            "line " + lineNumber + ": unexpected blank line");
                }
                var start = physicalLine.charAt(0) == CONTINUATION ? 1 : 0;
                logicalLine.append(physicalLine, start, physicalLine.length());
            } while (nextIsContinuation());
        } catch (IOException e) {
            throw new IcalException(IcalException.Kind.IO,
                    "Failed to read iCalendar data: " + e.getMessage(), e);
        }

        var colon = logicalLine.indexOf(":");
        if (colon < 0) {
            throw new IcalException(IcalException.Kind.LINE_FORMAT,
                    "line " + logicalLineNumber + ": bad line, couldn't find key:value");
        }
        return new IcalLine(logicalLine.substring(0, colon), logicalLine.substring(colon + 1));
    }

    /**
     * Returns the physical line number on which the last logical line started.
     */
    int lineNumber() {
        return logicalLineNumber;
    }

    private void readPhysicalLine() throws IOException {
        physicalLine.setLength(0);
        var c = reader.read();
        if (c < 0) {
            throw new IcalException(IcalException.Kind.STRUCTURE, "unexpected end of input");
        }
        lineNumber++;
        while (c >= 0 && c != '\n') {
            physicalLine.append((char) c);
            // a trailing \r does not count against the limit
            var limit = c == '\r' ? (long) maxLineLength + 1 : maxLineLength;
            if (physicalLine.length() > limit) {
                throw new IcalException(IcalException.Kind.LINE_FORMAT,
                        "line " + lineNumber + ": unexpected long line");
            }
            c = reader.read();
        }
        var length = physicalLine.length();
        if (length > 0 && physicalLine.charAt(length - 1) == '\r') {
            physicalLine.setLength(length - 1);
        }
    }

    private boolean nextIsContinuation() throws IOException {
        reader.mark(1);
        var next = reader.read();
        reader.reset();
        return next == CONTINUATION;
    }
}
