package de.bycsitsm.icsjson.ical;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IcalLineReaderTest {

    private static IcalLineReader reader(String text) {
        return new IcalLineReader(new StringReader(text), 4096);
    }

    @Test
    void reading_splits_lines_into_key_and_value() {
        var lines = reader("BEGIN:VCALENDAR\nVERSION:2.0\n");

        assertThat(lines.readLine()).isEqualTo(new IcalLine("BEGIN", "VCALENDAR"));
        assertThat(lines.readLine()).isEqualTo(new IcalLine("VERSION", "2.0"));
    }

    @Test
    void reading_splits_on_first_colon_only() {
        var line = reader("DESCRIPTION:Agenda: see https://example.com/agenda\n").readLine();

        assertThat(line.key()).isEqualTo("DESCRIPTION");
        assertThat(line.value()).isEqualTo("Agenda: see https://example.com/agenda");
    }

    @Test
    void reading_allows_empty_value() {
        var line = reader("LOCATION:\n").readLine();

        assertThat(line).isEqualTo(new IcalLine("LOCATION", ""));
    }

    @Test
    void reading_strips_carriage_returns() {
        var lines = reader("BEGIN:VEVENT\r\nUID:42\r\n");

        assertThat(lines.readLine()).isEqualTo(new IcalLine("BEGIN", "VEVENT"));
        assertThat(lines.readLine()).isEqualTo(new IcalLine("UID", "42"));
    }

    @Test
    void reading_accepts_last_line_without_terminator() {
        var line = reader("END:VCALENDAR").readLine();

        assertThat(line).isEqualTo(new IcalLine("END", "VCALENDAR"));
    }

    @Test
    void reading_unfolds_continuation_lines() {
        var lines = reader("SUMMARY:Hello\n  World\nUID:1\n");

        assertThat(lines.readLine()).isEqualTo(new IcalLine("SUMMARY", "Hello World"));
        assertThat(lines.readLine()).isEqualTo(new IcalLine("UID", "1"));
    }

    @Test
    void folded_line_reads_like_the_unfolded_line() {
        var folded = reader("DESCRIPTION:Quarterly plan\r\n ning and budget\r\n  review\r\n").readLine();
        var unfolded = reader("DESCRIPTION:Quarterly planning and budget review\r\n").readLine();

        assertThat(folded).isEqualTo(unfolded);
    }

    @Test
    void fold_may_split_the_key() {
        var line = reader("SUMM\n ARY:Split key\n").readLine();

        assertThat(line).isEqualTo(new IcalLine("SUMMARY", "Split key"));
    }

    @Test
    void tab_does_not_start_a_continuation() {
        var lines = reader("SUMMARY:Hello\n\tWorld:x\n");

        assertThat(lines.readLine()).isEqualTo(new IcalLine("SUMMARY", "Hello"));
        assertThat(lines.readLine()).isEqualTo(new IcalLine("\tWorld", "x"));
    }

    @Test
    void reading_rejects_blank_line() {
        var lines = reader("BEGIN:VCALENDAR\n\nEND:VCALENDAR\n");
        lines.readLine();

        assertThatThrownBy(lines::readLine)
                .isInstanceOf(IcalException.class)
                .hasMessageContaining("line 2: unexpected blank line")
                .extracting("kind").isEqualTo(IcalException.Kind.LINE_FORMAT);
    }

    @Test
    void reading_rejects_line_without_colon() {
        var lines = reader("BEGIN:VCALENDAR\nGARBAGE\n");
        lines.readLine();

        assertThatThrownBy(lines::readLine)
                .isInstanceOf(IcalException.class)
                .hasMessageContaining("line 2: bad line, couldn't find key:value")
                .extracting("kind").isEqualTo(IcalException.Kind.LINE_FORMAT);
    }

    @Test
    void reading_rejects_line_longer_than_maximum() {
        var lines = new IcalLineReader(new StringReader("SUMMARY:0123456789\n"), 10);

        assertThatThrownBy(lines::readLine)
                .isInstanceOf(IcalException.class)
                .hasMessageContaining("unexpected long line")
                .extracting("kind").isEqualTo(IcalException.Kind.LINE_FORMAT);
    }

    @Test
    void reading_accepts_line_of_maximum_length_with_carriage_return() {
        var lines = new IcalLineReader(new StringReader("SUMMARY:ab\r\nUID:1\r\n"), 10);

        assertThat(lines.readLine()).isEqualTo(new IcalLine("SUMMARY", "ab"));
        assertThat(lines.readLine()).isEqualTo(new IcalLine("UID", "1"));
    }

    @Test
    void largest_configurable_maximum_accepts_ordinary_lines() {
        var lines = new IcalLineReader(new StringReader("UID:1\nSUMMARY:Lunch\r\n"), Integer.MAX_VALUE);

        assertThat(lines.readLine()).isEqualTo(new IcalLine("UID", "1"));
        assertThat(lines.readLine()).isEqualTo(new IcalLine("SUMMARY", "Lunch"));
    }

    @Test
    void maximum_length_applies_to_each_physical_line_of_a_fold() {
        var lines = new IcalLineReader(new StringReader("SUMMARY:ab\n cdefghij\n"), 10);

        assertThat(lines.readLine()).isEqualTo(new IcalLine("SUMMARY", "abcdefghij"));
    }

    @Test
    void reading_past_end_of_input_fails() {
        var lines = reader("BEGIN:VCALENDAR\n");
        lines.readLine();

        assertThatThrownBy(lines::readLine)
                .isInstanceOf(IcalException.class)
                .hasMessageContaining("unexpected end of input")
                .extracting("kind").isEqualTo(IcalException.Kind.STRUCTURE);
    }

    @Test
    void reading_empty_input_fails() {
        assertThatThrownBy(() -> reader("").readLine())
                .isInstanceOf(IcalException.class)
                .hasMessageContaining("unexpected end of input");
    }

    @Test
    void line_number_points_at_start_of_folded_line() {
        var lines = reader("UID:1\nSUMMARY:a\n b\n c\nLOCATION:x\n");

        lines.readLine();
        lines.readLine();
        assertThat(lines.lineNumber()).isEqualTo(2);
        lines.readLine();
        assertThat(lines.lineNumber()).isEqualTo(5);
    }

    @Test
    void read_failure_is_reported_as_io_error() {
        var failing = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
                // nothing to close
            }
        };
        var lines = new IcalLineReader(failing, 4096);

        assertThatThrownBy(lines::readLine)
                .isInstanceOf(IcalException.class)
                .hasMessageContaining("disk gone")
                .hasCauseInstanceOf(IOException.class)
                .extracting("kind").isEqualTo(IcalException.Kind.IO);
    }
}
