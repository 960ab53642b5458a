package de.bycsitsm.icsjson.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bycsitsm.icsjson.ical.IcalCalendar;
import de.bycsitsm.icsjson.ical.IcalException;
import de.bycsitsm.icsjson.ical.IcalProperties;
import de.bycsitsm.icsjson.ical.IcalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Prints decoded calendars as JSON documents on standard output.
 * <p>
 * Each file named on the command line is decoded and printed in turn; without file
 * arguments standard input is decoded instead. A document that fails to decode or
 * serialize prints nothing on standard output, its error goes to standard error and
 * the exit code becomes {@value #EXIT_FAILURE}.
 */
@Component
class IcalJsonRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(IcalJsonRunner.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final String STDIN = "standard input";

    private final IcalService icalService;
    private final ObjectWriter jsonWriter;

    private int exitCode = EXIT_SUCCESS;

    IcalJsonRunner(IcalService icalService, ObjectMapper objectMapper, IcalProperties icalProperties) {
        this.icalService = icalService;
        var mapper = objectMapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jsonWriter = icalProperties.indentOutput()
                ? mapper.writerWithDefaultPrettyPrinter()
                : mapper.writer();
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = print(args.getNonOptionArgs(), System.in, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Decodes and prints the given files, or {@code stdin} if the list is empty.
     *
     * @return {@link #EXIT_SUCCESS} if every document was printed, {@link #EXIT_FAILURE} otherwise
     */
    int print(List<String> files, InputStream stdin, PrintStream out, PrintStream err) {
        if (files.isEmpty()) {
            return printOne(STDIN, () -> icalService.decode(stdin, STDIN), out, err);
        }

        var result = EXIT_SUCCESS;
        for (var file : files) {
            if (printOne(file, () -> icalService.decode(Path.of(file)), out, err) != EXIT_SUCCESS) {
                result = EXIT_FAILURE;
            }
        }
        return result;
    }

    private int printOne(String source, CalendarSource calendarSource, PrintStream out, PrintStream err) {
        try {
            var json = jsonWriter.writeValueAsString(calendarSource.decode());
            out.println(json);
            out.flush();
            return EXIT_SUCCESS;
        } catch (IcalException e) {
            err.println(e.getMessage());
        } catch (InvalidPathException e) {
            err.println("Invalid calendar file name " + source + ": " + e.getReason());
        } catch (JsonProcessingException e) {
            log.error("Failed to write calendar from {} as JSON", source, e);
            err.println("Failed to write JSON: " + e.getOriginalMessage());
        }
        err.flush();
        return EXIT_FAILURE;
    }

    @FunctionalInterface
    private interface CalendarSource {
        IcalCalendar decode();
    }
}
