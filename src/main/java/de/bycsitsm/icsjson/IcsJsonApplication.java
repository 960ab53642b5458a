package de.bycsitsm.icsjson;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Command-line entry point. Decodes the iCalendar files given as arguments, or
 * standard input if there are none, and prints each calendar as JSON.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IcsJsonApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(IcsJsonApplication.class, args)));
    }
}
