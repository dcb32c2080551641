package de.mirkosertic.pwstrength.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Switches logging between the quiet default and verbose output.
 * <p>
 * Both configurations log to standard error only, standard output carries the JSON results.
 */
public final class LoggingConfigurator {

    static final String VERBOSE_CONFIG = "logback-verbose.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called early in application startup, before logging is used.
     *
     * @param verbose true to log DEBUG and above
     */
    public static void configure(final boolean verbose) {
        if (verbose) {
            loadConfiguration(VERBOSE_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
    }

    static boolean loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream == null) {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                    return false;
                }
                context.reset();
                final JoranConfigurator configurator = new JoranConfigurator();
                configurator.setContext(context);
                configurator.doConfigure(configStream);
                return true;
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Could not read " + configFile + ": " + e.getMessage());
        }
        return false;
    }
}
