package io.s24x7.exporter.server.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Sets up Logback from the {@code logging} block of the exporter configuration, so that
 * logging is configured in the same HOCON file as everything else.
 *
 * <pre>
 * logging {
 *     level = "INFO"
 *     pattern = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n"
 *     loggers {
 *         "io.s24x7.exporter.client" = "DEBUG"
 *     }
 * }
 * </pre>
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "CONSOLE";

    // the JDK client and server are chatty at DEBUG
    private static final List<String> QUIET_LOGGERS =
            List.of("jdk.httpclient", "jdk.internal.httpclient", "com.sun.net.httpserver");

    private LogbackConfigurator() {
    }

    /**
     * Replace the current Logback setup with one console appender and the configured levels.
     *
     * @throws InvalidConfigurationException for an unknown level name or a non-string setting
     */
    public static void configure(Config config) {
        String pattern = optionalString(config, "logging.pattern",
                "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
        Level rootLevel = parseLevel("logging.level", optionalString(config, "logging.level", "INFO"));

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(rootLevel);
        root.addAppender(consoleAppender(context, pattern));

        if (config.hasPath("logging.loggers")) {
            // iterate the object so quoted keys keep the dots of package names
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.loggers").entrySet()) {
                String setting = "logging.loggers." + entry.getKey();
                context.getLogger(entry.getKey())
                        .setLevel(parseLevel(setting, String.valueOf(entry.getValue().unwrapped())));
            }
        }

        for (String name : QUIET_LOGGERS) {
            Logger logger = context.getLogger(name);
            if (logger.getLevel() == null) {
                logger.setLevel(Level.WARN);
            }
        }
    }

    private static ConsoleAppender<ILoggingEvent> consoleAppender(LoggerContext context, String pattern) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setName(APPENDER_NAME);
        appender.setContext(context);
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    static Level parseLevel(String setting, String value) {
        Level level = Level.toLevel(value, null);
        if (level == null) {
            throw new InvalidConfigurationException("Unknown log level '" + value + "' for " + setting);
        }
        return level;
    }

    private static String optionalString(Config config, String path, String fallback) {
        try {
            return config.hasPath(path) ? config.getString(path) : fallback;
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid logging setting '" + path + "': " + e.getMessage(), e);
        }
    }
}
