package io.s24x7.exporter.server.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.ContextInitializer;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreTestLogging() throws Exception {
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @Test
    @DisplayName("Should apply root and per-logger levels")
    void levels() {
        LogbackConfigurator.configure(ConfigFactory.parseString("""
                logging {
                    level = "WARN"
                    loggers { "io.s24x7.exporter.client" = "DEBUG" }
                }
                """));

        assertEquals(Level.WARN, context.getLogger("ROOT").getLevel());
        assertEquals(Level.DEBUG, context.getLogger("io.s24x7.exporter.client").getLevel());
        assertEquals(Level.WARN, context.getLogger("jdk.internal.httpclient").getLevel());
        assertNotNull(context.getLogger("ROOT").getAppender(LogbackConfigurator.APPENDER_NAME));
    }

    @Test
    @DisplayName("Should let configured loggers override the quiet defaults")
    void overrideQuietDefaults() {
        LogbackConfigurator.configure(ConfigFactory.parseString("logging.loggers { \"jdk.httpclient\" = \"TRACE\" }"));

        assertEquals(Level.INFO, context.getLogger("ROOT").getLevel());
        assertEquals(Level.TRACE, context.getLogger("jdk.httpclient").getLevel());
    }

    @Test
    @DisplayName("Should reject a logging level of the wrong type")
    void invalidSetting() {
        assertThrows(InvalidConfigurationException.class,
                () -> LogbackConfigurator.configure(ConfigFactory.parseString("logging.level { nested = 1 }")));
    }

    @Test
    @DisplayName("Should reject an unknown level name")
    void unknownLevel() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> LogbackConfigurator.configure(ConfigFactory.parseString("logging.loggers { \"io.s24x7\" = \"LOUD\" }")));
        assertTrue(e.getMessage().contains("LOUD"));
    }
}
