package io.s24x7.exporter.server;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import io.s24x7.exporter.server.config.ExporterConfig;
import io.s24x7.exporter.server.config.InvalidConfigurationException;
import io.s24x7.exporter.server.config.LogbackConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the site24x7 exporter.
 *
 * Usage:
 * <pre>
 * java -jar site24x7-exporter-server.jar
 * java -jar site24x7-exporter-server.jar --config /path/to/exporter.conf
 * java -jar site24x7-exporter-server.jar --conf site24x7_exporter.endpoint=site24x7.eu --conf logging.level=DEBUG
 * </pre>
 *
 * Credentials are read from {@code ZOHO_CLIENT_ID}, {@code ZOHO_CLIENT_SECRET} and
 * {@code ZOHO_REFRESH_TOKEN} unless set in the configuration file.
 */
public class Main {

    static final int EXIT_USAGE = 1;
    static final int EXIT_CONFIG = 2;

    /**
     * CLI arguments.
     */
    public static class Args {
        @Parameter(names = {"-c", "--config"}, description = "Path to HOCON configuration file")
        public String configPath;

        @Parameter(names = "--conf", description = "Configuration override as path=value, may be repeated")
        public List<String> overrides = new ArrayList<>();

        @Parameter(names = {"-h", "--help"}, help = true, description = "Show this help message")
        public boolean help;

        @Parameter(names = {"-v", "--version"}, description = "Show version information")
        public boolean version;
    }

    public static void main(String[] args) {
        Args cliArgs = new Args();
        JCommander jcommander = JCommander.newBuilder()
                .addObject(cliArgs)
                .programName("site24x7-exporter")
                .build();

        try {
            jcommander.parse(args);
        } catch (ParameterException e) {
            System.err.println("Error parsing arguments: " + e.getMessage());
            jcommander.usage();
            System.exit(EXIT_USAGE);
            return;
        }

        if (cliArgs.help) {
            jcommander.usage();
            return;
        }

        if (cliArgs.version) {
            System.out.println("site24x7_exporter " + version());
            return;
        }

        ExporterServer server;
        try {
            ExporterConfig config = new ExporterConfig(cliArgs.configPath, cliArgs.overrides);
            LogbackConfigurator.configure(config.getConfig());
            server = new ExporterServer(config.validate());
            Runtime.getRuntime().addShutdownHook(new Thread(server::shutdown, "exporter-shutdown-hook"));
            server.start();
        } catch (InvalidConfigurationException e) {
            log().error("Invalid configuration: {}", e.getMessage());
            System.exit(EXIT_CONFIG);
            return;
        } catch (Exception e) {
            log().error("Failed to start site24x7 exporter", e);
            System.exit(EXIT_USAGE);
            return;
        }
        server.awaitShutdown();
    }

    static String version() {
        String version = Main.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }

    // looked up after LogbackConfigurator has run
    private static Logger log() {
        return LoggerFactory.getLogger(Main.class);
    }
}
