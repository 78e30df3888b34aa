package org.netpreserve.sitescraper;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.config.JobConfig;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Command-line entry point.
 */
public class SiteScraper {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(SiteScraper.class);

    public static void main(String[] args) throws Exception {
        CommandLine commandLine;
        JobConfig config;
        try {
            commandLine = CommandLine.parse(args);
            if (commandLine.help()) {
                printUsage(System.out);
                System.exit(0);
                return;
            }
            config = loadConfig(commandLine);
        } catch (CrawlConfigException | IOException e) {
            System.err.println("sitescraper: " + e.getMessage());
            System.exit(1);
            return;
        }

        if (commandLine.dumpConfig()) {
            System.out.println(yamlMapper().writeValueAsString(config));
            System.exit(0);
            return;
        }
        if (commandLine.logFile() != null) startLogFile(commandLine.logFile());

        Crawl crawl;
        try {
            crawl = new Crawl(config);
        } catch (CrawlConfigException e) {
            System.err.println("sitescraper: " + e.getMessage());
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                crawl.close();
            } catch (Exception e) {
                System.err.println("Error shutting down crawl: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook"));

        int status = 0;
        try {
            var stats = crawl.run();
            System.out.println("Processed " + stats.processed() + " pages (" + stats.failed() + " failed). Records: "
                               + crawl.storage().recordsFile());
        } catch (CrawlConfigException e) {
            System.err.println("sitescraper: " + e.getMessage());
            status = 1;
        } finally {
            crawl.close();
        }
        if (status != 0) System.exit(status);
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Builds the effective configuration: built-in defaults, then the config file, then command-line options.
     */
    static JobConfig loadConfig(CommandLine commandLine) throws IOException, CrawlConfigException {
        var mapper = yamlMapper();
        JsonNode configTree;
        try (InputStream stream = SiteScraper.class.getResourceAsStream("config/defaults.yaml")) {
            if (stream == null) throw new IOException("config/defaults.yaml missing from classpath");
            configTree = mapper.readTree(stream);
        }
        if (commandLine.configFile() != null) {
            configTree = deepMerge(configTree, mapper.readTree(commandLine.configFile().toFile()));
        }
        configTree = deepMerge(configTree, commandLine.overrides());
        JobConfig config = mapper.treeToValue(configTree, JobConfig.class);
        Crawl.validate(config);
        return config;
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                JsonNode baseValue = merged.get(key);
                merged.set(key, deepMerge(baseValue, overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: sitescraper [options] URL...");
        out.println("Options:");
        out.println("  -o, --output-dir DIR          Directory for records, pages and images (default: scrape_output)");
        out.println("      --allowed-domains DOMAIN  Restrict crawling to these domains and their subdomains");
        out.println("      --max-pages N             Stop after storing N pages (default: 200)");
        out.println("      --max-depth N             Maximum link distance from a seed (default: 5)");
        out.println("      --concurrency N           Maximum fetches in flight (default: 8)");
        out.println("      --per-host N              Maximum fetches in flight per host (default: 4)");
        out.println("      --timeout SECONDS         Request timeout (default: 20)");
        out.println("      --user-agent STRING       User-Agent header to send");
        out.println("      --no-robots               Do not obey robots.txt");
        out.println("      --render POLICY           never, always or auto (default: auto)");
        out.println("      --no-images               Do not download images");
        out.println("      --delay-ms N              Pause before each fetch (default: 0)");
        out.println("      --config FILE             YAML configuration file");
        out.println("      --dump-config             Print the effective configuration and exit");
        out.println("      --log-file FILE           Also write the log to FILE");
        out.println("  -h, --help");
    }

    private static void startLogFile(Path file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{36} %kvp %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("log-file");
        fileAppender.setFile(file.toString());
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
        log.info("Logging to {}", file);
    }

    /**
     * Parsed command-line arguments.
     *
     * @param overrides configuration tree built from the options, merged over the defaults and config file
     */
    record CommandLine(ObjectNode overrides, @Nullable Path configFile, boolean dumpConfig, @Nullable Path logFile,
                       boolean help) {

        static CommandLine parse(String[] args) throws CrawlConfigException {
            var factory = JsonNodeFactory.instance;
            ObjectNode overrides = factory.objectNode();
            ArrayNode seeds = null;
            ArrayNode allowedDomains = null;
            Path configFile = null;
            Path logFile = null;
            boolean dumpConfig = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--help", "-h" -> {
                        return new CommandLine(overrides, null, false, null, true);
                    }
                    case "--dump-config" -> dumpConfig = true;
                    case "--config" -> configFile = Path.of(value(args, ++i, arg));
                    case "--log-file" -> logFile = Path.of(value(args, ++i, arg));
                    case "--output-dir", "-o" -> overrides.put("output", value(args, ++i, arg));
                    case "--allowed-domains" -> {
                        if (allowedDomains == null) {
                            allowedDomains = overrides.putObject("scope").putArray("allowedDomains");
                        }
                        for (String domain : value(args, ++i, arg).split(",")) {
                            if (!domain.isBlank()) allowedDomains.add(domain.trim());
                        }
                    }
                    case "--max-pages" -> limits(overrides).put("pages", longValue(args, ++i, arg));
                    case "--max-depth" -> limits(overrides).put("depth", intValue(args, ++i, arg));
                    case "--concurrency" -> limits(overrides).put("concurrency", intValue(args, ++i, arg));
                    case "--per-host" -> limits(overrides).put("perOrigin", intValue(args, ++i, arg));
                    case "--timeout" -> crawl(overrides).put("timeout", secondsAsMillis(args, ++i, arg));
                    case "--user-agent" -> crawl(overrides).put("userAgent", value(args, ++i, arg));
                    case "--no-robots" -> crawl(overrides).put("robots", false);
                    case "--render" -> crawl(overrides).put("render", value(args, ++i, arg));
                    case "--no-images" -> crawl(overrides).put("downloadImages", false);
                    case "--delay-ms" -> crawl(overrides).put("delay", longValue(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-")) throw new CrawlConfigException("Unknown option: " + arg);
                        if (seeds == null) seeds = overrides.putArray("seeds");
                        seeds.add(arg);
                    }
                }
            }
            return new CommandLine(overrides, configFile, dumpConfig, logFile, false);
        }

        private static ObjectNode limits(ObjectNode overrides) {
            return overrides.has("limits") ? (ObjectNode) overrides.get("limits") : overrides.putObject("limits");
        }

        private static ObjectNode crawl(ObjectNode overrides) {
            return overrides.has("crawl") ? (ObjectNode) overrides.get("crawl") : overrides.putObject("crawl");
        }

        private static String value(String[] args, int i, String option) throws CrawlConfigException {
            if (i >= args.length) throw new CrawlConfigException("Missing value for " + option);
            return args[i];
        }

        private static long longValue(String[] args, int i, String option) throws CrawlConfigException {
            String value = value(args, i, option);
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new CrawlConfigException("Invalid value for " + option + ": " + value);
            }
        }

        private static int intValue(String[] args, int i, String option) throws CrawlConfigException {
            String value = value(args, i, option);
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new CrawlConfigException("Invalid value for " + option + ": " + value);
            }
        }

        private static long secondsAsMillis(String[] args, int i, String option) throws CrawlConfigException {
            String value = value(args, i, option);
            try {
                return Math.round(Double.parseDouble(value.trim()) * 1000);
            } catch (NumberFormatException e) {
                throw new CrawlConfigException("Invalid value for " + option + ": " + value);
            }
        }
    }
}
