package com.mimecast.phishguard;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mimecast.phishguard.analysis.AnalysisResponse;
import com.mimecast.phishguard.analysis.EmailAnalyzer;
import com.mimecast.phishguard.config.AnalyzerConfig;
import com.mimecast.phishguard.endpoints.AnalyzerEndpoint;
import com.mimecast.phishguard.mime.MalformedMessageException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Analyzes a single message from the command line or runs the HTTP endpoint.
 *
 * @see AnalyzerEndpoint
 */
public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    /**
     * Application jar name.
     */
    private static final String NAME = "phishguard.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Phishing email classifier";

    private final String[] args;

    /**
     * Exit status of the last run, 0 on success.
     */
    private int status = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        // Logging stays off unless asked for.
        List<String> list = Arrays.asList(args);
        if (!list.contains("-v") && !list.contains("--verbose")) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);
        }

        Main main = new Main(args);
        if (main.getStatus() != 0) {
            System.exit(main.getStatus());
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        // Parse options.
        Optional<CommandLine> opt = parseArgs(options());

        if (opt.isPresent()) {
            CommandLine cmd = opt.get();

            try {
                if (cmd.hasOption("server")) {
                    runServer(loadConfig(cmd));
                } else if (cmd.hasOption("file")) {
                    analyzeFile(loadConfig(cmd), cmd.getOptionValue("file"));
                } else if (cmd.hasOption("text")) {
                    analyzeText(loadConfig(cmd), cmd.getOptionValue("text"), cmd.getOptionValue("subject"));
                } else {
                    optionsUsage(options());
                }
            } catch (IOException e) {
                log.error("Run failed: {}", e.getMessage(), e);
                log("Error: " + e.getMessage());
                status = 1;
            } catch (MalformedMessageException e) {
                log.warn("Malformed message: {}", e.getMessage());
                log("Failed to parse email message: " + e.getMessage());
                status = 2;
            }
        }

        // Bad options.
        else {
            status = 1;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "conf", true, "Path to configuration file (Default: bundled analyzer.json5)");
        options.addOption("f", "file", true, "EML file to analyze");
        options.addOption("t", "text", true, "Message body text to analyze");
        options.addOption("s", "subject", true, "Subject for --text");
        options.addOption(null, "server", false, "Run the HTTP endpoint");
        options.addOption("v", "verbose", false, "Enable logging");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                .setShowSince(false)
                .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            throw new RuntimeException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Loads configuration from --conf or the classpath default.
     *
     * @param cmd CommandLine instance.
     * @return AnalyzerConfig instance.
     * @throws IOException Unable to read configuration.
     */
    private AnalyzerConfig loadConfig(CommandLine cmd) throws IOException {
        if (cmd.hasOption("conf")) {
            return new AnalyzerConfig(cmd.getOptionValue("conf"));
        }
        return AnalyzerConfig.defaults();
    }

    private void analyzeFile(AnalyzerConfig config, String path) throws IOException, MalformedMessageException {
        byte[] bytes = Files.readAllBytes(Path.of(path));
        print(EmailAnalyzer.fromConfig(config).analyzeEml(bytes));
    }

    private void analyzeText(AnalyzerConfig config, String body, String subject) throws IOException {
        print(EmailAnalyzer.fromConfig(config).analyzeText(body, subject, null));
    }

    /**
     * Starts the endpoint and blocks until the JVM shuts down.
     *
     * @param config AnalyzerConfig instance.
     * @throws IOException Unable to bind.
     */
    private void runServer(AnalyzerConfig config) throws IOException {
        AnalyzerEndpoint endpoint = new AnalyzerEndpoint(EmailAnalyzer.fromConfig(config));
        endpoint.start(config.getEndpoint());
        log("Listening on port " + endpoint.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            endpoint.stop();
        }));
    }

    private void print(AnalysisResponse response) {
        Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
        log(gson.toJson(response));
    }

    /**
     * Gets exit status.
     *
     * @return Status code.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
