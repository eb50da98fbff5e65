package com.exformatter.cli;

import com.exformatter.api.FormatterResult;
import com.exformatter.api.Refactoring;
import com.exformatter.api.error.FormatterError;
import com.exformatter.config.ConfigurationLoader;
import com.exformatter.config.FormatterConfig;
import com.exformatter.core.FormatterEngine;
import com.exformatter.plugins.FileType;
import com.exformatter.plugins.elixir.ElixirFormatterPlugin;
import com.exformatter.util.ErrorFormatter;
import com.exformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code exformatter format|check|init}.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".exformatter.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);
    private static PrintStream out = System.out;

    public static void main(String[] args) {
        int status;
        try {
            status = run(args, System.out);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(status);
    }

    /**
     * Runs a command and returns the process exit status.
     */
    static int run(String[] args, PrintStream output) {
        out = output;
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color") && !_hasOption(args, "--ci"));

        if (args.length < 1) {
            _printUsage();
            return EXIT_FAILURE;
        }

        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        try {
            switch (args[0]) {
                case "format":
                    return _processFiles(args, true);
                case "check":
                    return _processFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("exformatter " + VERSION);
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + args[0]);
                    _printUsage();
                    return EXIT_FAILURE;
            }
        } catch (IOException | IllegalArgumentException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Command failed: " + args[0], e);
            return EXIT_FAILURE;
        }
    }

    private static void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "exformatter v" + VERSION));
        out.println("Usage:");
        out.println("  exformatter init [--force]        - Write a default " + CONFIG_FILE_NAME);
        out.println("  exformatter format <path>         - Format .ex and .exs files in path");
        out.println("  exformatter check <path>          - Fail if any file in path is not formatted");
        out.println("  exformatter --help|-h             - Show this help");
        out.println("  exformatter --version|-v          - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --line-length=<n>                 - Override the configured line length");
        out.println("  --include=<glob>                  - Only include files whose name matches");
        out.println("  --verbose                         - Show detailed output");
        out.println("  --ci                              - CI friendly output (no colors, no summary)");
        out.println("  --no-color                        - Disable colored output");
        out.println("  --force                           - Overwrite an existing config (with init)");
    }

    /**
     * Formats, or with {@code write} false only checks, every file under the
     * path argument.
     */
    private static int _processFiles(String[] args, boolean write) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_FAILURE;
        }

        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return EXIT_FAILURE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        int changedCount = 0;
        int errorCount = 0;
        Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();

        FormatterEngine engine = _createEngine(config);
        try {
            List<Path> files = _filterIncluded(engine.findFiles(path), _getOptionValue(args, "--include"));
            if (verbose) {
                _printInfo("Found " + files.size() + " files");
            }

            Instant start = Instant.now();
            for (Path file : files) {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                FormatterResult result = engine.formatFile(file, source);

                if (!result.isSuccessful()) {
                    errorCount++;
                    errorsByFile.put(file, result.getErrors());
                    for (FormatterError error : result.getErrors()) {
                        _printError(errorFormatter.formatError(file, error));
                    }
                    continue;
                }

                if (result.changes(source)) {
                    changedCount++;
                    if (write) {
                        Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                        _printSuccess("Formatted: " + file);
                    } else {
                        _printWarning("Not formatted: " + file);
                    }
                    if (verbose) {
                        for (Refactoring refactoring : result.getAppliedRefactorings()) {
                            _printInfo("  " + refactoring);
                        }
                    }
                } else if (verbose) {
                    _printInfo("Already formatted: " + file);
                }
            }

            if (!ciMode) {
                out.println();
                out.println((write ? "Formatted " : "Checked ") + files.size() + " files in "
                        + _formatDuration(Duration.between(start, Instant.now())) + ": "
                        + changedCount + (write ? " changed, " : " need formatting, ")
                        + errorCount + " with errors");
                if (!errorsByFile.isEmpty()) {
                    out.println(errorFormatter.formatErrorSummary(errorsByFile));
                }
            }
        } finally {
            _close(engine);
        }

        if (errorCount > 0) {
            return EXIT_FAILURE;
        }
        return !write && changedCount > 0 ? EXIT_FAILURE : EXIT_OK;
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_FAILURE;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config = ConfigurationLoader.loadConfig(
                Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME));

        String lineLength = _getOptionValue(args, "--line-length");
        if (lineLength != null) {
            try {
                config = config.withGeneralConfig(ConfigurationLoader.LINE_LENGTH, Integer.parseInt(lineLength));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid --line-length: " + lineLength, e);
            }
        }
        return config;
    }

    private static FormatterEngine _createEngine(FormatterConfig config) {
        FormatterEngine engine = new FormatterEngine(config);
        ElixirFormatterPlugin plugin = new ElixirFormatterPlugin();
        engine.registerPlugin(FileType.ELIXIR, plugin);
        engine.registerPlugin(FileType.ELIXIR_SCRIPT, plugin);
        return engine;
    }

    private static void _close(FormatterEngine engine) {
        try {
            engine.close();
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to close formatter engine", e);
        }
    }

    private static List<Path> _filterIncluded(List<Path> files, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return files;
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + includePattern);
        List<Path> included = new ArrayList<>();
        for (Path file : files) {
            if (matcher.matches(file.getFileName())) {
                included.add(file);
            }
        }
        return included;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
