package com.exformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.exformatter.api.CodeFormatter;
import com.exformatter.api.FormatterPlugin;
import com.exformatter.api.FormatterResult;
import com.exformatter.api.error.FormatterError;
import com.exformatter.api.error.Severity;
import com.exformatter.config.ConfigurationLoader;
import com.exformatter.config.FormatterConfig;
import com.exformatter.plugins.FileType;
import com.exformatter.util.LoggerUtil;

/**
 * Dispatches files to the plugin registered for their {@link FileType}.
 * <p>
 * Safe to use from several threads. A failure in one file never stops the
 * others: it is reported in that file's {@link FormatterResult}.
 */
public class FormatterEngine implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(FormatterEngine.class);
    private static final long DIRECTORY_TIMEOUT_MINUTES = 30;

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;
    private final List<PathMatcher> ignored = new ArrayList<>();

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public FormatterEngine(FormatterConfig config) {
        this.config = config;
        List<?> patterns = config.getGeneralConfig(ConfigurationLoader.IGNORE_FILES, List.of());
        for (Object pattern : patterns) {
            ignored.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        logger.fine("Formatter engine created, " + ignored.size() + " ignore patterns");
    }

    /**
     * Registers {@code plugin} for {@code fileType} and initializes it with
     * this engine's configuration.
     *
     * @throws IllegalArgumentException when the plugin rejects the configuration
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugin.initialize(config);
        plugins.put(fileType, plugin);
        logger.fine("Registered " + plugin.getName() + " plugin for " + fileType.getDescription());
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.failure(sourceCode, new FormatterError(
                    Severity.ERROR, "No plugin registered for file type: " + fileType, 1, 1));
        }

        processedFileCount.incrementAndGet();
        try {
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Formatted: " + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.fine("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }
            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);
            return FormatterResult.failure(sourceCode, FormatterError.fatal(
                    "Unexpected error: " + e, 1, 1, "Please report this as a formatter bug"));
        }
    }

    @Override
    public FormatterResult formatPath(Path file) {
        try {
            return formatFile(file, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read " + file, e);
            errorCount.incrementAndGet();
            return FormatterResult.failure(null, FormatterError.fatal(
                    "Failed to read file: " + e.getMessage(), 1, 1, null));
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported file under {@code directory} on
     * {@code threadCount} threads. Results are not written back.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        Map<Path, FormatterResult> results = new ConcurrentHashMap<>();

        List<Path> filesToProcess;
        try {
            filesToProcess = findFiles(directory);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }
        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> results.put(file, formatPath(file)));
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(DIRECTORY_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Lists the files under {@code root} that a registered plugin handles and
     * no ignore pattern matches, in path order. A regular file is returned
     * as is when it is supported.
     */
    public List<Path> findFiles(Path root) throws IOException {
        if (!Files.exists(root)) {
            logger.warning("Path does not exist: " + root);
            return List.of();
        }
        if (Files.isRegularFile(root)) {
            return isSupported(root) ? List.of(root) : List.of();
        }

        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(path -> !isIgnored(root.relativize(path)))
                    .filter(this::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isSupported(Path path) {
        FileType type = FileType.detect(path);
        return type != FileType.UNKNOWN && plugins.containsKey(type);
    }

    private boolean isIgnored(Path relative) {
        for (PathMatcher matcher : ignored) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes every plugin that holds resources. All plugins are closed even
     * when one fails; the first failure is rethrown.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter engine: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }
        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
