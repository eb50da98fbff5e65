package com.exformatter.plugins.elixir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

import com.exformatter.algebra.DocRenderer;
import com.exformatter.api.FormatterPlugin;
import com.exformatter.api.FormatterResult;
import com.exformatter.api.Refactoring;
import com.exformatter.api.error.FormatterError;
import com.exformatter.config.ConfigurationLoader;
import com.exformatter.config.FormatterConfig;
import com.exformatter.plugins.elixir.format.FormatterState;
import com.exformatter.plugins.elixir.parser.ParseException;
import com.exformatter.util.LoggerUtil;

/**
 * Formats {@code .ex} and {@code .exs} files.
 * <p>
 * Options are read from the {@code elixir} plugin section and the general
 * {@code lineLength}. Results are cached by path and content, so formatting
 * an unchanged file twice does the work once.
 */
public class ElixirFormatterPlugin implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(ElixirFormatterPlugin.class);
    private static final int CACHE_SIZE = 100;

    private FormatOptions baseOptions = FormatOptions.defaults();
    private boolean checkEquivalent = true;

    // Insertion ordered: lookups happen under the read lock and must not reorder entries
    private final Map<CacheKey, FormatterResult> resultCache = new LinkedHashMap<CacheKey, FormatterResult>(CACHE_SIZE, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<CacheKey, FormatterResult> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public String getName() {
        return ConfigurationLoader.ELIXIR_PLUGIN;
    }

    /**
     * @throws IllegalArgumentException for an invalid line length, local name or version
     */
    @Override
    public void initialize(FormatterConfig config) {
        String plugin = getName();
        Object version = config.getPluginConfig(plugin, ConfigurationLoader.RENAME_DEPRECATED_AT, null);

        baseOptions = FormatOptions.builder()
                .lineLength(config.getGeneralConfig(ConfigurationLoader.LINE_LENGTH,
                        FormatOptions.DEFAULT_LINE_LENGTH))
                .localsWithoutParens(config.getPluginConfigList(plugin, ConfigurationLoader.LOCALS_WITHOUT_PARENS))
                .renameDeprecatedAt(version == null ? null : version.toString())
                .build();
        checkEquivalent = config.getPluginConfig(plugin, ConfigurationLoader.CHECK_EQUIVALENT, true);
        clearCache();

        logger.fine("Elixir plugin initialized: lineLength=" + baseOptions.getLineLength()
                + ", checkEquivalent=" + checkEquivalent);
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        CacheKey cacheKey = new CacheKey(filePath, sourceCode);

        readLock.lock();
        try {
            FormatterResult cached = resultCache.get(cacheKey);
            if (cached != null) {
                return cached;
            }
        } finally {
            readLock.unlock();
        }

        FormatterResult result = formatUncached(filePath, sourceCode);

        writeLock.lock();
        try {
            resultCache.put(cacheKey, result);
        } finally {
            writeLock.unlock();
        }
        return result;
    }

    /** Path plus the full source text. */
    private record CacheKey(Path path, String source) {
    }

    private FormatterResult formatUncached(Path filePath, String sourceCode) {
        FormatOptions options = baseOptions.toBuilder().file(filePath.toString()).build();

        ElixirFormatter.Translation translation;
        String formatted;
        try {
            translation = ElixirFormatter.translate(sourceCode, options);
            formatted = DocRenderer.render(translation.doc(), options.getLineLength()) + "\n";
        } catch (ParseException e) {
            logger.fine("Cannot parse " + e.describe(options.getFile()));
            return FormatterResult.failure(sourceCode, parseError(e, "Fix the syntax error and run the formatter again"));
        }

        if (checkEquivalent) {
            Optional<FormatterError> mismatch = verify(sourceCode, formatted);
            if (mismatch.isPresent()) {
                logger.warning("Formatting would change the meaning of " + filePath + ", leaving it untouched");
                return FormatterResult.failure(sourceCode, mismatch.get());
            }
        }

        List<Refactoring> refactorings = new ArrayList<>();
        for (FormatterState.Rename rename : translation.renames()) {
            refactorings.add(Refactoring.renamedDeprecated(
                    rename.line(), rename.module(), rename.from(), rename.to(), rename.arity()));
        }
        return FormatterResult.formatted(formatted, refactorings);
    }

    /**
     * Compares the trees of the source and its formatted version. Renames of
     * deprecated calls are meant to change the tree and are not checked.
     */
    private Optional<FormatterError> verify(String sourceCode, String formatted) {
        if (baseOptions.getRenameDeprecatedAt() != null) {
            return Optional.empty();
        }
        try {
            return Equivalence.check(sourceCode, formatted)
                    .map(difference -> FormatterError.fatal(
                            "Formatted code is not equivalent to the original: " + difference.left()
                                    + " became " + difference.right(),
                            1, 1, "Please report this as a formatter bug"));
        } catch (ParseException e) {
            return Optional.of(parseError(e, "The formatter produced code it cannot read back; please report this"));
        }
    }

    private static FormatterError parseError(ParseException e, String suggestion) {
        return FormatterError.fatal(e.getDetail(), e.getLine(), e.getColumn(), suggestion);
    }

    public void clearCache() {
        writeLock.lock();
        try {
            resultCache.clear();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        clearCache();
    }
}
