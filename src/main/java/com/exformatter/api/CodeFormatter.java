package com.exformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Formats single sources, files on disk and whole trees with the plugins
 * registered for their file types. Results are returned, never written.
 */
public interface CodeFormatter {
    /**
     * Formats {@code sourceCode} as the contents of {@code filePath}.
     */
    FormatterResult formatFile(Path filePath, String sourceCode);

    /**
     * Reads {@code file} as UTF-8 and formats it.
     */
    FormatterResult formatPath(Path file);

    /**
     * Formats every supported file under {@code directory}, keyed by path.
     */
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
