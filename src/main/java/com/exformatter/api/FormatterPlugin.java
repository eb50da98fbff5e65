package com.exformatter.api;

import java.nio.file.Path;

import com.exformatter.config.FormatterConfig;

/**
 * Formats the files of one language.
 */
public interface FormatterPlugin {
    /**
     * The key of the plugin section in the configuration.
     */
    String getName();

    /**
     * Reads the plugin's options. Called once, before any file is formatted.
     *
     * @throws IllegalArgumentException when the configuration holds an invalid option
     */
    void initialize(FormatterConfig config);

    /**
     * Formats {@code sourceCode}. Failures are reported in the result; the
     * formatted code of an unsuccessful result is the unchanged source.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
