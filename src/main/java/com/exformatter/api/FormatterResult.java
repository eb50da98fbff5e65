package com.exformatter.api;

import java.util.List;

import com.exformatter.api.error.FormatterError;

/**
 * Outcome of formatting one file: the new code and the rewrites it carries,
 * or the errors that kept the file as it was.
 */
public final class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final List<Refactoring> appliedRefactorings;

    private FormatterResult(boolean successful, String formattedCode,
                            List<FormatterError> errors, List<Refactoring> appliedRefactorings) {
        this.successful = successful;
        this.formattedCode = formattedCode;
        this.errors = List.copyOf(errors);
        this.appliedRefactorings = List.copyOf(appliedRefactorings);
    }

    /** A successful result. */
    public static FormatterResult formatted(String formattedCode, List<Refactoring> appliedRefactorings) {
        return new FormatterResult(true, formattedCode, List.of(), appliedRefactorings);
    }

    /** An unsuccessful result that leaves {@code sourceCode} as it was. */
    public static FormatterResult failure(String sourceCode, FormatterError error) {
        return new FormatterResult(false, sourceCode, List.of(error), List.of());
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The formatted code, or the untouched source when formatting failed. Null
     * when the file could not be read.
     */
    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public List<Refactoring> getAppliedRefactorings() {
        return appliedRefactorings;
    }

    /**
     * True when formatting succeeded and produced something other than {@code source}.
     */
    public boolean changes(String source) {
        return successful && formattedCode != null && !formattedCode.equals(source);
    }
}
