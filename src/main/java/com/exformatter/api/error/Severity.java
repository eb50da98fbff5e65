package com.exformatter.api.error;

public enum Severity {
    FATAL,   // the file could not be formatted and is left untouched
    ERROR,   // the file was processed but needs manual attention
    WARNING, // formatting succeeded with a caveat
    INFO     // notes about applied rewrites
}
