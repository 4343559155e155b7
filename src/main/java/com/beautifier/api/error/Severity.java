package com.beautifier.api.error;

public enum Severity {
    FATAL,   // The file could not be formatted at all
    ERROR,   // Issues requiring manual intervention
    WARNING, // Non-critical issues
    INFO     // Informational messages about formatting
}
