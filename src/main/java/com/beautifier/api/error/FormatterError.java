package com.beautifier.api.error;

import java.nio.file.Path;

/**
 * Represents an error found during formatting.
 */
public class FormatterError {
    private final Severity severity;
    private final ErrorKind kind;
    private final String message;
    private final Path file;

    public FormatterError(Severity severity, ErrorKind kind, String message, Path file) {
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.file = file;
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public Path getFile() { return file; }
}
