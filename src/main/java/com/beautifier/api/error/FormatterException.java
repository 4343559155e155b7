package com.beautifier.api.error;

import java.nio.file.Path;

/**
 * A terminal failure of a formatting run, attributed to the file that caused it.
 */
public class FormatterException extends Exception {
    private final ErrorKind kind;
    private final Path path;

    public FormatterException(ErrorKind kind, Path path, String detail) {
        this(kind, path, detail, null);
    }

    public FormatterException(ErrorKind kind, Path path, String detail, Throwable cause) {
        super(_message(kind, path, detail), cause);
        this.kind = kind;
        this.path = path;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Converts this exception into a FATAL error entry for a result.
     */
    public FormatterError toError() {
        return new FormatterError(Severity.FATAL, kind, getMessage(), path);
    }

    private static String _message(ErrorKind kind, Path path, String detail) {
        StringBuilder sb = new StringBuilder(kind.getDescription());
        if (detail != null && !detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        if (path != null) {
            sb.append(" [").append(path).append("]");
        }
        return sb.toString();
    }
}
