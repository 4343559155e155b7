package com.beautifier.plugins;

import java.nio.file.Path;
import java.util.Locale;

import com.beautifier.api.error.ErrorKind;
import com.beautifier.api.error.FormatterException;

/**
 * Enum representing the supported languages, detected from the file extension only.
 */
public enum FileType {
    HTML("html"),
    CSS("css"),
    JAVASCRIPT("js"),
    TYPESCRIPT("ts");

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type from the extension of the file name, ignoring case.
     *
     * @param filePath the path to the file
     * @return the detected FileType
     * @throws FormatterException if the name has no extension or an unsupported one
     */
    public static FileType detect(Path filePath) throws FormatterException {
        Path fileName = filePath.getFileName();
        String name = fileName == null ? "" : fileName.toString();

        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            throw new FormatterException(ErrorKind.MISSING_EXTENSION, filePath, null);
        }

        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "html" -> HTML;
            case "css" -> CSS;
            case "js" -> JAVASCRIPT;
            case "ts" -> TYPESCRIPT;
            default -> throw new FormatterException(ErrorKind.UNSUPPORTED_EXTENSION, filePath, "." + extension);
        };
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case HTML -> "HTML document";
            case CSS -> "CSS stylesheet";
            case JAVASCRIPT -> "JavaScript source file";
            case TYPESCRIPT -> "TypeScript source file";
        };
    }
}
