package com.beautifier.api;

import java.nio.file.Path;

/**
 * The main formatter interface that all implementations must provide.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
}
