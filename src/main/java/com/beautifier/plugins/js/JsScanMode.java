package com.beautifier.plugins.js;

/**
 * Scanner modes of {@link JsTsLayoutEngine}.
 */
public enum JsScanMode {
    CODE,
    /** Inside a quoted or template literal; the opening quote is remembered. */
    STRING,
    LINE_COMMENT,
    BLOCK_COMMENT
}
