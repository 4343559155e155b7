package com.beautifier.plugins.css;

/**
 * Scanner modes of {@link CssLayoutEngine}. {@code COMMENT} and {@code STRING}
 * return to the mode they were entered from.
 */
public enum CssScanMode {
    /** Outside any block: selectors and at-rule statements. */
    SELECTOR,
    /** Inside braces: declarations or nested rules. */
    BLOCK,
    COMMENT,
    STRING
}
