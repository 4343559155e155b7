package com.beautifier.api;

import com.beautifier.config.FormatterConfig;

/**
 * Interface for language-specific layout plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Lay out already normalized source text. Never fails on malformed content.
     */
    String format(String sourceCode);
}
