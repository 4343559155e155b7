package com.beautifier.plugins.css;

import java.util.logging.Logger;

import com.beautifier.api.FormatterPlugin;
import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import com.beautifier.util.LoggerUtil;

/**
 * CSS formatter plugin.
 */
public class CssFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(CssFormatter.class);

    public static final int DEFAULT_COMPACT_DECLARATION_LIMIT = 3;

    private int indentSize = FormatterConfig.DEFAULT_INDENT_SIZE;
    private int lineLength = FormatterConfig.DEFAULT_LINE_LENGTH;
    private int compactDeclarationLimit = DEFAULT_COMPACT_DECLARATION_LIMIT;

    @Override
    public void initialize(FormatterConfig config) {
        this.indentSize = config.getIndentSize();
        this.lineLength = config.getLineLength();
        this.compactDeclarationLimit = config.getPluginConfig(
                ConfigurationLoader.CSS_PLUGIN, "compactDeclarationLimit", DEFAULT_COMPACT_DECLARATION_LIMIT);
        logger.fine("CSS plugin initialized, compact blocks up to " + compactDeclarationLimit + " declarations");
    }

    @Override
    public String format(String sourceCode) {
        return new CssLayoutEngine(indentSize, lineLength, compactDeclarationLimit).layout(sourceCode);
    }
}
