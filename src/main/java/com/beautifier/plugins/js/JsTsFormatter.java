package com.beautifier.plugins.js;

import java.util.logging.Logger;

import com.beautifier.api.FormatterPlugin;
import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import com.beautifier.layout.BracketSplitter;
import com.beautifier.util.LoggerUtil;

/**
 * Formatter plugin shared by JavaScript and TypeScript sources.
 */
public class JsTsFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(JsTsFormatter.class);

    private int indentSize = FormatterConfig.DEFAULT_INDENT_SIZE;
    private int lineLength = FormatterConfig.DEFAULT_LINE_LENGTH;
    private BracketSplitter splitter = BracketSplitter.DEFAULT;

    @Override
    public void initialize(FormatterConfig config) {
        this.indentSize = config.getIndentSize();
        this.lineLength = config.getLineLength();
        int runLength = config.getPluginConfig(
                ConfigurationLoader.JAVASCRIPT_PLUGIN, "bracketRunLength", BracketSplitter.DEFAULT_RUN_LENGTH);
        int lineLimit = config.getPluginConfig(
                ConfigurationLoader.JAVASCRIPT_PLUGIN, "bracketLineLimit", BracketSplitter.DEFAULT_LINE_LIMIT);
        this.splitter = new BracketSplitter(runLength, lineLimit);
        logger.fine("Script plugin initialized (bracket run " + runLength + ", line limit " + lineLimit + ")");
    }

    @Override
    public String format(String sourceCode) {
        return new JsTsLayoutEngine(indentSize, lineLength, splitter).layout(sourceCode);
    }

    BracketSplitter getSplitter() {
        return splitter;
    }
}
