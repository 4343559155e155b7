package com.beautifier.plugins.html;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

import com.beautifier.api.FormatterPlugin;
import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import com.beautifier.util.LoggerUtil;

/**
 * HTML formatter plugin. Puts every tag on its own line and indents by element
 * nesting.
 */
public class HtmlFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(HtmlFormatter.class);

    private int indentSize = FormatterConfig.DEFAULT_INDENT_SIZE;
    private int lineLength = FormatterConfig.DEFAULT_LINE_LENGTH;
    private Set<String> voidElements = _toNameSet(ConfigurationLoader.DEFAULT_VOID_ELEMENTS);

    @Override
    public void initialize(FormatterConfig config) {
        this.indentSize = config.getIndentSize();
        this.lineLength = config.getLineLength();
        List<String> configured = config.getPluginConfig(
                ConfigurationLoader.HTML_PLUGIN, "voidElements", ConfigurationLoader.DEFAULT_VOID_ELEMENTS);
        this.voidElements = _toNameSet(configured);
        logger.fine("HTML plugin initialized with " + voidElements.size() + " void elements");
    }

    @Override
    public String format(String sourceCode) {
        return new HtmlLayoutEngine(indentSize, lineLength, voidElements).layout(sourceCode);
    }

    Set<String> getVoidElements() {
        return voidElements;
    }

    private static Set<String> _toNameSet(List<?> names) {
        Set<String> result = new LinkedHashSet<>();
        for (Object name : names) {
            if (name != null) {
                result.add(name.toString().trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
