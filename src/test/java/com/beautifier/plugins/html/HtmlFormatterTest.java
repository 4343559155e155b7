package com.beautifier.plugins.html;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Set;

import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import org.junit.jupiter.api.Test;

public class HtmlFormatterTest {

    @Test
    void readsVoidElementsFromConfig() {
        HtmlFormatter formatter = new HtmlFormatter();
        formatter.initialize(ConfigurationLoader.loadDefaultConfig().withGeneral(FormatterConfig.INDENT_SIZE, 2));
        assertEquals(Set.of("meta", "link", "img", "br", "hr"), formatter.getVoidElements());
        assertEquals("<div>\n  <hr>\n  <input>\n    x\n", formatter.format("<div><hr><input>x"));
    }
}
