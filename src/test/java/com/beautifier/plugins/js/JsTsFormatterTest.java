package com.beautifier.plugins.js;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.HashMap;
import java.util.Map;

import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import org.junit.jupiter.api.Test;

public class JsTsFormatterTest {

    @Test
    void buildsSplitterFromConfig() {
        Map<String, Object> general = new HashMap<>();
        general.put(FormatterConfig.INDENT_SIZE, 2);
        Map<String, Object> script = new HashMap<>();
        script.put("bracketRunLength", 2);
        script.put("bracketLineLimit", 60);
        Map<String, Map<String, Object>> plugins = new HashMap<>();
        plugins.put(ConfigurationLoader.JAVASCRIPT_PLUGIN, script);

        JsTsFormatter formatter = new JsTsFormatter();
        formatter.initialize(new FormatterConfig(general, plugins));

        assertEquals(2, formatter.getSplitter().getRunLength());
        assertEquals(60, formatter.getSplitter().getLineLimit());
        assertEquals("x = f(g(1)\n);\n", formatter.format("x=f(g(1));"));
    }

    @Test
    void fallsBackToDefaults() {
        JsTsFormatter formatter = new JsTsFormatter();
        formatter.initialize(new FormatterConfig(new HashMap<>(), new HashMap<>()));
        assertEquals(3, formatter.getSplitter().getRunLength());
        assertEquals(80, formatter.getSplitter().getLineLimit());
    }
}
