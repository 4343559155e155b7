package com.beautifier.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import com.beautifier.api.error.FormatterException;
import com.beautifier.config.ConfigurationLoader;
import com.beautifier.config.FormatterConfig;
import com.beautifier.plugins.FileType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class FixtureFormattingTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "page.html",
        "rules.css",
        "app.js",
        "typed.ts",
    })
    void test(String fixture) throws IOException, FormatterException {
        int dot = fixture.lastIndexOf('.');
        String baseName = fixture.substring(0, dot);
        String extension = fixture.substring(dot);
        String in = read(baseName + ".in" + extension);
        String out = read(baseName + ".out" + extension);

        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
            .withGeneral(FormatterConfig.INDENT_SIZE, 2);
        SourceFormatter formatter = SourceFormatter.createDefault(config);
        FileType type = FileType.detect(Path.of(fixture));

        assertEquals(out, formatter.format(type, in));
        // formatting the expected output again leaves it unchanged
        assertEquals(out, formatter.format(type, out));
    }

    private static String read(String name) throws IOException {
        try (InputStream is = FixtureFormattingTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
