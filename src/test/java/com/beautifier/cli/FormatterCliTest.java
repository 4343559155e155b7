package com.beautifier.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FormatterCliTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    private Path input(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void formatsInputIntoOutput() throws IOException {
        Path in = input("style.css", "a{color:red}");
        Path out = dir.resolve("pretty.css");

        int exit = FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", out.toString(), "-n", "2", "--no-color" });

        assertEquals(0, exit);
        assertEquals("a {\n  color: red;\n}\n", Files.readString(out));
        assertTrue(output().contains("Formatting css file (indent: 2, line length: 80)"), output());
        assertTrue(output().contains("Formatted successfully: " + out), output());
    }

    @Test
    void acceptsEqualsForm() throws IOException {
        Path in = input("app.js", "x=1");
        Path out = dir.resolve("out.js");

        int exit = FormatterCli.run(new String[] {
            "--input=" + in, "--output=" + out, "--indent=2", "--line-length=100", "--no-color" });

        assertEquals(0, exit);
        assertEquals("x = 1;\n", Files.readString(out));
        assertTrue(output().contains("Formatting js file (indent: 2, line length: 100)"), output());
    }

    @Test
    void readsConfigFile() throws IOException {
        Path config = input("custom.yml", "general:\n  indentSize: 3\n");
        Path in = input("page.html", "<div><p>x</p></div>");
        Path out = dir.resolve("page.out.html");

        int exit = FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", out.toString(), "--config=" + config, "--no-color" });

        assertEquals(0, exit);
        assertEquals("<div>\n   <p>\n      x</p>\n</div>\n", Files.readString(out));
    }

    @Test
    void flagsOverrideConfigFile() throws IOException {
        Path config = input("custom.yml", "general:\n  indentSize: 3\n");
        Path in = input("s.css", "a{b:c}");
        Path out = dir.resolve("s.out.css");

        assertEquals(0, FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", out.toString(), "--config=" + config, "-n", "1", "--no-color" }));
        assertEquals("a {\n b: c;\n}\n", Files.readString(out));
    }

    @Test
    void missingRequiredOptionFails() {
        assertEquals(1, FormatterCli.run(new String[] { "-o", dir.resolve("x.css").toString(), "--no-color" }));
        assertTrue(output().contains("Missing required option --input"), output());
    }

    @Test
    void invalidIndentFails() throws IOException {
        Path in = input("a.css", "a{}");
        assertEquals(1, FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", dir.resolve("b.css").toString(), "-n", "wide", "--no-color" }));
        assertTrue(output().contains("Invalid value for --indent: wide"), output());
    }

    @Test
    void indentOutsideConfigRangeFails() throws IOException {
        Path in = input("a.js", "x=1;");
        Path out = dir.resolve("b.js");
        assertEquals(1, FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", out.toString(), "-n", "2000000000", "--no-color" }));
        assertTrue(output().contains("Invalid value for --indent: 2000000000"), output());
        assertTrue(output().contains("Usage:"), output());
        assertFalse(Files.exists(out));
    }

    @Test
    void lineLengthOutsideConfigRangeFails() throws IOException {
        Path in = input("a.js", "x=1;");
        assertEquals(1, FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", dir.resolve("b.js").toString(), "--line-length=5", "--no-color" }));
        assertTrue(output().contains("Invalid value for --line-length: 5"), output());
    }

    @Test
    void unsupportedExtensionFailsWithoutWriting() throws IOException {
        Path in = input("notes.txt", "hello");
        Path out = dir.resolve("out.txt");

        assertEquals(1, FormatterCli.run(new String[] { "-i", in.toString(), "-o", out.toString(), "--no-color" }));
        assertFalse(Files.exists(out));
        assertTrue(output().contains("UNSUPPORTED_EXTENSION"), output());
    }

    @Test
    void missingExtensionFails() throws IOException {
        Path in = input("Makefile", "all:");
        assertEquals(1, FormatterCli.run(new String[] {
            "-i", in.toString(), "-o", dir.resolve("out").toString(), "--no-color" }));
        assertTrue(output().contains("MISSING_EXTENSION"), output());
    }

    @Test
    void unreadableInputFails() {
        Path in = dir.resolve("absent.js");
        Path out = dir.resolve("out.js");

        assertEquals(1, FormatterCli.run(new String[] { "-i", in.toString(), "-o", out.toString(), "--no-color" }));
        assertFalse(Files.exists(out));
        assertTrue(output().contains("INPUT_READ_FAILURE"), output());
    }

    @Test
    void unwritableOutputFails() throws IOException {
        Path in = input("a.css", "a{}");
        Path out = dir.resolve("missing-dir").resolve("a.css");

        assertEquals(1, FormatterCli.run(new String[] { "-i", in.toString(), "-o", out.toString(), "--no-color" }));
        assertTrue(output().contains("OUTPUT_WRITE_FAILURE"), output());
    }

    @Test
    void helpAndVersion() {
        assertEquals(0, FormatterCli.run(new String[] { "--help", "--no-color" }));
        assertTrue(output().contains("Usage:"), output());
        assertEquals(0, FormatterCli.run(new String[] { "-v" }));
        assertTrue(output().contains("version 1.0.0"), output());
    }
}
