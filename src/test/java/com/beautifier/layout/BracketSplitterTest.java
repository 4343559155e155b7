package com.beautifier.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class BracketSplitterTest {

    @Test
    void breaksRunOfThreeClosers() {
        assertEquals("f(g(h(1))\n)", BracketSplitter.DEFAULT.split("f(g(h(1)))", "  ", 0));
    }

    @Test
    void breaksRunOfOpenersAndIndentsByDepth() {
        assertEquals("[[[\n      1]]\n]", BracketSplitter.DEFAULT.split("[[[1]]]", "  ", 0));
    }

    @Test
    void leavesShortRunsAlone() {
        assertEquals("f(g(x))", BracketSplitter.DEFAULT.split("f(g(x))", "  ", 0));
    }

    @Test
    void honoursConfiguredRunLength() {
        assertEquals("f(g(x)\n)", new BracketSplitter(2, 80).split("f(g(x))", "  ", 0));
    }

    @Test
    void breaksAfterOpenerPastLineLimit() {
        assertEquals("aaaaaaaaaaaa(\n b)", new BracketSplitter(3, 10).split("aaaaaaaaaaaa(b)", " ", 0));
    }

    @Test
    void ignoresDelimitersInStringsAndComments() {
        assertEquals("s = \"(((\";", BracketSplitter.DEFAULT.split("s = \"(((\";", "  ", 0));
        assertEquals("x // ((((\ny", BracketSplitter.DEFAULT.split("x // ((((\ny", "  ", 0));
        assertEquals("/* ]]] */ x", BracketSplitter.DEFAULT.split("/* ]]] */ x", "  ", 0));
    }

    @Test
    void reindentsLinesFromBaseLevel() {
        assertEquals("a\n  b", BracketSplitter.DEFAULT.split("a\nb", "  ", 1));
        assertEquals("{\n  a\n}", BracketSplitter.DEFAULT.split("{\n      a\n   }", "  ", 0));
    }

    @Test
    void splitOpenerFollowedByLineBreakLeavesNoBlankLine() {
        assertEquals(
            "f(function() {\n    x();\n  })",
            BracketSplitter.DEFAULT.split("f(function() {\n  x();\n})", "  ", 0));
    }

    @Test
    void collapsesWhitespaceOutsideLiterals() {
        assertEquals("a b 'c  d'", BracketSplitter.DEFAULT.split("a    b 'c  d'", "  ", 0));
    }

    @Test
    void unmatchedClosersNeverIndentBelowBase() {
        assertEquals(")\n]", BracketSplitter.DEFAULT.split(")\n]", "  ", 0));
    }
}
