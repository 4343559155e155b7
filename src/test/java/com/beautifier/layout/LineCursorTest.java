package com.beautifier.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class LineCursorTest {

    @Test
    void tracksCurrentLineLength() {
        LineCursor cursor = new LineCursor();
        cursor.append("ab");
        assertEquals(2, cursor.lineLength());
        cursor.append("\ncde");
        assertEquals(3, cursor.lineLength());
    }

    @Test
    void newlineStartsIndentedLine() {
        IndentState indent = new IndentState(2);
        indent.increment();
        LineCursor cursor = new LineCursor().append('x').newline(indent);
        assertEquals("x\n  ", cursor.toString());
        assertEquals(2, cursor.lineLength());
        assertTrue(cursor.isLineBlank());
    }

    @Test
    void newlineOnBlankLineReindentsInPlace() {
        LineCursor cursor = new LineCursor().append("x\n    ");
        cursor.newline("  ");
        assertEquals("x\n  ", cursor.toString());
        cursor.newline("");
        assertEquals("x\n", cursor.toString());
    }

    @Test
    void newlineOnEmptyBufferOnlyIndents() {
        assertEquals("  ", new LineCursor().newline("  ").toString());
    }

    @Test
    void reindentOnlyTouchesBlankLines() {
        LineCursor cursor = new LineCursor().append("x\n    ");
        cursor.reindent("  ");
        assertEquals("x\n  ", cursor.toString());
        cursor.append('y').reindent("      ");
        assertEquals("x\n  y", cursor.toString());
    }

    @Test
    void trimTrailingSpacesKeepsIndentation() {
        LineCursor cursor = new LineCursor().append("  ab  ");
        cursor.trimTrailingSpaces();
        assertEquals("  ab", cursor.toString());
        assertEquals(4, cursor.lineLength());

        LineCursor blank = new LineCursor().append("a\n    ");
        blank.trimTrailingSpaces();
        assertEquals("a\n    ", blank.toString());
    }

    @Test
    void reportsLastCharacter() {
        LineCursor cursor = new LineCursor();
        assertEquals('\0', cursor.lastChar());
        assertTrue(cursor.isLineBlank());
        cursor.append("a;");
        assertEquals(';', cursor.lastChar());
        assertFalse(cursor.isLineBlank());
    }

    @Test
    void indentLevelSaturatesAtZero() {
        IndentState indent = new IndentState(4);
        indent.decrement();
        assertEquals(0, indent.getLevel());
        indent.increment();
        indent.increment();
        assertEquals("        ", indent.render());
        assertEquals(8, indent.width());
        assertEquals("    ", indent.render(1));
        assertEquals("", new IndentState("\t", -3).render());
    }
}
