package com.beautifier.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class OperatorSpacerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "a+b          | a + b",
        "a  +  b      | a + b",
        "x==y         | x == y",
        "a===b        | a === b",
        "a>=b         | a >= b",
        "'a&&b||c'    | 'a && b || c'",
        "x=>y         | x => y",
        "i+=1;        | i += 1;",
        "f(a,b)       | f(a, b)",
        "f( a )       | f(a)",
        "a;b          | a; b",
        "if(x){       | if(x) {",
        "i++)         | i++)",
        "x--;         | x--;",
        "++i          | ++i",
        "a+++b        | a++ + b",
        "x++==y       | x++ == y",
    })
    void spacesOperatorsAndSeparators(String input, String expected) {
        assertEquals(expected, OperatorSpacer.SCRIPT.space(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "x = a + b;",
        "if(a && b) {",
        "f(a, b) => a * 2",
        "s = 'a+b';",
        "for(i = 0; i < n; i++) {",
    })
    void isIdempotentOnSpacedText(String spaced) {
        assertEquals(spaced, OperatorSpacer.SCRIPT.space(spaced));
        String once = OperatorSpacer.SCRIPT.space("x=a+b;");
        assertEquals(once, OperatorSpacer.SCRIPT.space(once));
    }

    @Test
    void copiesStringLiteralsUntouched() {
        assertEquals("s = 'a+b'", OperatorSpacer.SCRIPT.space("s='a+b'"));
        assertEquals("s = \"it\\\"s=x\"", OperatorSpacer.SCRIPT.space("s=\"it\\\"s=x\""));
        assertEquals("t = `a,b`", OperatorSpacer.SCRIPT.space("t=`a,b`"));
    }

    @Test
    void markupTextTreatsApostropheAsText() {
        assertEquals("don't a + b", OperatorSpacer.MARKUP_TEXT.space("don't a+b"));
    }

    @Test
    void stylesheetSpacesOnlyCombinators() {
        assertEquals("h1, h2 > p", OperatorSpacer.STYLESHEET.space("h1,h2>p"));
        assertEquals("ul li > a + b ~ c", OperatorSpacer.STYLESHEET.space("ul li>a+b~c"));
        assertEquals("font-size", OperatorSpacer.STYLESHEET.space("font-size"));
        assertEquals("red !important", OperatorSpacer.STYLESHEET.space("red !important"));
    }

    @Test
    void keepsIndentationAtLineStart() {
        assertEquals("  x = 1", OperatorSpacer.SCRIPT.space("  x=1"));
        assertEquals("a\n  b = 1", OperatorSpacer.SCRIPT.space("a\n  b=1"));
    }

    @Test
    void usesPrecedingCharacterForLeadingOperator() {
        assertEquals(" + b", OperatorSpacer.SCRIPT.space("+b", 'a'));
        assertEquals("+ b", OperatorSpacer.SCRIPT.space("+b"));
        assertEquals("+ b", OperatorSpacer.SCRIPT.space("+b", '('));
    }

    @Test
    void noSpaceBeforeClosersOrAtEnd() {
        assertEquals("a,", OperatorSpacer.SCRIPT.space("a,"));
        assertEquals("f(a, b)", OperatorSpacer.SCRIPT.space("f(a , b )"));
        assertEquals("x = -", OperatorSpacer.SCRIPT.space("x=-"));
    }
}
