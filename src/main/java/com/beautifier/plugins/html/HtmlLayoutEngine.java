package com.beautifier.plugins.html;

import java.util.Set;

import com.beautifier.layout.IndentState;
import com.beautifier.layout.LayoutText;
import com.beautifier.layout.LineCursor;
import com.beautifier.layout.OperatorSpacer;
import com.beautifier.layout.SourceReader;

/**
 * Lays out HTML one tag per line, indenting by element nesting.
 * <p>
 * An engine instance formats a single document and is then discarded.
 */
public class HtmlLayoutEngine {
    private final IndentState indent;
    private final int maxLineLength;
    private final Set<String> voidElements;

    private final LineCursor cursor = new LineCursor();
    private final StringBuilder tag = new StringBuilder();
    private HtmlScanMode mode = HtmlScanMode.TEXT;
    private char attributeQuote;

    public HtmlLayoutEngine(int indentSize, int maxLineLength, Set<String> voidElements) {
        this.indent = new IndentState(indentSize);
        this.maxLineLength = maxLineLength;
        this.voidElements = voidElements;
    }

    public String layout(String source) {
        SourceReader reader = new SourceReader(source);
        while (reader.hasNext()) {
            char c = reader.next();
            switch (mode) {
                case TEXT -> scanText(c, reader);
                case TAG -> scanTag(c);
                case TAG_QUOTE -> scanQuotedValue(c);
                case COMMENT -> scanComment(c);
            }
        }
        if (mode != HtmlScanMode.TEXT) {
            // unterminated tag or comment runs to the end of input
            emitTag(false);
        }
        return finish(cursor.toString());
    }

    int getLevel() {
        return indent.getLevel();
    }

    private void scanText(char c, SourceReader reader) {
        if (c == '<') {
            cursor.trimTrailingSpaces();
            if (!cursor.isLineBlank() && cursor.lineLength() > maxLineLength) {
                cursor.newline(indent);
            }
            tag.setLength(0);
            mode = HtmlScanMode.TAG;
            return;
        }

        if (Character.isWhitespace(c)) {
            if (cursor.isLineBlank() || cursor.lastChar() == ' ') {
                return;
            }
            int nextWord = wordLengthAhead(reader);
            if (nextWord > 0 && cursor.lineLength() + 1 + nextWord > maxLineLength) {
                cursor.newline(indent);
            } else {
                cursor.append(' ');
            }
            return;
        }

        if (!cursor.isLineBlank() && cursor.lineLength() >= maxLineLength && indent.width() < maxLineLength) {
            // a single token wider than the line is broken where it hits the limit
            cursor.newline(indent);
        }
        cursor.append(c);
    }

    private void scanTag(char c) {
        tag.append(c);
        if (tag.length() == 3 && "!--".contentEquals(tag)) {
            mode = HtmlScanMode.COMMENT;
        } else if (c == '"' || c == '\'') {
            attributeQuote = c;
            mode = HtmlScanMode.TAG_QUOTE;
        } else if (c == '>') {
            emitTag(true);
            mode = HtmlScanMode.TEXT;
        }
    }

    private void scanQuotedValue(char c) {
        tag.append(c);
        if (c == attributeQuote) {
            mode = HtmlScanMode.TAG;
        }
    }

    private void scanComment(char c) {
        tag.append(c);
        if (c == '>' && tag.length() >= 4 && tag.lastIndexOf("-->") == tag.length() - 3) {
            emitTag(true);
            mode = HtmlScanMode.TEXT;
        }
    }

    private void emitTag(boolean terminated) {
        String raw = tag.toString();
        String body = terminated ? raw.substring(0, raw.length() - 1) : raw;
        TagKind kind = TagKind.classify(body, voidElements);
        if (kind != TagKind.COMMENT) {
            body = normalizeAttributes(body);
        }
        String closer = terminated ? ">" : "";

        if (kind == TagKind.CLOSING) {
            indent.decrement();
            cursor.reindent(indent);
        }
        cursor.append('<').append(body).append(closer);
        if (kind == TagKind.OPENING) {
            indent.increment();
        }
        cursor.newline(indent);
        tag.setLength(0);
    }

    /**
     * Rewrites {@code =} as {@code " = "}, collapses whitespace runs and copies
     * quoted attribute values untouched.
     */
    static String normalizeAttributes(String body) {
        StringBuilder sb = new StringBuilder(body.length() + 8);
        int n = body.length();
        int i = 0;
        while (i < n) {
            char c = body.charAt(i);
            if (c == '=') {
                trimTrailingSpace(sb);
                sb.append(" = ");
                i++;
                while (i < n && Character.isWhitespace(body.charAt(i))) {
                    i++;
                }
            } else if (c == '"' || c == '\'') {
                int close = body.indexOf(c, i + 1);
                int end = close < 0 ? n : close + 1;
                sb.append(body, i, end);
                i = end;
            } else if (Character.isWhitespace(c)) {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ') {
                    sb.append(' ');
                }
                i++;
            } else {
                sb.append(c);
                i++;
            }
        }
        trimTrailingSpace(sb);
        return sb.toString();
    }

    /**
     * Spaces operators in the text between tags; markup and comments are copied
     * as they are.
     */
    static String finish(String laidOut) {
        StringBuilder out = new StringBuilder(laidOut.length() + 32);
        StringBuilder run = new StringBuilder();
        int n = laidOut.length();
        int i = 0;
        while (i < n) {
            if (laidOut.charAt(i) == '<') {
                flushTextRun(run, out);
                int end = markupEnd(laidOut, i);
                out.append(laidOut, i, end);
                i = end;
            } else {
                run.append(laidOut.charAt(i++));
            }
        }
        flushTextRun(run, out);
        return LayoutText.finish(out.toString());
    }

    private static void flushTextRun(StringBuilder run, StringBuilder out) {
        if (run.length() > 0) {
            out.append(LayoutText.collapseInteriorSpaces(OperatorSpacer.MARKUP_TEXT.space(run.toString())));
            run.setLength(0);
        }
    }

    private static int markupEnd(String text, int start) {
        int n = text.length();
        if (text.startsWith("<!--", start)) {
            int close = text.indexOf("-->", start + 2);
            return close < 0 ? n : close + 3;
        }
        char quote = '\0';
        for (int j = start + 1; j < n; j++) {
            char c = text.charAt(j);
            if (quote != '\0') {
                if (c == quote) {
                    quote = '\0';
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return j + 1;
            }
        }
        return n;
    }

    private static int wordLengthAhead(SourceReader reader) {
        int offset = 0;
        while (Character.isWhitespace(reader.peek(offset))) {
            offset++;
        }
        int length = 0;
        char c = reader.peek(offset + length);
        while (c != '\0' && c != '<' && !Character.isWhitespace(c)) {
            length++;
            c = reader.peek(offset + length);
        }
        return length;
    }

    private static void trimTrailingSpace(StringBuilder sb) {
        while (sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
            sb.setLength(sb.length() - 1);
        }
    }
}
