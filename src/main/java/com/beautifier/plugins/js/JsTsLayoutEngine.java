package com.beautifier.plugins.js;

import com.beautifier.layout.BracketSplitter;
import com.beautifier.layout.IndentState;
import com.beautifier.layout.LayoutText;
import com.beautifier.layout.LineCursor;
import com.beautifier.layout.OperatorSpacer;
import com.beautifier.layout.SourceReader;

/**
 * Lays out JavaScript and TypeScript: one statement per line, blocks indented by
 * brace depth, operators spaced, clustered brackets split apart.
 * <p>
 * Text is collected into a pending statement and flushed at delimiters; the
 * complete buffer then goes through a {@link BracketSplitter}.
 */
public class JsTsLayoutEngine {
    private static final String NO_BREAK_AFTER_CLOSER = ",;})";
    private static final String STATEMENT_ENDINGS = ";})]";

    private final IndentState indent;
    private final int maxLineLength;
    private final BracketSplitter splitter;

    private final LineCursor cursor = new LineCursor();
    private final StringBuilder pending = new StringBuilder();
    private JsScanMode mode = JsScanMode.CODE;
    private char quote;

    public JsTsLayoutEngine(int indentSize, int maxLineLength, BracketSplitter splitter) {
        this.indent = new IndentState(indentSize);
        this.maxLineLength = maxLineLength;
        this.splitter = splitter;
    }

    public String layout(String source) {
        SourceReader reader = new SourceReader(source);
        while (reader.hasNext()) {
            char c = reader.next();
            switch (mode) {
                case STRING -> scanString(c, reader);
                case LINE_COMMENT -> scanLineComment(c);
                case BLOCK_COMMENT -> scanBlockComment(c, reader);
                default -> scanCode(c, reader);
            }
        }
        finishStatement();
        String split = splitter.split(cursor.toString(), indent.getUnit(), 0);
        return LayoutText.finish(split);
    }

    int getLevel() {
        return indent.getLevel();
    }

    private void scanCode(char c, SourceReader reader) {
        switch (c) {
            case '"', '\'', '`' -> {
                pending.append(c);
                quote = c;
                mode = JsScanMode.STRING;
            }
            case '{', '(', '[' -> {
                pending.append(c);
                flush();
                if (c == '{') {
                    indent.increment();
                    cursor.newline(indent);
                }
            }
            case '}', ')', ']' -> closeDelimiter(c, reader.peek());
            case ';' -> {
                pending.append(c);
                flush();
                cursor.newline(indent);
            }
            case ',' -> {
                pending.append(c);
                if (cursor.lineLength() + pending.length() > maxLineLength) {
                    flush();
                    cursor.newline(indent);
                }
            }
            default -> {
                if (c == '/' && (reader.peek() == '/' || reader.peek() == '*')) {
                    openComment(c, reader.next());
                } else if (Character.isWhitespace(c)) {
                    collapseWhitespace();
                } else {
                    pending.append(c);
                }
            }
        }
    }

    private void closeDelimiter(char c, char next) {
        flush();
        cursor.trimTrailingSpaces();
        if (c == '}') {
            indent.decrement();
            cursor.newline(indent);
        }
        cursor.append(c);
        if (next != '\0' && NO_BREAK_AFTER_CLOSER.indexOf(next) < 0 && cursor.lineLength() > maxLineLength) {
            cursor.newline(indent);
        }
    }

    private void collapseWhitespace() {
        if (pending.length() == 0) {
            if (!cursor.isLineBlank()) {
                pending.append(' ');
            }
        } else if (pending.charAt(pending.length() - 1) != ' ') {
            pending.append(' ');
        }
    }

    private void openComment(char slash, char kind) {
        flush();
        if (!cursor.isLineBlank() && cursor.lastChar() != ' ') {
            cursor.append(' ');
        }
        cursor.append(slash).append(kind);
        mode = kind == '/' ? JsScanMode.LINE_COMMENT : JsScanMode.BLOCK_COMMENT;
    }

    private void scanString(char c, SourceReader reader) {
        pending.append(c);
        if (c == '\\' && reader.hasNext()) {
            pending.append(reader.next());
        } else if (c == quote) {
            mode = JsScanMode.CODE;
        }
    }

    private void scanLineComment(char c) {
        if (c == '\n') {
            mode = JsScanMode.CODE;
            cursor.newline(indent);
        } else {
            cursor.append(c);
        }
    }

    private void scanBlockComment(char c, SourceReader reader) {
        cursor.append(c);
        if (c == '*' && reader.peek() == '/') {
            cursor.append(reader.next());
            mode = JsScanMode.CODE;
            cursor.newline(indent);
        }
    }

    /**
     * Writes the pending statement to the buffer with operators spaced.
     */
    private void flush() {
        if (pending.length() == 0) {
            return;
        }
        String text = OperatorSpacer.SCRIPT.space(pending.toString(), cursor.lastChar());
        pending.setLength(0);
        if (cursor.isLineBlank()) {
            text = text.stripLeading();
        }
        cursor.append(text);
    }

    private void finishStatement() {
        String text = pending.toString().trim();
        pending.setLength(0);
        if (text.isEmpty()) {
            return;
        }
        String spaced = OperatorSpacer.SCRIPT.space(text, cursor.lastChar());
        String statement = splitter.split(spaced, indent.getUnit(), indent.getLevel());
        if (mode == JsScanMode.CODE && STATEMENT_ENDINGS.indexOf(statement.charAt(statement.length() - 1)) < 0) {
            statement = statement + ";";
        }
        cursor.reindent(indent);
        cursor.append(statement);
    }
}
