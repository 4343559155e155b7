package com.beautifier.plugins.css;

import java.util.ArrayList;
import java.util.List;

import com.beautifier.layout.IndentState;
import com.beautifier.layout.LayoutText;
import com.beautifier.layout.LineCursor;
import com.beautifier.layout.OperatorSpacer;
import com.beautifier.layout.SourceReader;

/**
 * Lays out CSS rules: selector and {@code {} on one line, declarations indented
 * inside, {@code }} on its own line.
 * <p>
 * Declarations of a block are buffered and written once, when the block closes
 * or a comment interrupts it. Short blocks are written on a single line.
 */
public class CssLayoutEngine {
    private final IndentState indent;
    private final int maxLineLength;
    private final int compactDeclarationLimit;

    private final LineCursor cursor = new LineCursor();
    private final StringBuilder pending = new StringBuilder();
    private final StringBuilder comment = new StringBuilder();
    private final List<String> declarations = new ArrayList<>();

    private CssScanMode mode = CssScanMode.SELECTOR;
    private CssScanMode resumeMode = CssScanMode.SELECTOR;
    private char quote;

    public CssLayoutEngine(int indentSize, int maxLineLength, int compactDeclarationLimit) {
        this.indent = new IndentState(indentSize);
        this.maxLineLength = maxLineLength;
        this.compactDeclarationLimit = compactDeclarationLimit;
    }

    public String layout(String source) {
        SourceReader reader = new SourceReader(source);
        while (reader.hasNext()) {
            char c = reader.next();
            switch (mode) {
                case COMMENT -> scanComment(c);
                case STRING -> scanString(c, reader);
                default -> scanRule(c, reader);
            }
        }
        endOfInput();
        return LayoutText.finish(LayoutText.collapseBlankLines(cursor.toString()));
    }

    private void scanRule(char c, SourceReader reader) {
        if (c == '/' && reader.peek() == '*') {
            reader.next();
            comment.setLength(0);
            comment.append("/*");
            resumeMode = mode;
            mode = CssScanMode.COMMENT;
        } else if (c == '"' || c == '\'') {
            pending.append(c);
            quote = c;
            resumeMode = mode;
            mode = CssScanMode.STRING;
        } else if (c == '{') {
            openBlock();
        } else if (c == '}') {
            closeBlock();
        } else if (c == ';') {
            if (indent.getLevel() > 0) {
                addDeclaration();
            } else {
                emitStatement(true);
            }
        } else if (Character.isWhitespace(c)) {
            if (pending.length() > 0 && pending.charAt(pending.length() - 1) != ' ') {
                pending.append(' ');
            }
        } else {
            pending.append(c);
        }
    }

    private void scanString(char c, SourceReader reader) {
        pending.append(c);
        if (c == '\\' && reader.hasNext()) {
            pending.append(reader.next());
        } else if (c == quote) {
            mode = resumeMode;
        }
    }

    private void scanComment(char c) {
        comment.append(c);
        if (c == '/' && comment.length() >= 4 && comment.charAt(comment.length() - 2) == '*') {
            emitComment();
            mode = resumeMode;
        }
    }

    private void openBlock() {
        renderDeclarations();
        String selector = OperatorSpacer.STYLESHEET.space(pending.toString().trim());
        pending.setLength(0);

        cursor.reindent(indent);
        if (!selector.isEmpty()) {
            cursor.append(selector).append(' ');
        }
        cursor.append('{');
        indent.increment();
        cursor.newline(indent);
        mode = CssScanMode.BLOCK;
    }

    private void closeBlock() {
        if (indent.getLevel() == 0) {
            // stray brace outside any block
            emitStatement(false);
        } else {
            addDeclaration();
            renderDeclarations();
            indent.decrement();
        }
        cursor.reindent(indent);
        cursor.append('}');
        cursor.newline(indent);
        mode = indent.getLevel() > 0 ? CssScanMode.BLOCK : CssScanMode.SELECTOR;
    }

    private void addDeclaration() {
        String text = pending.toString().trim();
        pending.setLength(0);
        if (!text.isEmpty()) {
            declarations.add(formatDeclaration(text));
        }
    }

    /**
     * Normalizes {@code name:value} to {@code name: value} and spaces the value.
     */
    static String formatDeclaration(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return OperatorSpacer.STYLESHEET.space(text);
        }
        String name = text.substring(0, colon).trim();
        String value = text.substring(colon + 1).trim();
        return name + ": " + OperatorSpacer.STYLESHEET.space(value);
    }

    private void renderDeclarations() {
        if (declarations.isEmpty()) {
            return;
        }
        String joined = String.join("; ", declarations) + ";";
        if (declarations.size() <= compactDeclarationLimit
                && indent.width() + joined.length() < maxLineLength) {
            cursor.reindent(indent);
            cursor.append(joined);
            cursor.newline(indent);
        } else {
            for (String declaration : declarations) {
                cursor.reindent(indent);
                cursor.append(declaration).append(';');
                cursor.newline(indent);
            }
        }
        declarations.clear();
    }

    private void emitStatement(boolean terminated) {
        String text = pending.toString().trim();
        pending.setLength(0);
        if (text.isEmpty()) {
            return;
        }
        cursor.reindent(indent);
        cursor.append(OperatorSpacer.STYLESHEET.space(text));
        if (terminated) {
            cursor.append(';');
        }
        cursor.newline(indent);
    }

    private void emitComment() {
        renderDeclarations();
        cursor.reindent(indent);
        cursor.append(comment);
        cursor.newline(indent);
        comment.setLength(0);
    }

    private void endOfInput() {
        if (mode == CssScanMode.COMMENT) {
            emitComment();
            mode = resumeMode;
        }
        if (indent.getLevel() == 0) {
            emitStatement(false);
        }
        while (indent.getLevel() > 0) {
            closeBlock();
        }
    }
}
