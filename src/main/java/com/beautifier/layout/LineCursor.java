package com.beautifier.layout;

/**
 * Output accumulator shared by every layout engine.
 * Tracks the length of the line currently being written so wrap decisions do not
 * need their own counters.
 */
public class LineCursor {
    private final StringBuilder out = new StringBuilder();
    private int lineLength;

    public LineCursor append(char c) {
        out.append(c);
        if (c == '\n') {
            lineLength = 0;
        } else {
            lineLength++;
        }
        return this;
    }

    public LineCursor append(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            append(text.charAt(i));
        }
        return this;
    }

    /**
     * Ends the current line and starts the next one at the given indent.
     * A line holding only indentation is re-indented in place instead, so
     * consecutive breaks never leave blank indented lines behind.
     */
    public LineCursor newline(IndentState indent) {
        return newline(indent.render());
    }

    public LineCursor newline(String indent) {
        if (out.length() > 0 && !isLineBlank()) {
            append('\n');
        } else {
            clearLine();
        }
        return append(indent);
    }

    /**
     * Replaces a whitespace-only current line with the given indent.
     * Does nothing when the line already has content.
     */
    public LineCursor reindent(IndentState indent) {
        return reindent(indent.render());
    }

    public LineCursor reindent(String indent) {
        if (isLineBlank()) {
            clearLine();
            append(indent);
        }
        return this;
    }

    public boolean isLineBlank() {
        for (int i = out.length() - 1; i >= 0; i--) {
            char c = out.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    /**
     * Drops spaces and tabs at the end of the current line unless they are the
     * line's indentation.
     */
    public LineCursor trimTrailingSpaces() {
        if (isLineBlank()) {
            return this;
        }
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        lineLength -= out.length() - end;
        out.setLength(end);
        return this;
    }

    public int lineLength() {
        return lineLength;
    }

    /**
     * Last character written, or {@code '\0'} for an empty buffer.
     */
    public char lastChar() {
        return out.length() == 0 ? '\0' : out.charAt(out.length() - 1);
    }

    private void clearLine() {
        int lineStart = out.lastIndexOf("\n") + 1;
        out.setLength(lineStart);
        lineLength = 0;
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
