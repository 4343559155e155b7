package com.beautifier.layout;

/**
 * Read-only cursor over the complete input text with arbitrary lookahead.
 */
public class SourceReader {
    private final String source;
    private final int length;
    private int pos;

    public SourceReader(String source) {
        this.source = source;
        this.length = source.length();
    }

    public boolean hasNext() {
        return pos < length;
    }

    public char next() {
        return source.charAt(pos++);
    }

    /**
     * Character after the one most recently returned, or {@code '\0'} at the end.
     */
    public char peek() {
        return peek(0);
    }

    public char peek(int offset) {
        int index = pos + offset;
        return index < length ? source.charAt(index) : '\0';
    }
}
