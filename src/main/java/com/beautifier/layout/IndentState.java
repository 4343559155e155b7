package com.beautifier.layout;

/**
 * Current nesting depth together with the literal string that represents one level.
 * The level saturates at zero, so unmatched closers in malformed input never
 * produce a negative indent.
 */
public class IndentState {
    private final String unit;
    private int level;

    public IndentState(int indentSize) {
        this(" ".repeat(Math.max(0, indentSize)), 0);
    }

    public IndentState(String unit, int level) {
        this.unit = unit;
        this.level = Math.max(0, level);
    }

    public String getUnit() {
        return unit;
    }

    public int getLevel() {
        return level;
    }

    public void increment() {
        level++;
    }

    public void decrement() {
        if (level > 0) {
            level--;
        }
    }

    /**
     * Renders the indent for the current level.
     */
    public String render() {
        return render(level);
    }

    public String render(int atLevel) {
        return unit.repeat(Math.max(0, atLevel));
    }

    /**
     * Width in characters of the indent for the current level.
     */
    public int width() {
        return unit.length() * level;
    }
}
