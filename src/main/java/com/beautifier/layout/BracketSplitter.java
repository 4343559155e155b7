package com.beautifier.layout;

/**
 * Breaks up runs of clustered delimiters such as {@code )))]} and overlong lines,
 * re-indenting every line from its own delimiter depth.
 * <p>
 * The line limit is independent of the configured maximum line length: it only
 * decides where a delimiter is allowed to force a break.
 */
public class BracketSplitter {
    public static final int DEFAULT_RUN_LENGTH = 3;
    public static final int DEFAULT_LINE_LIMIT = 80;

    public static final BracketSplitter DEFAULT = new BracketSplitter(DEFAULT_RUN_LENGTH, DEFAULT_LINE_LIMIT);

    private enum Mode {
        CODE,
        STRING,
        LINE_COMMENT,
        BLOCK_COMMENT
    }

    private final int runLength;
    private final int lineLimit;

    public BracketSplitter(int runLength, int lineLimit) {
        this.runLength = Math.max(1, runLength);
        this.lineLimit = lineLimit;
    }

    public int getRunLength() {
        return runLength;
    }

    public int getLineLimit() {
        return lineLimit;
    }

    /**
     * Splits {@code text}; every line break is followed by the indent for
     * {@code baseLevel} plus the number of delimiters open at that point.
     */
    public String split(String text, String indentUnit, int baseLevel) {
        LineCursor cursor = new LineCursor();
        Mode mode = Mode.CODE;
        char quote = '\0';
        int depth = 0;
        int run = 0;
        int n = text.length();

        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : '\0';

            switch (mode) {
                case STRING:
                    cursor.append(c);
                    if (c == '\\' && i + 1 < n) {
                        cursor.append(text.charAt(++i));
                    } else if (c == quote) {
                        mode = Mode.CODE;
                    }
                    continue;
                case BLOCK_COMMENT:
                    cursor.append(c);
                    if (c == '*' && next == '/') {
                        cursor.append(next);
                        i++;
                        mode = Mode.CODE;
                    }
                    continue;
                case LINE_COMMENT:
                    if (c != '\n') {
                        cursor.append(c);
                        continue;
                    }
                    mode = Mode.CODE;
                    break;
                default:
                    break;
            }

            if (OperatorSpacer.isQuote(c)) {
                mode = Mode.STRING;
                quote = c;
                cursor.append(c);
                run = 0;
            } else if (c == '/' && (next == '/' || next == '*')) {
                mode = next == '/' ? Mode.LINE_COMMENT : Mode.BLOCK_COMMENT;
                cursor.append(c).append(next);
                i++;
                run = 0;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                run++;
                cursor.append(c);
                if (run >= runLength || cursor.lineLength() > lineLimit) {
                    cursor.append('\n').append(indent(indentUnit, baseLevel + depth));
                    run = 0;
                }
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                run++;
                if (run >= runLength || cursor.lineLength() > lineLimit) {
                    cursor.newline("");
                    run = 0;
                }
                if (cursor.isLineBlank()) {
                    cursor.reindent(indent(indentUnit, baseLevel + depth));
                } else {
                    cursor.trimTrailingSpaces();
                }
                cursor.append(c);
                if (startsWord(next)) {
                    cursor.append(' ');
                }
            } else if (c == '\n') {
                // a break right after a split opener reuses the line the split started
                cursor.newline(indent(indentUnit, baseLevel + depth));
                run = 0;
            } else if (c == ' ' || c == '\t') {
                if (!cursor.isLineBlank() && cursor.lastChar() != ' ') {
                    cursor.append(' ');
                }
            } else {
                cursor.append(c);
                run = 0;
            }
        }
        return cursor.toString();
    }

    private static String indent(String unit, int level) {
        return unit.repeat(Math.max(0, level));
    }

    private static boolean startsWord(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '{';
    }
}
