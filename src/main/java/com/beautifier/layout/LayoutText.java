package com.beautifier.layout;

/**
 * Finishing helpers applied to a completed layout.
 */
public final class LayoutText {

    private LayoutText() {
    }

    /**
     * Removes carriage returns and surrounding whitespace from raw input.
     */
    public static String normalizeInput(String raw) {
        return raw.replace("\r", "").trim();
    }

    /**
     * Strips trailing whitespace from every line and guarantees exactly one
     * trailing newline.
     */
    public static String finish(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length() + 1);
        for (String line : lines) {
            sb.append(stripTrailing(line)).append('\n');
        }
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == '\n') {
            end--;
        }
        sb.setLength(end);
        return sb.append('\n').toString();
    }

    /**
     * Collapses runs of three or more newlines to a single blank line.
     */
    public static String collapseBlankLines(String text) {
        String result = text;
        while (result.contains("\n\n\n")) {
            result = result.replace("\n\n\n", "\n\n");
        }
        return result;
    }

    /**
     * Collapses repeated spaces that follow content on a line. Leading
     * indentation is kept as is.
     */
    public static String collapseInteriorSpaces(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean atLineStart = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                atLineStart = true;
            } else if (c != ' ') {
                atLineStart = false;
            } else if (!atLineStart && sb.length() > 0 && sb.charAt(sb.length() - 1) == ' ') {
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }
}
