package com.beautifier.layout;

/**
 * Normalizes the spacing around operators and punctuation in a text fragment.
 * <p>
 * Operator tokens are read greedily: a leading operator character absorbs a
 * following {@code =}, a second {@code &} or {@code |}, or the {@code >} of an
 * arrow. A doubled {@code +} or {@code -} is an increment and stays glued to its
 * operand. Each other token ends up with exactly one space on either side, except that no
 * space is added after an opening delimiter, at the start of a line, or in front
 * of a closing delimiter, comma or semicolon. Indentation at the start of a line
 * is never touched.
 * <p>
 * Instances are immutable and safe to share.
 */
public class OperatorSpacer {
    public static final String ALL_OPERATORS = "=+-*/%><!&|^~";

    /** Full operator set; string literals are copied through untouched. */
    public static final OperatorSpacer SCRIPT = new OperatorSpacer(ALL_OPERATORS, true);

    /** Full operator set for prose, where apostrophes are not string delimiters. */
    public static final OperatorSpacer MARKUP_TEXT = new OperatorSpacer(ALL_OPERATORS, false);

    /** Selector combinators only, so hyphenated identifiers and !important survive. */
    public static final OperatorSpacer STYLESHEET = new OperatorSpacer(">+~", true);

    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";
    private static final String NO_SPACE_AFTER_OPERATOR = ")]},;\n";
    private static final String NO_SPACE_AFTER_SEPARATOR = ")]}\n";

    private final String operators;
    private final boolean quoteAware;

    public OperatorSpacer(String operators, boolean quoteAware) {
        this.operators = operators;
        this.quoteAware = quoteAware;
    }

    public String space(String fragment) {
        return space(fragment, '\0');
    }

    /**
     * Spaces a fragment that will be appended right after {@code preceding} in the
     * output, so an operator at the very start of the fragment is still separated
     * from what came before. Pass {@code '\0'} when nothing precedes it.
     */
    public String space(String fragment, char preceding) {
        StringBuilder result = new StringBuilder(fragment.length() + 16);
        int n = fragment.length();
        int i = 0;

        while (i < n) {
            char c = fragment.charAt(i);

            if (quoteAware && isQuote(c)) {
                i = copyLiteral(fragment, i, result);
                continue;
            }

            if (operators.indexOf(c) >= 0) {
                String op = readOperator(fragment, i);
                i += op.length();
                if (isIncrement(op)) {
                    result.append(op);
                    continue;
                }
                trimGap(result);
                if (separatesFrom(lastChar(result, preceding))) {
                    result.append(' ');
                }
                result.append(op);
                i = skipSpaces(fragment, i);
                if (i < n && NO_SPACE_AFTER_OPERATOR.indexOf(fragment.charAt(i)) < 0) {
                    result.append(' ');
                }
                continue;
            }

            if (c == ',' || c == ';') {
                trimGap(result);
                result.append(c);
                i = skipSpaces(fragment, i + 1);
                if (i < n && NO_SPACE_AFTER_SEPARATOR.indexOf(fragment.charAt(i)) < 0) {
                    result.append(' ');
                }
                continue;
            }

            if (OPENERS.indexOf(c) >= 0) {
                if (c == '{' && isWordEnd(lastChar(result, preceding))) {
                    result.append(' ');
                }
                result.append(c);
                i = skipSpaces(fragment, i + 1);
                continue;
            }

            if (CLOSERS.indexOf(c) >= 0) {
                trimGap(result);
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    private String readOperator(String fragment, int start) {
        StringBuilder op = new StringBuilder().append(fragment.charAt(start));
        int j = start + 1;
        while (j < fragment.length()) {
            char next = fragment.charAt(j);
            String sofar = op.toString();
            boolean extend = (next == '=' && !isIncrement(sofar))
                    || (sofar.equals("&") && next == '&')
                    || (sofar.equals("|") && next == '|')
                    || (sofar.equals("=") && next == '>')
                    || (sofar.equals("+") && next == '+')
                    || (sofar.equals("-") && next == '-');
            if (!extend) {
                break;
            }
            op.append(next);
            j++;
        }
        return op.toString();
    }

    /**
     * Removes spaces before the insertion point unless they are the indentation
     * of the current line.
     */
    private static void trimGap(StringBuilder result) {
        int end = result.length();
        int start = end;
        while (start > 0 && (result.charAt(start - 1) == ' ' || result.charAt(start - 1) == '\t')) {
            start--;
        }
        if (start < end && start > 0 && result.charAt(start - 1) != '\n') {
            result.setLength(start);
        }
    }

    private static int copyLiteral(String fragment, int start, StringBuilder result) {
        char quote = fragment.charAt(start);
        result.append(quote);
        int i = start + 1;
        while (i < fragment.length()) {
            char c = fragment.charAt(i++);
            result.append(c);
            if (c == '\\' && i < fragment.length()) {
                result.append(fragment.charAt(i++));
            } else if (c == quote) {
                break;
            }
        }
        return i;
    }

    private static int skipSpaces(String fragment, int i) {
        while (i < fragment.length() && (fragment.charAt(i) == ' ' || fragment.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static char lastChar(StringBuilder result, char preceding) {
        return result.length() > 0 ? result.charAt(result.length() - 1) : preceding;
    }

    private static boolean separatesFrom(char last) {
        return last != '\0' && !Character.isWhitespace(last) && OPENERS.indexOf(last) < 0;
    }

    private static boolean isIncrement(String op) {
        return op.equals("++") || op.equals("--");
    }

    private static boolean isWordEnd(char last) {
        return Character.isLetterOrDigit(last) || last == '_' || last == '$' || last == ')' || last == ']';
    }

    static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '`';
    }
}
