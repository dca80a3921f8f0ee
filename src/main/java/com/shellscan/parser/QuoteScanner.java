package com.shellscan.parser;

/**
 * Finds the end of quoted and bracketed spans in raw shell text.
 * <p>
 * Every {@code skip*} method takes the index of the opening character and returns the index
 * just past the matching closing character. An unterminated span gives {@code -1}, and a span
 * nested deeper than {@link #MAX_NESTING} gives {@link #TOO_DEEP}.
 * <p>
 * A {@code $(..)} body is tokenized rather than counted, so comments, here-documents and
 * {@code case} patterns inside it do not move its end. {@code $((..))}, arrays and extglob
 * patterns are matched by parenthesis count.
 */
public final class QuoteScanner {
    public static final int MAX_NESTING = 256;
    public static final int TOO_DEEP = -2;

    private QuoteScanner() {
    }

    public static int skipSingleQuoted(String text, int open) {
        int close = text.indexOf('\'', open + 1);
        return close < 0 ? -1 : close + 1;
    }

    /** {@code open} points at the quote of {@code $'...'}, not at the dollar sign. */
    public static int skipAnsiCQuoted(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '\'') {
                return i + 1;
            }
        }
        return -1;
    }

    public static int skipDoubleQuoted(String text, int open) {
        return skipDoubleQuoted(text, open, 0);
    }

    public static int skipParenthesized(String text, int open) {
        return skipParenthesized(text, open, 0);
    }

    /** {@code open} points at the parenthesis of {@code $(..)} or {@code $((..))}. */
    public static int skipDollarParenthesized(String text, int open) {
        return skipDollarParenthesized(text, open, 0);
    }

    public static int skipBraced(String text, int open) {
        return skipBraced(text, open, 0);
    }

    public static int skipBackquoted(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '`') {
                return i + 1;
            }
        }
        return -1;
    }

    static int skipDollarParenthesized(String text, int open, int nesting) {
        if (open + 1 < text.length() && text.charAt(open + 1) == '(') {
            return skipParenthesized(text, open, nesting);
        }
        return ShellTokenizer.skipSubstitution(text, open, nesting);
    }

    static int skipDoubleQuoted(String text, int open, int nesting) {
        if (nesting > MAX_NESTING) {
            return TOO_DEEP;
        }
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else if (c == '`') {
                i = skipBackquoted(text, i);
            } else if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '(') {
                i = skipDollarParenthesized(text, i + 1, nesting + 1);
            } else if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                i = skipBraced(text, i + 1, nesting + 1);
            } else {
                i++;
            }
            if (i < 0) {
                return i;
            }
        }
        return -1;
    }

    static int skipParenthesized(String text, int open, int nesting) {
        if (nesting > MAX_NESTING) {
            return TOO_DEEP;
        }
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> i += 2;
                case '\'' -> i = skipSingleQuoted(text, i);
                case '"' -> i = skipDoubleQuoted(text, i, nesting + 1);
                case '`' -> i = skipBackquoted(text, i);
                case '(' -> {
                    depth++;
                    i++;
                }
                case ')' -> {
                    depth--;
                    i++;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> i++;
            }
            if (i < 0) {
                return i;
            }
        }
        return -1;
    }

    static int skipBraced(String text, int open, int nesting) {
        if (nesting > MAX_NESTING) {
            return TOO_DEEP;
        }
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> i += 2;
                case '\'' -> i = skipSingleQuoted(text, i);
                case '"' -> i = skipDoubleQuoted(text, i, nesting + 1);
                case '`' -> i = skipBackquoted(text, i);
                case '$' -> {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '(') {
                        i = skipDollarParenthesized(text, i + 1, nesting + 1);
                    } else {
                        i++;
                    }
                }
                case '{' -> {
                    depth++;
                    i++;
                }
                case '}' -> {
                    depth--;
                    i++;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> i++;
            }
            if (i < 0) {
                return i;
            }
        }
        return -1;
    }
}
