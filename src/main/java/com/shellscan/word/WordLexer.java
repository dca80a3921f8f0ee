package com.shellscan.word;

import com.shellscan.parser.QuoteScanner;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class WordLexer {

    public MutableList<WordPiece> lex(String word) throws WordLexException {
        MutableList<WordPiece> pieces = Lists.mutable.empty();
        StringBuilder text = new StringBuilder();
        int i = tildePrefix(word, pieces);

        while (i < word.length()) {
            char c = word.charAt(i);
            switch (c) {
                case '\\' -> {
                    flush(text, pieces);
                    int end = Math.min(i + 2, word.length());
                    pieces.add(new WordPiece.EscapeSequence(word.substring(i, end)));
                    i = end;
                }
                case '\'' -> {
                    flush(text, pieces);
                    int end = QuoteScanner.skipSingleQuoted(word, i);
                    if (end < 0) {
                        throw unterminated("single quote", word);
                    }
                    pieces.add(new WordPiece.SingleQuotedText(word.substring(i + 1, end - 1)));
                    i = end;
                }
                case '"' -> {
                    flush(text, pieces);
                    int end = QuoteScanner.skipDoubleQuoted(word, i);
                    if (end < 0) {
                        throw unterminated(end, "double quote", word);
                    }
                    pieces.add(new WordPiece.DoubleQuotedSequence(lexDoubleQuoted(word.substring(i + 1, end - 1))));
                    i = end;
                }
                case '`' -> {
                    flush(text, pieces);
                    i = backquoted(word, i, pieces);
                }
                case '$' -> {
                    if (isExpansionStart(word, i, false)) {
                        flush(text, pieces);
                        i = dollar(word, i, pieces, false);
                    } else {
                        text.append(c);
                        i++;
                    }
                }
                default -> {
                    text.append(c);
                    i++;
                }
            }
        }

        flush(text, pieces);
        return pieces;
    }

    private MutableList<WordPiece> lexDoubleQuoted(String content) throws WordLexException {
        MutableList<WordPiece> pieces = Lists.mutable.empty();
        StringBuilder text = new StringBuilder();
        int i = 0;

        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\\' && i + 1 < content.length() && "$`\"\\\n".indexOf(content.charAt(i + 1)) >= 0) {
                flush(text, pieces);
                pieces.add(new WordPiece.EscapeSequence(content.substring(i, i + 2)));
                i += 2;
            } else if (c == '`') {
                flush(text, pieces);
                i = backquoted(content, i, pieces);
            } else if (c == '$' && isExpansionStart(content, i, true)) {
                flush(text, pieces);
                i = dollar(content, i, pieces, true);
            } else {
                text.append(c);
                i++;
            }
        }

        flush(text, pieces);
        return pieces;
    }

    private static boolean isExpansionStart(String s, int start, boolean inDoubleQuotes) {
        if (start + 1 >= s.length()) {
            return false;
        }
        char next = s.charAt(start + 1);
        return next == '(' || next == '{'
            || (!inDoubleQuotes && (next == '\'' || next == '"'))
            || next == '_' || Character.isLetterOrDigit(next)
            || "@*#?$!-".indexOf(next) >= 0;
    }

    // start is a dollar sign that isExpansionStart accepted
    private int dollar(String s, int start, MutableList<WordPiece> pieces, boolean inDoubleQuotes)
            throws WordLexException {
        char next = s.charAt(start + 1);

        if (next == '(') {
            int end = QuoteScanner.skipDollarParenthesized(s, start + 1);
            if (end < 0) {
                throw unterminated(end, "command substitution", s);
            }
            boolean arithmetic = start + 2 < s.length() && s.charAt(start + 2) == '('
                && end - 2 > start + 2 && s.charAt(end - 2) == ')';
            if (arithmetic) {
                pieces.add(new WordPiece.ArithmeticExpression(s.substring(start + 3, end - 2)));
            } else {
                pieces.add(new WordPiece.CommandSubstitution(s.substring(start + 2, end - 1)));
            }
            return end;
        }

        if (next == '{') {
            int end = QuoteScanner.skipBraced(s, start + 1);
            if (end < 0) {
                throw unterminated(end, "parameter expansion", s);
            }
            pieces.add(new WordPiece.ParameterExpansion(s.substring(start, end)));
            return end;
        }

        if (next == '\'' && !inDoubleQuotes) {
            int end = QuoteScanner.skipAnsiCQuoted(s, start + 1);
            if (end < 0) {
                throw unterminated("ANSI-C quote", s);
            }
            pieces.add(new WordPiece.AnsiCQuotedText(s.substring(start + 2, end - 1)));
            return end;
        }

        if (next == '"' && !inDoubleQuotes) {
            int end = QuoteScanner.skipDoubleQuoted(s, start + 1);
            if (end < 0) {
                throw unterminated(end, "double quote", s);
            }
            pieces.add(new WordPiece.GettextDoubleQuotedSequence(lexDoubleQuoted(s.substring(start + 2, end - 1))));
            return end;
        }

        if (next == '_' || Character.isLetter(next)) {
            int end = start + 1;
            while (end < s.length() && (s.charAt(end) == '_' || Character.isLetterOrDigit(s.charAt(end)))) {
                end++;
            }
            pieces.add(new WordPiece.ParameterExpansion(s.substring(start, end)));
            return end;
        }

        // Positional and special parameters are a single character
        pieces.add(new WordPiece.ParameterExpansion(s.substring(start, start + 2)));
        return start + 2;
    }

    private int backquoted(String s, int start, MutableList<WordPiece> pieces) throws WordLexException {
        int end = QuoteScanner.skipBackquoted(s, start);
        if (end < 0) {
            throw unterminated("backquote", s);
        }
        pieces.add(new WordPiece.BackquotedCommandSubstitution(unescapeBackquoted(s.substring(start + 1, end - 1))));
        return end;
    }

    // Inside backquotes only \\, \` and \$ lose their backslash
    private static String unescapeBackquoted(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder result = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && "\\`$".indexOf(body.charAt(i + 1)) >= 0) {
                result.append(body.charAt(i + 1));
                i++;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    private static int tildePrefix(String word, MutableList<WordPiece> pieces) {
        if (!word.startsWith("~")) {
            return 0;
        }
        int end = word.indexOf('/');
        if (end < 0) {
            end = word.length();
        }
        for (int i = 1; i < end; i++) {
            if ("\\'\"`$".indexOf(word.charAt(i)) >= 0) {
                return 0;
            }
        }
        pieces.add(new WordPiece.TildePrefix(word.substring(0, end)));
        return end;
    }

    private static void flush(StringBuilder text, MutableList<WordPiece> pieces) {
        if (!text.isEmpty()) {
            pieces.add(new WordPiece.Text(text.toString()));
            text.setLength(0);
        }
    }

    private static WordLexException unterminated(String what, String word) {
        return new WordLexException("unterminated " + what + " in word: " + word);
    }

    private static WordLexException unterminated(int end, String what, String word) {
        if (end == QuoteScanner.TOO_DEEP) {
            return new WordLexException("substitutions nested too deeply in word: " + word);
        }
        return unterminated(what, word);
    }
}
