package com.shellscan.parser;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

public class ShellTokenizer {

    public enum Kind {
        WORD,
        IO_NUMBER,
        OPERATOR,
        NEWLINE,
        ARITHMETIC,
        PROCESS_SUBSTITUTION,
        EOF
    }

    public record Token(Kind kind, String text, int offset, String hereDocBody) {
        Token(Kind kind, String text, int offset) {
            this(kind, text, offset, null);
        }

        public boolean isOperator(String operator) {
            return kind == Kind.OPERATOR && text.equals(operator);
        }

        public boolean isWord(String word) {
            return kind == Kind.WORD && text.equals(word);
        }

        Token withHereDocBody(String body) {
            return new Token(kind, text, offset, body);
        }
    }

    private record PendingHereDoc(int tokenIndex, String delimiter, boolean removeTabs) {}

    // Longest first
    private static final String[] OPERATORS = {
        ";;&", "<<<", "<<-", "&>>",
        "&&", "||", ";;", ";&", "|&", "<<", ">>", "<&", ">&", "<>", ">|", "&>",
        "<", ">", "|", "&", ";", "(", ")"
    };

    private static final String METACHARACTERS = " \t\n;&|()<>";
    private static final String EXTGLOB_OPERATORS = "@!+*?";
    private static final Pattern ASSIGNMENT_PREFIX =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\[[^\\]]*\\])?\\+?=");

    private final String text;
    private final int nesting;
    private final MutableList<Token> tokens = Lists.mutable.empty();
    private final MutableList<PendingHereDoc> pendingHereDocs = Lists.mutable.empty();
    private int pos;
    private boolean expectHereDocDelimiter;
    private boolean removeTabs;
    private int testDepth;
    private boolean regexNext;
    private boolean nestedTooDeeply;

    public ShellTokenizer(String text) {
        this(text, 0, 0);
    }

    private ShellTokenizer(String text, int start, int nesting) {
        this.text = text;
        this.pos = start;
        this.nesting = nesting;
    }

    public MutableList<Token> tokenize() throws ShellParseException {
        while (pos < text.length()) {
            step();
        }

        readHereDocBodies();
        tokens.add(new Token(Kind.EOF, "", text.length()));
        return tokens;
    }

    /**
     * Finds the end of the command or process substitution whose opening parenthesis is at
     * {@code open}.
     * <p>
     * The body is tokenized, and each unmatched {@code )} is tried in turn until the tokens before
     * it parse as a command list. When none does, the first unmatched {@code )} is taken and the
     * body's own syntax error surfaces when it is parsed.
     *
     * @return the index just past the closing parenthesis, {@code -1} when there is none, or
     *         {@link QuoteScanner#TOO_DEEP}
     */
    public static int skipSubstitution(String text, int open) {
        return skipSubstitution(text, open, 0);
    }

    static int skipSubstitution(String text, int open, int nesting) {
        if (nesting > QuoteScanner.MAX_NESTING) {
            return QuoteScanner.TOO_DEEP;
        }
        ShellTokenizer body = new ShellTokenizer(text, open + 1, nesting + 1);
        try {
            return body.substitutionEnd();
        } catch (ShellParseException e) {
            return body.nestedTooDeeply ? QuoteScanner.TOO_DEEP : -1;
        }
    }

    private int substitutionEnd() throws ShellParseException {
        int parens = 0;
        int firstCandidate = -1;
        while (pos < text.length()) {
            int count = tokens.size();
            try {
                step();
            } catch (ShellParseException e) {
                if (firstCandidate < 0 || nestedTooDeeply) {
                    throw e;
                }
                return firstCandidate;
            }
            if (tokens.size() == count) {
                continue;
            }
            Token last = tokens.getLast();
            if (last.isOperator("(")) {
                parens++;
            } else if (last.isOperator(")") && parens > 0) {
                parens--;
            } else if (last.isOperator(")")) {
                tokens.remove(tokens.size() - 1);
                if (parsesAsCommandList()) {
                    return pos;
                }
                if (firstCandidate < 0) {
                    firstCandidate = pos;
                }
                tokens.add(last);
            }
        }
        return firstCandidate;
    }

    private boolean parsesAsCommandList() {
        MutableList<Token> body = Lists.mutable.withAll(tokens);
        body.add(new Token(Kind.EOF, "", pos));
        try {
            new ShellGrammar(body, nesting).substitutionBody();
            return true;
        } catch (ShellParseException e) {
            // a case pattern or a parenthesis inside the body, keep scanning
            return false;
        }
    }

    private void step() throws ShellParseException {
        char c = text.charAt(pos);

        if (c == ' ' || c == '\t') {
            pos++;
        } else if (c == '\\' && charAt(pos + 1) == '\n') {
            pos += 2;
        } else if (c == '#') {
            skipComment();
        } else if (c == '\n') {
            tokens.add(new Token(Kind.NEWLINE, "\n", pos));
            pos++;
            expectHereDocDelimiter = false;
            regexNext = false;
            readHereDocBodies();
        } else if (regexNext) {
            word();
        } else if (c == '(' && charAt(pos + 1) == '(' && arithmeticCommand()) {
            return;
        } else if ((c == '<' || c == '>') && charAt(pos + 1) == '(') {
            processSubstitution();
        } else {
            String operator = matchOperator();
            if (operator != null) {
                tokens.add(new Token(Kind.OPERATOR, operator, pos));
                pos += operator.length();
                if (operator.equals("<<") || operator.equals("<<-")) {
                    expectHereDocDelimiter = true;
                    removeTabs = operator.equals("<<-");
                }
            } else {
                word();
            }
        }
    }

    private void word() throws ShellParseException {
        int start = pos;
        String value = regexNext ? readRegex() : readWord();
        regexNext = false;

        Kind kind = Kind.WORD;
        char next = charAt(pos);
        if ((next == '<' || next == '>') && isDigits(value)) {
            kind = Kind.IO_NUMBER;
        }

        if (kind == Kind.WORD && expectHereDocDelimiter) {
            pendingHereDocs.add(new PendingHereDoc(tokens.size(), unquote(value), removeTabs));
            expectHereDocDelimiter = false;
        }
        tokens.add(new Token(kind, value, start));

        if (kind == Kind.WORD) {
            if (value.equals("[[")) {
                testDepth++;
            } else if (value.equals("]]") && testDepth > 0) {
                testDepth--;
            } else if (value.equals("=~") && testDepth > 0) {
                regexNext = true;
            }
        }
    }

    private String readWord() throws ShellParseException {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (METACHARACTERS.indexOf(c) >= 0) {
                if (c == '(' && pos > start && opensWordTail(text.substring(start, pos))) {
                    pos = require(QuoteScanner.skipParenthesized(text, pos, nesting), "parenthesis", pos);
                    continue;
                }
                break;
            }
            pos = skipWordChar(c);
        }
        return text.substring(start, pos);
    }

    // Right-hand side of =~ inside [[ ]]: parentheses and | belong to the pattern
    private String readRegex() throws ShellParseException {
        int start = pos;
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\n') {
                if (depth == 0) {
                    break;
                }
                pos++;
            } else if (c == '(') {
                depth++;
                pos++;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
                pos++;
            } else if (depth == 0 && (c == ';' || c == '&')) {
                break;
            } else {
                pos = skipWordChar(c);
            }
        }
        return text.substring(start, pos);
    }

    private int skipWordChar(char c) throws ShellParseException {
        return switch (c) {
            case '\\' -> Math.min(pos + 2, text.length());
            case '\'' -> require(QuoteScanner.skipSingleQuoted(text, pos), "single quote", pos);
            case '"' -> require(QuoteScanner.skipDoubleQuoted(text, pos, nesting), "double quote", pos);
            case '`' -> require(QuoteScanner.skipBackquoted(text, pos), "backquote", pos);
            case '$' -> skipDollar();
            default -> pos + 1;
        };
    }

    private int skipDollar() throws ShellParseException {
        return switch (charAt(pos + 1)) {
            case '(' -> require(QuoteScanner.skipDollarParenthesized(text, pos + 1, nesting), "command substitution", pos);
            case '{' -> require(QuoteScanner.skipBraced(text, pos + 1, nesting), "parameter expansion", pos);
            case '\'' -> require(QuoteScanner.skipAnsiCQuoted(text, pos + 1), "ANSI-C quote", pos);
            case '"' -> require(QuoteScanner.skipDoubleQuoted(text, pos + 1, nesting), "double quote", pos);
            default -> pos + 1;
        };
    }

    // name=( array ) and extglob patterns such as @(a|b)
    private static boolean opensWordTail(String prefix) {
        return ASSIGNMENT_PREFIX.matcher(prefix).matches()
            || EXTGLOB_OPERATORS.indexOf(prefix.charAt(prefix.length() - 1)) >= 0;
    }

    private boolean arithmeticCommand() {
        int end = QuoteScanner.skipParenthesized(text, pos + 1, nesting);
        if (end < 0 || charAt(end) != ')') {
            return false;
        }
        tokens.add(new Token(Kind.ARITHMETIC, text.substring(pos + 2, end - 1), pos));
        pos = end + 1;
        return true;
    }

    private void processSubstitution() throws ShellParseException {
        int end = require(skipSubstitution(text, pos + 1, nesting), "process substitution", pos);
        tokens.add(new Token(Kind.PROCESS_SUBSTITUTION, text.substring(pos, end), pos));
        pos = end;
    }

    private String matchOperator() {
        for (String operator : OPERATORS) {
            if (text.startsWith(operator, pos)) {
                return operator;
            }
        }
        return null;
    }

    private void skipComment() {
        int end = text.indexOf('\n', pos);
        pos = end < 0 ? text.length() : end;
    }

    private void readHereDocBodies() {
        for (PendingHereDoc pending : pendingHereDocs) {
            StringBuilder body = new StringBuilder();
            while (pos < text.length()) {
                int lineEnd = text.indexOf('\n', pos);
                if (lineEnd < 0) {
                    lineEnd = text.length();
                }
                String line = text.substring(pos, lineEnd);
                pos = Math.min(lineEnd + 1, text.length());
                if (pending.removeTabs()) {
                    line = stripLeadingTabs(line);
                }
                if (line.equals(pending.delimiter())) {
                    break;
                }
                body.append(line).append('\n');
            }
            tokens.set(pending.tokenIndex(), tokens.get(pending.tokenIndex()).withHereDocBody(body.toString()));
        }
        pendingHereDocs.clear();
    }

    private int require(int end, String what, int start) throws ShellParseException {
        if (end == QuoteScanner.TOO_DEEP) {
            nestedTooDeeply = true;
            throw new ShellParseException("commands nested too deeply", start);
        }
        if (end < 0) {
            throw new ShellParseException("unterminated " + what, start);
        }
        return end;
    }

    private char charAt(int index) {
        return index < text.length() ? text.charAt(index) : '\0';
    }

    static String unquote(String delimiter) {
        StringBuilder sb = new StringBuilder(delimiter.length());
        for (int i = 0; i < delimiter.length(); i++) {
            char c = delimiter.charAt(i);
            if (c != '\'' && c != '"' && c != '\\') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String stripLeadingTabs(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == '\t') {
            i++;
        }
        return line.substring(i);
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
