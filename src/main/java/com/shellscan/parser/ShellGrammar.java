package com.shellscan.parser;

import com.shellscan.parser.ShellTokenizer.Kind;
import com.shellscan.parser.ShellTokenizer.Token;
import com.shellscan.syntax.AndOrList;
import com.shellscan.syntax.Assignment;
import com.shellscan.syntax.Command;
import com.shellscan.syntax.CommandPrefixOrSuffixItem;
import com.shellscan.syntax.CompoundCommand;
import com.shellscan.syntax.CompoundList;
import com.shellscan.syntax.ExtendedTestExpr;
import com.shellscan.syntax.FunctionDefinition;
import com.shellscan.syntax.IoRedirect;
import com.shellscan.syntax.Pipeline;
import com.shellscan.syntax.ProcessSubstitution;
import com.shellscan.syntax.Program;
import com.shellscan.syntax.SimpleCommand;
import com.shellscan.syntax.Word;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

class ShellGrammar {
    static final int MAX_NESTING = 256;

    private static final Set<String> LIST_TERMINATORS =
        Set.of("then", "elif", "else", "fi", "do", "done", "esac", "}");

    private static final Set<String> COMPOUND_KEYWORDS = Set.of("{", "if", "for", "while", "until", "case");

    private static final Set<String> REDIRECT_OPERATORS =
        Set.of("<", ">", ">>", "<>", ">|", "<&", ">&", "<<", "<<-", "<<<", "&>", "&>>");

    private static final Set<String> UNARY_TEST_OPERATORS = Set.of(
        "-a", "-b", "-c", "-d", "-e", "-f", "-g", "-h", "-k", "-p", "-r", "-s", "-t", "-u", "-w", "-x",
        "-G", "-L", "-N", "-O", "-S", "-R", "-n", "-o", "-v", "-z");

    private static final Set<String> BINARY_TEST_OPERATORS = Set.of(
        "==", "=", "!=", "=~", "-eq", "-ne", "-lt", "-le", "-gt", "-ge", "-nt", "-ot", "-ef");

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern ASSIGNMENT =
        Pattern.compile("([A-Za-z_][A-Za-z0-9_]*(?:\\[[^\\]]*\\])?)(\\+?)=(.*)", Pattern.DOTALL);

    private final MutableList<Token> tokens;
    private final int baseDepth;
    private int index;
    private int depth;

    ShellGrammar(MutableList<Token> tokens, int baseDepth) {
        this.tokens = tokens;
        this.baseDepth = baseDepth;
    }

    Program program() throws ShellParseException {
        MutableList<CompoundList> completeCommands = Lists.mutable.empty();
        skipNewlines();
        while (peek().kind() != Kind.EOF) {
            completeCommands.add(completeCommand());
            skipNewlines();
        }
        return new Program(completeCommands.asUnmodifiable());
    }

    CompoundList substitutionBody() throws ShellParseException {
        CompoundList list = compoundList();
        if (peek().kind() != Kind.EOF) {
            throw unexpected(peek());
        }
        return list;
    }

    // One line of the top level: and-or lists up to a newline
    private CompoundList completeCommand() throws ShellParseException {
        MutableList<CompoundList.Item> items = Lists.mutable.empty();
        while (true) {
            AndOrList andOr = andOr();
            Token next = peek();
            if (next.isOperator(";") || next.isOperator("&")) {
                advance();
                items.add(new CompoundList.Item(andOr, separatorOf(next)));
                if (atLineEnd()) {
                    break;
                }
            } else if (atLineEnd()) {
                items.add(new CompoundList.Item(andOr, CompoundList.SeparatorOperator.SEQUENCE));
                break;
            } else {
                throw unexpected(next);
            }
        }
        return new CompoundList(items.asUnmodifiable());
    }

    private CompoundList compoundList() throws ShellParseException {
        skipNewlines();
        MutableList<CompoundList.Item> items = Lists.mutable.empty();
        while (!atListTerminator()) {
            AndOrList andOr = andOr();
            Token next = peek();
            if (next.isOperator(";") || next.isOperator("&")) {
                advance();
                items.add(new CompoundList.Item(andOr, separatorOf(next)));
                skipNewlines();
            } else if (next.kind() == Kind.NEWLINE) {
                skipNewlines();
                items.add(new CompoundList.Item(andOr, CompoundList.SeparatorOperator.SEQUENCE));
            } else {
                items.add(new CompoundList.Item(andOr, CompoundList.SeparatorOperator.SEQUENCE));
                break;
            }
        }
        if (items.isEmpty()) {
            throw unexpected(peek());
        }
        return new CompoundList(items.asUnmodifiable());
    }

    private AndOrList andOr() throws ShellParseException {
        Pipeline first = pipeline();
        MutableList<AndOrList.AndOr> additional = Lists.mutable.empty();
        while (peek().isOperator("&&") || peek().isOperator("||")) {
            AndOrList.Operator operator = advance().text().equals("&&") ? AndOrList.Operator.AND : AndOrList.Operator.OR;
            skipNewlines();
            additional.add(new AndOrList.AndOr(operator, pipeline()));
        }
        return new AndOrList(first, additional.asUnmodifiable());
    }

    private Pipeline pipeline() throws ShellParseException {
        boolean timed = false;
        if (peek().isWord("time") && startsCommand(peek(1))) {
            advance();
            timed = true;
            if (peek().isWord("-p")) {
                advance();
            }
        }
        boolean bang = false;
        while (peek().isWord("!") && startsCommand(peek(1))) {
            advance();
            bang = !bang;
        }

        MutableList<Command> commands = Lists.mutable.empty();
        commands.add(command());
        while (peek().isOperator("|") || peek().isOperator("|&")) {
            advance();
            skipNewlines();
            commands.add(command());
        }
        return new Pipeline(timed, bang, commands.asUnmodifiable());
    }

    private Command command() throws ShellParseException {
        Token t = peek();
        enter(t);
        try {
            if (startsCompoundCommand(t)) {
                CompoundCommand compound = compoundCommand();
                return new Command.Compound(compound, redirectList());
            }
            if (t.isWord("function")) {
                return new Command.Function(functionKeywordDefinition());
            }
            if (t.isWord("[[")) {
                return new Command.ExtendedTest(extendedTest());
            }
            if (t.kind() == Kind.WORD && (LIST_TERMINATORS.contains(t.text()) || t.text().equals("]]"))) {
                throw unexpected(t);
            }
            if (t.kind() == Kind.WORD && NAME.matcher(t.text()).matches()
                && peek(1).isOperator("(") && peek(2).isOperator(")")) {
                return new Command.Function(functionDefinition());
            }
            return new Command.Simple(simpleCommand());
        } finally {
            depth--;
        }
    }

    private CompoundCommand compoundCommand() throws ShellParseException {
        Token t = advance();
        if (t.kind() == Kind.ARITHMETIC) {
            return new CompoundCommand.Arithmetic(t.text());
        }
        if (t.isOperator("(")) {
            CompoundList list = compoundList();
            expectOperator(")");
            return new CompoundCommand.Subshell(list);
        }
        return switch (t.text()) {
            case "{" -> {
                CompoundList list = compoundList();
                expectWord("}");
                yield new CompoundCommand.BraceGroup(list);
            }
            case "if" -> ifClause();
            case "for" -> forClause();
            case "while" -> new CompoundCommand.WhileClause(compoundList(), doGroup());
            case "until" -> new CompoundCommand.UntilClause(compoundList(), doGroup());
            case "case" -> caseClause();
            default -> throw unexpected(t);
        };
    }

    private CompoundCommand.IfClause ifClause() throws ShellParseException {
        CompoundList condition = compoundList();
        expectWord("then");
        CompoundList then = compoundList();

        MutableList<CompoundCommand.ElseClause> elses = Lists.mutable.empty();
        while (true) {
            Token t = advance();
            if (t.isWord("elif")) {
                CompoundList elifCondition = compoundList();
                expectWord("then");
                elses.add(new CompoundCommand.ElseClause(elifCondition, compoundList()));
            } else if (t.isWord("else")) {
                elses.add(new CompoundCommand.ElseClause(null, compoundList()));
                expectWord("fi");
                break;
            } else if (t.isWord("fi")) {
                break;
            } else {
                throw unexpected(t);
            }
        }
        return new CompoundCommand.IfClause(condition, then, elses.asUnmodifiable());
    }

    private CompoundCommand forClause() throws ShellParseException {
        if (peek().kind() == Kind.ARITHMETIC) {
            String header = advance().text();
            if (peek().isOperator(";")) {
                advance();
            }
            skipNewlines();
            return new CompoundCommand.ArithmeticForClause(header, doGroup());
        }

        Token name = advance();
        if (name.kind() != Kind.WORD || !NAME.matcher(name.text()).matches()) {
            throw unexpected(name);
        }
        skipNewlines();

        MutableList<Word> values = null;
        if (peek().isWord("in")) {
            advance();
            MutableList<Word> words = Lists.mutable.empty();
            while (peek().kind() == Kind.WORD) {
                words.add(new Word(advance().text()));
            }
            Token separator = advance();
            if (!separator.isOperator(";") && separator.kind() != Kind.NEWLINE) {
                throw unexpected(separator);
            }
            values = words.asUnmodifiable();
        } else if (peek().isOperator(";")) {
            advance();
        }
        skipNewlines();
        return new CompoundCommand.ForClause(name.text(), values, doGroup());
    }

    private CompoundCommand.CaseClause caseClause() throws ShellParseException {
        Token value = advance();
        if (value.kind() != Kind.WORD) {
            throw unexpected(value);
        }
        skipNewlines();
        expectWord("in");
        skipNewlines();

        MutableList<CompoundCommand.CaseItem> cases = Lists.mutable.empty();
        while (!peek().isWord("esac")) {
            if (peek().isOperator("(")) {
                advance();
            }
            MutableList<Word> patterns = Lists.mutable.empty();
            patterns.add(casePattern());
            while (peek().isOperator("|")) {
                advance();
                patterns.add(casePattern());
            }
            expectOperator(")");
            skipNewlines();

            CompoundList cmd = atListTerminator() ? null : compoundList();
            Token t = peek();
            CompoundCommand.CaseItemTerminator terminator;
            if (t.isOperator(";;")) {
                terminator = CompoundCommand.CaseItemTerminator.BREAK;
            } else if (t.isOperator(";&")) {
                terminator = CompoundCommand.CaseItemTerminator.FALL_THROUGH;
            } else if (t.isOperator(";;&")) {
                terminator = CompoundCommand.CaseItemTerminator.CONTINUE_MATCHING;
            } else if (t.isWord("esac")) {
                cases.add(new CompoundCommand.CaseItem(patterns.asUnmodifiable(), cmd, CompoundCommand.CaseItemTerminator.BREAK));
                break;
            } else {
                throw unexpected(t);
            }
            advance();
            skipNewlines();
            cases.add(new CompoundCommand.CaseItem(patterns.asUnmodifiable(), cmd, terminator));
        }
        expectWord("esac");
        return new CompoundCommand.CaseClause(new Word(value.text()), cases.asUnmodifiable());
    }

    private Word casePattern() throws ShellParseException {
        Token t = advance();
        if (t.kind() != Kind.WORD) {
            throw unexpected(t);
        }
        return new Word(t.text());
    }

    private CompoundCommand.DoGroup doGroup() throws ShellParseException {
        expectWord("do");
        CompoundList list = compoundList();
        expectWord("done");
        return new CompoundCommand.DoGroup(list);
    }

    // name () body
    private FunctionDefinition functionDefinition() throws ShellParseException {
        String name = advance().text();
        advance();
        advance();
        skipNewlines();
        return functionBody(name);
    }

    // function name [()] body
    private FunctionDefinition functionKeywordDefinition() throws ShellParseException {
        advance();
        Token name = advance();
        if (name.kind() != Kind.WORD) {
            throw unexpected(name);
        }
        if (peek().isOperator("(") && peek(1).isOperator(")")) {
            advance();
            advance();
        }
        skipNewlines();
        return functionBody(name.text());
    }

    private FunctionDefinition functionBody(String name) throws ShellParseException {
        Token t = peek();
        if (!startsCompoundCommand(t)) {
            throw unexpected(t);
        }
        CompoundCommand body = compoundCommand();
        return new FunctionDefinition(name, body, redirectList());
    }

    private ExtendedTestExpr extendedTest() throws ShellParseException {
        advance();
        ExtendedTestExpr expr = testOr();
        skipNewlines();
        expectWord("]]");
        return expr;
    }

    private ExtendedTestExpr testOr() throws ShellParseException {
        ExtendedTestExpr left = testAnd();
        while (peekSkippingNewlines().isOperator("||")) {
            advance();
            left = new ExtendedTestExpr.Or(left, testAnd());
        }
        return left;
    }

    private ExtendedTestExpr testAnd() throws ShellParseException {
        ExtendedTestExpr left = testUnary();
        while (peekSkippingNewlines().isOperator("&&")) {
            advance();
            left = new ExtendedTestExpr.And(left, testUnary());
        }
        return left;
    }

    private ExtendedTestExpr testUnary() throws ShellParseException {
        Token t = peekSkippingNewlines();
        enter(t);
        try {
            if (t.isWord("!")) {
                advance();
                return new ExtendedTestExpr.Not(testUnary());
            }
            if (t.isOperator("(")) {
                advance();
                ExtendedTestExpr inner = testOr();
                skipNewlines();
                expectOperator(")");
                return new ExtendedTestExpr.Parenthesized(inner);
            }
            return testPrimary();
        } finally {
            depth--;
        }
    }

    private ExtendedTestExpr testPrimary() throws ShellParseException {
        Token t = advance();
        if (!isTestWord(t)) {
            throw unexpected(t);
        }
        Token next = peek();
        if (UNARY_TEST_OPERATORS.contains(t.text()) && isTestWord(next)
            && !next.isWord("]]") && !isBinaryTestOperator(next)) {
            return new ExtendedTestExpr.UnaryTest(t.text(), new Word(advance().text()));
        }
        if (isBinaryTestOperator(next)) {
            String operator = advance().text();
            Token right = advance();
            if (!isTestWord(right)) {
                throw unexpected(right);
            }
            return new ExtendedTestExpr.BinaryTest(operator, new Word(t.text()), new Word(right.text()));
        }
        // A lone word tests for a non-empty string
        return new ExtendedTestExpr.UnaryTest("-n", new Word(t.text()));
    }

    private MutableList<IoRedirect> redirectList() throws ShellParseException {
        MutableList<IoRedirect> redirects = Lists.mutable.empty();
        while (isRedirectStart(peek())) {
            redirects.add(ioRedirect());
        }
        return redirects.asUnmodifiable();
    }

    private SimpleCommand simpleCommand() throws ShellParseException {
        MutableList<CommandPrefixOrSuffixItem> prefix = Lists.mutable.empty();
        while (true) {
            Token t = peek();
            if (isRedirectStart(t)) {
                prefix.add(new CommandPrefixOrSuffixItem.Redirect(ioRedirect()));
            } else if (t.kind() == Kind.PROCESS_SUBSTITUTION) {
                prefix.add(new CommandPrefixOrSuffixItem.Substitution(processSubstitution(advance())));
            } else if (t.kind() == Kind.WORD && ASSIGNMENT.matcher(t.text()).matches()) {
                prefix.add(assignmentWord(advance()));
            } else {
                break;
            }
        }

        Word name = null;
        MutableList<CommandPrefixOrSuffixItem> suffix = Lists.mutable.empty();
        if (peek().kind() == Kind.WORD) {
            name = new Word(advance().text());
            while (true) {
                Token t = peek();
                if (isRedirectStart(t)) {
                    suffix.add(new CommandPrefixOrSuffixItem.Redirect(ioRedirect()));
                } else if (t.kind() == Kind.PROCESS_SUBSTITUTION) {
                    suffix.add(new CommandPrefixOrSuffixItem.Substitution(processSubstitution(advance())));
                } else if (t.kind() == Kind.WORD) {
                    suffix.add(new CommandPrefixOrSuffixItem.WordItem(new Word(advance().text())));
                } else {
                    break;
                }
            }
        }

        if (prefix.isEmpty() && name == null) {
            throw unexpected(peek());
        }
        return new SimpleCommand(prefix.asUnmodifiable(), name, suffix.asUnmodifiable());
    }

    private CommandPrefixOrSuffixItem assignmentWord(Token token) throws ShellParseException {
        Matcher matcher = ASSIGNMENT.matcher(token.text());
        if (!matcher.matches()) {
            throw unexpected(token);
        }
        String rawValue = matcher.group(3);

        Assignment.Value value;
        if (rawValue.startsWith("(") && QuoteScanner.skipParenthesized(rawValue, 0) == rawValue.length()) {
            value = new Assignment.Value.Array(arrayElements(rawValue.substring(1, rawValue.length() - 1)));
        } else {
            value = new Assignment.Value.Scalar(new Word(rawValue));
        }
        Assignment assignment = new Assignment(matcher.group(1), value, !matcher.group(2).isEmpty());
        return new CommandPrefixOrSuffixItem.AssignmentWord(assignment, new Word(token.text()));
    }

    private MutableList<Assignment.ArrayElement> arrayElements(String body) throws ShellParseException {
        MutableList<Assignment.ArrayElement> elements = Lists.mutable.empty();
        for (Token t : new ShellTokenizer(body).tokenize()) {
            if (t.kind() == Kind.NEWLINE || t.kind() == Kind.EOF) {
                continue;
            }
            if (t.kind() != Kind.WORD) {
                throw unexpected(t);
            }
            String text = t.text();
            int close = text.indexOf("]=");
            if (text.startsWith("[") && close > 0) {
                elements.add(new Assignment.ArrayElement(new Word(text.substring(1, close)), new Word(text.substring(close + 2))));
            } else {
                elements.add(new Assignment.ArrayElement(null, new Word(text)));
            }
        }
        return elements.asUnmodifiable();
    }

    private IoRedirect ioRedirect() throws ShellParseException {
        Integer fd = null;
        Token t = advance();
        if (t.kind() == Kind.IO_NUMBER) {
            fd = fileDescriptor(t);
            t = advance();
        }
        if (t.kind() != Kind.OPERATOR || !REDIRECT_OPERATORS.contains(t.text())) {
            throw unexpected(t);
        }

        String operator = t.text();
        return switch (operator) {
            case "<<", "<<-" -> {
                Token delimiter = requireWord(advance());
                String body = delimiter.hereDocBody() != null ? delimiter.hereDocBody() : "";
                boolean requiresExpansion = delimiter.text().equals(ShellTokenizer.unquote(delimiter.text()));
                yield new IoRedirect.HereDocument(fd, operator.equals("<<-"), requiresExpansion,
                    new Word(delimiter.text()), new Word(body));
            }
            case "<<<" -> new IoRedirect.HereString(fd, new Word(requireWord(advance()).text()));
            case "&>", "&>>" -> new IoRedirect.OutputAndError(new Word(requireWord(advance()).text()), operator.equals("&>>"));
            default -> fileRedirect(fd, IoRedirect.Kind.fromSymbol(operator));
        };
    }

    private IoRedirect fileRedirect(Integer fd, IoRedirect.Kind kind) throws ShellParseException {
        Token target = advance();
        if (target.kind() == Kind.PROCESS_SUBSTITUTION) {
            return new IoRedirect.File(fd, kind, new IoRedirect.Target.Substitution(processSubstitution(target)));
        }
        requireWord(target);
        if (kind.isDuplicate() && target.text().chars().allMatch(Character::isDigit)) {
            return new IoRedirect.File(fd, kind, new IoRedirect.Target.Fd(fileDescriptor(target)));
        }
        return new IoRedirect.File(fd, kind, new IoRedirect.Target.Filename(new Word(target.text())));
    }

    private ProcessSubstitution processSubstitution(Token token) throws ShellParseException {
        String text = token.text();
        ProcessSubstitution.Kind kind = text.charAt(0) == '<' ? ProcessSubstitution.Kind.READ : ProcessSubstitution.Kind.WRITE;
        String inner = text.substring(2, text.length() - 1);
        MutableList<Token> innerTokens = new ShellTokenizer(inner).tokenize();
        CompoundList list = new ShellGrammar(innerTokens, baseDepth + depth + 1).substitutionBody();
        return new ProcessSubstitution(kind, list, inner);
    }

    private Integer fileDescriptor(Token token) throws ShellParseException {
        try {
            return Integer.valueOf(token.text());
        } catch (NumberFormatException e) {
            throw new ShellParseException("file descriptor out of range: " + token.text(), token.offset());
        }
    }

    private void enter(Token t) throws ShellParseException {
        depth++;
        if (baseDepth + depth > MAX_NESTING) {
            depth--;
            throw new ShellParseException("commands nested too deeply", t.offset());
        }
    }

    private boolean atListTerminator() {
        Token t = peek();
        return switch (t.kind()) {
            case EOF -> true;
            case OPERATOR -> t.text().equals(")") || t.text().equals(";;") || t.text().equals(";&") || t.text().equals(";;&");
            case WORD -> LIST_TERMINATORS.contains(t.text());
            default -> false;
        };
    }

    private boolean atLineEnd() {
        Kind kind = peek().kind();
        return kind == Kind.NEWLINE || kind == Kind.EOF;
    }

    private static boolean startsCompoundCommand(Token t) {
        return t.kind() == Kind.ARITHMETIC
            || t.isOperator("(")
            || (t.kind() == Kind.WORD && COMPOUND_KEYWORDS.contains(t.text()));
    }

    private static boolean startsCommand(Token t) {
        return switch (t.kind()) {
            case WORD, IO_NUMBER, ARITHMETIC, PROCESS_SUBSTITUTION -> true;
            case OPERATOR -> t.text().equals("(") || REDIRECT_OPERATORS.contains(t.text());
            default -> false;
        };
    }

    private static boolean isRedirectStart(Token t) {
        return t.kind() == Kind.IO_NUMBER
            || (t.kind() == Kind.OPERATOR && REDIRECT_OPERATORS.contains(t.text()));
    }

    private static boolean isTestWord(Token t) {
        return t.kind() == Kind.WORD || t.kind() == Kind.IO_NUMBER;
    }

    private static boolean isBinaryTestOperator(Token t) {
        return (t.kind() == Kind.WORD && BINARY_TEST_OPERATORS.contains(t.text()))
            || t.isOperator("<")
            || t.isOperator(">");
    }

    private static CompoundList.SeparatorOperator separatorOf(Token t) {
        return t.isOperator("&") ? CompoundList.SeparatorOperator.ASYNC : CompoundList.SeparatorOperator.SEQUENCE;
    }

    private Token requireWord(Token t) throws ShellParseException {
        if (t.kind() != Kind.WORD) {
            throw unexpected(t);
        }
        return t;
    }

    private void expectWord(String word) throws ShellParseException {
        Token t = advance();
        if (!t.isWord(word)) {
            throw unexpected(t);
        }
    }

    private void expectOperator(String operator) throws ShellParseException {
        Token t = advance();
        if (!t.isOperator(operator)) {
            throw unexpected(t);
        }
    }

    private void skipNewlines() {
        while (peek().kind() == Kind.NEWLINE) {
            advance();
        }
    }

    private Token peekSkippingNewlines() {
        skipNewlines();
        return peek();
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private Token advance() {
        Token t = peek();
        if (index < tokens.size() - 1) {
            index++;
        }
        return t;
    }

    private static ShellParseException unexpected(Token t) {
        return switch (t.kind()) {
            case EOF -> new ShellParseException("syntax error: unexpected end of input", t.offset());
            case NEWLINE -> new ShellParseException("syntax error near unexpected newline", t.offset());
            default -> new ShellParseException("syntax error near unexpected token `" + t.text() + "'", t.offset());
        };
    }
}
