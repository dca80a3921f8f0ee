package com.shellscan.extract;

import com.shellscan.parser.ShellParseException;
import com.shellscan.parser.ShellParser;
import com.shellscan.syntax.AndOrList;
import com.shellscan.syntax.Assignment;
import com.shellscan.syntax.Command;
import com.shellscan.syntax.CommandPrefixOrSuffixItem;
import com.shellscan.syntax.CompoundCommand;
import com.shellscan.syntax.CompoundList;
import com.shellscan.syntax.ExtendedTestExpr;
import com.shellscan.syntax.IoRedirect;
import com.shellscan.syntax.Pipeline;
import com.shellscan.syntax.Program;
import com.shellscan.syntax.ShellTextRenderer;
import com.shellscan.syntax.SimpleCommand;
import com.shellscan.syntax.Word;
import com.shellscan.word.WordLexException;
import com.shellscan.word.WordLexer;
import com.shellscan.word.WordPiece;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.collector.Collectors2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Stream;

/**
 * Lists the text of every simple command a shell command line can run, including commands
 * inside command substitutions, process substitutions and control structures.
 * <p>
 * Commands come out in the order they are written, not the order they would run: a command is
 * listed before the substitutions in its own arguments. The same text is listed once per
 * occurrence.
 * <p>
 * Only the top-level text has to parse. A substitution whose text does not parse, a word that
 * does not lex, or a substitution nested deeper than
 * {@link ExtractorOptions#maxSubstitutionDepth()} contributes no commands.
 */
public class CommandExtractor {
    private static final Logger log = LoggerFactory.getLogger(CommandExtractor.class);

    private final ShellParser parser;
    private final WordLexer lexer;
    private final ShellTextRenderer renderer;
    private final ExtractorOptions options;

    public CommandExtractor() {
        this(ExtractorOptions.defaults());
    }

    public CommandExtractor(ExtractorOptions options) {
        this(new ShellParser(), new WordLexer(), options);
    }

    public CommandExtractor(ShellParser parser, WordLexer lexer, ExtractorOptions options) {
        this.parser = parser;
        this.lexer = lexer;
        this.renderer = new ShellTextRenderer();
        this.options = options;
    }

    /**
     * Parses {@code commandText} and returns the commands it contains.
     * <p>
     * The text is parsed before this method returns; nested substitutions are parsed as the
     * stream is consumed. The stream can be consumed once.
     *
     * @throws ShellParseException if {@code commandText} is not a valid command line
     */
    public Stream<String> extract(String commandText) throws ShellParseException {
        Program program = parser.parse(commandText);
        return program(program, 0);
    }

    public MutableList<String> extractAll(String commandText) throws ShellParseException {
        return extract(commandText).collect(Collectors2.toList());
    }

    private Stream<String> program(Program program, int depth) {
        return program.completeCommands().stream().flatMap(list -> compoundList(list, depth));
    }

    private Stream<String> compoundList(CompoundList list, int depth) {
        return list.items().stream().flatMap(item -> andOrList(item.andOr(), depth));
    }

    private Stream<String> andOrList(AndOrList andOr, int depth) {
        return Stream.concat(
            pipeline(andOr.first(), depth),
            andOr.additional().stream().flatMap(next -> pipeline(next.pipeline(), depth)));
    }

    private Stream<String> pipeline(Pipeline pipeline, int depth) {
        return pipeline.seq().stream().flatMap(command -> command(command, depth));
    }

    private Stream<String> command(Command command, int depth) {
        if (command instanceof Command.Simple simple) {
            return simpleCommand(simple.command(), depth);
        }
        if (command instanceof Command.Compound compound) {
            Stream<String> body = compoundCommand(compound.command(), depth);
            if (!options.scanCompoundRedirects()) {
                return body;
            }
            return Stream.concat(body, compound.redirects().stream().flatMap(r -> redirect(r, depth)));
        }
        if (command instanceof Command.Function function) {
            return compoundCommand(function.definition().body(), depth);
        }
        if (command instanceof Command.ExtendedTest test) {
            return extendedTest(test.expr(), depth);
        }
        throw unhandled(command);
    }

    private Stream<String> simpleCommand(SimpleCommand command, int depth) {
        String text = renderer.render(command).trim();
        Stream<String> self = text.isEmpty() ? Stream.empty() : Stream.of(text);

        return Stream.of(
                self,
                command.prefix().stream().flatMap(item -> item(item, depth)),
                Stream.ofNullable(command.wordOrName()).flatMap(name -> word(name, depth)),
                command.suffix().stream().flatMap(item -> item(item, depth)))
            .flatMap(s -> s);
    }

    private Stream<String> item(CommandPrefixOrSuffixItem item, int depth) {
        if (item instanceof CommandPrefixOrSuffixItem.Redirect r) {
            return redirect(r.redirect(), depth);
        }
        if (item instanceof CommandPrefixOrSuffixItem.AssignmentWord a) {
            return assignment(a.assignment(), depth);
        }
        if (item instanceof CommandPrefixOrSuffixItem.WordItem w) {
            return word(w.word(), depth);
        }
        if (item instanceof CommandPrefixOrSuffixItem.Substitution s) {
            return compoundList(s.substitution().list(), depth);
        }
        throw unhandled(item);
    }

    private Stream<String> assignment(Assignment assignment, int depth) {
        if (assignment.value() instanceof Assignment.Value.Scalar scalar) {
            return word(scalar.word(), depth);
        }
        if (assignment.value() instanceof Assignment.Value.Array array) {
            return array.elements().stream().flatMap(element -> Stream.concat(
                Stream.ofNullable(element.index()).flatMap(index -> word(index, depth)),
                word(element.value(), depth)));
        }
        throw unhandled(assignment.value());
    }

    private Stream<String> redirect(IoRedirect redirect, int depth) {
        if (redirect instanceof IoRedirect.File file) {
            if (file.target() instanceof IoRedirect.Target.Substitution s) {
                return compoundList(s.substitution().list(), depth);
            }
            return Stream.empty();
        }
        if (redirect instanceof IoRedirect.HereDocument) {
            return Stream.empty();
        }
        if (redirect instanceof IoRedirect.HereString hereString) {
            return word(hereString.word(), depth);
        }
        if (redirect instanceof IoRedirect.OutputAndError outputAndError) {
            return word(outputAndError.word(), depth);
        }
        throw unhandled(redirect);
    }

    private Stream<String> word(Word word, int depth) {
        MutableList<WordPiece> pieces;
        try {
            pieces = lexer.lex(word.value());
        } catch (WordLexException e) {
            log.debug("Skipping word that does not lex: {}", e.getMessage());
            return Stream.empty();
        }
        return pieces.stream().flatMap(piece -> wordPiece(piece, depth));
    }

    private Stream<String> wordPiece(WordPiece piece, int depth) {
        if (piece instanceof WordPiece.CommandSubstitution substitution) {
            return substitution(substitution.command(), depth + 1);
        }
        if (piece instanceof WordPiece.BackquotedCommandSubstitution substitution) {
            return substitution(substitution.command(), depth + 1);
        }
        if (piece instanceof WordPiece.DoubleQuotedSequence quoted) {
            return quoted.pieces().stream().flatMap(inner -> wordPiece(inner, depth));
        }
        if (piece instanceof WordPiece.GettextDoubleQuotedSequence quoted) {
            return quoted.pieces().stream().flatMap(inner -> wordPiece(inner, depth));
        }
        return Stream.empty();
    }

    private Stream<String> substitution(String commandText, int depth) {
        if (depth > options.maxSubstitutionDepth()) {
            log.debug("Skipping substitution nested {} levels deep: {}", depth, commandText);
            return Stream.empty();
        }
        Program program;
        try {
            program = parser.parse(commandText);
        } catch (ShellParseException e) {
            log.debug("Skipping substitution that does not parse: {}", e.getMessage());
            return Stream.empty();
        }
        return program(program, depth);
    }

    private Stream<String> compoundCommand(CompoundCommand command, int depth) {
        if (command instanceof CompoundCommand.BraceGroup group) {
            return compoundList(group.list(), depth);
        }
        if (command instanceof CompoundCommand.Subshell subshell) {
            return compoundList(subshell.list(), depth);
        }
        if (command instanceof CompoundCommand.ForClause forClause) {
            Stream<Word> values = forClause.values() == null ? Stream.empty() : forClause.values().stream();
            return Stream.concat(
                values.flatMap(value -> word(value, depth)),
                doGroup(forClause.body(), depth));
        }
        if (command instanceof CompoundCommand.CaseClause caseClause) {
            return Stream.concat(
                word(caseClause.value(), depth),
                caseClause.cases().stream()
                    .filter(arm -> arm.cmd() != null)
                    .flatMap(arm -> compoundList(arm.cmd(), depth)));
        }
        if (command instanceof CompoundCommand.IfClause ifClause) {
            return Stream.of(
                    compoundList(ifClause.condition(), depth),
                    compoundList(ifClause.then(), depth),
                    ifClause.elses().stream().flatMap(arm -> Stream.concat(
                        Stream.ofNullable(arm.condition()).flatMap(condition -> compoundList(condition, depth)),
                        compoundList(arm.body(), depth))))
                .flatMap(s -> s);
        }
        if (command instanceof CompoundCommand.WhileClause whileClause) {
            return Stream.concat(compoundList(whileClause.condition(), depth), doGroup(whileClause.body(), depth));
        }
        if (command instanceof CompoundCommand.UntilClause untilClause) {
            return Stream.concat(compoundList(untilClause.condition(), depth), doGroup(untilClause.body(), depth));
        }
        if (command instanceof CompoundCommand.ArithmeticForClause arithmeticFor) {
            return doGroup(arithmeticFor.body(), depth);
        }
        if (command instanceof CompoundCommand.Arithmetic) {
            return Stream.empty();
        }
        throw unhandled(command);
    }

    private Stream<String> doGroup(CompoundCommand.DoGroup group, int depth) {
        return compoundList(group.list(), depth);
    }

    private Stream<String> extendedTest(ExtendedTestExpr expr, int depth) {
        if (expr instanceof ExtendedTestExpr.Not not) {
            return extendedTest(not.inner(), depth);
        }
        if (expr instanceof ExtendedTestExpr.Parenthesized parenthesized) {
            return extendedTest(parenthesized.inner(), depth);
        }
        if (expr instanceof ExtendedTestExpr.And and) {
            return Stream.concat(extendedTest(and.left(), depth), extendedTest(and.right(), depth));
        }
        if (expr instanceof ExtendedTestExpr.Or or) {
            return Stream.concat(extendedTest(or.left(), depth), extendedTest(or.right(), depth));
        }
        if (expr instanceof ExtendedTestExpr.UnaryTest unary) {
            return word(unary.operand(), depth);
        }
        if (expr instanceof ExtendedTestExpr.BinaryTest binary) {
            return Stream.concat(word(binary.left(), depth), word(binary.right(), depth));
        }
        throw unhandled(expr);
    }

    // New syntax node types must be wired in above
    private static IllegalStateException unhandled(Object node) {
        return new IllegalStateException("No extraction rule for " + node.getClass().getSimpleName());
    }
}
