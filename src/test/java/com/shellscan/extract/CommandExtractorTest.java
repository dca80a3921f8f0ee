package com.shellscan.extract;

import com.shellscan.parser.ShellParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CommandExtractorTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private List<String> extract(String commandText) throws ShellParseException {
        return extract(commandText, ExtractorOptions.defaults());
    }

    private List<String> extract(String commandText, ExtractorOptions options) throws ShellParseException {
        return new CommandExtractor(options).extract(commandText).collect(Collectors.toList());
    }

    // ============================================================
    // Lists and pipelines
    // ============================================================

    @Test
    public void testSingleCommand() throws ShellParseException {
        assertEquals(List.of("ls -la"), extract("ls -la"));
    }

    @Test
    public void testEmptyInput() throws ShellParseException {
        assertEquals(List.of(), extract(""));
        assertEquals(List.of(), extract("   \n\n"));
        assertEquals(List.of(), extract("# only a comment"));
    }

    @Test
    public void testPipelineMembersInOrder() throws ShellParseException {
        assertEquals(List.of("cat file", "grep x", "wc -l"), extract("cat file | grep x | wc -l"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a && b", "a || b", "a; b", "a & b", "a&&b", "a;b"})
    public void testListOperatorsSplitCommands(String commandText) throws ShellParseException {
        assertEquals(List.of("a", "b"), extract(commandText));
    }

    @Test
    public void testOperatorsWithoutSpaces() throws ShellParseException {
        assertEquals(List.of("ls", "rm"), extract("ls&&rm"));
    }

    @Test
    public void testMultipleLines() throws ShellParseException {
        assertEquals(List.of("cd /tmp", "ls", "pwd"), extract("cd /tmp\nls\n\npwd"));
    }

    @Test
    public void testTrailingCommentIsIgnored() throws ShellParseException {
        assertEquals(List.of("ls"), extract("ls # $(rm -rf /)"));
    }

    @Test
    public void testTimedAndNegatedPipelines() throws ShellParseException {
        assertEquals(List.of("ls", "grep x"), extract("time ls | grep x"));
        assertEquals(List.of("grep -q x file", "echo missing"), extract("! grep -q x file && echo missing"));
        assertEquals(List.of("make", "tee log"), extract("make |& tee log"));
    }

    // ============================================================
    // Command and process substitution
    // ============================================================

    @Test
    public void testCommandSubstitution() throws ShellParseException {
        assertEquals(List.of("echo $(whoami)", "whoami"), extract("echo $(whoami)"));
    }

    @Test
    public void testBackquotedSubstitutionMatchesDollarForm() throws ShellParseException {
        List<String> backquoted = extract("echo `whoami`");
        List<String> dollar = extract("echo $(whoami)");

        assertEquals(List.of("echo `whoami`", "whoami"), backquoted);
        assertEquals(dollar.subList(1, dollar.size()), backquoted.subList(1, backquoted.size()));
    }

    @Test
    public void testEscapedBackquotesNest() throws ShellParseException {
        assertEquals(
            List.of("echo `echo \\`whoami\\``", "echo `whoami`", "whoami"),
            extract("echo `echo \\`whoami\\``"));
    }

    @Test
    public void testNestedCommandSubstitution() throws ShellParseException {
        assertEquals(
            List.of("echo $(cat $(whoami).txt)", "cat $(whoami).txt", "whoami"),
            extract("echo $(cat $(whoami).txt)"));
    }

    @Test
    public void testSubstitutionInsideDoubleQuotes() throws ShellParseException {
        assertEquals(List.of("echo \"user: $(whoami)\"", "whoami"), extract("echo \"user: $(whoami)\""));
        assertEquals(List.of("echo $\"hello $(id)\"", "id"), extract("echo $\"hello $(id)\""));
    }

    @Test
    public void testSingleQuotedTextIsNotScanned() throws ShellParseException {
        assertEquals(List.of("echo '$(whoami)'"), extract("echo '$(whoami)'"));
        assertEquals(List.of("echo \"\\$(whoami)\""), extract("echo \"\\$(whoami)\""));
    }

    @Test
    public void testArithmeticAndParameterExpansionsAreNotScanned() throws ShellParseException {
        assertEquals(List.of("echo $((1 + 2))"), extract("echo $((1 + 2))"));
        assertEquals(List.of("echo ${x:-$(id)}"), extract("echo ${x:-$(id)}"));
    }

    @Test
    public void testReadProcessSubstitution() throws ShellParseException {
        assertEquals(List.of("cat <(ls)", "ls"), extract("cat <(ls)"));
    }

    @Test
    public void testWriteProcessSubstitution() throws ShellParseException {
        assertEquals(List.of("ls >(cat)", "cat"), extract("ls >(cat)"));
    }

    @Test
    public void testProcessSubstitutionsWithNestedCommands() throws ShellParseException {
        assertEquals(
            List.of("diff <(ls $(pwd)) <(ls /)", "ls $(pwd)", "pwd", "ls /"),
            extract("diff <(ls $(pwd)) <(ls /)"));
    }

    @Test
    public void testSubstitutionInCommandName() throws ShellParseException {
        assertEquals(List.of("$(which python) script.py", "which python"), extract("$(which python) script.py"));
    }

    // ============================================================
    // Comments, case patterns and here-documents inside substitutions
    // ============================================================

    @Test
    public void testQuoteInsideCommentDoesNotSwallowLaterCommands() throws ShellParseException {
        List<String> commands = extract("echo $(true # it's\n) ; rm -rf / ; echo ')' # '");

        assertTrue(commands.contains("rm -rf /"));
        assertEquals(List.of("echo $(true # it's\n)", "true", "rm -rf /", "echo ')'"), commands);
    }

    @Test
    public void testCommentInsideQuotedSubstitution() throws ShellParseException {
        assertEquals(
            List.of("echo \"$(true # it's\n)\"", "true", "id"),
            extract("echo \"$(true # it's\n)\"; id"));
    }

    @Test
    public void testParenthesisInsideCommentDoesNotCloseSubstitution() throws ShellParseException {
        assertEquals(List.of("echo $(echo # )\nls)", "echo", "ls"), extract("echo $(echo # )\nls)"));
    }

    @Test
    public void testCasePatternsInsideSubstitution() throws ShellParseException {
        assertEquals(List.of("echo $(case x in a) ls;; esac)", "ls"), extract("echo $(case x in a) ls;; esac)"));
        assertEquals(
            List.of("echo $(case \"$1\" in (a|b) ls;; *) pwd;; esac)", "ls", "pwd"),
            extract("echo $(case \"$1\" in (a|b) ls;; *) pwd;; esac)"));
    }

    @Test
    public void testHereDocumentInsideSubstitution() throws ShellParseException {
        assertEquals(List.of("echo $(cat <<X\n)\nX\n)", "cat <<X"), extract("echo $(cat <<X\n)\nX\n)"));
    }

    @Test
    public void testCommentInsideProcessSubstitution() throws ShellParseException {
        assertEquals(
            List.of("diff <(ls # it's\n) <(pwd)", "ls", "pwd"),
            extract("diff <(ls # it's\n) <(pwd)"));
    }

    // ============================================================
    // Redirects and assignments
    // ============================================================

    @Test
    public void testRedirectsAreRendered() throws ShellParseException {
        assertEquals(List.of("echo hi > out.txt"), extract("echo hi >out.txt"));
        assertEquals(List.of("ls 2>&1"), extract("ls 2>&1"));
        assertEquals(List.of("> out.txt echo hi"), extract(">out.txt echo hi"));
        assertEquals(List.of("> out.txt"), extract("> out.txt"));
    }

    @Test
    public void testFilenameRedirectTargetIsNotScanned() throws ShellParseException {
        assertEquals(List.of("echo hi > $(mktemp)"), extract("echo hi > $(mktemp)"));
    }

    @Test
    public void testProcessSubstitutionRedirectTarget() throws ShellParseException {
        assertEquals(List.of("cat < <(ls)", "ls"), extract("cat < <(ls)"));
    }

    @Test
    public void testHereStringIsScanned() throws ShellParseException {
        assertEquals(List.of("cat <<< $(whoami)", "whoami"), extract("cat <<< $(whoami)"));
    }

    @Test
    public void testOutputAndErrorRedirectIsScanned() throws ShellParseException {
        assertEquals(List.of("ls &> $(echo log)", "echo log"), extract("ls &> $(echo log)"));
    }

    @Test
    public void testHereDocumentBodyIsNotScanned() throws ShellParseException {
        assertEquals(List.of("cat <<EOF", "ls"), extract("cat <<EOF\n$(whoami)\nEOF\nls"));
    }

    @Test
    public void testAssignmentPrefix() throws ShellParseException {
        assertEquals(List.of("FOO=$(id) bar", "id"), extract("FOO=$(id) bar"));
    }

    @Test
    public void testBareAssignment() throws ShellParseException {
        assertEquals(List.of("X=$(date)", "date"), extract("X=$(date)"));
    }

    @Test
    public void testArrayAssignment() throws ShellParseException {
        assertEquals(
            List.of("arr=($(ls) [2]=$(pwd))", "ls", "pwd"),
            extract("arr=($(ls) [2]=$(pwd))"));
    }

    // ============================================================
    // Compound commands
    // ============================================================

    @Test
    public void testSubshellHasNoEntryOfItsOwn() throws ShellParseException {
        assertEquals(List.of("ls", "rm -rf /"), extract("(ls && rm -rf /)"));
    }

    @Test
    public void testBraceGroup() throws ShellParseException {
        assertEquals(List.of("ls", "pwd"), extract("{ ls; pwd; }"));
    }

    @Test
    public void testIfClause() throws ShellParseException {
        assertEquals(
            List.of("true", "echo a", "test -f x", "echo b", "echo c"),
            extract("if true; then echo a; elif test -f x; then echo b; else echo c; fi"));
    }

    @Test
    public void testForClause() throws ShellParseException {
        assertEquals(List.of("ls", "cat $f"), extract("for f in $(ls); do cat $f; done"));
    }

    @Test
    public void testArithmeticForClause() throws ShellParseException {
        assertEquals(List.of("echo $i"), extract("for ((i=0; i<3; i++)); do echo $i; done"));
    }

    @Test
    public void testWhileAndUntil() throws ShellParseException {
        assertEquals(List.of("read line", "echo $line"), extract("while read line; do echo $line; done"));
        assertEquals(List.of("false", "sleep 1"), extract("until false; do sleep 1; done"));
    }

    @Test
    public void testCaseClause() throws ShellParseException {
        assertEquals(
            List.of("uname", "echo linux", "echo other"),
            extract("case $(uname) in Linux) echo linux;; *) echo other;; esac"));
    }

    @Test
    public void testArithmeticCommandHasNoCommands() throws ShellParseException {
        assertEquals(List.of(), extract("(( x > 1 ))"));
    }

    @Test
    public void testFunctionBodies() throws ShellParseException {
        assertEquals(List.of("rm -rf /tmp/x"), extract("foo() { rm -rf /tmp/x; }"));
        assertEquals(List.of("ls"), extract("function bar { ls; }"));
    }

    @Test
    public void testExtendedTestOperands() throws ShellParseException {
        assertEquals(
            List.of("which ls", "id -u"),
            extract("[[ -f $(which ls) && $(id -u) == 0 ]]"));
        assertEquals(List.of("a"), extract("[[ ! ( $(a) =~ ^x(y|z)$ ) ]]"));
    }

    @Test
    public void testCompoundRedirectsSkippedByDefault() throws ShellParseException {
        assertEquals(
            List.of("read line", "echo $line"),
            extract("while read line; do echo $line; done < <(ls)"));
        assertEquals(List.of("ls"), extract("{ ls; } <<< $(whoami)"));
    }

    @Test
    public void testCompoundRedirectsScannedWhenEnabled() throws ShellParseException {
        ExtractorOptions options = ExtractorOptions.defaults().withScanCompoundRedirects(true);

        assertEquals(
            List.of("read line", "echo $line", "ls"),
            extract("while read line; do echo $line; done < <(ls)", options));
        assertEquals(List.of("ls", "whoami"), extract("{ ls; } <<< $(whoami)", options));
    }

    // ============================================================
    // Errors and limits
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {"ls &&", "ls |", "if true; then", "(ls", "fi", "echo )", "echo 'unterminated"})
    public void testTopLevelSyntaxErrorsFail(String commandText) {
        CommandExtractor extractor = new CommandExtractor();
        assertThrows(ShellParseException.class, () -> extractor.extract(commandText));
    }

    @Test
    public void testUnparsableSubstitutionContributesNothing() throws ShellParseException {
        assertEquals(List.of("echo $(if)", "ls"), extract("echo $(if); ls"));
    }

    @Test
    public void testSubstitutionDepthLimit() throws ShellParseException {
        String commandText = "echo $(echo $(whoami))";

        assertEquals(
            List.of("echo $(echo $(whoami))", "echo $(whoami)", "whoami"),
            extract(commandText));
        assertEquals(
            List.of("echo $(echo $(whoami))", "echo $(whoami)"),
            extract(commandText, ExtractorOptions.defaults().withMaxSubstitutionDepth(1)));
        assertEquals(
            List.of("echo $(echo $(whoami))"),
            extract(commandText, ExtractorOptions.defaults().withMaxSubstitutionDepth(0)));
    }

    @Test
    public void testDeeplyNestedSubstitutionsReportNesting() {
        String commandText = "echo " + "\"$(echo ".repeat(300) + "x" + ")\"".repeat(300);
        CommandExtractor extractor = new CommandExtractor();

        ShellParseException e = assertThrows(ShellParseException.class, () -> extractor.extract(commandText));
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());
    }

    @Test
    public void testNegativeDepthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractorOptions(-1, false));
    }

    // ============================================================
    // Stream behavior
    // ============================================================

    @Test
    public void testExtractionIsDeterministic() throws ShellParseException {
        String commandText = "for f in $(ls); do cat <(grep x $f) | wc -l; done && echo `date`";
        assertEquals(extract(commandText), extract(commandText));
    }

    @Test
    public void testDuplicatesAreKept() throws ShellParseException {
        assertEquals(List.of("ls", "ls"), extract("ls; ls"));
    }

    @Test
    public void testStreamIsSingleUse() throws ShellParseException {
        Stream<String> commands = new CommandExtractor().extract("ls | wc -l");
        assertEquals(2, commands.count());
        assertThrows(IllegalStateException.class, commands::count);
    }

    @Test
    public void testStreamCanStopEarly() throws ShellParseException {
        List<String> first = new CommandExtractor().extract("ls; $(whoami); pwd")
            .limit(1)
            .collect(Collectors.toList());
        assertEquals(List.of("ls"), first);
    }

    @Test
    public void testExtractAll() throws ShellParseException {
        assertEquals(List.of("ls", "pwd"), new CommandExtractor().extractAll("ls && pwd"));
    }
}
