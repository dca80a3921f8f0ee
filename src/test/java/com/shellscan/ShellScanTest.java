package com.shellscan;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ShellScanTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(InputStream stdin, String... args) {
        CommandLine commandLine = new CommandLine(new ShellScan(stdin));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private int run(String... args) {
        return run(new ByteArrayInputStream(new byte[0]), args);
    }

    private static InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testCommandArgument() {
        assertEquals(0, run("echo $(whoami)"));
        assertEquals("echo $(whoami)\nwhoami\n", out.toString());
        assertEquals("", err.toString());
    }

    @Test
    public void testReadsStandardInput() {
        assertEquals(0, run(stdin("ls | wc -l\n")));
        assertEquals("ls\nwc -l\n", out.toString());
    }

    @Test
    public void testCompactJsonOutput() {
        assertEquals(0, run("-j", "-c", "ls && pwd"));
        assertEquals("[\"ls\",\"pwd\"]\n", out.toString());
    }

    @Test
    public void testNulSeparatedOutput() {
        assertEquals(0, run("--null", "ls; pwd"));
        assertEquals("ls\0pwd\0", out.toString());
    }

    @Test
    public void testEmptyInputPrintsNothing() {
        assertEquals(0, run(stdin("")));
        assertEquals("", out.toString());
    }

    @Test
    public void testSyntaxErrorExitsWithOne() {
        assertEquals(1, run("ls &&"));
        assertEquals("", out.toString());
        assertTrue(err.toString().startsWith("Error: syntax error: unexpected end of input"));
    }

    @Test
    public void testMaxDepthOption() {
        assertEquals(0, run("--max-depth", "0", "echo $(whoami)"));
        assertEquals("echo $(whoami)\n", out.toString());
    }

    @Test
    public void testNegativeMaxDepthIsAnError() {
        assertEquals(1, run("--max-depth=-1", "ls"));
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testScanCompoundRedirectsOption() {
        assertEquals(0, run("--scan-compound-redirects", "{ ls; } <<< $(whoami)"));
        assertEquals("ls\nwhoami\n", out.toString());
    }

    @Test
    public void testVerboseRestoresLogLevel() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level before = root.getLevel();

        assertEquals(0, run("-v", "echo $(if)"));
        assertEquals("echo $(if)\n", out.toString());
        assertEquals(before, root.getLevel());
    }

    @Test
    public void testUnknownOptionIsAUsageError() {
        assertEquals(2, run("--no-such-option", "ls"));
    }
}
