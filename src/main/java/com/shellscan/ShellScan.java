package com.shellscan;

import ch.qos.logback.classic.Level;
import com.shellscan.extract.CommandExtractor;
import com.shellscan.extract.ExtractorOptions;
import com.shellscan.output.OutputFormatter;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "shellscan", mixinStandardHelpOptions = true, version = "1.0",
         description = "List every command a shell command line can run, including substitutions")
public class ShellScan implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "The command line to scan (default: stdin)")
    private String commandText;

    @Option(names = {"-j", "--json"}, description = "Print the commands as a JSON array")
    private boolean json = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-0", "--null"}, description = "Terminate each command with NUL instead of newline")
    private boolean nullSeparated = false;

    @Option(names = "--max-depth", paramLabel = "N",
            description = "Follow command substitutions at most N levels deep (default: ${DEFAULT-VALUE})")
    private int maxDepth = ExtractorOptions.DEFAULT_MAX_SUBSTITUTION_DEPTH;

    @Option(names = "--scan-compound-redirects",
            description = "Also scan redirects attached to compound commands such as { ...; } > file")
    private boolean scanCompoundRedirects = false;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose = false;

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;

    public ShellScan() {
        this(System.in);
    }

    ShellScan(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ShellScan()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        ch.qos.logback.classic.Logger rootLogger =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            String text = commandText != null
                ? commandText
                : new String(stdin.readAllBytes(), StandardCharsets.UTF_8);

            ExtractorOptions options = new ExtractorOptions(maxDepth, scanCompoundRedirects);
            MutableList<String> commands = new CommandExtractor(options).extractAll(text);

            out.print(formatter().format(commands));
            out.flush();
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        } finally {
            rootLogger.setLevel(originalLevel);
        }
    }

    private OutputFormatter formatter() {
        if (json) {
            return new OutputFormatter(OutputFormatter.Format.JSON, !compactOutput);
        }
        return new OutputFormatter(nullSeparated ? OutputFormatter.Format.NUL_SEPARATED : OutputFormatter.Format.LINES);
    }
}
