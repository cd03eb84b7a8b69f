package com.raditha.syntax.cli;

import com.raditha.syntax.build.SyntaxTrees;
import com.raditha.syntax.config.BuildOptions;
import com.raditha.syntax.config.BuildSettings;
import com.raditha.syntax.io.SemanticTreeReader;
import com.raditha.syntax.io.SyntaxTreeJsonWriter;
import com.raditha.syntax.tree.Tree;
import com.raditha.syntax.tree.TreeDumper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface: builds the syntax tree of a JSON fixture and prints
 * it.
 * <p>
 * Usage:
 * java -jar syntax-tree.jar [options] &lt;fixture.json&gt;
 * <p>
 * Configuration priority: CLI arguments > config file > defaults
 */
@Command(name = "syntax-tree", mixinStandardHelpOptions = true, version = "syntax-tree v1.0.0",
        description = "Builds a token-exact syntax tree from a semantic tree and its tokens")
@SuppressWarnings("java:S106")
public class SyntaxTreeCLI implements Callable<Integer> {

    @Parameters(index = "0", description = "Fixture with tokens and declarations", paramLabel = "<fixture.json>")
    private Path fixture;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--json", description = "Print the tree as JSON instead of a text dump")
    private boolean jsonOutput = false;

    @Option(names = "--no-verify", description = "Skip the structural self check of the finished tree")
    private boolean noVerify = false;

    @Option(names = "--log-summary", description = "Log node and fold counts")
    private boolean logSummary = false;

    private final SemanticTreeReader reader;

    public SyntaxTreeCLI() {
        this(new SemanticTreeReader());
    }

    SyntaxTreeCLI(SemanticTreeReader reader) {
        this.reader = reader;
    }

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        BuildOptions options = BuildSettings.loadConfig(configFile,
                noVerify ? Boolean.FALSE : null,
                logSummary ? Boolean.TRUE : null);

        SemanticTreeReader.Fixture input = reader.read(fixture);
        Tree root = SyntaxTrees.build(input.tokens(), input.translationUnit(), options);

        if (jsonOutput) {
            System.out.println(new SyntaxTreeJsonWriter().write(root));
        } else {
            System.out.print(TreeDumper.dump(root));
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine(new SyntaxTreeCLI()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping: 2 for bad configuration or
     * arguments, 3 for I/O errors, 1 for anything else.
     */
    static CommandLine createCommandLine(SyntaxTreeCLI command) {
        CommandLine cmd = new CommandLine(command);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (fixture == null || fixture.toString().isBlank()) {
            throw new IllegalArgumentException("Fixture path cannot be empty");
        }
    }
}
