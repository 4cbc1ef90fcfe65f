package org.ontodsl.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;
import org.ontodsl.cli.CommandLineInterface;
import org.ontodsl.compiler.Compiler;
import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.compiler.api.CompilationException;
import org.ontodsl.compiler.api.CompiledScript;
import org.ontodsl.compiler.api.ICompiler;
import org.ontodsl.compiler.api.QueryBlock;
import org.ontodsl.compiler.diagnostics.CompilerLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles an OntoDSL file to Cypher.")
public class CompileCommand implements Callable<Integer> {

    /** Exit code for a program rejected by the compiler. */
    public static final int EXIT_COMPILATION_ERROR = 1;
    /** Exit code for unreadable input, unwritable output or bad configuration. */
    public static final int EXIT_IO_ERROR = 2;

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    /** Output formats of the compile command. */
    public enum Format { TEXT, JSON }

    @Parameters(index = "0", description = "The DSL file to compile.")
    private File input;

    @Option(names = {"-o", "--output"}, description = "Write the output to this file instead of standard output.")
    private File output;

    @Option(names = "--format", defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private Format format;

    @Option(names = "--dump-ast", description = "Print the parsed program in canonical form to standard error.")
    private boolean dumpAst;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final Function<CompilerOptions, ICompiler> compilerFactory;

    public CompileCommand() {
        this(Compiler::new);
    }

    /**
     * @param compilerFactory Creates the compiler from the configured options.
     */
    public CompileCommand(Function<CompilerOptions, ICompiler> compilerFactory) {
        this.compilerFactory = compilerFactory;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        CompilerOptions options;
        try {
            options = parent != null ? CompilerOptions.fromConfig(parent.getConfig()) : CompilerOptions.defaults();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        CompilerLogger.setLevel(options.verbosity());

        if (!input.isFile()) {
            err.println("Error: File not found: " + input.getAbsolutePath());
            return EXIT_IO_ERROR;
        }

        CompiledScript script;
        try {
            script = compilerFactory.apply(options).compile(input.toPath());
        } catch (CompilationException e) {
            err.println("Compilation failed: " + e.getMessage());
            return EXIT_COMPILATION_ERROR;
        } catch (IOException e) {
            err.println("Error: Cannot read " + input.getAbsolutePath() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        script.warnings().forEach(w -> err.println("Warning: " + w));
        if (dumpAst) {
            err.print(script.canonicalSource());
            err.flush();
        }

        String rendered = format == Format.JSON ? toJson(script) : script.render();
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(rendered);
            out.flush();
            return 0;
        }
        try {
            Files.writeString(output.toPath(), rendered, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Cannot write " + output.getAbsolutePath() + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        log.info("Wrote {} block(s) to {}", script.blocks().size(), output.getAbsolutePath());
        return 0;
    }

    private static String toJson(CompiledScript script) {
        List<BlockJson> blocks = script.blocks().stream().map(BlockJson::of).toList();
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(new ScriptJson(script.programName(), blocks, script.warnings())) + "\n";
    }

    private static final class ScriptJson {
        final String programName;
        final List<BlockJson> blocks;
        final List<String> warnings;

        ScriptJson(String programName, List<BlockJson> blocks, List<String> warnings) {
            this.programName = programName;
            this.blocks = blocks;
            this.warnings = warnings;
        }
    }

    private static final class BlockJson {
        final String kind;
        final String subject;
        final int line;
        final String cypher;

        private BlockJson(String kind, String subject, int line, String cypher) {
            this.kind = kind;
            this.subject = subject;
            this.line = line;
            this.cypher = cypher;
        }

        static BlockJson of(QueryBlock block) {
            return new BlockJson(block.kind().name(), block.subjectAlias(),
                    block.source() == null ? 0 : block.source().lineNumber(), block.cypher());
        }
    }
}
