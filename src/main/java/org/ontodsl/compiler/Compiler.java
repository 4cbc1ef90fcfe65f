package org.ontodsl.compiler;

import org.ontodsl.compiler.api.CompilationException;
import org.ontodsl.compiler.api.CompiledScript;
import org.ontodsl.compiler.api.ICompiler;
import org.ontodsl.compiler.api.LexException;
import org.ontodsl.compiler.api.ParseException;
import org.ontodsl.compiler.api.QueryBlock;
import org.ontodsl.compiler.api.SemanticException;
import org.ontodsl.compiler.backend.cypher.CypherGenerator;
import org.ontodsl.compiler.diagnostics.CompilerLogger;
import org.ontodsl.compiler.diagnostics.Diagnostic;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Lexer;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.Parser;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;
import org.ontodsl.compiler.frontend.semantics.SemanticAnalyzer;
import org.ontodsl.compiler.util.AstPrinter;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from DSL text to
 * Cypher: lexing, parsing, semantic analysis and code generation.
 * <p>
 * Every call to {@link #compile(String, String)} uses its own diagnostics engine and alias
 * registry. An instance holds only immutable options, so it can be shared between threads.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;

    /**
     * Creates a compiler with the options from the classpath configuration.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * Creates a compiler with explicit options.
     * @param options The compiler options.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * @return The options this compiler was created with.
     */
    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Fails on the first error of any phase; warnings are collected in the result.
     */
    @Override
    public CompiledScript compile(String source, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();
        CompilerLogger.debug("Lexer: " + tokens.size() + " tokens in " + programName);
        failOnErrors(diagnostics);

        // Phase 2: Parsing (builds AST)
        Parser parser = new Parser(tokens, diagnostics, programName, options.maxExpressionDepth());
        Program program = parser.parse();
        CompilerLogger.debug("Parser: " + program.statements().size() + " statements in " + programName);
        failOnErrors(diagnostics);

        // Phase 3: Semantic Analysis (alias resolution)
        AliasRegistry aliases = new AliasRegistry(diagnostics);
        new SemanticAnalyzer(diagnostics, aliases).analyze(program);
        CompilerLogger.debug("Semantics: " + aliases.entries().size() + " aliases in " + programName);
        failOnErrors(diagnostics);

        // Phase 4: Code Generation
        List<QueryBlock> blocks = new CypherGenerator(options).generate(program, aliases);

        List<String> warnings = diagnostics.warnings().stream().map(Diagnostic::toString).toList();
        CompilerLogger.info("Compiled " + programName + ": " + blocks.size() + " block(s), "
                + warnings.size() + " warning(s)");
        return new CompiledScript(programName, blocks, warnings, AstPrinter.print(program));
    }

    private static void failOnErrors(DiagnosticsEngine diagnostics) throws CompilationException {
        Diagnostic first = diagnostics.firstError().orElse(null);
        if (first == null) {
            return;
        }
        String summary = diagnostics.summary();
        throw switch (first.code().category()) {
            case LEXICAL -> new LexException(summary, first.code(), first.sourceInfo());
            case SYNTAX -> new ParseException(summary, first.code(), first.sourceInfo());
            case SEMANTIC -> new SemanticException(summary, first.code(), first.sourceInfo());
        };
    }
}
