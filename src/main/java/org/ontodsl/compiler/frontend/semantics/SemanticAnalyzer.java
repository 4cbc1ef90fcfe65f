package org.ontodsl.compiler.frontend.semantics;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateNode;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.parser.features.load.LoadNode;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeNode;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertNode;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateNode;
import org.ontodsl.compiler.frontend.semantics.analysis.AggregateAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.ComputeAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.EnrichAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.LoadAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.NormalizeAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.UnitConvertAnalysisHandler;
import org.ontodsl.compiler.frontend.semantics.analysis.ValidateAnalysisHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Performs semantic analysis on the AST: alias resolution across statements, required lists,
 * supported functions and best-effort field checks.
 * It walks the statements in program order and dispatches each to the handler for its class.
 * Statements without a handler (comments) are skipped. Analysis stops at the first statement
 * that reports an error; the registry is sealed afterwards in every case.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final AliasRegistry registry;
    private final Map<Class<? extends StatementNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param registry The alias registry to fill.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, AliasRegistry registry) {
        this.diagnostics = diagnostics;
        this.registry = registry;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        handlers.put(LoadNode.class, new LoadAnalysisHandler());
        handlers.put(NormalizeNode.class, new NormalizeAnalysisHandler());
        handlers.put(AggregateNode.class, new AggregateAnalysisHandler());
        handlers.put(UnitConvertNode.class, new UnitConvertAnalysisHandler());
        handlers.put(EnrichNode.class, new EnrichAnalysisHandler());
        handlers.put(ComputeNode.class, new ComputeAnalysisHandler());
        handlers.put(ValidateNode.class, new ValidateAnalysisHandler());
    }

    /**
     * Analyzes the given program.
     * @param program The parsed program.
     */
    public void analyze(Program program) {
        try {
            for (StatementNode statement : program.statements()) {
                IAnalysisHandler handler = handlers.get(statement.getClass());
                if (handler != null) {
                    handler.analyze(statement, registry, diagnostics);
                }
                if (diagnostics.hasErrors()) {
                    return;
                }
            }
        } finally {
            registry.seal();
        }
    }
}
