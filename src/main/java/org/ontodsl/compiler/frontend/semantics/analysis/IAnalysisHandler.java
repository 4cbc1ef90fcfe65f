package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of statement.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single statement.
     * @param node The statement to analyze.
     * @param registry The alias registry holding everything earlier statements defined.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics);
}
