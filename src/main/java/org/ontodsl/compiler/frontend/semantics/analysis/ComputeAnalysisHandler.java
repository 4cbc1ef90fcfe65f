package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Handles the semantic analysis of {@link ComputeNode}s.
 * The target alias gets the group keys and the result field.
 */
public class ComputeAnalysisHandler implements IAnalysisHandler {

    /** Aggregation functions accepted by COMPUTE, compared case-insensitively. */
    public static final Set<String> SUPPORTED_FUNCTIONS = Set.of("sum", "avg", "count", "min", "max", "collect");

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!(node instanceof ComputeNode compute)) return;

        String source = compute.source().text();
        if (!AnalysisSupport.requireAlias(compute.source(), "COMPUTE source", registry, diagnostics)) return;
        if (!AnalysisSupport.requireNonEmpty(compute.groupKeys(), "group key list", compute.sourceInfo(), diagnostics)) return;

        Token function = compute.function().name();
        if (!SUPPORTED_FUNCTIONS.contains(function.text().toLowerCase(Locale.ROOT))) {
            diagnostics.reportError(CompilerErrorCode.UNSUPPORTED_FUNCTION,
                    "Unsupported aggregation function '" + function.text()
                            + "'; expected one of sum, avg, count, min, max, collect.",
                    function.sourceInfo());
            return;
        }

        Set<String> fields = new LinkedHashSet<>();
        for (Token key : compute.groupKeys()) {
            AnalysisSupport.checkField(source, key, registry, diagnostics);
            AnalysisSupport.requireUnique(key, "group key", fields, diagnostics);
        }
        AnalysisSupport.checkField(source, compute.function().argument(), registry, diagnostics);
        AnalysisSupport.requireUnique(compute.resultName(), "result name", fields, diagnostics);

        registry.define(compute.target(), compute.kind(), compute, fields, false);
    }
}
