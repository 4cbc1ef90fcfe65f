package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.load.ColumnMapping;
import org.ontodsl.compiler.frontend.parser.features.load.LoadNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Handles the semantic analysis of {@link LoadNode}s.
 * The alias gets the mapped target fields; without MAP_COLUMNS its field set stays open.
 */
public class LoadAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!(node instanceof LoadNode load)) return;

        if (load.hasColumnMap()
                && !AnalysisSupport.requireNonEmpty(load.columns(), "MAP_COLUMNS block", load.sourceInfo(), diagnostics)) {
            return;
        }
        Set<String> fields = new LinkedHashSet<>();
        for (ColumnMapping column : load.columns()) {
            AnalysisSupport.requireUnique(column.target(), "MAP_COLUMNS target", fields, diagnostics);
        }
        registry.define(load.alias(), load.kind(), load, fields, !load.hasColumnMap());
    }
}
