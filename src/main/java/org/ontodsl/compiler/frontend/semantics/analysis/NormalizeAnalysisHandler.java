package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.normalize.FieldNormalization;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

/**
 * Handles the semantic analysis of {@link NormalizeNode}s.
 */
public class NormalizeAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!(node instanceof NormalizeNode normalize)) return;

        String alias = normalize.target().text();
        if (!AnalysisSupport.requireAlias(normalize.target(), "NORMALIZE target", registry, diagnostics)) return;
        if (!AnalysisSupport.requireNonEmpty(normalize.fields(), "NORMALIZE block", normalize.sourceInfo(), diagnostics)) return;

        for (FieldNormalization field : normalize.fields()) {
            if (!AnalysisSupport.requireNonEmpty(field.mappings(),
                    "value mapping of field '" + field.field().text() + "'", field.field().sourceInfo(), diagnostics)) {
                return;
            }
            AnalysisSupport.checkField(alias, field.field(), registry, diagnostics);
        }
    }
}
