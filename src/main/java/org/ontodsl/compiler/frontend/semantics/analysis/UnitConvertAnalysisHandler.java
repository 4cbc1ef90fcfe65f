package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

/**
 * Handles the semantic analysis of {@link UnitConvertNode}s.
 * A bare FROM identifier is a field reference on the converted alias.
 */
public class UnitConvertAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!(node instanceof UnitConvertNode convert)) return;

        String alias = convert.target().text();
        if (!AnalysisSupport.requireAlias(convert.target(), "UNIT_CONVERT target", registry, diagnostics)) return;
        AnalysisSupport.checkField(alias, convert.field(), registry, diagnostics);
        if (convert.isFromField()) {
            AnalysisSupport.checkField(alias, convert.from(), registry, diagnostics);
        }
    }
}
