package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

/**
 * Handles the semantic analysis of {@link ValidateNode}s. The rule name is not checked.
 */
public class ValidateAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (node instanceof ValidateNode validate) {
            AnalysisSupport.requireAlias(validate.target(), "VALIDATE target", registry, diagnostics);
        }
    }
}
