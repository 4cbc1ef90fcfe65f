package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.parser.ast.AstNode;
import org.ontodsl.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.IdentifierNode;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.ast.ValueShape;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.OutputField;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;
import org.ontodsl.compiler.frontend.semantics.EnrichBinding;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Handles the semantic analysis of {@link EnrichNode}s.
 * Resolves every identifier of the output block to the source or the factor side and defines
 * the target alias with the output field names.
 */
public class EnrichAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!(node instanceof EnrichNode enrich)) return;

        String source = enrich.source().text();
        if (!AnalysisSupport.requireAlias(enrich.source(), "ENRICH source", registry, diagnostics)) return;
        if (!AnalysisSupport.requireNonEmpty(enrich.outputs(), "ENRICH output block", enrich.sourceInfo(), diagnostics)) return;
        AnalysisSupport.checkField(source, enrich.matchKey(), registry, diagnostics);

        Set<String> fields = new LinkedHashSet<>();
        for (OutputField output : enrich.outputs()) {
            if (!checkExpression(output.expression(), enrich, registry, diagnostics)) return;
            AnalysisSupport.requireUnique(output.name(), "output field", fields, diagnostics);
        }
        registry.define(enrich.target(), enrich.kind(), enrich, fields, false);
    }

    private boolean checkExpression(AstNode expression, EnrichNode enrich,
                                    AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (expression instanceof FunctionCallNode call) {
            diagnostics.reportError(CompilerErrorCode.UNSUPPORTED_FUNCTION,
                    "Function call '" + call.name().text() + "(" + call.argument().text()
                            + ")' is not allowed in an ENRICH output block.",
                    call.sourceInfo());
            return false;
        }
        if (expression instanceof IdentifierNode identifier) {
            return checkIdentifier(identifier, enrich, registry, diagnostics);
        }
        if (expression instanceof BinaryExpressionNode binary
                && !"+".equals(binary.operatorSymbol())
                && (binary.left().shape() == ValueShape.STRING || binary.right().shape() == ValueShape.STRING)) {
            diagnostics.reportWarning("Operator '" + binary.operatorSymbol()
                    + "' applied to a string value.", binary.operator().sourceInfo());
        }
        for (AstNode child : expression.getChildren()) {
            if (!checkExpression(child, enrich, registry, diagnostics)) return false;
        }
        return true;
    }

    private boolean checkIdentifier(IdentifierNode identifier, EnrichNode enrich,
                                    AliasRegistry registry, DiagnosticsEngine diagnostics) {
        switch (EnrichBinding.sideOf(enrich, identifier)) {
            case SOURCE -> {
                AnalysisSupport.checkField(enrich.source().text(), identifier.name(), registry, diagnostics);
                return true;
            }
            case FACTOR -> {
                return true;
            }
            default -> {
                String qualifier = identifier.qualifier().text();
                if (registry.isDefined(qualifier)) {
                    diagnostics.reportError(CompilerErrorCode.ALIAS_NOT_IN_SCOPE,
                            "Alias '" + qualifier + "' is not in scope in this ENRICH; use '"
                                    + enrich.source().text() + "' or '" + enrich.factorAlias() + "'.",
                            identifier.sourceInfo());
                } else {
                    diagnostics.reportError(CompilerErrorCode.UNKNOWN_ALIAS,
                            "Unknown alias '" + qualifier + "' in '" + identifier.qualifiedName() + "'.",
                            identifier.sourceInfo());
                }
                return false;
            }
        }
    }
}
