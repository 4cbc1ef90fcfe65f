package org.ontodsl.compiler.backend.cypher;

import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.IdentifierNode;
import org.ontodsl.compiler.frontend.parser.ast.NumberLiteralNode;
import org.ontodsl.compiler.frontend.parser.ast.StringLiteralNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.semantics.EnrichBinding;

/**
 * Renders ENRICH output expressions as Cypher.
 * <p>
 * Source fields become {@code a.<field>}, factor fields {@code ef.<field>}. A {@code +} of
 * string shape is rendered flat as a concatenation chain; every other binary operation is
 * parenthesized so Cypher evaluates it in the parsed order.
 */
public final class ExpressionRenderer {

	private final EnrichNode enrich;
	private final String sourceVariable;
	private final String factorVariable;

	/**
	 * @param enrich         The statement the expressions belong to.
	 * @param sourceVariable The Cypher variable bound to the source node.
	 * @param factorVariable The Cypher variable bound to the factor row.
	 */
	public ExpressionRenderer(EnrichNode enrich, String sourceVariable, String factorVariable) {
		this.enrich = enrich;
		this.sourceVariable = sourceVariable;
		this.factorVariable = factorVariable;
	}

	/**
	 * @param expression An analyzed output expression.
	 * @return The Cypher expression text.
	 */
	public String render(ExpressionNode expression) {
		if (expression instanceof StringLiteralNode string) {
			return CypherText.quote(string.value());
		}
		if (expression instanceof NumberLiteralNode number) {
			return number.getValue().toPlainString();
		}
		if (expression instanceof IdentifierNode identifier) {
			return identifier(identifier);
		}
		if (expression instanceof BinaryExpressionNode binary) {
			String left = render(binary.left());
			String right = render(binary.right());
			if (binary.isConcatenation()) {
				return left + " + " + right;
			}
			return "(" + left + " " + binary.operatorSymbol() + " " + right + ")";
		}
		if (expression instanceof FunctionCallNode call) {
			throw new InternalCompilerError("Function call '" + call.name().text() + "' reached ENRICH code generation at "
					+ call.sourceInfo() + ".");
		}
		throw new InternalCompilerError("Unknown expression node " + expression.getClass().getSimpleName() + ".");
	}

	private String identifier(IdentifierNode identifier) {
		String field = CypherText.name(identifier.name().text());
		return switch (EnrichBinding.sideOf(enrich, identifier)) {
			case SOURCE -> sourceVariable + "." + field;
			case FACTOR -> factorVariable + "." + field;
			case UNBOUND -> throw new InternalCompilerError("Unresolved qualifier in '" + identifier.qualifiedName()
					+ "' at " + identifier.sourceInfo() + ".");
		};
	}
}
