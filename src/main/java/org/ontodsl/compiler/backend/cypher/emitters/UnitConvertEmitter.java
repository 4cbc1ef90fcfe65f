package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits an in-place multiplicative conversion using a factor looked up in the conversion table.
 * When FROM names a unit field, only nodes whose unit matches a table row are converted and the
 * unit field is updated as well.
 */
public class UnitConvertEmitter implements IStatementEmitter<UnitConvertNode> {

	@Override
	public void emit(UnitConvertNode node, EmissionContext ctx) {
		CompilerOptions.UnitTableOptions table = ctx.options().unitTable();
		String fromColumn = "conv." + CypherText.name(table.fromColumn());
		String toColumn = "conv." + CypherText.name(table.toColumn());
		String property = "n." + CypherText.name(node.field().text());
		String target = CypherText.quote(node.toValue());

		List<String> lines = new ArrayList<>();
		lines.add("LOAD CSV WITH HEADERS FROM "
				+ CypherText.doubleQuote(ctx.options().importPrefix() + node.tableValue()) + " AS conv");
		lines.add("MATCH (n:" + CypherText.name(node.target().text()) + ")");
		if (node.isFromField()) {
			String unitProperty = "n." + CypherText.name(node.from().text());
			lines.add("WHERE " + unitProperty + " = " + fromColumn + " AND " + toColumn + " = " + target);
			lines.add("SET " + property + " = " + property + " * toFloat(conv." + CypherText.name(table.factorColumn()) + "),");
			lines.add("    " + unitProperty + " = " + target + ";");
		} else {
			lines.add("WHERE " + fromColumn + " = " + CypherText.quote(node.fromValue()) + " AND " + toColumn + " = " + target);
			lines.add("SET " + property + " = " + property + " * toFloat(conv." + CypherText.name(table.factorColumn()) + ");");
		}
		ctx.emit(node, lines);
	}
}
