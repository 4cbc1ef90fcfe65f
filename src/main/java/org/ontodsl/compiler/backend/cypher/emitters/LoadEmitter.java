package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.parser.features.load.ColumnMapping;
import org.ontodsl.compiler.frontend.parser.features.load.LoadNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits a bulk {@code LOAD CSV} that creates one node per row.
 * <p>
 * Rows are linked to a shared factory node when a column is the configured factory column or
 * is mapped to the configured factory key field. Without MAP_COLUMNS the node gets one entry
 * per field later statements referenced, or every column when none did.
 */
public class LoadEmitter implements IStatementEmitter<LoadNode> {

	@Override
	public void emit(LoadNode node, EmissionContext ctx) {
		if (node.hasColumnMap() && node.columns().isEmpty()) {
			throw new InternalCompilerError("LOAD_CSV at " + node.sourceInfo() + " has an empty MAP_COLUMNS block.");
		}
		CompilerOptions.FactoryOptions factory = ctx.options().factory();
		String label = CypherText.name(node.alias().text());

		// target field -> CSV column
		Map<String, String> fields = new LinkedHashMap<>();
		if (node.hasColumnMap()) {
			for (ColumnMapping column : node.columns()) {
				fields.put(column.target().text(), column.source().text());
			}
		} else {
			for (String field : ctx.aliases().knownFields(node.alias().text())) {
				fields.put(field, field);
			}
		}
		String factoryColumn = factoryColumn(fields, factory);

		List<String> lines = new ArrayList<>();
		lines.add("LOAD CSV WITH HEADERS FROM "
				+ CypherText.doubleQuote(ctx.options().importPrefix() + node.pathValue()) + " AS row");
		lines.add("WITH row");
		if (factoryColumn != null) {
			lines.add("MERGE (f:" + CypherText.name(factory.label()) + " { id: row." + CypherText.name(factoryColumn) + " })");
		}
		if (fields.isEmpty()) {
			lines.add("CREATE (m:" + label + ")");
			lines.add("SET m += row" + (factoryColumn == null ? ";" : ""));
		} else {
			List<String> entries = new ArrayList<>();
			fields.forEach((target, source) -> entries.add(CypherText.entry(target, "row." + CypherText.name(source))));
			lines.add("CREATE (m:" + label + " " + CypherText.propertyMap(entries) + ")" + (factoryColumn == null ? ";" : ""));
		}
		if (factoryColumn != null) {
			lines.add("MERGE (m)-[:" + CypherText.name(factory.relationship()) + "]->(f);");
		}
		ctx.emit(node, lines);
	}

	private static String factoryColumn(Map<String, String> fields, CompilerOptions.FactoryOptions factory) {
		String keyColumn = fields.get(factory.keyField());
		if (keyColumn != null) {
			return keyColumn;
		}
		return fields.containsValue(factory.column()) ? factory.column() : null;
	}
}
