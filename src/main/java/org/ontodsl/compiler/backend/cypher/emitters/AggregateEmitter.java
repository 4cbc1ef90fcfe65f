package org.ontodsl.compiler.backend.cypher.emitters;

import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.backend.cypher.CypherText;
import org.ontodsl.compiler.backend.cypher.EmissionContext;
import org.ontodsl.compiler.backend.cypher.IStatementEmitter;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregationClause;
import org.ontodsl.compiler.frontend.parser.features.aggregate.TimeWindow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Emits a grouping {@code WITH} over the source nodes and creates one target node per group.
 * Groups keyed by the factory key field are linked to their factory node.
 */
public class AggregateEmitter implements IStatementEmitter<AggregateNode> {

	@Override
	public void emit(AggregateNode node, EmissionContext ctx) {
		if (node.groupKeys().isEmpty() || node.aggregations().isEmpty()) {
			throw new InternalCompilerError("AGGREGATE at " + node.sourceInfo()
					+ " needs group keys and aggregation clauses.");
		}
		CompilerOptions.FactoryOptions factory = ctx.options().factory();

		List<String> projections = new ArrayList<>();
		List<String> properties = new ArrayList<>();
		boolean hasFactoryKey = false;
		for (Token key : node.groupKeys()) {
			String name = CypherText.name(key.text());
			projections.add("m." + name + " AS " + name);
			properties.add(CypherText.entry(key.text(), name));
			hasFactoryKey |= key.text().equals(factory.keyField());
		}
		TimeWindow window = node.timeWindow();
		if (window != null) {
			String name = CypherText.name(window.targetField().text());
			projections.add(truncation(window.mode().text(), "m." + CypherText.name(window.sourceField().text())) + " AS " + name);
			properties.add(CypherText.entry(window.targetField().text(), name));
		}
		for (AggregationClause clause : node.aggregations()) {
			String name = CypherText.name(clause.alias().text());
			projections.add(aggregation(clause) + " AS " + name);
			properties.add(CypherText.entry(clause.alias().text(), name));
		}

		List<String> lines = new ArrayList<>();
		lines.add("MATCH (m:" + CypherText.name(node.source().text()) + ")");
		lines.add("WITH\n  " + String.join(",\n  ", projections));
		String create = "CREATE (a:" + CypherText.name(node.target().text()) + " " + CypherText.propertyMap(properties) + ")";
		if (hasFactoryKey) {
			String key = CypherText.name(factory.keyField());
			lines.add(create);
			lines.add("WITH a");
			lines.add("MATCH (f:" + CypherText.name(factory.label()) + " { id: a." + key + " })");
			lines.add("MERGE (a)-[:" + CypherText.name(factory.relationship()) + "]->(f);");
		} else {
			lines.add(create + ";");
		}
		ctx.emit(node, lines);
	}

	private static String aggregation(AggregationClause clause) {
		String field = clause.field() == null ? null : "m." + CypherText.name(clause.field().text());
		return switch (clause.function()) {
			case SUM -> "SUM(" + requireField(field, clause) + ")";
			case FIRST -> "COLLECT(" + requireField(field, clause) + ")[0]";
			case COUNT -> field == null ? "COUNT(*)" : "COUNT(" + field + ")";
		};
	}

	private static String requireField(String field, AggregationClause clause) {
		if (field == null) {
			throw new InternalCompilerError(clause.functionToken().text() + " at "
					+ clause.functionToken().sourceInfo() + " has no field.");
		}
		return field;
	}

	/**
	 * @param mode  The TIME_WINDOW mode; unknown modes truncate by month.
	 * @param value The rendered timestamp property.
	 * @return The truncation expression.
	 */
	static String truncation(String mode, String value) {
		return switch (mode.toLowerCase(Locale.ROOT)) {
			case "day", "daily" -> "date.truncate('day', datetime(" + value + "))";
			case "week", "weekly" -> "date.truncate('week', datetime(" + value + "))";
			case "year", "yearly" -> "date.truncate('year', datetime(" + value + "))";
			case "hour", "hourly" -> "datetime.truncate('hour', datetime(" + value + "))";
			default -> "date.truncate('month', datetime(" + value + "))";
		};
	}
}
