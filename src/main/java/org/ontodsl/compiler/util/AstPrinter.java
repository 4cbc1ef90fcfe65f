package org.ontodsl.compiler.util;

import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.lexer.TokenType;
import org.ontodsl.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.ExpressionNode;
import org.ontodsl.compiler.frontend.parser.ast.FunctionCallNode;
import org.ontodsl.compiler.frontend.parser.ast.IdentifierNode;
import org.ontodsl.compiler.frontend.parser.ast.NumberLiteralNode;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.ast.StringLiteralNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregationClause;
import org.ontodsl.compiler.frontend.parser.features.comment.CommentNode;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.parser.features.load.LoadNode;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeNode;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertNode;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes an AST back into DSL text in a canonical layout: one statement per line, single
 * spaces, commas between list entries and double-quoted strings.
 * Parsing the output yields a structurally equal program.
 */
public final class AstPrinter {

	private AstPrinter() {}

	/**
	 * @param program The program to print.
	 * @return The canonical DSL text, one line per statement, ending with a newline unless empty.
	 */
	public static String print(Program program) {
		return program.statements().stream()
				.map(AstPrinter::print)
				.map(line -> line + "\n")
				.collect(Collectors.joining());
	}

	/**
	 * @param statement The statement to print.
	 * @return The canonical DSL text of the statement, without a line break.
	 */
	public static String print(StatementNode statement) {
		if (statement instanceof LoadNode load) {
			StringBuilder sb = new StringBuilder("LOAD_CSV ").append(quote(load.pathValue()))
					.append(" AS ").append(load.alias().text());
			if (load.hasColumnMap()) {
				sb.append(" MAP_COLUMNS ").append(braces(load.columns().stream()
						.map(c -> c.source().text() + " -> " + c.target().text()).toList()));
			}
			return sb.toString();
		}
		if (statement instanceof NormalizeNode normalize) {
			return "NORMALIZE " + normalize.target().text() + " " + braces(normalize.fields().stream()
					.map(f -> f.field().text() + ": " + braces(f.mappings().stream()
							.map(m -> value(m.from()) + ": " + value(m.to())).toList()))
					.toList());
		}
		if (statement instanceof AggregateNode aggregate) {
			StringBuilder sb = new StringBuilder("AGGREGATE ").append(aggregate.source().text())
					.append(" BY ").append(brackets(aggregate.groupKeys()))
					.append(" INTO ").append(aggregate.target().text());
			for (AggregationClause clause : aggregate.aggregations()) {
				sb.append(' ').append(clause.function().keyword().name())
						.append('(').append(clause.field() == null ? "" : clause.field().text()).append(')')
						.append(" AS ").append(clause.alias().text());
			}
			if (aggregate.timeWindow() != null) {
				sb.append(" TIME_WINDOW ").append(aggregate.timeWindow().mode().text())
						.append(" FROM ").append(aggregate.timeWindow().sourceField().text())
						.append(" INTO ").append(aggregate.timeWindow().targetField().text());
			}
			return sb.toString();
		}
		if (statement instanceof UnitConvertNode convert) {
			return "UNIT_CONVERT " + convert.target().text() + "." + convert.field().text()
					+ " FROM " + value(convert.from()) + " TO " + value(convert.to())
					+ " USING " + quote(convert.tableValue());
		}
		if (statement instanceof EnrichNode enrich) {
			return "ENRICH " + enrich.source().text() + " WITH " + value(enrich.factorTable())
					+ " MATCH ON " + enrich.matchKey().text()
					+ " OUTPUT " + enrich.target().text() + " AS " + braces(enrich.outputs().stream()
					.map(o -> o.name().text() + ": " + print(o.expression())).toList());
		}
		if (statement instanceof ComputeNode compute) {
			return "COMPUTE " + compute.resultName().text() + " FOR " + compute.source().text()
					+ " GROUP BY " + brackets(compute.groupKeys())
					+ " INTO " + compute.target().text() + " AS " + print(compute.function());
		}
		if (statement instanceof ValidateNode validate) {
			return "VALIDATE " + validate.target().text() + " WITH " + quote(validate.ruleValue());
		}
		if (statement instanceof CommentNode comment) {
			return "# " + comment.text().replaceAll("[\\r\\n]+", " ");
		}
		throw new InternalCompilerError("Cannot print " + statement.getClass().getSimpleName());
	}

	/**
	 * Prints an expression without parentheses. Parser-built trees nest only where
	 * precedence and left associativity put them, so the text parses back to the same tree.
	 * @param expression The expression to print.
	 * @return The DSL text of the expression.
	 */
	public static String print(ExpressionNode expression) {
		if (expression instanceof StringLiteralNode string) return quote(string.value());
		if (expression instanceof NumberLiteralNode number) return number.numberToken().text();
		if (expression instanceof IdentifierNode identifier) return identifier.qualifiedName();
		if (expression instanceof FunctionCallNode call) return call.name().text() + "(" + call.argument().text() + ")";
		if (expression instanceof BinaryExpressionNode binary) {
			return print(binary.left()) + " " + binary.operatorSymbol() + " " + print(binary.right());
		}
		throw new InternalCompilerError("Cannot print " + expression.getClass().getSimpleName());
	}

	private static String value(Token token) {
		return token.type() == TokenType.STRING ? quote((String) token.value()) : token.text();
	}

	private static String braces(List<String> entries) {
		return entries.isEmpty() ? "{ }" : "{ " + String.join(", ", entries) + " }";
	}

	private static String brackets(List<Token> identifiers) {
		return "[" + identifiers.stream().map(Token::text).collect(Collectors.joining(", ")) + "]";
	}

	private static String quote(String value) {
		StringBuilder sb = new StringBuilder("\"");
		for (char c : value.toCharArray()) {
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\r' -> sb.append("\\r");
				default -> sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
