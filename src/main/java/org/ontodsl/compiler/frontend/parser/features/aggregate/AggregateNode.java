package org.ontodsl.compiler.frontend.parser.features.aggregate;

import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.List;

/**
 * An AST node for
 * {@code AGGREGATE <source> BY [keys] INTO <target> <clauses> [TIME_WINDOW ...]}.
 *
 * @param keyword The AGGREGATE token.
 * @param source The alias being aggregated.
 * @param groupKeys The grouping fields.
 * @param target The alias introduced for the aggregated nodes.
 * @param aggregations The aggregation clauses in source order.
 * @param timeWindow The optional time window, or {@code null}.
 */
public record AggregateNode(
        Token keyword,
        Token source,
        List<Token> groupKeys,
        Token target,
        List<AggregationClause> aggregations,
        TimeWindow timeWindow
) implements StatementNode {

    public AggregateNode {
        groupKeys = List.copyOf(groupKeys);
        aggregations = List.copyOf(aggregations);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.AGGREGATE;
    }

    @Override
    public String subjectAlias() {
        return source.text();
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
