package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregationClause;
import org.ontodsl.compiler.frontend.parser.features.aggregate.TimeWindow;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Handles the semantic analysis of {@link AggregateNode}s.
 * The target alias gets the group keys, the time window field and the aggregation aliases.
 */
public class AggregateAnalysisHandler implements IAnalysisHandler {

    /** Time window modes the generator knows; anything else falls back to month. */
    public static final Set<String> TIME_WINDOW_MODES =
            Set.of("month", "monthly", "day", "daily", "week", "weekly", "year", "yearly", "hour", "hourly");

    @Override
    public void analyze(StatementNode node, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!(node instanceof AggregateNode aggregate)) return;

        String source = aggregate.source().text();
        if (!AnalysisSupport.requireAlias(aggregate.source(), "AGGREGATE source", registry, diagnostics)) return;
        if (!AnalysisSupport.requireNonEmpty(aggregate.groupKeys(), "group key list", aggregate.sourceInfo(), diagnostics)) return;
        if (!AnalysisSupport.requireNonEmpty(aggregate.aggregations(), "aggregation clause list", aggregate.sourceInfo(), diagnostics)) return;

        Set<String> fields = new LinkedHashSet<>();
        for (Token key : aggregate.groupKeys()) {
            AnalysisSupport.checkField(source, key, registry, diagnostics);
            AnalysisSupport.requireUnique(key, "group key", fields, diagnostics);
        }
        TimeWindow window = aggregate.timeWindow();
        if (window != null) {
            if (!TIME_WINDOW_MODES.contains(window.mode().text().toLowerCase(Locale.ROOT))) {
                diagnostics.reportWarning("Unknown TIME_WINDOW mode '" + window.mode().text()
                        + "'; truncating by month.", window.mode().sourceInfo());
            }
            AnalysisSupport.checkField(source, window.sourceField(), registry, diagnostics);
            AnalysisSupport.requireUnique(window.targetField(), "TIME_WINDOW target", fields, diagnostics);
        }
        for (AggregationClause clause : aggregate.aggregations()) {
            if (clause.field() != null) {
                AnalysisSupport.checkField(source, clause.field(), registry, diagnostics);
            }
            AnalysisSupport.requireUnique(clause.alias(), "aggregation alias", fields, diagnostics);
        }

        registry.define(aggregate.target(), aggregate.kind(), aggregate, fields, false);
    }
}
