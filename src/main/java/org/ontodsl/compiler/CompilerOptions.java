package org.ontodsl.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable compiler settings, read from the {@code ontodsl} section of a Typesafe {@link Config}.
 * Defaults live in {@code reference.conf}.
 *
 * @param maxExpressionDepth The maximum operator nesting of one expression.
 * @param verbosity The {@link org.ontodsl.compiler.diagnostics.CompilerLogger} level.
 * @param importPrefix The prefix put in front of every CSV path in {@code LOAD CSV}.
 * @param factory The factory dimension conventions.
 * @param unitTable The column names of unit conversion tables.
 * @param sourceRelationshipPrefix The prefix of the relationship from an enriched node to its source.
 */
public record CompilerOptions(
        int maxExpressionDepth,
        int verbosity,
        String importPrefix,
        FactoryOptions factory,
        UnitTableOptions unitTable,
        String sourceRelationshipPrefix
) {

    /**
     * How rows that carry a factory are linked to a shared factory node.
     *
     * @param label The label of factory nodes.
     * @param column The CSV column holding the factory id.
     * @param keyField The node field holding the factory id.
     * @param relationship The relationship type to the factory node.
     */
    public record FactoryOptions(String label, String column, String keyField, String relationship) {
    }

    /**
     * Column names of a unit conversion table.
     *
     * @param fromColumn The column with the source unit.
     * @param toColumn The column with the target unit.
     * @param factorColumn The column with the multiplicative factor.
     */
    public record UnitTableOptions(String fromColumn, String toColumn, String factorColumn) {
    }

    public CompilerOptions {
        if (maxExpressionDepth < 1) {
            throw new IllegalArgumentException("max-expression-depth must be at least 1, was " + maxExpressionDepth);
        }
    }

    /**
     * Reads the options from a configuration whose root contains the {@code ontodsl} section.
     * @param config The configuration.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config.getConfig("ontodsl.compiler");
        Config codegen = config.getConfig("ontodsl.codegen");
        Config factory = codegen.getConfig("factory");
        Config unitTable = codegen.getConfig("unit-table");
        return new CompilerOptions(
                compiler.getInt("max-expression-depth"),
                compiler.getInt("verbosity"),
                codegen.getString("import-prefix"),
                new FactoryOptions(
                        factory.getString("label"),
                        factory.getString("column"),
                        factory.getString("key-field"),
                        factory.getString("relationship")),
                new UnitTableOptions(
                        unitTable.getString("from-column"),
                        unitTable.getString("to-column"),
                        unitTable.getString("factor-column")),
                codegen.getString("source-relationship-prefix"));
    }

    /**
     * @return The options from {@code reference.conf} and any {@code application.conf} on the classpath.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }
}
