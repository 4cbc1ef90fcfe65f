package org.ontodsl.compiler.api;

/**
 * The generated Cypher text for one DSL statement.
 *
 * @param kind The kind of the statement that produced the block.
 * @param subjectAlias The primary alias the statement operates on.
 * @param source The position of the statement's keyword.
 * @param cypher The Cypher text, starting with a trace comment and ending with {@code ;}.
 */
public record QueryBlock(StatementKind kind, String subjectAlias, SourceInfo source, String cypher) {
}
