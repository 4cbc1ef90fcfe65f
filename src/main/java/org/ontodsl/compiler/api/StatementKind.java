package org.ontodsl.compiler.api;

/**
 * The closed set of DSL statement kinds, in the spelling of their leading keyword.
 */
public enum StatementKind {
    /** {@code LOAD_CSV}: ingest raw rows as nodes. */
    LOAD_CSV,
    /** {@code NORMALIZE}: rewrite literal field values. */
    NORMALIZE,
    /** {@code AGGREGATE}: group nodes into aggregated nodes. */
    AGGREGATE,
    /** {@code UNIT_CONVERT}: rescale a field using a conversion table. */
    UNIT_CONVERT,
    /** {@code ENRICH}: join nodes against a factor table into derived nodes. */
    ENRICH,
    /** {@code COMPUTE}: compute one aggregated value per group. */
    COMPUTE,
    /** {@code VALIDATE}: placeholder hook for a named rule. */
    VALIDATE,
    /** A comment; contributes no output. */
    COMMENT
}
