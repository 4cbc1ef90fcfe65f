package org.ontodsl.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the formatted error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that does not start any token. */
    UNEXPECTED_CHARACTER(Category.LEXICAL),
    /** A string literal that is not closed before the end of the input. */
    UNTERMINATED_STRING(Category.LEXICAL),
    // endregion

    // region Parser Errors
    /** A token of a different type than the grammar requires. */
    UNEXPECTED_TOKEN(Category.SYNTAX),
    /** The input ended in the middle of a statement. */
    UNEXPECTED_END_OF_INPUT(Category.SYNTAX),
    /** A token that cannot start a statement. */
    UNKNOWN_STATEMENT(Category.SYNTAX),
    /** An expression nests operators deeper than the configured limit. */
    EXPRESSION_TOO_DEEP(Category.SYNTAX),
    // endregion

    // region Semantic Analysis Errors
    /** An alias was referenced before any earlier statement introduced it. */
    UNKNOWN_ALIAS(Category.SEMANTIC),
    /** An alias was introduced again by a different statement kind. */
    ALIAS_REDEFINED(Category.SEMANTIC),
    /** A registered alias was referenced where it is not part of the statement's match. */
    ALIAS_NOT_IN_SCOPE(Category.SEMANTIC),
    /** An aggregation or expression function that the generator does not support. */
    UNSUPPORTED_FUNCTION(Category.SEMANTIC),
    /** A list the statement requires to be non-empty (keys, clauses, mappings) was empty. */
    EMPTY_LIST(Category.SEMANTIC),
    /** A field, alias or column name occurs twice in the names one statement introduces. */
    DUPLICATE_NAME(Category.SEMANTIC);
    // endregion

    /**
     * The compiler phase family an error code belongs to.
     */
    public enum Category {
        /** Raised by the lexer. */
        LEXICAL,
        /** Raised by the parser. */
        SYNTAX,
        /** Raised by the semantic analyzer. */
        SEMANTIC
    }

    private final Category category;

    CompilerErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The category of this error code.
     */
    public Category category() {
        return category;
    }
}
