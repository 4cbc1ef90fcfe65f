package org.ontodsl.compiler.api;

/**
 * Thrown when the token stream does not match the grammar.
 */
public class ParseException extends CompilationException {

    /**
     * @param message The formatted diagnostic summary.
     * @param errorCode The error code of the first error.
     * @param sourceInfo The position of the first error.
     */
    public ParseException(String message, CompilerErrorCode errorCode, SourceInfo sourceInfo) {
        super(message, errorCode, sourceInfo);
    }
}
