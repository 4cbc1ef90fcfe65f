package org.ontodsl.compiler.api;

/**
 * Thrown when the input contains a character sequence that is not a token.
 */
public class LexException extends CompilationException {

    /**
     * @param message The formatted diagnostic summary.
     * @param errorCode The error code of the first error.
     * @param sourceInfo The position of the first error.
     */
    public LexException(String message, CompilerErrorCode errorCode, SourceInfo sourceInfo) {
        super(message, errorCode, sourceInfo);
    }
}
