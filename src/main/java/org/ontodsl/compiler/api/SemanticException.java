package org.ontodsl.compiler.api;

/**
 * Thrown when the statements reference aliases or lists inconsistently.
 */
public class SemanticException extends CompilationException {

    /**
     * @param message The formatted diagnostic summary.
     * @param errorCode The error code of the first error.
     * @param sourceInfo The position of the first error.
     */
    public SemanticException(String message, CompilerErrorCode errorCode, SourceInfo sourceInfo) {
        super(message, errorCode, sourceInfo);
    }
}
