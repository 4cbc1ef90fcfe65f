package org.ontodsl.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * It is part of the public API and hides the internal diagnostic types of the compiler.
 * The concrete subtype tells which phase rejected the program:
 * {@link LexException}, {@link ParseException} or {@link SemanticException}.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception.
     * @param message The detail message.
     * @param errorCode The error code of the first error.
     * @param sourceInfo The position of the first error, may be null.
     */
    public CompilationException(String message, CompilerErrorCode errorCode, SourceInfo sourceInfo) {
        this(message, errorCode, sourceInfo, null);
    }

    /**
     * Constructs a new compilation exception.
     * @param message The detail message.
     * @param errorCode The error code of the first error.
     * @param sourceInfo The position of the first error, may be null.
     * @param cause The cause, may be null.
     */
    public CompilationException(String message, CompilerErrorCode errorCode, SourceInfo sourceInfo, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code of the first error.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the first error, or {@code null} if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
