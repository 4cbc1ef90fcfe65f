package org.ontodsl.compiler.api;

/**
 * Signals a broken compiler invariant, e.g. a malformed AST reaching the generator.
 * <p>
 * This is never a user-facing compile error and is deliberately unchecked so that it
 * is not confused with {@link CompilationException}.
 */
public class InternalCompilerError extends RuntimeException {

    /**
     * @param message Description of the violated invariant.
     */
    public InternalCompilerError(String message) {
        super(message);
    }
}
