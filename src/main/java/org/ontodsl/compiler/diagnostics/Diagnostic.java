package org.ontodsl.compiler.diagnostics;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The error code, or {@code null} for warnings.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    /**
     * @return The position of this diagnostic as a {@link SourceInfo}.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, lineNumber, columnNumber);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
