package org.ontodsl.compiler.diagnostics;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, parser, etc.).
 * One engine belongs to exactly one compile request.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code    The error code.
     * @param message The error message.
     * @param where   The position of the error.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo where) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message,
                where.fileName(), where.lineNumber(), where.columnNumber()));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param where   The position of the warning.
     */
    public void reportWarning(String message, SourceInfo where) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message,
                where.fileName(), where.lineNumber(), where.columnNumber()));
        CompilerLogger.warn(where + ": " + message);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The first reported error, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * @return All reported warnings in reporting order.
     */
    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected errors as a single, formatted string.
     *
     * @return A formatted string summary of all errors.
     */
    public String summary() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
