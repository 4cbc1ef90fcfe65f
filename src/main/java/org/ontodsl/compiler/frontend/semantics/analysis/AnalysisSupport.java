package org.ontodsl.compiler.frontend.semantics.analysis;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.SourceInfo;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

import java.util.Collection;
import java.util.Set;

/**
 * Checks shared by the analysis handlers.
 */
final class AnalysisSupport {

    private AnalysisSupport() {}

    /**
     * Reports {@link CompilerErrorCode#UNKNOWN_ALIAS} unless the alias is defined.
     * @return True if the alias is defined.
     */
    static boolean requireAlias(Token alias, String role, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (registry.isDefined(alias.text())) {
            return true;
        }
        diagnostics.reportError(CompilerErrorCode.UNKNOWN_ALIAS,
                "Unknown alias '" + alias.text() + "' used as " + role
                        + "; it must be defined by an earlier LOAD_CSV, AGGREGATE, ENRICH or COMPUTE statement.",
                alias.sourceInfo());
        return false;
    }

    /**
     * Reports {@link CompilerErrorCode#EMPTY_LIST} if the list is empty.
     * @return True if the list has at least one entry.
     */
    static boolean requireNonEmpty(Collection<?> list, String what, SourceInfo where, DiagnosticsEngine diagnostics) {
        if (!list.isEmpty()) {
            return true;
        }
        diagnostics.reportError(CompilerErrorCode.EMPTY_LIST, "The " + what + " must not be empty.", where);
        return false;
    }

    /**
     * Adds the name to {@code names}, reporting {@link CompilerErrorCode#DUPLICATE_NAME} if it is
     * already there.
     * @return True if the name was not taken yet.
     */
    static boolean requireUnique(Token name, String what, Set<String> names, DiagnosticsEngine diagnostics) {
        if (names.add(name.text())) {
            return true;
        }
        diagnostics.reportError(CompilerErrorCode.DUPLICATE_NAME,
                "Duplicate " + what + " '" + name.text() + "'; a name can be produced only once per statement.",
                name.sourceInfo());
        return false;
    }

    /**
     * Records a field reference and warns if the alias is known not to have the field.
     */
    static void checkField(String alias, Token field, AliasRegistry registry, DiagnosticsEngine diagnostics) {
        if (!registry.referenceField(alias, field.text())) {
            diagnostics.reportWarning("Field '" + field.text() + "' is not known on alias '" + alias
                    + "' (known: " + String.join(", ", registry.knownFields(alias)) + ").", field.sourceInfo());
        }
    }
}
