package org.ontodsl.compiler.frontend.semantics;

import org.ontodsl.compiler.api.CompilerErrorCode;
import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.api.StatementKind;
import org.ontodsl.compiler.diagnostics.DiagnosticsEngine;
import org.ontodsl.compiler.frontend.lexer.Token;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The program-scoped table of aliases. One registry belongs to exactly one compile request;
 * it is filled by the {@link SemanticAnalyzer} in statement order and sealed before code
 * generation. Alias names are case-sensitive.
 */
public class AliasRegistry {

    private final Map<String, AliasEntry> entries = new LinkedHashMap<>();
    private final DiagnosticsEngine diagnostics;
    private boolean sealed = false;

    /**
     * Constructs a new, empty alias registry.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public AliasRegistry(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Defines an alias. Defining an existing alias again from the same statement kind merges the
     * known fields; from a different kind it is an {@link CompilerErrorCode#ALIAS_REDEFINED} error.
     * @param name The alias token.
     * @param kind The kind of the introducing statement.
     * @param node The introducing statement.
     * @param fields The fields the statement gives the alias's nodes.
     * @param openSchema True if further fields may be discovered later.
     * @return {@code true} if the alias is defined afterwards, {@code false} if an error was reported.
     */
    public boolean define(Token name, StatementKind kind, StatementNode node,
                          Collection<String> fields, boolean openSchema) {
        checkNotSealed();
        AliasEntry existing = entries.get(name.text());
        if (existing == null) {
            entries.put(name.text(), new AliasEntry(name, kind, node, openSchema, new LinkedHashSet<>(fields)));
            return true;
        }
        if (existing.kind() != kind) {
            diagnostics.reportError(CompilerErrorCode.ALIAS_REDEFINED,
                    "Alias '" + name.text() + "' is already defined by " + existing.kind()
                            + " at " + existing.name().sourceInfo() + " and cannot be redefined by " + kind + ".",
                    name.sourceInfo());
            return false;
        }
        Set<String> merged = new LinkedHashSet<>(existing.knownFields());
        merged.addAll(fields);
        entries.put(name.text(), new AliasEntry(existing.name(), kind, node,
                existing.openSchema() || openSchema, merged));
        return true;
    }

    /**
     * Resolves an alias by its exact name.
     * @param name The alias name.
     * @return The entry, or empty if the alias has not been defined.
     */
    public Optional<AliasEntry> resolve(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * @param name The alias name.
     * @return True if the alias has been defined.
     */
    public boolean isDefined(String name) {
        return entries.containsKey(name);
    }

    /**
     * Records a field reference on an alias. An open field set learns the field.
     * @param alias The alias name; must be defined.
     * @param field The referenced field.
     * @return {@code true} if the field is known (or was just learned), {@code false} if the
     *         alias has a closed field set without that field.
     */
    public boolean referenceField(String alias, String field) {
        AliasEntry entry = entries.get(alias);
        if (entry == null) {
            throw new InternalCompilerError("Field reference on undefined alias '" + alias + "'.");
        }
        if (entry.hasField(field)) {
            return true;
        }
        if (!entry.openSchema()) {
            return false;
        }
        checkNotSealed();
        entry.knownFields().add(field);
        return true;
    }

    /**
     * @param alias The alias name.
     * @return The known fields in first-seen order, or an empty set for an unknown alias.
     */
    public Set<String> knownFields(String alias) {
        AliasEntry entry = entries.get(alias);
        return entry == null ? Set.of() : Collections.unmodifiableSet(entry.knownFields());
    }

    /**
     * @return All entries in definition order.
     */
    public Collection<AliasEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Makes the registry read-only. Called once analysis has finished.
     */
    public void seal() {
        if (sealed) return;
        entries.replaceAll((name, entry) -> new AliasEntry(entry.name(), entry.kind(), entry.node(),
                entry.openSchema(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.knownFields()))));
        sealed = true;
    }

    /**
     * @return True once {@link #seal()} has been called.
     */
    public boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new InternalCompilerError("Alias registry is sealed; it cannot change during code generation.");
        }
    }
}
