package org.ontodsl.compiler.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The immutable result of a successful compilation.
 *
 * @param programName The name the program was compiled under.
 * @param blocks The generated query blocks in execution order.
 * @param warnings Formatted warnings reported during compilation.
 * @param canonicalSource The program re-serialized from its AST in canonical DSL form.
 */
public record CompiledScript(
        String programName,
        List<QueryBlock> blocks,
        List<String> warnings,
        String canonicalSource
) {

    /**
     * Copies the lists so the result cannot change afterwards.
     */
    public CompiledScript {
        blocks = List.copyOf(blocks);
        warnings = List.copyOf(warnings);
    }

    /**
     * Renders all blocks separated by a blank line, ending with a newline.
     * An empty program renders as the empty string.
     *
     * @return The final Cypher text.
     */
    public String render() {
        if (blocks.isEmpty()) {
            return "";
        }
        return blocks.stream().map(QueryBlock::cypher).collect(Collectors.joining("\n\n")) + "\n";
    }
}
