package org.ontodsl.compiler.backend.cypher;

import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.compiler.api.QueryBlock;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Context passed to statement emitters. Collects the query blocks of one program in order
 * and gives read access to the options and the sealed alias registry.
 */
public final class EmissionContext {

	private final CompilerOptions options;
	private final AliasRegistry aliases;
	private final List<QueryBlock> blocks = new ArrayList<>();

	/**
	 * @param options     The compiler options.
	 * @param aliases     The sealed alias registry.
	 */
	public EmissionContext(CompilerOptions options, AliasRegistry aliases) {
		this.options = options;
		this.aliases = aliases;
	}

	/**
	 * Adds the block of a statement. The trace comment {@code // KIND: alias} is put in front.
	 *
	 * @param node  The statement the lines belong to.
	 * @param lines The Cypher lines, the last one terminated by {@code ;}.
	 */
	public void emit(StatementNode node, List<String> lines) {
		List<String> all = new ArrayList<>(lines.size() + 1);
		all.add("// " + node.kind().name() + ": " + CypherText.commentText(node.subjectAlias()));
		all.addAll(lines);
		blocks.add(new QueryBlock(node.kind(), node.subjectAlias(), node.sourceInfo(), String.join("\n", all)));
	}

	public CompilerOptions options() {
		return options;
	}

	public AliasRegistry aliases() {
		return aliases;
	}

	/**
	 * @return The blocks emitted so far, in program order.
	 */
	public List<QueryBlock> blocks() {
		return List.copyOf(blocks);
	}
}
