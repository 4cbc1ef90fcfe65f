package org.ontodsl.compiler.backend.cypher;

import org.ontodsl.compiler.CompilerOptions;
import org.ontodsl.compiler.api.InternalCompilerError;
import org.ontodsl.compiler.api.QueryBlock;
import org.ontodsl.compiler.diagnostics.CompilerLogger;
import org.ontodsl.compiler.frontend.parser.ast.Program;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.semantics.AliasRegistry;

import java.util.List;

/**
 * Phase: Generates Cypher from an analyzed program by delegating every statement to the
 * emitter resolved via the {@link CypherEmitterRegistry}. Blocks keep program order.
 */
public final class CypherGenerator {

	private final CompilerOptions options;
	private final CypherEmitterRegistry registry;

	/**
	 * Creates a generator with the built-in emitters.
	 *
	 * @param options The compiler options.
	 */
	public CypherGenerator(CompilerOptions options) {
		this(options, CypherEmitterRegistry.initializeWithDefaults());
	}

	/**
	 * Creates a generator with a prepared registry.
	 *
	 * @param options  The compiler options.
	 * @param registry The emitter registry.
	 */
	public CypherGenerator(CompilerOptions options, CypherEmitterRegistry registry) {
		this.options = options;
		this.registry = registry;
	}

	/**
	 * Generates one query block per statement (comments produce none).
	 *
	 * @param program The semantically valid program.
	 * @param aliases The sealed alias registry produced by the analysis of {@code program}.
	 * @return The query blocks in program order.
	 */
	public List<QueryBlock> generate(Program program, AliasRegistry aliases) {
		if (!aliases.isSealed()) {
			throw new InternalCompilerError("Code generation requires a sealed alias registry.");
		}
		EmissionContext ctx = new EmissionContext(options, aliases);
		for (StatementNode node : program.statements()) {
			registry.resolve(node).emit(node, ctx);
		}
		List<QueryBlock> blocks = ctx.blocks();
		CompilerLogger.debug("Generated " + blocks.size() + " Cypher block(s) for " + program.name());
		return blocks;
	}
}
