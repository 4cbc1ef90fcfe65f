package org.ontodsl.compiler.backend.cypher;

import org.ontodsl.compiler.backend.cypher.emitters.AggregateEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.CommentEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.ComputeEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.EnrichEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.LoadEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.NormalizeEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.UnitConvertEmitter;
import org.ontodsl.compiler.backend.cypher.emitters.ValidateEmitter;
import org.ontodsl.compiler.frontend.parser.ast.StatementNode;
import org.ontodsl.compiler.frontend.parser.features.aggregate.AggregateNode;
import org.ontodsl.compiler.frontend.parser.features.comment.CommentNode;
import org.ontodsl.compiler.frontend.parser.features.compute.ComputeNode;
import org.ontodsl.compiler.frontend.parser.features.enrich.EnrichNode;
import org.ontodsl.compiler.frontend.parser.features.load.LoadNode;
import org.ontodsl.compiler.frontend.parser.features.normalize.NormalizeNode;
import org.ontodsl.compiler.frontend.parser.features.unitconvert.UnitConvertNode;
import org.ontodsl.compiler.frontend.parser.features.validate.ValidateNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping statement classes to emitter instances.
 * <p>
 * Provides explicit registration and a default emitter fallback for unregistered classes.
 */
public final class CypherEmitterRegistry {

	private final Map<Class<? extends StatementNode>, IStatementEmitter<? extends StatementNode>> byClass = new HashMap<>();
	private final IStatementEmitter<StatementNode> defaultEmitter;

	private CypherEmitterRegistry(IStatementEmitter<StatementNode> defaultEmitter) {
		this.defaultEmitter = defaultEmitter;
	}

	/**
	 * Registers an emitter for the given statement class.
	 *
	 * @param nodeType The concrete statement class.
	 * @param emitter  The emitter instance handling that class.
	 * @param <T>      Concrete statement type parameter.
	 */
	public <T extends StatementNode> void register(Class<T> nodeType, IStatementEmitter<T> emitter) {
		byClass.put(nodeType, emitter);
	}

	/**
	 * Resolves the emitter for the given statement, falling back to the default emitter.
	 *
	 * @param node The statement to resolve an emitter for.
	 * @return A non-null emitter.
	 */
	@SuppressWarnings("unchecked")
	public IStatementEmitter<StatementNode> resolve(StatementNode node) {
		IStatementEmitter<?> found = byClass.get(node.getClass());
		return found != null ? (IStatementEmitter<StatementNode>) found : defaultEmitter;
	}

	/**
	 * Creates an empty registry with the given default emitter.
	 *
	 * @param defaultEmitter The fallback emitter used for unknown statement types.
	 * @return A new registry instance.
	 */
	public static CypherEmitterRegistry initialize(IStatementEmitter<StatementNode> defaultEmitter) {
		return new CypherEmitterRegistry(defaultEmitter);
	}

	/**
	 * Initializes a registry with the default emitter and all built-in emitters.
	 *
	 * @return A registry pre-populated with the standard emitters.
	 */
	public static CypherEmitterRegistry initializeWithDefaults() {
		CypherEmitterRegistry reg = initialize(new DefaultStatementEmitter());
		reg.register(LoadNode.class, new LoadEmitter());
		reg.register(NormalizeNode.class, new NormalizeEmitter());
		reg.register(AggregateNode.class, new AggregateEmitter());
		reg.register(UnitConvertNode.class, new UnitConvertEmitter());
		reg.register(EnrichNode.class, new EnrichEmitter());
		reg.register(ComputeNode.class, new ComputeEmitter());
		reg.register(ValidateNode.class, new ValidateEmitter());
		reg.register(CommentNode.class, new CommentEmitter());
		return reg;
	}
}
