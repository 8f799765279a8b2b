package works.grove;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.grove.exceptions.UnknownTypeException;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * Maps the stable {@link Node#typeName() type names} recorded by the codecs
 * to factories for the corresponding node classes.
 *
 * <p>
 * Applications register their own node types before decoding anything that might contain them.
 * A registry is passed explicitly to each {@link NodeCodec}; there is no global instance.
 */
public final class TypeRegistry {
	private final Map<String, NodeFactory<?>> factories = new LinkedHashMap<>();

	/**
	 * Creates a registry with no types in it.
	 */
	public TypeRegistry() {
	}

	/**
	 * @return a registry that knows {@link Node} and {@link ReadOnlyNode}
	 */
	public static TypeRegistry withStandardTypes() {
		TypeRegistry result = new TypeRegistry();
		result.register(new Node());
		result.register(new ReadOnlyNode());
		return result;
	}

	/**
	 * Associates <code>typeName</code> with <code>factory</code>, replacing any previous association.
	 */
	public TypeRegistry register(String typeName, NodeFactory<?> factory) {
		requireNonNull(factory);
		NodeFactory<?> old = factories.put(requireNonNull(typeName), factory);
		if (old != null) {
			LOGGER.debug("Replaced factory for node type \"{}\"", typeName);
		}
		return this;
	}

	/**
	 * Registers the {@link Node#factory() factory} of <code>prototype</code>
	 * under its {@link Node#typeName() type name}.
	 */
	public TypeRegistry register(Node prototype) {
		return register(prototype.typeName(), prototype.factory());
	}

	public boolean isRegistered(String typeName) {
		return factories.containsKey(typeName);
	}

	public Set<String> typeNames() {
		return unmodifiableSet(factories.keySet());
	}

	/**
	 * @throws UnknownTypeException if <code>typeName</code> is not registered
	 */
	public NodeFactory<?> resolve(String typeName) {
		return resolve(typeName, null);
	}

	/**
	 * @param fallbackTypeName used if <code>typeName</code> isn't registered; may be null
	 * @throws UnknownTypeException if neither type name is registered
	 */
	public NodeFactory<?> resolve(String typeName, String fallbackTypeName) {
		NodeFactory<?> factory = factories.get(typeName);
		if (factory != null) {
			return factory;
		}
		if (fallbackTypeName != null) {
			factory = factories.get(fallbackTypeName);
			if (factory != null) {
				LOGGER.debug("Node type \"{}\" is not registered; using fallback \"{}\"", typeName, fallbackTypeName);
				return factory;
			}
		}
		throw new UnknownTypeException(typeName, fallbackTypeName);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
