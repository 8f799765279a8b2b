package works.grove;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.grove.exceptions.DecodeException;
import works.grove.exceptions.UnknownTypeException;

import static java.util.Objects.requireNonNull;

/**
 * Translates whole subtrees to and from some external representation <code>T</code>.
 *
 * <p>
 * Subclasses only deal with the format: they turn a {@link NodeSnapshot} into a
 * <code>T</code> and back. This class takes care of choosing node classes
 * through the {@link TypeRegistry} and of updating the target node atomically.
 *
 * <p>
 * Instances hold no per-call state and can be reused.
 *
 * @param <T> the encoded representation, such as <code>byte[]</code> or <code>String</code>
 */
public abstract class NodeCodec<T> {
	private final TypeRegistry registry;

	protected NodeCodec(TypeRegistry registry) {
		this.registry = requireNonNull(registry);
	}

	public final TypeRegistry registry() {
		return registry;
	}

	/**
	 * @throws works.grove.exceptions.ValidationException if the snapshot contains something the format can't represent
	 */
	public abstract T encode(NodeSnapshot snapshot);

	/**
	 * @throws DecodeException if <code>input</code> is malformed
	 */
	public abstract NodeSnapshot decode(T input);

	/**
	 * Encodes <code>node</code> and all its descendants.
	 */
	public final T exportFrom(Node node) {
		NodeSnapshot snapshot = NodeSnapshot.of(node);
		T result = encode(snapshot);
		LOGGER.debug("Exported {} nodes from {}", snapshot.size(), node.id());
		return result;
	}

	/**
	 * Decodes <code>input</code> into a brand new tree whose root, like its descendants,
	 * is created through the registry.
	 *
	 * @param fallbackTypeName used for types the registry doesn't know; may be null
	 * @throws UnknownTypeException if a type name can't be resolved
	 */
	public final Node importNew(T input, String fallbackTypeName) {
		NodeSnapshot snapshot = decode(requireNonNull(input));
		Node root = registry.resolve(snapshot.typeName(), fallbackTypeName).create();
		if (!snapshot.isFlat() && !root.acceptsChildren()) {
			throw new DecodeException("Root node of type \"" + root.typeName() + "\" can't have children");
		}
		root.restoreFrom(snapshot, registry, fallbackTypeName);
		LOGGER.debug("Imported {} nodes as new {}", snapshot.size(), root.typeName());
		return root;
	}

	public final Node importNew(T input) {
		return importNew(input, null);
	}

	/**
	 * Decodes <code>input</code> into a detached tree whose root is a plain {@link Node}.
	 * Nothing outside the returned tree is touched, so a failure here leaves
	 * every existing node as it was.
	 */
	final Node stage(T input, String fallbackTypeName) {
		NodeSnapshot snapshot = decode(requireNonNull(input));
		Node staged = new Node();
		staged.restoreFrom(snapshot, registry, fallbackTypeName);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Staged {} nodes recorded as {} {}", snapshot.size(), snapshot.typeName(), snapshot.id());
		}
		return staged;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NodeCodec.class);
}
