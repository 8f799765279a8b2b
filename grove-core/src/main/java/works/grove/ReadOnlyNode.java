package works.grove;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A leaf node whose content is fixed when it is constructed.
 *
 * <p>
 * Reads behave exactly as they do for {@link Node}. Every mutator is a no-op:
 * content changes are ignored, children are never accepted, and
 * {@link #importFrom imports} leave the node untouched whatever the input.
 * A read-only node can still be attached to, moved between, and detached from mutable parents.
 */
public class ReadOnlyNode extends Node {
	public ReadOnlyNode() {
		this(Map.of());
	}

	/**
	 * @param snapshot converted with {@link ContentValue#of(Object)} and stored in its iteration order.
	 * Use an ordered map such as {@link java.util.LinkedHashMap} when the order matters:
	 * the iteration order of {@link Map#of} varies from one JVM run to the next,
	 * and so would this node's encodings.
	 * @throws works.grove.exceptions.ValidationException if a value isn't supported
	 */
	public ReadOnlyNode(Map<String, ?> snapshot) {
		snapshot.forEach((key, value) -> putContentDirectly(key, ContentValue.of(value)));
	}

	@Override
	public NodeFactory<ReadOnlyNode> factory() {
		return ReadOnlyNode::new;
	}

	@Override
	protected boolean isMutable() {
		return false;
	}

	@Override
	protected boolean acceptsChildren() {
		return false;
	}

	@Override
	public ReadOnlyNode clone(boolean deep) {
		return (ReadOnlyNode) super.clone(deep);
	}

	@Override
	public void set(String key, ContentValue value) {
		LOGGER.debug("Ignoring set of \"{}\" on read-only node {}", key, id());
	}

	@Override
	public boolean delete(String key) {
		LOGGER.debug("Ignoring delete of \"{}\" on read-only node {}", key, id());
		return false;
	}

	@Override
	public <T> void importFrom(T input, NodeCodec<T> codec, String fallbackTypeName) {
		LOGGER.debug("Ignoring import into read-only node {}", id());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ReadOnlyNode.class);
}
