package works.grove;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * An immutable, format-neutral description of a subtree: what a {@link NodeCodec}
 * writes out and what it reads back in.
 *
 * @param content in the order it is to be encoded
 * @param children in sibling order
 */
public record NodeSnapshot(
	Identifier id,
	String typeName,
	Map<String, ContentValue> content,
	List<NodeSnapshot> children
) {
	public NodeSnapshot {
		requireNonNull(id);
		requireNonNull(typeName);
		LinkedHashMap<String, ContentValue> orderedContent = new LinkedHashMap<>();
		content.forEach((key, value) -> orderedContent.put(requireNonNull(key), requireNonNull(value)));
		content = unmodifiableMap(orderedContent);
		children = List.copyOf(children);
	}

	public static NodeSnapshot of(Node node) {
		List<NodeSnapshot> children = new ArrayList<>(node.findNumChildren());
		for (Node child: node.children()) {
			children.add(of(child));
		}
		return new NodeSnapshot(node.id(), node.typeName(), node.content(), children);
	}

	/**
	 * @return true if there are no children
	 */
	public boolean isFlat() {
		return children.isEmpty();
	}

	/**
	 * @return the number of nodes in this subtree, including this one
	 */
	public int size() {
		int result = 1;
		for (NodeSnapshot child: children) {
			result += child.size();
		}
		return result;
	}
}
