package works.grove;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.grove.exceptions.DecodeException;
import works.grove.exceptions.ValidationException;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * One vertex of an ordered tree of documents.
 *
 * <p>
 * A node has an {@link Identifier}, an ordered map of {@link ContentValue content},
 * at most one parent, and an ordered list of children that it owns.
 * Mutation is safe by construction: {@link #addChild} silently refuses any
 * attachment that would create a cycle, and moves a node that already has a
 * parent rather than attaching it twice.
 *
 * <p>
 * Subclasses representing application-specific node types should override
 * {@link #typeName()} and {@link #factory()}, and be registered with a
 * {@link TypeRegistry} so the codecs can reconstruct them.
 *
 * <p>
 * Nodes are not thread-safe.
 *
 * @see NodeCodec
 * @see ReadOnlyNode
 */
public class Node {
	private Identifier id;
	private final LinkedHashMap<String, ContentValue> content = new LinkedHashMap<>();
	private final ArrayList<Node> children = new ArrayList<>();
	private Node parent;
	private Node prev;
	private Node next;

	public Node() {
		this.id = Identifier.random();
	}

	//
	// Identity and type
	//

	public final Identifier id() {
		return id;
	}

	/**
	 * The stable name under which this node's concrete type is recorded by the codecs.
	 * Defaults to the class's binary name.
	 */
	public String typeName() {
		return getClass().getName();
	}

	/**
	 * @return a factory for blank nodes of this node's concrete type.
	 * Subclasses must override this.
	 */
	public NodeFactory<? extends Node> factory() {
		return Node::new;
	}

	/**
	 * @return false if nodes of this type are always leaves
	 */
	protected boolean acceptsChildren() {
		return true;
	}

	//
	// Hierarchy
	//

	public final Optional<Node> parent() {
		return Optional.ofNullable(parent);
	}

	public final Optional<Node> prev() {
		return Optional.ofNullable(prev);
	}

	public final Optional<Node> next() {
		return Optional.ofNullable(next);
	}

	public final Optional<Node> firstChild() {
		return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
	}

	public final Optional<Node> lastChild() {
		return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
	}

	/**
	 * @return an unmodifiable view of the direct children, in order
	 */
	public final List<Node> children() {
		return unmodifiableList(children);
	}

	/**
	 * @throws IndexOutOfBoundsException if there's no child at <code>index</code>
	 */
	public final Node childAt(int index) {
		return children.get(index);
	}

	public final boolean isRoot() {
		return parent == null;
	}

	/**
	 * @return true if this node has no children
	 */
	public final boolean isFlat() {
		return children.isEmpty();
	}

	/**
	 * Appends <code>child</code> to this node's children.
	 *
	 * @see #addChild(Node, int)
	 */
	public final boolean addChild(Node child) {
		return addChild(child, Integer.MAX_VALUE);
	}

	/**
	 * Inserts <code>child</code> among this node's children so that it ends up at
	 * position <code>index</code>, clamped to the valid range.
	 * If <code>child</code> already has a parent, including this node,
	 * it is detached first and <code>index</code> refers to the positions
	 * that remain after detaching.
	 *
	 * <p>
	 * Silently does nothing if <code>child</code> is this node or one of its
	 * ancestors, or if this node doesn't {@link #acceptsChildren() accept children}.
	 *
	 * @return true if <code>child</code> was attached
	 */
	public boolean addChild(Node child, int index) {
		if (!acceptsChildren()) {
			LOGGER.debug("Ignoring addChild to {}: node type does not accept children", id);
			return false;
		}
		requireNonNull(child);
		for (Node n = this; n != null; n = n.parent) {
			if (n == child) {
				LOGGER.debug("Ignoring addChild of {} to {}: would create a cycle", child.id, id);
				return false;
			}
		}
		if (child.parent != null) {
			child.parent.unlink(child);
		}
		link(child, Math.max(0, Math.min(index, children.size())));
		return true;
	}

	/**
	 * Detaches <code>child</code> if it is a direct child of this node.
	 *
	 * @return true if it was detached
	 */
	public boolean deleteChild(Node child) {
		if (child == null || child.parent != this) {
			return false;
		}
		unlink(child);
		return true;
	}

	/**
	 * Detaches this node from its parent, if any, making it a root.
	 */
	public final void detach() {
		if (parent != null) {
			parent.deleteChild(this);
		}
	}

	private void link(Node child, int position) {
		children.add(position, child);
		child.parent = this;
		child.prev = (position == 0) ? null : children.get(position - 1);
		child.next = (position == children.size() - 1) ? null : children.get(position + 1);
		if (child.prev != null) {
			child.prev.next = child;
		}
		if (child.next != null) {
			child.next.prev = child;
		}
	}

	private void unlink(Node child) {
		assert child.parent == this;
		children.remove(child.findIndex());
		if (child.prev != null) {
			child.prev.next = child.next;
		}
		if (child.next != null) {
			child.next.prev = child.prev;
		}
		child.parent = null;
		child.prev = null;
		child.next = null;
	}

	private void unlinkAll() {
		while (!children.isEmpty()) {
			unlink(children.get(children.size() - 1));
		}
	}

	//
	// Content
	//

	public final boolean has(String key) {
		return content.containsKey(key);
	}

	public final Optional<ContentValue> get(String key) {
		return Optional.ofNullable(content.get(key));
	}

	/**
	 * @return an unmodifiable view of the content, in insertion order
	 */
	public final Map<String, ContentValue> content() {
		return unmodifiableMap(content);
	}

	public final List<String> keys() {
		return List.copyOf(content.keySet());
	}

	/**
	 * Stores <code>value</code> under <code>key</code>. An existing key keeps its
	 * position in the content order; a new key goes at the end.
	 */
	public void set(String key, ContentValue value) {
		content.put(requireNonNull(key), requireNonNull(value));
	}

	/**
	 * @return false if every content mutator on this node is ignored, whatever its arguments
	 */
	protected boolean isMutable() {
		return true;
	}

	public final void set(String key, String value) {
		set(key, ContentValue.of(value));
	}

	public final void set(String key, long value) {
		set(key, ContentValue.of(value));
	}

	public final void set(String key, double value) {
		set(key, ContentValue.of(value));
	}

	public final void set(String key, boolean value) {
		set(key, ContentValue.of(value));
	}

	/**
	 * @throws ValidationException if <code>value</code> isn't one of the types supported by {@link ContentValue#of(Object)}
	 * and this node {@link #isMutable() is mutable}
	 */
	public final void set(String key, Object value) {
		if (!isMutable()) {
			LOGGER.debug("Ignoring set of \"{}\" on immutable node {}", key, id);
			return;
		}
		set(key, ContentValue.of(value));
	}

	/**
	 * @return true if <code>key</code> was present
	 */
	public boolean delete(String key) {
		return content.remove(key) != null;
	}

	final void putContentDirectly(String key, ContentValue value) {
		content.put(requireNonNull(key), requireNonNull(value));
	}

	//
	// Position
	//

	/**
	 * @return this node's position among its siblings, or -1 if it is a root
	 */
	public final int findIndex() {
		if (parent == null) {
			return -1;
		}
		List<Node> siblings = parent.children;
		for (int i = 0; i < siblings.size(); i++) {
			if (siblings.get(i) == this) {
				return i;
			}
		}
		throw new IllegalStateException("Node " + id + " is missing from its parent's children");
	}

	/**
	 * @return the number of ancestors; zero for a root
	 */
	public final int findLevel() {
		int level = 0;
		for (Node n = parent; n != null; n = n.parent) {
			++level;
		}
		return level;
	}

	public final int findNumChildren() {
		return children.size();
	}

	public final Node findRoot() {
		Node result = this;
		while (result.parent != null) {
			result = result.parent;
		}
		return result;
	}

	//
	// Routes
	//

	public final Route findRoute() {
		List<Integer> reversed = new ArrayList<>();
		for (Node n = this; n.parent != null; n = n.parent) {
			reversed.add(n.findIndex());
		}
		Collections.reverse(reversed);
		return Route.of(reversed.stream().mapToInt(Integer::intValue).toArray());
	}

	/**
	 * Resolves <code>route</code> treating this node as its root.
	 *
	 * @return the node, or {@link Optional#empty()} if <code>route</code> is malformed
	 * or an index is out of range
	 */
	public final Optional<Node> getByRoute(String route) {
		return Route.tryParse(route).flatMap(this::getByRoute);
	}

	public final Optional<Node> getByRoute(Route route) {
		Node current = this;
		for (int i = 0; i < route.length(); i++) {
			int index = route.index(i);
			if (index >= current.children.size()) {
				return Optional.empty();
			}
			current = current.children.get(index);
		}
		return Optional.of(current);
	}

	//
	// Walks
	//

	/**
	 * Visits this node and then all its descendants in pre-order.
	 */
	public final void all(Visitor visitor) {
		walkPreOrder(this, visitor, new Cancellation());
	}

	public final List<Node> all() {
		return collect(this::all);
	}

	/**
	 * Like {@link #all(Visitor)}, but skips this node.
	 */
	public final void descendants(Visitor visitor) {
		walkDescendants(this, visitor, new Cancellation());
	}

	public final List<Node> descendants() {
		return collect(this::descendants);
	}

	public final void children(Visitor visitor) {
		walkSequence(new ArrayList<>(children), visitor);
	}

	public final void childrenReverse(Visitor visitor) {
		walkSequence(childrenReverse(), visitor);
	}

	public final List<Node> childrenReverse() {
		List<Node> result = new ArrayList<>(children);
		Collections.reverse(result);
		return result;
	}

	/**
	 * Visits the ancestors of this node, nearest first.
	 */
	public final void parents(Visitor visitor) {
		walkSequence(parents(), visitor);
	}

	public final List<Node> parents() {
		List<Node> result = new ArrayList<>();
		for (Node n = parent; n != null; n = n.parent) {
			result.add(n);
		}
		return result;
	}

	/**
	 * Visits the siblings that come after this node, in order.
	 */
	public final void siblings(Visitor visitor) {
		walkSequence(siblings(), visitor);
	}

	public final List<Node> siblings() {
		List<Node> result = new ArrayList<>();
		for (Node n = next; n != null; n = n.next) {
			result.add(n);
		}
		return result;
	}

	/**
	 * Visits the siblings that come before this node, nearest first.
	 */
	public final void siblingsReverse(Visitor visitor) {
		walkSequence(siblingsReverse(), visitor);
	}

	public final List<Node> siblingsReverse() {
		List<Node> result = new ArrayList<>();
		for (Node n = prev; n != null; n = n.prev) {
			result.add(n);
		}
		return result;
	}

	private static boolean walkPreOrder(Node node, Visitor visitor, Cancellation cancellation) {
		visitor.visit(node, cancellation);
		if (cancellation.isCancelled()) {
			return false;
		}
		return walkDescendants(node, visitor, cancellation);
	}

	private static boolean walkDescendants(Node node, Visitor visitor, Cancellation cancellation) {
		// Copy so the visitor can rearrange the tree as it goes
		for (Node child: new ArrayList<>(node.children)) {
			if (!walkPreOrder(child, visitor, cancellation)) {
				return false;
			}
		}
		return true;
	}

	private static void walkSequence(List<Node> nodes, Visitor visitor) {
		Cancellation cancellation = new Cancellation();
		for (Node node: nodes) {
			visitor.visit(node, cancellation);
			if (cancellation.isCancelled()) {
				return;
			}
		}
	}

	private static List<Node> collect(Consumer<Visitor> walk) {
		List<Node> result = new ArrayList<>();
		walk.accept((node, cancellation) -> result.add(node));
		return result;
	}

	//
	// Search
	//

	/**
	 * @return this node and its descendants having the given identifier, in {@link #all()} order
	 */
	public final List<Node> find(Identifier what) {
		requireNonNull(what);
		return find(what, (node, id, cancellation) -> id.equals(node.id));
	}

	/**
	 * Like {@link #find(Identifier)}, but any string is accepted.
	 * Strings that can't be identifiers match nothing.
	 */
	public final List<Node> find(String id) {
		if (id == null || id.isEmpty()) {
			return List.of();
		}
		return find(Identifier.from(id));
	}

	/**
	 * @return this node and its descendants whose content has <code>what</code> under <code>key</code>, in {@link #all()} order.
	 * A <code>what</code> that can't be a {@link ContentValue} matches nothing.
	 */
	public final List<Node> find(Object what, String key) {
		ContentValue target;
		try {
			target = ContentValue.of(what);
		} catch (ValidationException e) {
			LOGGER.debug("No content can match {}", what, e);
			return List.of();
		}
		return find(target, (node, value, cancellation) -> value.equals(node.content.get(key)));
	}

	/**
	 * Calls <code>matcher</code> on this node and its descendants in {@link #all()} order,
	 * stopping early if it cancels.
	 *
	 * @return the nodes for which <code>matcher</code> returned true
	 */
	public final <T> List<Node> find(T what, Matcher<? super T> matcher) {
		List<Node> result = new ArrayList<>();
		all((node, cancellation) -> {
			if (matcher.matches(node, what, cancellation)) {
				result.add(node);
			}
		});
		return result;
	}

	//
	// Equality and cloning
	//

	/**
	 * Structural equality including identity: same id, same content,
	 * and children that are pairwise {@link #isSame} in the same order.
	 */
	public final boolean isSame(Node other) {
		return matches(other, true);
	}

	/**
	 * Like {@link #isSame} but ignores identifiers throughout the subtree.
	 */
	public final boolean isLike(Node other) {
		return matches(other, false);
	}

	private boolean matches(Node other, boolean compareIDs) {
		if (other == null) {
			return false;
		} else if (other == this) {
			return true;
		} else if (compareIDs && !id.equals(other.id)) {
			return false;
		} else if (!content.equals(other.content)) {
			return false;
		} else if (children.size() != other.children.size()) {
			return false;
		}
		for (int i = 0; i < children.size(); i++) {
			if (!children.get(i).matches(other.children.get(i), compareIDs)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @param deep whether to clone the descendants too
	 * @return a new root node of the same concrete type with the same
	 * identifier and content, in the same order
	 */
	public Node clone(boolean deep) {
		Node copy = factory().create();
		if (copy.getClass() != getClass()) {
			throw new IllegalStateException(getClass().getName() + " must override factory(); got " + copy.getClass().getName());
		}
		copy.id = id;
		copy.content.clear();
		copy.content.putAll(content);
		copy.unlinkAll();
		if (deep) {
			for (Node child: children) {
				copy.link(child.clone(true), copy.children.size());
			}
		}
		return copy;
	}

	//
	// Codecs
	//

	public final <T> T exportTo(NodeCodec<T> codec) {
		return codec.exportFrom(this);
	}

	/**
	 * @see #importFrom(Object, NodeCodec, String)
	 */
	public final <T> void importFrom(T input, NodeCodec<T> codec) {
		importFrom(input, codec, null);
	}

	/**
	 * Replaces this node's identifier, content and children with those decoded from <code>input</code>.
	 * This node keeps its own concrete type; each descendant is created using the factory
	 * that <code>codec</code>'s {@link TypeRegistry} has for its recorded type name,
	 * or for <code>fallbackTypeName</code> if there is none.
	 *
	 * <p>
	 * Either this succeeds completely or this node is unchanged.
	 * Children this node had before are detached and become roots.
	 *
	 * @param fallbackTypeName used for types the registry doesn't know; may be null
	 * @throws works.grove.exceptions.DecodeException if the input is malformed
	 * @throws works.grove.exceptions.UnknownTypeException if a type can't be resolved
	 */
	public <T> void importFrom(T input, NodeCodec<T> codec, String fallbackTypeName) {
		Node staged = codec.stage(input, fallbackTypeName);
		if (!staged.isFlat() && !acceptsChildren()) {
			throw new DecodeException("Node " + id + " of type \"" + typeName()
				+ "\" can't have the " + staged.children.size() + " children recorded for it");
		}
		overwriteWith(staged);
		LOGGER.debug("Imported {} into {}", id, typeName());
	}

	/**
	 * Populates this blank node from <code>snapshot</code>, creating descendants
	 * through <code>registry</code>.
	 */
	final void restoreFrom(NodeSnapshot snapshot, TypeRegistry registry, String fallbackTypeName) {
		id = snapshot.id();
		content.clear();
		content.putAll(snapshot.content());
		unlinkAll();
		for (NodeSnapshot childSnapshot: snapshot.children()) {
			Node child = registry.resolve(childSnapshot.typeName(), fallbackTypeName).create();
			if (!childSnapshot.isFlat() && !child.acceptsChildren()) {
				throw new DecodeException("Node " + childSnapshot.id() + " of type \"" + child.typeName()
					+ "\" can't have the " + childSnapshot.children().size() + " children recorded for it");
			}
			child.restoreFrom(childSnapshot, registry, fallbackTypeName);
			link(child, children.size());
		}
	}

	private void overwriteWith(Node staged) {
		id = staged.id;
		content.clear();
		content.putAll(staged.content);
		unlinkAll();
		for (Node child: new ArrayList<>(staged.children)) {
			staged.unlink(child);
			link(child, children.size());
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + id + ")" + content;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
}
