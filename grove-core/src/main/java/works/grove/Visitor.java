package works.grove;

/**
 * Callback for the walks offered by {@link Node}, such as {@link Node#all(Visitor)}.
 */
@FunctionalInterface
public interface Visitor {
	void visit(Node node, Cancellation cancellation);
}
