package works.grove;

/**
 * Predicate for {@link Node#find(Object, Matcher)}.
 *
 * @param <T> the type of the value being searched for
 */
@FunctionalInterface
public interface Matcher<T> {
	boolean matches(Node node, T what, Cancellation cancellation);
}
