package works.grove;

/**
 * Produces a blank node of one concrete type.
 * Blank means a fresh identifier, no content, and no children.
 */
@FunctionalInterface
public interface NodeFactory<N extends Node> {
	N create();
}
