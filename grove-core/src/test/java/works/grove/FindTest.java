package works.grove;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FindTest {
	Node root, target, other;

	@BeforeEach
	void setUp() {
		root = new Node();
		target = new Node();
		target.set("type", "target");
		other = new Node();
		other.set("type", "other");
		root.addChild(target);
		root.addChild(other);
	}

	@Test
	void findByContent_exactlyOneMatch() {
		assertEquals(List.of(target), root.find("target", "type"));
	}

	@Test
	void findByContent_includesSelf() {
		root.set("type", "target");
		assertEquals(List.of(root, target), root.find("target", "type"));
	}

	@Test
	void findByContent_comparesTypedValues() {
		target.set("n", 1);
		other.set("n", 1.0);
		assertEquals(List.of(target), root.find(1, "n"));
		assertEquals(List.of(other), root.find(1.0, "n"));
		assertEquals(List.of(), root.find("1", "n"));
	}

	@Test
	void findByContent_nullMatchesOnlyPresentNull() {
		target.set("maybe", ContentValue.NULL);
		assertEquals(List.of(target), root.find(null, "maybe"));
	}

	@Test
	void findByContent_unsupportedValue_matchesNothing() {
		assertEquals(List.of(), root.find(new Object(), "type"));
		assertEquals(List.of(), root.find(new StringBuilder("target"), "type"));
	}

	@Test
	void findByID_invalidStringMatchesNothing() {
		assertEquals(List.of(), root.find(""));
		assertEquals(List.of(), root.find((String) null));
		assertEquals(List.of(), root.find("no-such-id"));
	}

	@Test
	void findByID_searchesSubtree() {
		assertEquals(List.of(other), root.find(other.id()));
		assertEquals(List.of(other), root.find(other.id().toString()));
		assertEquals(List.of(), target.find(other.id()));
	}

	@Test
	void findByID_cloneSharesID() {
		Node twin = other.clone(false);
		target.addChild(twin);
		assertEquals(List.of(twin, other), root.find(other.id()));
	}

	@Test
	void findByMatcher_collectsMatches() {
		List<Node> found = root.find("type", (node, key, cancellation) -> node.has(key));
		assertEquals(List.of(target, other), found);
	}

	@Test
	void findByMatcher_passesWhatThrough() {
		List<Node> found = root.find(2, (node, count, cancellation) -> node.findNumChildren() == count);
		assertEquals(List.of(root), found);
	}

	@Test
	void findByMatcher_cancelStopsSearch() {
		List<Node> found = root.find("type", (node, key, cancellation) -> {
			if (node.has(key)) {
				cancellation.cancel();
				return true;
			}
			return false;
		});
		assertEquals(List.of(target), found);
	}

	@Test
	void find_noMatches_isEmpty() {
		assertEquals(List.of(), root.find("absent", "type"));
		assertEquals(List.of(), root.find(Identifier.random()));
	}
}
