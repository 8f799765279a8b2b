package works.grove;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TraversalTest {
	Node root, a, b, c;

	@BeforeEach
	void setUp() {
		root = new Node();
		a = new Node();
		b = new Node();
		c = new Node();
		root.addChild(a);
		a.addChild(b);
		a.addChild(c);
	}

	@Test
	void all_preOrderRoutes() {
		assertEquals(List.of("-1", "-1_0", "-1_0_0", "-1_0_1"), routes(root.all()));
	}

	@Test
	void childrenReverse_routes() {
		assertEquals(List.of("-1_0_1", "-1_0_0"), routes(a.childrenReverse()));
	}

	@Test
	void siblingsReverse_onlyEarlierSiblings() {
		assertEquals(List.of(), routes(b.siblingsReverse()));
		assertEquals(List.of("-1_0_0"), routes(c.siblingsReverse()));
	}

	@Test
	void siblings_onlyLaterSiblings() {
		assertEquals(List.of("-1_0_1"), routes(b.siblings()));
		assertEquals(List.of(), routes(c.siblings()));
	}

	@Test
	void descendants_excludesSelf() {
		assertEquals(List.of(a, b, c), root.descendants());
		assertEquals(List.of(), c.descendants());
	}

	@Test
	void parents_nearestFirst() {
		assertEquals(List.of(a, root), c.parents());
		assertEquals(List.of(), root.parents());
	}

	@Test
	void all_visitsSubtreeBeforeNextSibling() {
		Node d = new Node();
		Node e = new Node();
		root.addChild(d);
		b.addChild(e);

		assertEquals(List.of(root, a, b, e, c, d), root.all());
	}

	@Test
	void all_cancelStopsImmediately() {
		List<Node> visited = new ArrayList<>();
		root.all((node, cancellation) -> {
			visited.add(node);
			if (node == b) {
				cancellation.cancel();
			}
		});
		assertEquals(List.of(root, a, b), visited);
	}

	@Test
	void descendants_cancelOnFirst() {
		List<Node> visited = new ArrayList<>();
		root.descendants((node, cancellation) -> {
			visited.add(node);
			cancellation.cancel();
		});
		assertEquals(List.of(a), visited);
	}

	@Test
	void childrenWalks_cancel() {
		List<Node> forward = new ArrayList<>();
		a.children((node, cancellation) -> {
			forward.add(node);
			cancellation.cancel();
		});
		List<Node> reverse = new ArrayList<>();
		a.childrenReverse((node, cancellation) -> {
			reverse.add(node);
			cancellation.cancel();
		});
		assertEquals(List.of(b), forward);
		assertEquals(List.of(c), reverse);
	}

	@Test
	void parents_cancel() {
		List<Node> visited = new ArrayList<>();
		c.parents((node, cancellation) -> {
			visited.add(node);
			cancellation.cancel();
		});
		assertEquals(List.of(a), visited);
	}

	@Test
	void siblingWalks_visitInOrder() {
		Node d = new Node();
		a.addChild(d);

		List<Node> after = new ArrayList<>();
		b.siblings((node, cancellation) -> after.add(node));
		List<Node> before = new ArrayList<>();
		d.siblingsReverse((node, cancellation) -> before.add(node));

		assertEquals(List.of(c, d), after);
		assertEquals(List.of(c, b), before);
	}

	@Test
	void all_toleratesDetachDuringWalk() {
		List<Node> visited = new ArrayList<>();
		root.all((node, cancellation) -> {
			visited.add(node);
			if (node == b) {
				c.detach();
			}
		});
		assertEquals(List.of(root, a, b, c), visited);
		assertEquals(List.of(b), a.children());
	}

	private static List<String> routes(List<Node> nodes) {
		return nodes.stream()
			.map(n -> n.findRoute().toString())
			.collect(toList());
	}
}
