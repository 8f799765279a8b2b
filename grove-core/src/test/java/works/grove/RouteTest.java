package works.grove;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.grove.exceptions.MalformedRouteException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouteTest {

	@Test
	void root_isMinusOne() {
		assertEquals("-1", Route.root().toString());
		assertTrue(Route.root().isRoot());
		assertEquals(Route.root(), new Node().findRoute());
	}

	@Test
	void parse_roundTrips() {
		Route route = Route.parse("-1_3_0_12");
		assertEquals(List.of(3, 0, 12), route.indices());
		assertEquals(3, route.length());
		assertEquals("-1_3_0_12", route.toString());
		assertEquals(Route.of(3, 0, 12), route);
		assertEquals(Route.root().then(3).then(0).then(12), route);
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "0", "0_1", "-1_", "-1__0", "-1_-1", "-1_a", "-1_01", "-1_+1", "1_-1", "-1_99999999999"})
	void parse_malformed_throws(String text) {
		assertThrows(MalformedRouteException.class, () -> Route.parse(text));
		assertEquals(Optional.empty(), Route.tryParse(text));
	}

	@Test
	void of_negativeIndex_throws() {
		assertThrows(IllegalArgumentException.class, () -> Route.of(0, -2));
		assertThrows(IllegalArgumentException.class, () -> Route.root().then(-1));
	}

	@Test
	void getByRoute_resolvesEveryNode() {
		Node root = sampleTree();
		for (Node node: root.all()) {
			assertSame(node, root.getByRoute(node.findRoute()).orElseThrow());
			assertSame(node, root.getByRoute(node.findRoute().toString()).orElseThrow());
		}
	}

	@Test
	void getByRoute_outOfRange_isEmpty() {
		Node root = sampleTree();
		assertEquals(Optional.empty(), root.getByRoute("-1_5"));
		assertEquals(Optional.empty(), root.getByRoute("-1_0_0_0_0"));
	}

	@Test
	void getByRoute_malformed_isEmpty() {
		Node root = sampleTree();
		assertEquals(Optional.empty(), root.getByRoute("0_1"));
		assertEquals(Optional.empty(), root.getByRoute("banana"));
		assertEquals(Optional.empty(), root.getByRoute((String) null));
	}

	@Test
	void getByRoute_isRelativeToReceiver() {
		Node root = sampleTree();
		Node subtree = root.childAt(1);
		assertSame(subtree.childAt(0), subtree.getByRoute("-1_0").orElseThrow());
		assertSame(subtree, subtree.getByRoute("-1").orElseThrow());
	}

	private static Node sampleTree() {
		Node root = new Node();
		for (int i = 0; i < 3; i++) {
			Node child = new Node();
			root.addChild(child);
			for (int j = 0; j <= i; j++) {
				Node grandchild = new Node();
				child.addChild(grandchild);
				if (j == 1) {
					grandchild.addChild(new Node());
				}
			}
		}
		return root;
	}
}
