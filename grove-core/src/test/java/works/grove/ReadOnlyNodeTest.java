package works.grove;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.grove.exceptions.ValidationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadOnlyNodeTest {
	Map<String, Object> snapshot;
	ReadOnlyNode node;

	@BeforeEach
	void setUp() {
		snapshot = new LinkedHashMap<>();
		snapshot.put("type", "target");
		snapshot.put("count", 3);
		snapshot.put("ratio", 0.5);
		snapshot.put("flag", true);
		snapshot.put("nothing", null);
		node = new ReadOnlyNode(snapshot);
	}

	@Test
	void reads_matchSnapshot() {
		assertSnapshotIntact();
		assertEquals(List.of("type", "count", "ratio", "flag", "nothing"), node.keys());
		assertEquals(List.of(node), node.find("target", "type"));
		assertEquals(List.of(node), node.all());
	}

	@Test
	void mutators_haveNoEffect() {
		node.set("type", "other");
		node.set("added", 1);
		node.set("count", (Object) 4L);
		assertFalse(node.delete("type"));
		assertFalse(node.addChild(new Node()));
		assertFalse(node.addChild(new Node(), 0));
		assertFalse(node.addChild(null));
		assertFalse(node.deleteChild(null));
		node.set("type", new StringBuilder("unsupported"));
		node.set("type", (Object) null);
		node.set("type", (ContentValue) null);
		node.set(null, "value");
		assertFalse(node.delete(null));

		assertSnapshotIntact();
		assertEquals(0, node.findNumChildren());
		assertTrue(node.isFlat());
	}

	@Test
	void import_hasNoEffect() {
		Node source = new Node();
		source.set("type", "imported");
		source.addChild(new Node());
		SnapshotCodec codec = new SnapshotCodec(TypeRegistry.withStandardTypes());

		node.importFrom(codec.exportFrom(source), codec);
		node.importFrom(new NodeSnapshot(Identifier.random(), "", Map.of(), List.of()), codec);

		assertSnapshotIntact();
		assertEquals(0, node.findNumChildren());
	}

	@Test
	void canBeChildOfMutableNode() {
		Node parent = new Node();
		assertTrue(parent.addChild(node));
		assertSame(parent, node.parent().orElseThrow());
		assertEquals("-1_0", node.findRoute().toString());

		node.detach();
		assertTrue(node.isRoot());
	}

	@Test
	void laterSnapshotChanges_notVisible() {
		snapshot.put("type", "changed");
		assertSnapshotIntact();
	}

	@Test
	void unsupportedSnapshotValue_throws() {
		assertThrows(ValidationException.class, () -> new ReadOnlyNode(Map.of("bad", new StringBuilder())));
	}

	private void assertSnapshotIntact() {
		assertEquals(5, node.content().size());
		assertEquals(ContentValue.of("target"), node.get("type").orElseThrow());
		assertEquals(ContentValue.of(3L), node.get("count").orElseThrow());
		assertEquals(ContentValue.of(0.5), node.get("ratio").orElseThrow());
		assertEquals(ContentValue.TRUE, node.get("flag").orElseThrow());
		assertTrue(node.has("nothing"));
		assertEquals(ContentValue.NULL, node.get("nothing").orElseThrow());
	}
}
