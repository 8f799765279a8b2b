package works.grove.jackson;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.grove.GroveTestUtils;
import works.grove.Node;
import works.grove.TypeRegistry;
import works.grove.bson.BinaryCodec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Both formats must describe the same tree.
 */
class CrossFormatConsistencyTest {
	BinaryCodec binary;
	JsonCodec json;

	@BeforeEach
	void setUp() {
		TypeRegistry registry = GroveTestUtils.registry();
		binary = new BinaryCodec(registry);
		json = new JsonCodec(registry);
	}

	@Test
	void sampleDocument() {
		check(GroveTestUtils.sampleDocument());
	}

	@Test
	void extremeValues() {
		check(GroveTestUtils.extremeValues());
	}

	@Test
	void deepChain() {
		check(GroveTestUtils.chain(50));
	}

	@Test
	void binaryThroughJson() {
		Node original = GroveTestUtils.sampleDocument();
		Node viaBinary = binary.importNew(binary.exportFrom(original));
		Node viaBoth = json.importNew(json.exportFrom(viaBinary));
		assertTrue(viaBoth.isSame(original));
		assertEquals(viaBoth.getClass(), original.getClass());
	}

	private void check(Node original) {
		Node fromBinary = new Node();
		fromBinary.importFrom(original.exportTo(binary), binary);
		Node fromJson = new Node();
		fromJson.importFrom(original.exportTo(json), json);

		assertTrue(fromBinary.isSame(fromJson));
		assertTrue(fromBinary.isSame(original));
		assertEquals(binary.decode(binary.exportFrom(original)), json.decode(json.exportFrom(original)));
	}
}
