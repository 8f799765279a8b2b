package works.grove;

import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentifierTest {

	@Test
	void random_isCanonicalUUID() {
		Identifier id = Identifier.random();
		assertEquals(id.toString(), UUID.fromString(id.toString()).toString());
		assertNotEquals(id, Identifier.random());
	}

	@Test
	void from_hasValueSemantics() {
		assertEquals(Identifier.from("abc"), Identifier.from("abc"));
		assertEquals(Identifier.from("abc").hashCode(), Identifier.from("abc").hashCode());
		assertTrue(Identifier.from("abc").compareTo(Identifier.from("abd")) < 0);
	}

	@Test
	void from_empty_throws() {
		assertThrows(IllegalArgumentException.class, () -> Identifier.from(""));
	}
}
