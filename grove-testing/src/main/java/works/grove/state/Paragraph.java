package works.grove.state;

import works.grove.ContentValue;
import works.grove.Node;
import works.grove.NodeFactory;

/**
 * A leaf holding some text. Deliberately left out of {@link works.grove.GroveTestUtils#registry()}
 * in some tests to exercise fallback types.
 */
public class Paragraph extends Node {
	public static final String TYPE_NAME = "grove.test.Paragraph";

	@Override
	public String typeName() {
		return TYPE_NAME;
	}

	@Override
	public NodeFactory<Paragraph> factory() {
		return Paragraph::new;
	}

	@Override
	protected boolean acceptsChildren() {
		return false;
	}

	public static Paragraph of(String text) {
		Paragraph result = new Paragraph();
		result.set("text", text);
		return result;
	}

	public String text() {
		return get("text")
			.map(ContentValue::asJava)
			.map(String::valueOf)
			.orElse("");
	}
}
