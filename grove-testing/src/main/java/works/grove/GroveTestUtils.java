package works.grove;

import java.util.Map;
import works.grove.state.Paragraph;
import works.grove.state.Section;

/**
 * Sample trees shared by the codec tests.
 */
public final class GroveTestUtils {
	private GroveTestUtils() {}

	/**
	 * @return the standard types plus {@link Section} and {@link Paragraph}
	 */
	public static TypeRegistry registry() {
		return TypeRegistry.withStandardTypes()
			.register(new Section())
			.register(new Paragraph());
	}

	/**
	 * A small document with every kind of content value, two levels of nesting,
	 * a read-only leaf, and both registered subclasses.
	 */
	public static Node sampleDocument() {
		Node document = new Node();
		document.set("title", "Sample");
		document.set("version", 3);
		document.set("published", true);
		document.set("rating", 4.25);
		document.set("editor", ContentValue.NULL);

		Section intro = Section.titled("Introduction");
		intro.addChild(Paragraph.of("First paragraph."));
		intro.addChild(Paragraph.of("Second paragraph, with unicode: é中🌳"));
		document.addChild(intro);

		Section body = Section.titled("Body");
		Section nested = Section.titled("Details");
		nested.set("depth", 2);
		nested.addChild(Paragraph.of(""));
		body.addChild(nested);
		body.addChild(new ReadOnlyNode(Map.of("license", "CC-BY")));
		document.addChild(body);

		Node appendix = new Node();
		appendix.set("z-last", "inserted first");
		appendix.set("a-first", "inserted second");
		document.addChild(appendix);
		return document;
	}

	/**
	 * Content values at the edges of their ranges. Every one is representable in both formats.
	 */
	public static Node extremeValues() {
		Node node = new Node();
		node.set("maxLong", Long.MAX_VALUE);
		node.set("minLong", Long.MIN_VALUE);
		node.set("zero", 0);
		node.set("negativeZero", -0.0);
		node.set("tiny", Double.MIN_VALUE);
		node.set("huge", Double.MAX_VALUE);
		node.set("wholeFloat", 2.0);
		node.set("empty", "");
		node.set("quotes", "\"quoted\" \\ backslash \n newline \u0000 nul");
		node.set("", "empty key");
		node.set("false", false);
		return node;
	}

	/**
	 * @return a chain of <code>depth</code> nodes below a root
	 */
	public static Node chain(int depth) {
		Node root = new Node();
		Node current = root;
		for (int i = 0; i < depth; i++) {
			Node child = new Node();
			child.set("level", i + 1);
			current.addChild(child);
			current = child;
		}
		return root;
	}
}
