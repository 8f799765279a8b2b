package works.grove.state;

import works.grove.Node;
import works.grove.NodeFactory;

/**
 * A document section. Holds a title and any number of child nodes.
 */
public class Section extends Node {
	public static final String TYPE_NAME = "grove.test.Section";

	@Override
	public String typeName() {
		return TYPE_NAME;
	}

	@Override
	public NodeFactory<Section> factory() {
		return Section::new;
	}

	public static Section titled(String title) {
		Section result = new Section();
		result.set("title", title);
		return result;
	}
}
