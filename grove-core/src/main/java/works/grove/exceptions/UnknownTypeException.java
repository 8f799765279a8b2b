package works.grove.exceptions;

import works.grove.TypeRegistry;

/**
 * Thrown when a {@link TypeRegistry} has no factory for a type name,
 * and no registered fallback was supplied.
 */
@SuppressWarnings("serial")
public class UnknownTypeException extends CodecException {
	private final String typeName;

	public UnknownTypeException(String typeName, String fallbackTypeName) {
		super(message(typeName, fallbackTypeName));
		this.typeName = typeName;
	}

	public String typeName() {
		return typeName;
	}

	private static String message(String typeName, String fallbackTypeName) {
		if (fallbackTypeName == null) {
			return "No factory registered for node type \"" + typeName + "\"";
		} else {
			return "No factory registered for node type \"" + typeName + "\" or its fallback \"" + fallbackTypeName + "\"";
		}
	}
}
