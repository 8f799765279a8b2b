package works.grove.jackson;

/**
 * @param prettyPrint whether {@link JsonCodec#encode} emits indented, multi-line output
 * @param maxDepth the deepest nesting {@link JsonCodec} will decode, counting the root as depth zero
 */
public record JsonCodecConfiguration(
	boolean prettyPrint,
	int maxDepth
) {
	public JsonCodecConfiguration {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxDepth can't be negative: " + maxDepth);
		}
	}

	public static JsonCodecConfiguration defaultConfiguration() {
		return new JsonCodecConfiguration(false, 512);
	}

	public JsonCodecConfiguration withPrettyPrint(boolean prettyPrint) {
		return new JsonCodecConfiguration(prettyPrint, maxDepth);
	}
}
