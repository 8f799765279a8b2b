package works.grove.bson;

/**
 * @param maxDepth the deepest nesting {@link BinaryCodec} will decode, counting the root as depth zero.
 *                 Input nested more deeply is rejected rather than risking a stack overflow.
 */
public record BinaryCodecConfiguration(
	int maxDepth
) {
	public BinaryCodecConfiguration {
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxDepth can't be negative: " + maxDepth);
		}
	}

	public static BinaryCodecConfiguration defaultConfiguration() {
		return new BinaryCodecConfiguration(512);
	}
}
