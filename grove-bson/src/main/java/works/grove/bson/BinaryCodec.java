package works.grove.bson;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import org.bson.BsonSerializationException;
import org.bson.ByteBufNIO;
import org.bson.io.BasicOutputBuffer;
import org.bson.io.ByteBufferBsonInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.grove.ContentValue;
import works.grove.ContentValue.BooleanValue;
import works.grove.ContentValue.FloatValue;
import works.grove.ContentValue.IntegerValue;
import works.grove.ContentValue.StringValue;
import works.grove.Identifier;
import works.grove.Node;
import works.grove.NodeCodec;
import works.grove.NodeSnapshot;
import works.grove.TypeRegistry;
import works.grove.exceptions.DecodeException;

import static java.util.Objects.requireNonNull;
import static works.grove.bson.BinaryCodecConfiguration.defaultConfiguration;

/**
 * Encodes a subtree as a compact, deterministic byte array.
 *
 * <p>
 * All numbers are little-endian, and strings use the BSON string layout:
 * an int32 byte count that includes a trailing NUL, the UTF-8 bytes, then the NUL.
 * Each node is written as:
 *
 * <ol>
 *     <li>its identifier, as a string</li>
 *     <li>its type name, as a string</li>
 *     <li>one byte: 1 if the node has no children, otherwise 0</li>
 *     <li>an int32 count of content entries, then for each entry in content order:
 *         the key as a string, the value's {@link ContentValue.Type#tag() tag} byte, and the value
 *         (nothing for null; one byte 0 or 1 for boolean; int64 for integer;
 *         IEEE 754 double for float; a string for string)</li>
 *     <li>unless the flag byte was 1: an int32 count of children, then each child in order</li>
 * </ol>
 *
 * Structurally identical trees therefore always encode to identical bytes.
 */
public final class BinaryCodec extends NodeCodec<byte[]> {
	private final BinaryCodecConfiguration config;

	public BinaryCodec(TypeRegistry registry) {
		this(registry, defaultConfiguration());
	}

	public BinaryCodec(TypeRegistry registry, BinaryCodecConfiguration config) {
		super(registry);
		this.config = requireNonNull(config);
	}

	/**
	 * Encodes <code>node</code> and all its descendants.
	 */
	public byte[] toSerialized(Node node) {
		return exportFrom(node);
	}

	@Override
	public byte[] encode(NodeSnapshot snapshot) {
		try (BasicOutputBuffer out = new BasicOutputBuffer()) {
			writeNode(snapshot, out);
			byte[] result = out.toByteArray();
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Encoded {} nodes in {} bytes", snapshot.size(), result.length);
			}
			return result;
		}
	}

	private static void writeNode(NodeSnapshot node, BasicOutputBuffer out) {
		out.writeString(node.id().toString());
		out.writeString(node.typeName());
		out.writeByte(node.isFlat() ? 1 : 0);
		out.writeInt32(node.content().size());
		for (Entry<String, ContentValue> entry: node.content().entrySet()) {
			out.writeString(entry.getKey());
			writeValue(entry.getValue(), out);
		}
		if (!node.isFlat()) {
			out.writeInt32(node.children().size());
			for (NodeSnapshot child: node.children()) {
				writeNode(child, out);
			}
		}
	}

	private static void writeValue(ContentValue value, BasicOutputBuffer out) {
		out.writeByte(value.type().tag());
		switch (value.type()) {
			case NULL -> { }
			case BOOLEAN -> out.writeByte(((BooleanValue) value).value() ? 1 : 0);
			case INTEGER -> out.writeInt64(((IntegerValue) value).value());
			case FLOAT -> out.writeDouble(((FloatValue) value).value());
			case STRING -> out.writeString(((StringValue) value).value());
		}
	}

	@Override
	public NodeSnapshot decode(byte[] input) {
		ByteBuffer buffer = ByteBuffer.wrap(requireNonNull(input));
		try (ByteBufferBsonInput in = new ByteBufferBsonInput(new ByteBufNIO(buffer))) {
			NodeSnapshot result = new Reader(in, buffer).readNode(0);
			if (buffer.hasRemaining()) {
				throw new DecodeException(buffer.remaining() + " unexpected bytes after node at offset " + buffer.position());
			}
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Decoded {} nodes from {} bytes", result.size(), input.length);
			}
			return result;
		} catch (BsonSerializationException e) {
			throw new DecodeException("Malformed binary node: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads from <code>in</code>, consulting <code>buffer</code> (which backs it)
	 * to validate lengths before allocating anything.
	 */
	private final class Reader {
		private final ByteBufferBsonInput in;
		private final ByteBuffer buffer;

		Reader(ByteBufferBsonInput in, ByteBuffer buffer) {
			this.in = in;
			this.buffer = buffer;
		}

		NodeSnapshot readNode(int depth) {
			if (depth > config.maxDepth()) {
				throw new DecodeException("Nodes nested deeper than the limit of " + config.maxDepth());
			}
			String id = readString("identifier");
			if (id.isEmpty()) {
				throw new DecodeException("Empty node identifier at offset " + buffer.position());
			}
			String typeName = readString("type name");
			boolean isFlat = readFlag("isFlat");

			int numEntries = readCount("content entry");
			Map<String, ContentValue> content = new LinkedHashMap<>();
			for (int i = 0; i < numEntries; i++) {
				String key = readString("content key");
				ContentValue value = readValue(key);
				if (content.put(key, value) != null) {
					throw new DecodeException("Duplicate content key \"" + key + "\" in node " + id);
				}
			}

			List<NodeSnapshot> children = new ArrayList<>();
			if (!isFlat) {
				int numChildren = readCount("child");
				for (int i = 0; i < numChildren; i++) {
					children.add(readNode(depth + 1));
				}
			}
			return new NodeSnapshot(Identifier.from(id), typeName, content, children);
		}

		private ContentValue readValue(String key) {
			byte tag = in.readByte();
			ContentValue.Type type = ContentValue.Type.fromTag(tag);
			if (type == null) {
				throw new DecodeException("Unknown value tag " + tag + " for content key \"" + key + "\"");
			}
			return switch (type) {
				case NULL -> ContentValue.NULL;
				case BOOLEAN -> ContentValue.of(readFlag("boolean value of \"" + key + "\""));
				case INTEGER -> ContentValue.of(in.readInt64());
				case FLOAT -> ContentValue.of(in.readDouble());
				case STRING -> ContentValue.of(readString("string value of \"" + key + "\""));
			};
		}

		private boolean readFlag(String what) {
			byte b = in.readByte();
			switch (b) {
				case 0: return false;
				case 1: return true;
				default: throw new DecodeException("Invalid " + what + " byte " + b + " at offset " + (buffer.position() - 1));
			}
		}

		private int readCount(String what) {
			int count = in.readInt32();
			if (count < 0) {
				throw new DecodeException("Negative " + what + " count " + count);
			}
			return count;
		}

		/**
		 * Like {@link ByteBufferBsonInput#readString()}, but checks the length
		 * against the bytes remaining before allocating.
		 */
		private String readString(String what) {
			int size = in.readInt32();
			if (size <= 0 || size > buffer.remaining()) {
				throw new DecodeException("Invalid " + what + " length " + size + " with " + buffer.remaining() + " bytes remaining");
			}
			byte[] bytes = new byte[size - 1];
			in.readBytes(bytes);
			if (in.readByte() != 0) {
				throw new DecodeException("Unterminated " + what + " ending at offset " + buffer.position());
			}
			try {
				return StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes))
					.toString();
			} catch (CharacterCodingException e) {
				throw new DecodeException("Invalid UTF-8 in " + what + " ending at offset " + buffer.position(), e);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BinaryCodec.class);
}
