package works.grove.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
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
import works.grove.exceptions.CodecException;
import works.grove.exceptions.DecodeException;
import works.grove.exceptions.ValidationException;

import static java.util.Objects.requireNonNull;
import static works.grove.jackson.JsonCodecConfiguration.defaultConfiguration;

/**
 * Encodes a subtree as a JSON document of this shape:
 *
 * <pre>
 * { "id": "...", "fqn": "type name",
 *   "intrinsic": { "isFlat": true|false },
 *   "content": { "key": null|boolean|number|string, ... },
 *   "children": [ ... ] }
 * </pre>
 *
 * Content entries appear in content order. Integer values are written without
 * a fraction and float values always with one (or an exponent), so each value
 * decodes to the same {@link ContentValue.Type type} it started as.
 *
 * <p>
 * Decoding is lenient about omissions: a missing <code>id</code> gets a fresh one,
 * and missing <code>intrinsic</code>, <code>content</code> or <code>children</code>
 * fields mean "nothing there". It is strict about everything else.
 */
public final class JsonCodec extends NodeCodec<String> {
	private final JsonCodecConfiguration config;
	private final JsonMapper mapper;
	private final ObjectWriter writer;

	public static final String ID = "id";
	public static final String FQN = "fqn";
	public static final String INTRINSIC = "intrinsic";
	public static final String IS_FLAT = "isFlat";
	public static final String CONTENT = "content";
	public static final String CHILDREN = "children";

	public JsonCodec(TypeRegistry registry) {
		this(registry, defaultConfiguration());
	}

	public JsonCodec(TypeRegistry registry, JsonCodecConfiguration config) {
		super(registry);
		this.config = requireNonNull(config);
		// Each level of nodes costs two levels of JSON: the node object and its children array
		JsonFactory factory = new JsonFactoryBuilder()
			.enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
			.streamReadConstraints(StreamReadConstraints.builder()
				.maxNestingDepth(2 * config.maxDepth() + 8)
				.build())
			.build();
		this.mapper = JsonMapper.builder(factory)
			.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
			.build();
		this.writer = config.prettyPrint()
			? mapper.writerWithDefaultPrettyPrinter()
			: mapper.writer();
	}

	@Override
	public String encode(NodeSnapshot snapshot) {
		ObjectNode json = toJsonNode(snapshot);
		try {
			return writer.writeValueAsString(json);
		} catch (JsonProcessingException e) {
			throw new CodecException("Unable to write JSON for node " + snapshot.id(), e);
		}
	}

	@Override
	public NodeSnapshot decode(String input) {
		JsonNode json;
		try {
			json = mapper.readTree(requireNonNull(input));
		} catch (JsonProcessingException e) {
			throw new DecodeException("Malformed JSON: " + e.getOriginalMessage(), e);
		}
		NodeSnapshot result = fromJsonNode(json);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Decoded {} nodes from {} characters", result.size(), input.length());
		}
		return result;
	}

	public ObjectNode toJsonNode(Node node) {
		return toJsonNode(NodeSnapshot.of(node));
	}

	/**
	 * @throws ValidationException if any float content value is infinite or NaN, which JSON can't represent
	 */
	public ObjectNode toJsonNode(NodeSnapshot snapshot) {
		return writeNode(snapshot, mapper.getNodeFactory());
	}

	/**
	 * @throws DecodeException if <code>json</code> doesn't have the shape of a node
	 */
	public NodeSnapshot fromJsonNode(JsonNode json) {
		return readNode(json, 0);
	}

	private static ObjectNode writeNode(NodeSnapshot node, JsonNodeFactory factory) {
		ObjectNode result = factory.objectNode();
		result.put(ID, node.id().toString());
		result.put(FQN, node.typeName());
		result.putObject(INTRINSIC).put(IS_FLAT, node.isFlat());
		ObjectNode content = result.putObject(CONTENT);
		for (Entry<String, ContentValue> entry: node.content().entrySet()) {
			writeValue(entry.getKey(), entry.getValue(), content, node.id());
		}
		ArrayNode children = result.putArray(CHILDREN);
		for (NodeSnapshot child: node.children()) {
			children.add(writeNode(child, factory));
		}
		return result;
	}

	private static void writeValue(String key, ContentValue value, ObjectNode content, Identifier nodeID) {
		switch (value.type()) {
			case NULL -> content.putNull(key);
			case BOOLEAN -> content.put(key, ((BooleanValue) value).value());
			case INTEGER -> content.put(key, ((IntegerValue) value).value());
			case FLOAT -> {
				double d = ((FloatValue) value).value();
				if (!Double.isFinite(d)) {
					throw new ValidationException("JSON can't represent " + d + " at key \"" + key + "\" of node " + nodeID);
				}
				content.put(key, d);
			}
			case STRING -> content.put(key, ((StringValue) value).value());
		}
	}

	private NodeSnapshot readNode(JsonNode json, int depth) {
		if (depth > config.maxDepth()) {
			throw new DecodeException("Nodes nested deeper than the limit of " + config.maxDepth());
		}
		if (json == null || !json.isObject()) {
			throw new DecodeException("Expected a JSON object for a node; found " + describe(json));
		}
		checkFieldNames(json, NODE_FIELDS, "node");

		Identifier id = readID(json.get(ID));

		JsonNode fqn = json.get(FQN);
		if (fqn == null) {
			throw new DecodeException("Node " + id + " has no \"" + FQN + "\" field");
		} else if (!fqn.isTextual()) {
			throw new DecodeException("Expected a string for \"" + FQN + "\" of node " + id + "; found " + describe(fqn));
		}

		Boolean isFlat = readIsFlat(json.get(INTRINSIC), id);

		Map<String, ContentValue> content = new LinkedHashMap<>();
		JsonNode contentJson = json.get(CONTENT);
		if (contentJson != null) {
			if (!contentJson.isObject()) {
				throw new DecodeException("Expected an object for \"" + CONTENT + "\" of node " + id + "; found " + describe(contentJson));
			}
			Iterator<Entry<String, JsonNode>> fields = contentJson.fields();
			while (fields.hasNext()) {
				Entry<String, JsonNode> field = fields.next();
				content.put(field.getKey(), readValue(field.getValue(), field.getKey(), id));
			}
		}

		List<NodeSnapshot> children = new ArrayList<>();
		JsonNode childrenJson = json.get(CHILDREN);
		if (childrenJson != null) {
			if (!childrenJson.isArray()) {
				throw new DecodeException("Expected an array for \"" + CHILDREN + "\" of node " + id + "; found " + describe(childrenJson));
			}
			for (JsonNode child: childrenJson) {
				children.add(readNode(child, depth + 1));
			}
		}
		if (Boolean.TRUE.equals(isFlat) && !children.isEmpty()) {
			throw new DecodeException("Node " + id + " is marked flat but has " + children.size() + " children");
		}

		return new NodeSnapshot(id, fqn.textValue(), content, children);
	}

	private static Identifier readID(JsonNode json) {
		if (json == null) {
			Identifier fresh = Identifier.random();
			LOGGER.debug("Node has no \"{}\"; assigned {}", ID, fresh);
			return fresh;
		} else if (!json.isTextual()) {
			throw new DecodeException("Expected a string for \"" + ID + "\"; found " + describe(json));
		} else if (json.textValue().isEmpty()) {
			throw new DecodeException("Node \"" + ID + "\" can't be empty");
		}
		return Identifier.from(json.textValue());
	}

	/**
	 * @return null if the flag is absent
	 */
	private static Boolean readIsFlat(JsonNode intrinsic, Identifier id) {
		if (intrinsic == null) {
			return null;
		} else if (!intrinsic.isObject()) {
			throw new DecodeException("Expected an object for \"" + INTRINSIC + "\" of node " + id + "; found " + describe(intrinsic));
		}
		checkFieldNames(intrinsic, INTRINSIC_FIELDS, "\"" + INTRINSIC + "\" of node " + id);
		JsonNode flag = intrinsic.get(IS_FLAT);
		if (flag == null) {
			return null;
		} else if (!flag.isBoolean()) {
			throw new DecodeException("Expected a boolean for \"" + IS_FLAT + "\" of node " + id + "; found " + describe(flag));
		}
		return flag.booleanValue();
	}

	private static ContentValue readValue(JsonNode json, String key, Identifier id) {
		if (json.isNull()) {
			return ContentValue.NULL;
		} else if (json.isBoolean()) {
			return ContentValue.of(json.booleanValue());
		} else if (json.isIntegralNumber()) {
			if (!json.canConvertToLong()) {
				throw new DecodeException("Integer out of range at key \"" + key + "\" of node " + id + ": " + json.asText());
			}
			return ContentValue.of(json.longValue());
		} else if (json.isFloatingPointNumber()) {
			return ContentValue.of(json.doubleValue());
		} else if (json.isTextual()) {
			return ContentValue.of(json.textValue());
		} else {
			throw new DecodeException("Unsupported content value at key \"" + key + "\" of node " + id + ": " + describe(json));
		}
	}

	private static void checkFieldNames(JsonNode json, Set<String> allowed, String where) {
		Iterator<String> names = json.fieldNames();
		while (names.hasNext()) {
			String name = names.next();
			if (!allowed.contains(name)) {
				throw new DecodeException("Unexpected field \"" + name + "\" in " + where);
			}
		}
	}

	private static String describe(JsonNode json) {
		return (json == null) ? "nothing" : json.getNodeType().toString().toLowerCase();
	}

	private static final Set<String> NODE_FIELDS = Set.of(ID, FQN, INTRINSIC, CONTENT, CHILDREN);
	private static final Set<String> INTRINSIC_FIELDS = Set.of(IS_FLAT);
	private static final Logger LOGGER = LoggerFactory.getLogger(JsonCodec.class);
}
