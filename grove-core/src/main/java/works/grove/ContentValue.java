package works.grove;

import works.grove.exceptions.ValidationException;

import static java.util.Objects.requireNonNull;

/**
 * A value stored under a key in a {@link Node}'s content.
 * This is a closed set: every value is exactly one of the five cases below,
 * and each case has a stable {@link Type#tag() tag} used by the codecs.
 */
public sealed interface ContentValue {
	Type type();

	/**
	 * @return the boxed Java equivalent: {@code null}, {@link Boolean}, {@link Long}, {@link Double} or {@link String}
	 */
	Object asJava();

	enum Type {
		NULL(0),
		BOOLEAN(1),
		INTEGER(2),
		FLOAT(3),
		STRING(4);

		private final byte tag;

		Type(int tag) {
			this.tag = (byte) tag;
		}

		public byte tag() {
			return tag;
		}

		/**
		 * @return the type with the given tag, or null if there is none
		 */
		public static Type fromTag(byte tag) {
			for (Type type: values()) {
				if (type.tag == tag) {
					return type;
				}
			}
			return null;
		}
	}

	NullValue NULL = new NullValue();
	BooleanValue TRUE = new BooleanValue(true);
	BooleanValue FALSE = new BooleanValue(false);

	record NullValue() implements ContentValue {
		@Override public Type type() { return Type.NULL; }
		@Override public Object asJava() { return null; }
		@Override public String toString() { return "null"; }
	}

	record BooleanValue(boolean value) implements ContentValue {
		@Override public Type type() { return Type.BOOLEAN; }
		@Override public Object asJava() { return value; }
		@Override public String toString() { return Boolean.toString(value); }
	}

	record IntegerValue(long value) implements ContentValue {
		@Override public Type type() { return Type.INTEGER; }
		@Override public Object asJava() { return value; }
		@Override public String toString() { return Long.toString(value); }
	}

	record FloatValue(double value) implements ContentValue {
		@Override public Type type() { return Type.FLOAT; }
		@Override public Object asJava() { return value; }
		@Override public String toString() { return Double.toString(value); }
	}

	record StringValue(String value) implements ContentValue {
		public StringValue {
			requireNonNull(value);
		}

		@Override public Type type() { return Type.STRING; }
		@Override public Object asJava() { return value; }
		@Override public String toString() { return '"' + value + '"'; }
	}

	static BooleanValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	static IntegerValue of(long value) {
		return new IntegerValue(value);
	}

	static FloatValue of(double value) {
		return new FloatValue(value);
	}

	/**
	 * @return a {@link StringValue}, or {@link #NULL} if <code>value</code> is null
	 */
	static ContentValue of(String value) {
		return value == null ? NULL : new StringValue(value);
	}

	/**
	 * Converts an ordinary Java object to the corresponding content value.
	 *
	 * @throws ValidationException if <code>value</code> has no content value equivalent
	 */
	static ContentValue of(Object value) {
		if (value == null) {
			return NULL;
		} else if (value instanceof ContentValue c) {
			return c;
		} else if (value instanceof Boolean b) {
			return of(b.booleanValue());
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return of(((Number) value).longValue());
		} else if (value instanceof Double || value instanceof Float) {
			return of(((Number) value).doubleValue());
		} else if (value instanceof String s) {
			return new StringValue(s);
		} else {
			throw new ValidationException("Unsupported content value type: " + value.getClass().getName());
		}
	}
}
