package works.grove;

import java.util.Comparator;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The identity of a {@link Node}. Survives cloning and both serialization formats.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Identifier implements Comparable<Identifier> {
	@NonNull final String value;

	/**
	 * Compares by lexicographic order on the string representation.
	 */
	@Override
	public int compareTo(Identifier other) {
		return value.compareTo(other.value);
	}

	public static Identifier from(String value) {
		if (value.isEmpty()) {
			throw new IllegalArgumentException("Identifier can't be empty");
		}
		return new Identifier(value);
	}

	/**
	 * @return a new identifier whose value is a random UUID in its canonical string form.
	 */
	public static Identifier random() {
		return new Identifier(UUID.randomUUID().toString());
	}

	@Override public String toString() { return value; }

	public static final Comparator<Identifier> LEXICAL_ORDER = Identifier::compareTo;
}
