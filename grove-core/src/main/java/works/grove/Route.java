package works.grove;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import works.grove.exceptions.MalformedRouteException;

import static java.util.stream.Collectors.toList;

/**
 * The position of a {@link Node} relative to a root, as the sequence of
 * sibling indices leading down to it.
 *
 * <p>
 * The textual form joins the segments with underscores. The first segment
 * is always {@code -1}, standing for the root itself, so the root's route is
 * just <code>-1</code> and the second child of the root's first child is
 * <code>-1_0_1</code>.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Route {
	private final int[] indices;

	public static final String ROOT_SEGMENT = "-1";
	public static final String SEPARATOR = "_";

	public static Route root() {
		return ROOT;
	}

	public static Route of(int... indices) {
		for (int index: indices) {
			if (index < 0) {
				throw new IllegalArgumentException("Route index can't be negative: " + index);
			}
		}
		return new Route(indices.clone());
	}

	/**
	 * @throws MalformedRouteException if <code>text</code> isn't a valid route
	 */
	public static Route parse(String text) {
		String[] segments = text.split(SEPARATOR, -1);
		if (!ROOT_SEGMENT.equals(segments[0])) {
			throw new MalformedRouteException("Route must start with \"" + ROOT_SEGMENT + "\": \"" + text + "\"");
		}
		int[] indices = new int[segments.length - 1];
		for (int i = 1; i < segments.length; i++) {
			String segment = segments[i];
			if (!INDEX_SEGMENT.matcher(segment).matches()) {
				throw new MalformedRouteException("Invalid route segment \"" + segment + "\" in \"" + text + "\"");
			}
			try {
				indices[i-1] = Integer.parseInt(segment);
			} catch (NumberFormatException e) {
				throw new MalformedRouteException("Route segment out of range \"" + segment + "\" in \"" + text + "\"", e);
			}
		}
		return new Route(indices);
	}

	/**
	 * Like {@link #parse} but returns {@link Optional#empty()} instead of throwing.
	 */
	public static Optional<Route> tryParse(String text) {
		if (text == null) {
			return Optional.empty();
		}
		try {
			return Optional.of(parse(text));
		} catch (MalformedRouteException e) {
			return Optional.empty();
		}
	}

	public Route then(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Route index can't be negative: " + index);
		}
		int[] extended = Arrays.copyOf(indices, indices.length + 1);
		extended[indices.length] = index;
		return new Route(extended);
	}

	/**
	 * @return the number of indices, not counting the root segment
	 */
	public int length() {
		return indices.length;
	}

	public boolean isRoot() {
		return indices.length == 0;
	}

	public int index(int position) {
		return indices[position];
	}

	public List<Integer> indices() {
		return Arrays.stream(indices).boxed().collect(toList());
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(ROOT_SEGMENT);
		for (int index: indices) {
			sb.append(SEPARATOR).append(index);
		}
		return sb.toString();
	}

	private static final Route ROOT = new Route(new int[0]);
	private static final Pattern INDEX_SEGMENT = Pattern.compile("0|[1-9][0-9]*");
}
