package works.grove.exceptions;

import works.grove.Route;

/**
 * Indicates a string that is not the textual form of a {@link Route}.
 */
public class MalformedRouteException extends IllegalArgumentException {
	public MalformedRouteException(String message) { super(message); }
	public MalformedRouteException(String message, Throwable cause) { super(message, cause); }
}
