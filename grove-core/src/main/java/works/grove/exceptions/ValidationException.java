package works.grove.exceptions;

import works.grove.ContentValue;

/**
 * Indicates a value that cannot be stored as {@link ContentValue content},
 * or cannot be represented by the format it is being written to.
 */
public class ValidationException extends IllegalArgumentException {
	public ValidationException(String message) { super(message); }
	public ValidationException(String message, Throwable cause) { super(message, cause); }
}
