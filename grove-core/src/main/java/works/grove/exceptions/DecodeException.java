package works.grove.exceptions;

/**
 * Thrown when encoded input is truncated, corrupt, or does not have the shape of a node.
 */
@SuppressWarnings("serial")
public class DecodeException extends CodecException {
	public DecodeException(String message) { super(message); }
	public DecodeException(String message, Throwable cause) { super(message, cause); }
}
