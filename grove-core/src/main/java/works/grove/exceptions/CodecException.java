package works.grove.exceptions;

import works.grove.NodeCodec;

/**
 * Common superclass of failures reported by a {@link NodeCodec}.
 * A codec that throws one of these has not modified the node it was working on.
 */
@SuppressWarnings("serial")
public class CodecException extends RuntimeException {
	public CodecException(String message) { super(message); }
	public CodecException(String message, Throwable cause) { super(message, cause); }
}
