package com.mimecast.phishguard.mime;

/**
 * Exception thrown when a byte sequence cannot be parsed as a mail message at all.
 * <p>
 * Partially malformed messages do not raise this, the decoder returns what it could read.
 */
public class MalformedMessageException extends Exception {

    /**
     * Constructs a new MalformedMessageException.
     *
     * @param message Error message.
     */
    public MalformedMessageException(String message) {
        super(message);
    }

    /**
     * Constructs a new MalformedMessageException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
