package com.questrail.stego.codec;

/**
 * Root of all failures raised by the embedding/extraction stack.
 *
 * <p>Every subtype is deterministic for a given input: retrying the same call
 * with the same configuration and payload fails the same way.</p>
 */
public class StegoException extends RuntimeException
{
    public StegoException(String message) {
        super(message);
    }

    public StegoException(String message, Throwable cause) {
        super(message, cause);
    }
}
