package com.questrail.stego.model;

import com.questrail.stego.codec.StegoException;

/**
 * Indicates that extracted bytes were requested as text but are not valid
 * UTF-8. Raised only by the strict text view, never during extraction.
 */
public final class InvalidUtf8Exception extends StegoException
{
    public InvalidUtf8Exception(String message, Throwable cause) {
        super(message, cause);
    }
}
