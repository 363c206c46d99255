package com.libragraph.framekit.util.digest;

import java.io.IOException;

/**
 * Thrown when a channel handed to a stream digest cannot be repositioned.
 */
public class NonSeekableStreamException extends IOException {

    public NonSeekableStreamException(String message) {
        super(message);
    }

    public NonSeekableStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
