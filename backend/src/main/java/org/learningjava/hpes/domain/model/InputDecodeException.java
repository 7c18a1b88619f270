package org.learningjava.hpes.domain.model;

/**
 * The input could not be read at all (no recoverable characters, unreadable container,
 * oversized payload). Distinguishes "could not read input" from "no code found".
 */
public class InputDecodeException extends RuntimeException {

    public InputDecodeException(String message) {
        super(message);
    }

    public InputDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
