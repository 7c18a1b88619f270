package org.learningjava.hpes.domain.model.parse;

public class ParseTimeoutException extends RuntimeException {

    public ParseTimeoutException(String message) {
        super(message);
    }
}
