package io.dectree.service.analysis;

/** A target range is malformed or names an unknown endpoint. */
public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
