package io.bitmask.core;

/**
 * Root of the errors raised by the codecs. All of them are unchecked.
 */
public class BitmaskException extends RuntimeException {

    public BitmaskException(String message) {
        super(message);
    }
}
