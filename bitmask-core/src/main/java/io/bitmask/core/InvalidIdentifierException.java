package io.bitmask.core;

import java.util.OptionalInt;

/**
 * Thrown when an identifier cannot be represented by a bit of the mask:
 * it is negative, not smaller than the mask width, or missing altogether.
 */
public class InvalidIdentifierException extends BitmaskException {

    private final OptionalInt identifier;
    private final MaskWidth width;

    public InvalidIdentifierException(int identifier, MaskWidth width) {
        super("identifier " + identifier + " out of range for " + width.bits()
                + "-bit mask: expected 0.." + width.maxIdentifier());
        this.identifier = OptionalInt.of(identifier);
        this.width = width;
    }

    private InvalidIdentifierException(String message, MaskWidth width) {
        super(message);
        this.identifier = OptionalInt.empty();
        this.width = width;
    }

    /**
     * Reports a {@code null} element of an identifier collection.
     *
     * @param position zero-based position of the element in iteration order
     * @param width    width of the mask being encoded
     */
    public static InvalidIdentifierException missing(int position, MaskWidth width) {
        return new InvalidIdentifierException("null identifier at position " + position, width);
    }

    /**
     * @return the rejected identifier, empty when the identifier was {@code null}
     */
    public OptionalInt identifier() {
        return identifier;
    }

    public boolean isMissing() {
        return identifier.isEmpty();
    }

    public MaskWidth width() {
        return width;
    }
}
