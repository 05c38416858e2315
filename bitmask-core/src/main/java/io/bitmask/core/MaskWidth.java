package io.bitmask.core;

/**
 * Fixed widths a bitmask can have.
 * <p>
 * The width bounds the identifier range to {@code [0, bits - 1]} and is part of
 * the stored format: a mask written with one width is only portable to a codec
 * of the same width (or a wider one after unsigned widening).
 */
public enum MaskWidth {
    INT32(Integer.SIZE),
    INT64(Long.SIZE);

    private final int bits;

    MaskWidth(int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    public int maxIdentifier() {
        return bits - 1;
    }

    public boolean contains(int identifier) {
        return identifier >= 0 && identifier < bits;
    }

    /**
     * Validate an identifier before it is used as a shift distance.
     *
     * @param identifier the bit position
     * @return the identifier, unchanged
     * @throws InvalidIdentifierException if the identifier is outside {@code [0, bits - 1]}
     */
    public int checkIdentifier(int identifier) {
        if (!contains(identifier)) {
            throw new InvalidIdentifierException(identifier, this);
        }
        return identifier;
    }
}
