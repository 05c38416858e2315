package io.bitmask.kernel;

import io.bitmask.core.InvalidIdentifierException;
import io.bitmask.core.MaskWidth;

import java.util.Collection;

/**
 * Packs a set of small identifiers into a single 64-bit mask.
 * <p>
 * Bit {@code i} (counted from the least significant bit) is set iff identifier
 * {@code i} is a member. Valid identifiers are {@code [0, 63]}.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Every identifier is range-checked before it is shifted; out-of-range
 *       values raise {@link InvalidIdentifierException}.</li>
 *   <li>{@link #encode(int...)} is idempotent for duplicates.</li>
 *   <li>{@link #decode(long)} returns identifiers in strictly ascending order
 *       for any bit pattern, including negative masks.</li>
 *   <li>All methods are pure and thread-safe.</li>
 * </ul>
 *
 * @see IntBitSetCodec
 */
public final class BitSetCodec {
    public static final MaskWidth WIDTH = MaskWidth.INT64;

    private static final int[] EMPTY = new int[0];

    private BitSetCodec() {
    }

    public static long encode(int... ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids required");
        }
        var mask = 0L;
        for (var id : ids) {
            mask |= bit(id);
        }
        return mask;
    }

    public static long encode(Collection<Integer> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids required");
        }
        var mask = 0L;
        var position = 0;
        for (var id : ids) {
            if (id == null) {
                throw InvalidIdentifierException.missing(position, WIDTH);
            }
            mask |= bit(id);
            position++;
        }
        return mask;
    }

    public static int[] decode(long mask) {
        if (mask == 0L) {
            return EMPTY;
        }
        var result = new int[Long.bitCount(mask)];
        var index = 0;
        var word = mask;
        while (word != 0L) {
            result[index++] = Long.numberOfTrailingZeros(word);
            word &= word - 1L;
        }
        return result;
    }

    public static boolean hasBit(long mask, int id) {
        return (mask & bit(id)) != 0L;
    }

    public static long toggleBit(long mask, int id) {
        return mask ^ bit(id);
    }

    private static long bit(int id) {
        return 1L << WIDTH.checkIdentifier(id);
    }
}
