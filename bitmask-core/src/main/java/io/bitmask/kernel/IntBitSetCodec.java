package io.bitmask.kernel;

import io.bitmask.core.InvalidIdentifierException;
import io.bitmask.core.MaskWidth;

import java.util.Collection;

/**
 * 32-bit counterpart of {@link BitSetCodec}. Valid identifiers are {@code [0, 31]};
 * identifier 31 maps to the sign bit, so {@code encode(31) == Integer.MIN_VALUE}.
 */
public final class IntBitSetCodec {
    public static final MaskWidth WIDTH = MaskWidth.INT32;

    private static final int[] EMPTY = new int[0];

    private IntBitSetCodec() {
    }

    public static int encode(int... ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids required");
        }
        var mask = 0;
        for (var id : ids) {
            mask |= bit(id);
        }
        return mask;
    }

    public static int encode(Collection<Integer> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids required");
        }
        var mask = 0;
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

    public static int[] decode(int mask) {
        if (mask == 0) {
            return EMPTY;
        }
        var result = new int[Integer.bitCount(mask)];
        var index = 0;
        var word = mask;
        while (word != 0) {
            result[index++] = Integer.numberOfTrailingZeros(word);
            word &= word - 1;
        }
        return result;
    }

    public static boolean hasBit(int mask, int id) {
        return (mask & bit(id)) != 0;
    }

    public static int toggleBit(int mask, int id) {
        return mask ^ bit(id);
    }

    private static int bit(int id) {
        return 1 << WIDTH.checkIdentifier(id);
    }
}
