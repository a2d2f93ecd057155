package io.utxoledger.core.protocol;

import java.math.BigInteger;

/**
 * Unsigned 128-bit amounts.
 * All arithmetic on amounts is checked and throws {@link ArithmeticException} outside the range.
 */
public final class Values {
    public static final int BYTES = 16;
    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private Values() {}

    public static BigInteger of(long v) {
        return require(BigInteger.valueOf(v));
    }

    public static BigInteger require(BigInteger v) {
        if (v == null) throw new IllegalArgumentException("Missing value");
        if (v.signum() < 0 || v.compareTo(MAX) > 0) {
            throw new IllegalArgumentException("Value out of u128 range: " + v);
        }
        return v;
    }

    public static BigInteger checkedAdd(BigInteger a, BigInteger b) {
        BigInteger sum = a.add(b);
        if (sum.compareTo(MAX) > 0) throw new ArithmeticException("u128 overflow");
        return sum;
    }

    public static BigInteger checkedSub(BigInteger a, BigInteger b) {
        BigInteger diff = a.subtract(b);
        if (diff.signum() < 0) throw new ArithmeticException("u128 underflow");
        return diff;
    }

    public static BigInteger checkedMul(BigInteger a, BigInteger b) {
        BigInteger product = a.multiply(b);
        if (product.compareTo(MAX) > 0) throw new ArithmeticException("u128 overflow");
        return product;
    }

    /** 16-byte big-endian, zero padded. */
    public static byte[] toBytes(BigInteger v) {
        require(v);
        byte[] raw = v.toByteArray();
        byte[] out = new byte[BYTES];
        int copy = Math.min(raw.length, BYTES);
        System.arraycopy(raw, raw.length - copy, out, BYTES - copy, copy);
        return out;
    }

    public static BigInteger fromBytes(byte[] b) {
        if (b == null || b.length != BYTES) throw new IllegalArgumentException("Value must be 16 bytes");
        return new BigInteger(1, b);
    }
}
