package io.utxoledger.core.protocol;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/** 256-bit identifier: output ids, out-points and transaction ids. */
public final class Hash {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash of(byte[] bytes) { return new Hash(bytes); }

    public static Hash fromHex(String hex) {
        if (hex == null) throw new IllegalArgumentException("Missing hash hex");
        try {
            return new Hash(Hex.decode(hex.startsWith("0x") ? hex.substring(2) : hex));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed hash hex: " + hex, e);
        }
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.toHexString(bytes); }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}
