package io.utxoledger.core.protocol;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * Raw 32-byte Ed25519 public key that owns an output.
 * Authorities are identified by the same key type.
 */
public final class OwnerKey {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public OwnerKey(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Owner key must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static OwnerKey fromHex(String hex) {
        if (hex == null) throw new IllegalArgumentException("Missing owner key hex");
        try {
            return new OwnerKey(Hex.decode(hex.startsWith("0x") ? hex.substring(2) : hex));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed owner key hex: " + hex, e);
        }
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.toHexString(bytes); }

    @Override public boolean equals(Object o){ return o instanceof OwnerKey && Arrays.equals(bytes, ((OwnerKey)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "OwnerKey("+hex().substring(0,8)+"…)"; }
}
