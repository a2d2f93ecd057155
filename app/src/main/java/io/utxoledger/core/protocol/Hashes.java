package io.utxoledger.core.protocol;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** The single hash function of the ledger. Ids and signing payloads must all go through here. */
public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static Hash hashOf(byte[] in) {
        return new Hash(sha256(in));
    }

    /** H(data || suffix), suffix as 8 big-endian bytes. */
    public static Hash hashWithIndex(byte[] data, long suffix) {
        ByteBuffer buf = ByteBuffer.allocate(data.length + Long.BYTES);
        buf.put(data);
        buf.putLong(suffix);
        return new Hash(sha256(buf.array()));
    }
}
