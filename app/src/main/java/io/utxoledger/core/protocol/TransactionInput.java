package io.utxoledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/** Claims the unspent output {@code outPoint}; {@code signature} proves the right to spend it. */
public final class TransactionInput {
    public static final int SIGNATURE_LENGTH = 64;
    public static final int ENCODED_LENGTH = Hash.LENGTH + SIGNATURE_LENGTH;

    private final Hash outPoint;
    private final byte[] signature;

    public TransactionInput(Hash outPoint, byte[] signature) {
        if (outPoint == null) throw new IllegalArgumentException("Missing out point");
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("Signature must be 64 bytes");
        }
        this.outPoint = outPoint;
        this.signature = signature.clone();
    }

    /** Input with an all-zero signature, the shape it has inside the signing payload. */
    public static TransactionInput unsigned(Hash outPoint) {
        return new TransactionInput(outPoint, new byte[SIGNATURE_LENGTH]);
    }

    public Hash outPoint() { return outPoint; }
    public byte[] signature() { return signature.clone(); }

    public TransactionInput withSignature(byte[] sig) {
        return new TransactionInput(outPoint, sig);
    }

    void writeTo(ByteBuffer buf) {
        buf.put(outPoint.bytes());
        buf.put(signature);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionInput)) return false;
        TransactionInput other = (TransactionInput) o;
        return outPoint.equals(other.outPoint) && Arrays.equals(signature, other.signature);
    }

    @Override public int hashCode() {
        return Objects.hash(outPoint, Arrays.hashCode(signature));
    }

    @Override public String toString() {
        return "TransactionInput{outPoint=" + outPoint + "}";
    }
}
