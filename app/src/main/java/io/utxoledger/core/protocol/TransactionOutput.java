package io.utxoledger.core.protocol;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Objects;

/** An amount locked to an owner key. Immutable once created. */
public final class TransactionOutput {
    public static final int ENCODED_LENGTH = Values.BYTES + OwnerKey.LENGTH;

    private final BigInteger value;
    private final OwnerKey ownerKey;

    public TransactionOutput(BigInteger value, OwnerKey ownerKey) {
        if (ownerKey == null) throw new IllegalArgumentException("Missing owner key");
        this.value = Values.require(value);
        this.ownerKey = ownerKey;
    }

    public TransactionOutput(long value, OwnerKey ownerKey) {
        this(Values.of(value), ownerKey);
    }

    public BigInteger value() { return value; }
    public OwnerKey ownerKey() { return ownerKey; }

    /** value(16) || ownerKey(32) */
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(ENCODED_LENGTH);
        writeTo(buf);
        return buf.array();
    }

    /** Id of a genesis output: hash of its own content. */
    public Hash genesisId() {
        return Hashes.hashOf(serialize());
    }

    /** Id of a reward output minted at {@code blockHeight}. */
    public Hash rewardId(long blockHeight) {
        return Hashes.hashWithIndex(serialize(), blockHeight);
    }

    void writeTo(ByteBuffer buf) {
        buf.put(Values.toBytes(value));
        buf.put(ownerKey.bytes());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionOutput)) return false;
        TransactionOutput other = (TransactionOutput) o;
        return value.equals(other.value) && ownerKey.equals(other.ownerKey);
    }

    @Override public int hashCode() { return Objects.hash(value, ownerKey); }

    @Override public String toString() {
        return "TransactionOutput{value=" + value + ", owner=" + ownerKey + "}";
    }
}
