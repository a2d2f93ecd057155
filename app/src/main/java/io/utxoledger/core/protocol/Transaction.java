package io.utxoledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered inputs and outputs. Order is part of the canonical encoding, so it
 * changes both output ids and the signing payload.
 */
public final class Transaction {

    private final List<TransactionInput> inputs;
    private final List<TransactionOutput> outputs;

    public Transaction(List<TransactionInput> inputs, List<TransactionOutput> outputs) {
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final List<TransactionInput> inputs = new ArrayList<>();
        private final List<TransactionOutput> outputs = new ArrayList<>();

        public Builder input(TransactionInput in) { this.inputs.add(in); return this; }
        public Builder spend(Hash outPoint) { this.inputs.add(TransactionInput.unsigned(outPoint)); return this; }
        public Builder output(TransactionOutput out) { this.outputs.add(out); return this; }
        public Builder output(long value, OwnerKey owner) { this.outputs.add(new TransactionOutput(value, owner)); return this; }

        public Transaction build() {
            return new Transaction(inputs, outputs);
        }
    }

    public List<TransactionInput> inputs() { return inputs; }
    public List<TransactionOutput> outputs() { return outputs; }

    /** Canonical encoding including signatures. */
    public byte[] serialize() {
        ByteBuffer buf = ByteBuffer.allocate(encodedSize());
        buf.putInt(inputs.size());
        for (TransactionInput in : inputs) in.writeTo(buf);
        buf.putInt(outputs.size());
        for (TransactionOutput out : outputs) out.writeTo(buf);
        return buf.array();
    }

    /**
     * The bytes every spender signs: the encoding with each input signature zeroed,
     * so each owner can sign independently.
     */
    public byte[] signingPayload() {
        return withoutSignatures().serialize();
    }

    public Transaction withoutSignatures() {
        List<TransactionInput> stripped = new ArrayList<>(inputs.size());
        for (TransactionInput in : inputs) stripped.add(TransactionInput.unsigned(in.outPoint()));
        return new Transaction(stripped, outputs);
    }

    /** Copy with input {@code index} carrying {@code signature}. */
    public Transaction withSignature(int index, byte[] signature) {
        List<TransactionInput> signed = new ArrayList<>(inputs);
        signed.set(index, inputs.get(index).withSignature(signature));
        return new Transaction(signed, outputs);
    }

    /** Pool bookkeeping id: hash of the full encoding. */
    public Hash id() {
        return Hashes.hashOf(serialize());
    }

    /** Id the output at {@code index} receives once committed: H(encoding || index). */
    public Hash outputId(long index) {
        return outputId(serialize(), index);
    }

    public static Hash outputId(byte[] encodedTx, long index) {
        return Hashes.hashWithIndex(encodedTx, index);
    }

    private int encodedSize() {
        return 4 + inputs.size() * TransactionInput.ENCODED_LENGTH
                + 4 + outputs.size() * TransactionOutput.ENCODED_LENGTH;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return inputs.equals(other.inputs) && outputs.equals(other.outputs);
    }

    @Override public int hashCode() { return 31 * inputs.hashCode() + outputs.hashCode(); }

    @Override public String toString() {
        return "Transaction{inputs=" + inputs.size() + ", outputs=" + outputs.size() + "}";
    }
}
