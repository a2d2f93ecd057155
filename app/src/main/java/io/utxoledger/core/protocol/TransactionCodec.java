package io.utxoledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

public final class TransactionCodec {
    private TransactionCodec(){}

    public static Transaction fromBytes(byte[] bytes) {
        if (bytes == null) throw new IllegalArgumentException("Malformed Transaction bytes: null");
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);

            int inputCount = readCount(buf, TransactionInput.ENCODED_LENGTH);
            List<TransactionInput> inputs = new ArrayList<>(inputCount);
            for (int i = 0; i < inputCount; i++) {
                Hash outPoint = new Hash(readFixed(buf, Hash.LENGTH));
                byte[] signature = readFixed(buf, TransactionInput.SIGNATURE_LENGTH);
                inputs.add(new TransactionInput(outPoint, signature));
            }

            int outputCount = readCount(buf, TransactionOutput.ENCODED_LENGTH);
            List<TransactionOutput> outputs = new ArrayList<>(outputCount);
            for (int i = 0; i < outputCount; i++) {
                outputs.add(readOutput(buf));
            }

            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("Trailing bytes: " + buf.remaining());
            }
            return new Transaction(inputs, outputs);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }

    public static TransactionOutput outputFromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != TransactionOutput.ENCODED_LENGTH) {
            throw new IllegalArgumentException("Malformed TransactionOutput bytes");
        }
        return readOutput(ByteBuffer.wrap(bytes));
    }

    private static TransactionOutput readOutput(ByteBuffer buf) {
        byte[] value = readFixed(buf, Values.BYTES);
        byte[] owner = readFixed(buf, OwnerKey.LENGTH);
        return new TransactionOutput(Values.fromBytes(value), new OwnerKey(owner));
    }

    private static int readCount(ByteBuffer b, int elementSize) {
        if (b.remaining() < 4) throw new IllegalArgumentException("Missing count");
        int count = b.getInt();
        if (count < 0 || (long) count * elementSize > b.remaining()) {
            throw new IllegalArgumentException("Bad count: " + count + " (remaining=" + b.remaining() + ")");
        }
        return count;
    }

    private static byte[] readFixed(ByteBuffer b, int len) {
        if (len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
