package io.utxoledger.core.events;

import io.utxoledger.core.protocol.Transaction;

import java.math.BigInteger;

/** Emitted once per committed transaction, after its writes are persisted. */
public final class TransactionSuccess {
    private final Transaction transaction;
    private final BigInteger reward;

    public TransactionSuccess(Transaction transaction, BigInteger reward) {
        this.transaction = transaction;
        this.reward = reward;
    }

    public Transaction transaction() { return transaction; }
    public BigInteger reward() { return reward; }

    @Override public String toString() {
        return "TransactionSuccess{" + transaction + ", reward=" + reward + "}";
    }
}
