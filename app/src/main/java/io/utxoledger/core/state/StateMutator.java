package io.utxoledger.core.state;

import io.utxoledger.core.events.LedgerEventSink;
import io.utxoledger.core.events.TransactionSuccess;
import io.utxoledger.core.mempool.ValidationResult;
import io.utxoledger.core.metrics.LedgerMetrics;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionInput;
import io.utxoledger.core.protocol.Values;

import java.math.BigInteger;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a fully validated transaction: reward into the pool, inputs removed,
 * outputs inserted at their precomputed ids. All three land in one
 * {@link LedgerUpdate}; the success event is sent after it is persisted.
 */
public final class StateMutator {
    private static final Logger LOG = Logger.getLogger(StateMutator.class.getName());

    private final LedgerEventSink events;

    public StateMutator(LedgerEventSink events) {
        this.events = events != null ? events : LedgerEventSink.noop();
    }

    public StateMutator() {
        this(LedgerEventSink.noop());
    }

    /**
     * Must be called with a result computed against the current state of {@code ledger}.
     *
     * @throws IllegalStateException if the reward pool would overflow or an input is no
     *         longer unspent; nothing is written
     */
    public void commit(Transaction tx, ValidationResult.FullyValid valid, UtxoStore ledger) {
        List<Hash> ids = valid.provides();
        if (ids.size() != tx.outputs().size()) {
            throw new IllegalArgumentException("Validation result does not match transaction outputs");
        }
        for (int i = 0; i < ids.size(); i++) {
            if (!ids.get(i).equals(tx.outputId(i))) {
                throw new IllegalArgumentException("Validation result was computed for another transaction");
            }
        }

        BigInteger newPool;
        try {
            newPool = Values.checkedAdd(ledger.rewardPool(), valid.reward());
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Reward pool overflow", e);
        }

        LedgerUpdate.Builder update = LedgerUpdate.builder().rewardPool(newPool);
        for (TransactionInput input : tx.inputs()) {
            update.remove(input.outPoint());
        }
        for (int i = 0; i < ids.size(); i++) {
            update.insert(ids.get(i), tx.outputs().get(i));
        }
        ledger.apply(update.build());

        LedgerMetrics.recordCommitted(valid.reward());
        LOG.fine(() -> "Committed " + tx + " reward=" + valid.reward() + " pool=" + newPool);
        notifySuccess(tx, valid.reward());
    }

    private void notifySuccess(Transaction tx, BigInteger reward) {
        try {
            events.onTransactionSuccess(new TransactionSuccess(tx, reward));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Event sink failed for committed transaction", e);
        }
    }
}
