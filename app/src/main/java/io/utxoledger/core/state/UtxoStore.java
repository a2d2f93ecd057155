package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TransactionOutput;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Unspent-output set plus the reward pool.
 * Every key present denotes value that is currently unspent.
 * Writes only go through {@link #apply(LedgerUpdate)}, which persists all of an
 * update or none of it.
 */
public interface UtxoStore {

    Optional<TransactionOutput> get(Hash id);

    boolean contains(Hash id);

    /** Pooled fees not yet distributed. Zero when never written. */
    BigInteger rewardPool();

    /**
     * Apply removals, insertions and the reward-pool value atomically.
     * Removing an id that is not present, or inserting at an id that already exists
     * (and is not removed by the same update), fails with {@link IllegalStateException}
     * before anything is written.
     */
    void apply(LedgerUpdate update);

    /** Number of unspent outputs (debug/metrics). */
    long size();

    /** True when the store holds no outputs and no pooled reward. */
    default boolean isEmpty() {
        return size() == 0 && rewardPool().signum() == 0;
    }
}
