package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TransactionOutput;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of UtxoStore.
 * Not persistent; resets every process run.
 */
public final class InMemoryUtxoStore implements UtxoStore {

    private final Map<Hash, TransactionOutput> utxos = new HashMap<>();
    private BigInteger rewardPool = BigInteger.ZERO;

    @Override
    public synchronized Optional<TransactionOutput> get(Hash id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(utxos.get(id));
    }

    @Override
    public synchronized boolean contains(Hash id) {
        return id != null && utxos.containsKey(id);
    }

    @Override
    public synchronized BigInteger rewardPool() {
        return rewardPool;
    }

    @Override
    public synchronized void apply(LedgerUpdate update) {
        // all checks happen before the first write
        List<Hash> missing = update.missingRemovalsWith(this);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Output id not found: " + missing.get(0));
        }
        List<Hash> clashes = update.collisionsWith(this);
        if (!clashes.isEmpty()) {
            throw new IllegalStateException("Output id already exists: " + clashes.get(0));
        }
        for (Hash id : update.removals()) {
            utxos.remove(id);
        }
        utxos.putAll(update.insertions());
        update.rewardPool().ifPresent(v -> rewardPool = v);
    }

    @Override
    public synchronized long size() {
        return utxos.size();
    }
}
