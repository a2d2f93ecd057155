package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.protocol.Values;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One atomic batch of ledger writes: removals first, then insertions, then the
 * reward pool (if set).
 */
public final class LedgerUpdate {
    private final Set<Hash> removals;
    private final Map<Hash, TransactionOutput> insertions;
    private final BigInteger rewardPool;

    private LedgerUpdate(Set<Hash> removals, Map<Hash, TransactionOutput> insertions, BigInteger rewardPool) {
        this.removals = Collections.unmodifiableSet(removals);
        this.insertions = Collections.unmodifiableMap(insertions);
        this.rewardPool = rewardPool;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final Set<Hash> removals = new LinkedHashSet<>();
        private final Map<Hash, TransactionOutput> insertions = new LinkedHashMap<>();
        private BigInteger rewardPool;

        public Builder remove(Hash id) {
            if (id == null) throw new IllegalArgumentException("Missing id");
            removals.add(id);
            return this;
        }

        public Builder insert(Hash id, TransactionOutput output) {
            if (id == null || output == null) throw new IllegalArgumentException("Missing id or output");
            if (insertions.putIfAbsent(id, output) != null) {
                throw new IllegalStateException("Duplicate insertion in one update: " + id);
            }
            return this;
        }

        public Builder rewardPool(BigInteger value) {
            this.rewardPool = Values.require(value);
            return this;
        }

        public boolean inserts(Hash id) { return insertions.containsKey(id); }

        public LedgerUpdate build() {
            return new LedgerUpdate(new LinkedHashSet<>(removals), new LinkedHashMap<>(insertions), rewardPool);
        }
    }

    public Set<Hash> removals() { return removals; }
    public Map<Hash, TransactionOutput> insertions() { return insertions; }
    public Optional<BigInteger> rewardPool() { return Optional.ofNullable(rewardPool); }

    public boolean isEmpty() {
        return removals.isEmpty() && insertions.isEmpty() && rewardPool == null;
    }

    /** Ids this update removes that are not in {@code store}. */
    List<Hash> missingRemovalsWith(UtxoStore store) {
        List<Hash> missing = new ArrayList<>();
        for (Hash id : removals) {
            if (!store.contains(id)) missing.add(id);
        }
        return missing;
    }

    /** Ids this update inserts that already exist in {@code store} and are not removed first. */
    List<Hash> collisionsWith(UtxoStore store) {
        List<Hash> clashes = new ArrayList<>();
        for (Hash id : insertions.keySet()) {
            if (!removals.contains(id) && store.contains(id)) clashes.add(id);
        }
        return clashes;
    }

    @Override public String toString() {
        return "LedgerUpdate{remove=" + removals.size() + ", insert=" + insertions.size()
                + ", rewardPool=" + rewardPool + "}";
    }
}
