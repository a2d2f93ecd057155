package io.utxoledger.core.mempool;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.state.UtxoStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Dependency-aware pool:
 * - fully valid txs go straight to the ready queue
 * - pending txs are ready once every id they require is provided by a ready tx,
 *   otherwise they wait in the future set
 * - ready order is insertion order, so a provider always precedes its dependants
 * - the future set is bounded; when full the longest-waiting tx is evicted
 */
public final class TransactionPool {
    private static final Logger LOG = Logger.getLogger(TransactionPool.class.getName());

    public static final int DEFAULT_MAX_FUTURE = 1024;

    private final TxValidator validator;
    private final UtxoStore ledger;
    private final int maxFuture;

    private final Map<Hash, Entry> ready = new LinkedHashMap<>();
    private final Map<Hash, Entry> future = new LinkedHashMap<>();
    /** output id -> id of the ready tx that creates it */
    private final Map<Hash, Hash> providers = new HashMap<>();

    public TransactionPool(TxValidator validator, UtxoStore ledger) {
        this(validator, ledger, DEFAULT_MAX_FUTURE);
    }

    public TransactionPool(TxValidator validator, UtxoStore ledger, int maxFuture) {
        if (maxFuture < 1) throw new IllegalArgumentException("maxFuture must be positive");
        this.validator = validator;
        this.ledger = ledger;
        this.maxFuture = maxFuture;
    }

    /**
     * Validate and add a tx. Returns false if it is already pooled.
     *
     * @throws IllegalArgumentException if validation rejects it
     */
    public synchronized boolean add(Transaction tx) {
        Hash id = tx.id();
        if (ready.containsKey(id) || future.containsKey(id)) {
            return false;
        }
        ValidationResult result = validator.validate(tx, ledger);
        if (result instanceof ValidationResult.Rejected) {
            ValidationError error = ((ValidationResult.Rejected) result).error();
            throw new IllegalArgumentException("Transaction rejected: " + error.message() + " (" + error + ")");
        }
        admit(new Entry(id, tx, result));
        return true;
    }

    /** Pull up to max ready transactions, providers first. */
    public synchronized List<Transaction> getBatch(int max) {
        List<Transaction> out = new ArrayList<>(Math.min(max, ready.size()));
        Iterator<Entry> it = ready.values().iterator();
        while (it.hasNext() && out.size() < max) {
            Entry e = it.next();
            out.add(e.tx);
            it.remove();
            dropProvides(e);
        }
        return out;
    }

    /** Remove included txs, ready or waiting. */
    public synchronized void removeAll(Collection<Transaction> included) {
        for (Transaction tx : included) {
            Hash id = tx.id();
            Entry e = ready.remove(id);
            if (e != null) {
                dropProvides(e);
            }
            future.remove(id);
        }
    }

    /**
     * Re-check waiting txs against the ledger, e.g. after a block committed their parents.
     * Txs that no longer validate are dropped.
     */
    public synchronized void revalidate() {
        List<Entry> waiting = new ArrayList<>(future.values());
        future.clear();
        for (Entry e : waiting) {
            ValidationResult result = validator.validate(e.tx, ledger);
            if (result instanceof ValidationResult.Rejected) {
                LOG.fine(() -> "Dropping waiting tx " + e.id.hex() + ": " + result);
                continue;
            }
            admit(new Entry(e.id, e.tx, result));
        }
    }

    public synchronized int size() { return ready.size() + future.size(); }
    public synchronized int readyCount() { return ready.size(); }
    public synchronized int futureCount() { return future.size(); }

    private void admit(Entry entry) {
        if (isSatisfied(entry)) {
            markReady(entry);
            promoteFutures();
        } else {
            if (future.size() >= maxFuture) {
                Iterator<Entry> oldest = future.values().iterator();
                Entry evicted = oldest.next();
                oldest.remove();
                LOG.fine(() -> "Future set full, evicting " + evicted.id.hex());
            }
            future.put(entry.id, entry);
        }
    }

    private void markReady(Entry entry) {
        ready.put(entry.id, entry);
        for (Hash provided : entry.result.provides()) {
            providers.put(provided, entry.id);
        }
    }

    private void promoteFutures() {
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            Iterator<Entry> it = future.values().iterator();
            while (it.hasNext()) {
                Entry e = it.next();
                if (isSatisfied(e)) {
                    it.remove();
                    markReady(e);
                    progressed = true;
                }
            }
        }
    }

    private boolean isSatisfied(Entry entry) {
        for (Hash required : entry.result.requires()) {
            if (!providers.containsKey(required)) return false;
        }
        return true;
    }

    private void dropProvides(Entry entry) {
        for (Hash provided : entry.result.provides()) {
            providers.remove(provided, entry.id);
        }
    }

    private static final class Entry {
        final Hash id;
        final Transaction tx;
        final ValidationResult result;

        Entry(Hash id, Transaction tx, ValidationResult result) {
            this.id = id;
            this.tx = tx;
            this.result = result;
        }
    }
}
