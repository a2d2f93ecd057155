package io.utxoledger.core.node;

import io.utxoledger.core.events.LedgerEventSink;
import io.utxoledger.core.events.LoggingEventSink;
import io.utxoledger.core.mempool.TransactionPool;
import io.utxoledger.core.mempool.TxValidator;
import io.utxoledger.core.mempool.ValidationResult;
import io.utxoledger.core.metrics.LedgerMetrics;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.reward.DistributionResult;
import io.utxoledger.core.reward.RewardDistributor;
import io.utxoledger.core.state.InMemoryUtxoStore;
import io.utxoledger.core.state.RocksDBUtxoStore;
import io.utxoledger.core.state.StateMutator;
import io.utxoledger.core.state.UtxoStore;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires store, validator, mutator, distributor and pool.
 * Call start() once, then spend()/finalizeBlock() or executeBlock() per block.
 * Every call validates against the store as it is at that moment.
 */
public final class LedgerNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LedgerNode.class.getName());

    private final UtxoStore store;
    private final TxValidator validator;
    private final StateMutator mutator;
    private final RewardDistributor distributor;
    private final TransactionPool pool;
    private final NodeConfig config;

    public LedgerNode(UtxoStore store, LedgerEventSink events, NodeConfig config) {
        this.store = store;
        this.config = config;
        this.validator = new TxValidator();
        this.mutator = new StateMutator(events);
        this.distributor = new RewardDistributor();
        this.pool = new TransactionPool(validator, store);
    }

    /** Convenience factory for an in-memory local node. */
    public static LedgerNode inMemory(NodeConfig config) {
        return new LedgerNode(new InMemoryUtxoStore(), new LoggingEventSink(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static LedgerNode rocks(NodeConfig config) {
        return new LedgerNode(RocksDBUtxoStore.open(config.dataDir), new LoggingEventSink(), config);
    }

    public static LedgerNode open(NodeConfig config) {
        return config.inMemory ? inMemory(config) : rocks(config);
    }

    /** Seed genesis outputs if the store is empty. Safe to call multiple times. */
    public void start() {
        if (!GenesisBuilder.initIfNeeded(store, config.genesisUtxos)) {
            LOG.info("Ledger already initialised: " + store.size() + " unspent outputs, pool " + store.rewardPool());
        }
    }

    /**
     * Validate and, when fully valid, commit. Pending and rejected results are
     * returned without touching the store.
     */
    public ValidationResult spend(Transaction tx) {
        ValidationResult result = validator.validate(tx, store);
        if (result instanceof ValidationResult.FullyValid) {
            mutator.commit(tx, (ValidationResult.FullyValid) result, store);
        } else if (result instanceof ValidationResult.Pending) {
            LedgerMetrics.recordPending();
            LOG.fine(() -> "Transaction pending: " + result);
        } else {
            LedgerMetrics.recordRejected(((ValidationResult.Rejected) result).error().name());
            LOG.fine(() -> "Transaction rejected: " + result);
        }
        return result;
    }

    /** Pay the reward pool out to {@code authorities} at block finalization. */
    public DistributionResult finalizeBlock(List<OwnerKey> authorities, long blockHeight) {
        return distributor.distribute(authorities, blockHeight, store);
    }

    /**
     * Apply {@code txs} in order, each seeing the commits before it, then finalize.
     * A commit that fails (reward pool overflow) leaves that tx out and the block continues.
     */
    public BlockExecution executeBlock(List<Transaction> txs, List<OwnerKey> authorities, long blockHeight) {
        List<Transaction> committed = new ArrayList<>();
        List<Transaction> pending = new ArrayList<>();
        Map<Transaction, ValidationResult.Rejected> rejected = new LinkedHashMap<>();

        for (Transaction tx : txs) {
            ValidationResult result;
            try {
                result = spend(tx);
            } catch (IllegalStateException e) {
                LOG.log(Level.WARNING, "Commit aborted for " + tx, e);
                continue;
            }
            if (result.isFullyValid()) {
                committed.add(tx);
            } else if (result.isPending()) {
                pending.add(tx);
            } else {
                rejected.put(tx, (ValidationResult.Rejected) result);
            }
        }
        DistributionResult distribution = finalizeBlock(authorities, blockHeight);
        pool.removeAll(committed);
        pool.revalidate();

        BlockExecution execution = new BlockExecution(blockHeight, committed, pending, rejected, distribution);
        LOG.info("Executed block " + execution);
        return execution;
    }

    public Optional<TransactionOutput> utxo(Hash id) { return store.get(id); }
    public BigInteger rewardPool() { return store.rewardPool(); }

    public UtxoStore store() { return store; }
    public TransactionPool pool() { return pool; }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close ledger store", e);
            }
        }
    }
}
