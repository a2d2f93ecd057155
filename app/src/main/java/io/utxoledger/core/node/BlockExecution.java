package io.utxoledger.core.node;

import io.utxoledger.core.mempool.ValidationResult;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.reward.DistributionResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Summary of one {@link LedgerNode#executeBlock} call. */
public final class BlockExecution {
    private final long height;
    private final List<Transaction> committed;
    private final List<Transaction> pending;
    private final Map<Transaction, ValidationResult.Rejected> rejected;
    private final DistributionResult distribution;

    BlockExecution(long height,
                   List<Transaction> committed,
                   List<Transaction> pending,
                   Map<Transaction, ValidationResult.Rejected> rejected,
                   DistributionResult distribution) {
        this.height = height;
        this.committed = List.copyOf(committed);
        this.pending = List.copyOf(pending);
        this.rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
        this.distribution = distribution;
    }

    public long height() { return height; }
    public List<Transaction> committed() { return committed; }
    public List<Transaction> pending() { return pending; }
    public Map<Transaction, ValidationResult.Rejected> rejected() { return rejected; }
    public DistributionResult distribution() { return distribution; }

    @Override public String toString() {
        return "BlockExecution{height=" + height + ", committed=" + committed.size()
                + ", pending=" + pending.size() + ", rejected=" + rejected.size()
                + ", " + distribution + "}";
    }
}
