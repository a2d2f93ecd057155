package io.utxoledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter committed = registry.counter("ledger.tx.committed");
    private static final Counter pending = registry.counter("ledger.tx.pending");
    private static final Counter minted = registry.counter("ledger.reward.minted");
    private static final Counter wasted = registry.counter("ledger.reward.wasted");
    private static final Counter skipped = registry.counter("ledger.reward.skipped");
    private static final DistributionSummary fees = DistributionSummary.builder("ledger.tx.fee")
            .baseUnit("minor")
            .description("Reward accrued per committed transaction")
            .register(registry);

    private LedgerMetrics() {}

    public static void recordCommitted(BigInteger reward) {
        committed.increment();
        // summary is approximate for amounts beyond double precision
        fees.record(reward.doubleValue());
    }

    public static void recordPending() {
        pending.increment();
    }

    public static void recordRejected(String error) {
        Counter.builder("ledger.tx.rejected")
                .description("Transactions rejected by validation")
                .tag("error", error)
                .register(registry)
                .increment();
    }

    public static void recordMinted(int outputs) {
        minted.increment(outputs);
    }

    public static void recordWasted() {
        wasted.increment();
    }

    public static void recordSkipped() {
        skipped.increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append('{').append(tag.getKey()).append('=').append(tag.getValue()).append('}');
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
