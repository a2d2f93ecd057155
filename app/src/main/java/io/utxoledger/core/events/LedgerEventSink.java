package io.utxoledger.core.events;

/**
 * Receives ledger notifications. Delivery is best-effort: a sink that throws is
 * logged and never undoes the commit that triggered it.
 */
@FunctionalInterface
public interface LedgerEventSink {

    void onTransactionSuccess(TransactionSuccess event);

    static LedgerEventSink noop() {
        return event -> { };
    }
}
