package io.utxoledger.core.events;

import java.util.logging.Logger;

public final class LoggingEventSink implements LedgerEventSink {
    private static final Logger LOG = Logger.getLogger(LoggingEventSink.class.getName());

    @Override
    public void onTransactionSuccess(TransactionSuccess event) {
        LOG.info("Transaction committed: " + event.transaction().id().hex()
                + " (reward " + event.reward() + ")");
    }
}
