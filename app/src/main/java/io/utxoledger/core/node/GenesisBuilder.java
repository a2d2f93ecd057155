package io.utxoledger.core.node;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.state.LedgerUpdate;
import io.utxoledger.core.state.UtxoStore;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Seeds the configured genesis outputs, each keyed by the hash of its own content.
 */
public final class GenesisBuilder {
    private static final Logger LOG = Logger.getLogger(GenesisBuilder.class.getName());

    private GenesisBuilder(){}

    /** Build the single update that seeds {@code genesisUtxos}. Identical entries collapse to one id. */
    public static LedgerUpdate buildGenesis(List<TransactionOutput> genesisUtxos) {
        LedgerUpdate.Builder update = LedgerUpdate.builder();
        Set<Hash> seen = new LinkedHashSet<>();
        for (TransactionOutput utxo : genesisUtxos) {
            Hash id = utxo.genesisId();
            if (!seen.add(id)) {
                LOG.warning("Duplicate genesis output ignored: " + utxo);
                continue;
            }
            update.insert(id, utxo);
        }
        return update.build();
    }

    /**
     * If the store is empty, seed the genesis outputs.
     * Idempotent: does nothing once the ledger holds state.
     */
    public static boolean initIfNeeded(UtxoStore store, List<TransactionOutput> genesisUtxos) {
        if (!store.isEmpty()) return false;
        if (genesisUtxos == null || genesisUtxos.isEmpty()) return false;
        LedgerUpdate update = buildGenesis(genesisUtxos);
        store.apply(update);
        LOG.info("Seeded " + update.insertions().size() + " genesis outputs");
        return true;
    }
}
