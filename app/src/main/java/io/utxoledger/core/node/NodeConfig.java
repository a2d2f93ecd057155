package io.utxoledger.core.node;

import io.utxoledger.core.protocol.TransactionOutput;

import java.util.List;

/** Simple config holder for a local ledger node. */
public final class NodeConfig {
    public final List<TransactionOutput> genesisUtxos;
    public final String dataDir;
    public final boolean inMemory;

    public NodeConfig(List<TransactionOutput> genesisUtxos, String dataDir, boolean inMemory) {
        this.genesisUtxos = genesisUtxos != null ? List.copyOf(genesisUtxos) : List.of();
        this.dataDir = dataDir;
        this.inMemory = inMemory;
    }

    public static NodeConfig inMemory(List<TransactionOutput> genesisUtxos) {
        return new NodeConfig(genesisUtxos, null, true);
    }

    public NodeConfig withGenesis(List<TransactionOutput> genesisUtxos) {
        return new NodeConfig(genesisUtxos, this.dataDir, this.inMemory);
    }
}
