package io.utxoledger.core;

import io.utxoledger.core.node.GenesisBuilder;
import io.utxoledger.core.protocol.Hashes;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.state.InMemoryUtxoStore;
import io.utxoledger.core.state.LedgerUpdate;
import io.utxoledger.core.state.UtxoStore;
import io.utxoledger.core.wallet.Wallet;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class LedgerFixtures {
    private LedgerFixtures() {}

    public static Wallet wallet(String alias) {
        return Wallet.fromSeed(Hashes.sha256(("test-wallet:" + alias).getBytes(StandardCharsets.UTF_8)));
    }

    public static UtxoStore storeWith(TransactionOutput... genesis) {
        UtxoStore store = new InMemoryUtxoStore();
        GenesisBuilder.initIfNeeded(store, List.of(genesis));
        return store;
    }

    public static void setRewardPool(UtxoStore store, BigInteger value) {
        store.apply(LedgerUpdate.builder().rewardPool(value).build());
    }
}
