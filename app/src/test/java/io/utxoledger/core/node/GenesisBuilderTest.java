package io.utxoledger.core.node;

import io.utxoledger.core.LedgerFixtures;
import io.utxoledger.core.protocol.Hashes;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.state.InMemoryUtxoStore;
import io.utxoledger.core.state.UtxoStore;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenesisBuilderTest {

    private final TransactionOutput first = new TransactionOutput(100, LedgerFixtures.wallet("alice").getPublicKey());
    private final TransactionOutput second = new TransactionOutput(50, LedgerFixtures.wallet("bob").getPublicKey());

    @Test
    void seedsExactlyTheConfiguredOutputs() {
        UtxoStore store = new InMemoryUtxoStore();

        assertTrue(GenesisBuilder.initIfNeeded(store, List.of(first, second)));

        assertEquals(2, store.size());
        assertEquals(first, store.get(Hashes.hashOf(first.serialize())).orElseThrow());
        assertEquals(second, store.get(Hashes.hashOf(second.serialize())).orElseThrow());
        assertEquals(BigInteger.ZERO, store.rewardPool());
    }

    @Test
    void isIdempotentOnceSeeded() {
        UtxoStore store = new InMemoryUtxoStore();
        GenesisBuilder.initIfNeeded(store, List.of(first));

        assertFalse(GenesisBuilder.initIfNeeded(store, List.of(first, second)));
        assertEquals(1, store.size());
    }

    @Test
    void identicalEntriesCollapse() {
        UtxoStore store = new InMemoryUtxoStore();
        GenesisBuilder.initIfNeeded(store, List.of(first, first));
        assertEquals(1, store.size());
    }
}
