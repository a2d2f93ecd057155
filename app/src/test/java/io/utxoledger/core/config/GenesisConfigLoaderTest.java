package io.utxoledger.core.config;

import io.utxoledger.core.LedgerFixtures;
import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.protocol.Values;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GenesisConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void savedConfigLoadsBack() {
        Path file = dir.resolve("nested/genesis.json");
        List<TransactionOutput> utxos = List.of(
                new TransactionOutput(Values.MAX, LedgerFixtures.wallet("alice").getPublicKey()),
                new TransactionOutput(5, LedgerFixtures.wallet("bob").getPublicKey()));

        GenesisConfigLoader.save(file, utxos);

        assertEquals(utxos, GenesisConfigLoader.load(file));
    }

    @Test
    void readsStringValues() throws Exception {
        OwnerKey owner = LedgerFixtures.wallet("carol").getPublicKey();
        Path file = dir.resolve("genesis.json");
        Files.writeString(file, "{\"genesisUtxos\":[{\"value\":\"340282366920938463463374607431768211455\","
                + "\"ownerKey\":\"" + owner.hex() + "\"}]}", StandardCharsets.UTF_8);

        List<TransactionOutput> utxos = GenesisConfigLoader.load(file);

        assertEquals(List.of(new TransactionOutput(Values.MAX, owner)), utxos);
    }

    @Test
    void invalidEntryIsReported() throws Exception {
        Path file = dir.resolve("genesis.json");
        Files.writeString(file, "{\"genesisUtxos\":[{\"value\":\"1\",\"ownerKey\":\"abcd\"}]}", StandardCharsets.UTF_8);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> GenesisConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("#0"));
    }

    @Test
    void nullEntryIsReported() throws Exception {
        Path file = dir.resolve("genesis.json");
        Files.writeString(file, "{\"genesisUtxos\":[null]}", StandardCharsets.UTF_8);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> GenesisConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("#0"));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(IllegalStateException.class, () -> GenesisConfigLoader.load(dir.resolve("absent.json")));
    }
}
