package io.utxoledger.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.TransactionOutput;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the genesis file:
 * <pre>{"genesisUtxos":[{"value":"100","ownerKey":"&lt;64 hex chars&gt;"}]}</pre>
 * Values are decimal strings (or JSON numbers) so the full u128 range survives.
 */
public final class GenesisConfigLoader {
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GenesisConfigLoader() {}

    public static List<TransactionOutput> load(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Genesis file not found: " + path);
        }
        GenesisFile file;
        try {
            file = JSON.readValue(path.toFile(), GenesisFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genesis config from " + path, e);
        }
        if (file.genesisUtxos == null) {
            return List.of();
        }
        List<TransactionOutput> out = new ArrayList<>(file.genesisUtxos.size());
        for (int i = 0; i < file.genesisUtxos.size(); i++) {
            Entry e = file.genesisUtxos.get(i);
            if (e == null || e.value == null || e.ownerKey == null) {
                throw new IllegalStateException("Invalid genesis entry #" + i + " in " + path
                        + ": value and ownerKey are required");
            }
            try {
                out.add(new TransactionOutput(e.value, OwnerKey.fromHex(e.ownerKey)));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Invalid genesis entry #" + i + " in " + path, ex);
            }
        }
        return out;
    }

    public static void save(Path path, List<TransactionOutput> utxos) {
        GenesisFile file = new GenesisFile();
        file.genesisUtxos = new ArrayList<>(utxos.size());
        for (TransactionOutput utxo : utxos) {
            Entry e = new Entry();
            e.value = utxo.value();
            e.ownerKey = utxo.ownerKey().hex();
            file.genesisUtxos.add(e);
        }
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist genesis config to " + path, e);
        }
    }

    public static final class GenesisFile {
        @JsonProperty("genesisUtxos")
        public List<Entry> genesisUtxos;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Entry {
        @JsonProperty("value")
        public BigInteger value;
        @JsonProperty("ownerKey")
        public String ownerKey;
    }
}
