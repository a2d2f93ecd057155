package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TransactionCodec;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.protocol.Values;
import org.rocksdb.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent UtxoStore using RocksDB.
 *
 * Layout (column families):
 *  - "utxos" : key = output id(32), val = output.serialize() (48)
 *  - "meta"  : key = "reward_total", val = pooled reward (16, big-endian)
 *
 * Each {@link #apply(LedgerUpdate)} is written as one WriteBatch.
 */
public final class RocksDBUtxoStore implements UtxoStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBUtxoStore.class.getName());
    private static final byte[] REWARD_KEY = "reward_total".getBytes(StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfUtxos;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;

    private RocksDBUtxoStore(RocksDB db,
                             ColumnFamilyHandle cfDefault,
                             ColumnFamilyHandle cfUtxos,
                             ColumnFamilyHandle cfMeta,
                             DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfUtxos = cfUtxos;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBUtxoStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = List.of(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("utxos".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new java.util.ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBUtxoStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new RuntimeException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- UtxoStore API ----------------

    @Override
    public synchronized Optional<TransactionOutput> get(Hash id) {
        if (id == null) return Optional.empty();
        try {
            byte[] body = db.get(cfUtxos, id.bytes());
            return body == null ? Optional.empty() : Optional.of(TransactionCodec.outputFromBytes(body));
        } catch (RocksDBException e) {
            throw new RuntimeException("get failed for " + id, e);
        }
    }

    @Override
    public synchronized boolean contains(Hash id) {
        if (id == null) return false;
        try {
            return db.get(cfUtxos, id.bytes()) != null;
        } catch (RocksDBException e) {
            throw new RuntimeException("contains failed for " + id, e);
        }
    }

    @Override
    public synchronized BigInteger rewardPool() {
        try {
            byte[] raw = db.get(cfMeta, REWARD_KEY);
            return raw == null ? BigInteger.ZERO : Values.fromBytes(raw);
        } catch (RocksDBException e) {
            throw new RuntimeException("rewardPool read failed", e);
        }
    }

    @Override
    public synchronized void apply(LedgerUpdate update) {
        List<Hash> missing = update.missingRemovalsWith(this);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Output id not found: " + missing.get(0));
        }
        List<Hash> clashes = update.collisionsWith(this);
        if (!clashes.isEmpty()) {
            throw new IllegalStateException("Output id already exists: " + clashes.get(0));
        }
        if (update.isEmpty()) return;

        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            for (Hash id : update.removals()) {
                batch.delete(cfUtxos, id.bytes());
            }
            for (Map.Entry<Hash, TransactionOutput> e : update.insertions().entrySet()) {
                batch.put(cfUtxos, e.getKey().bytes(), e.getValue().serialize());
            }
            if (update.rewardPool().isPresent()) {
                batch.put(cfMeta, REWARD_KEY, Values.toBytes(update.rewardPool().get()));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new RuntimeException("apply failed: " + update, e);
        }
    }

    @Override
    public synchronized long size() {
        try (RocksIterator it = db.newIterator(cfUtxos)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public void close() {
        // column family handles first, then DB/options
        closeQuietly(cfUtxos);
        closeQuietly(cfMeta);
        closeQuietly(cfDefault);
        closeQuietly(db);
        closeQuietly(dbOptions);
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            LOG.log(Level.WARNING, "Failed to close RocksDB resource", e);
        }
    }
}
