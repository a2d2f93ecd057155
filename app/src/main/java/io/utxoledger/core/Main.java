package io.utxoledger.core;

import io.utxoledger.core.config.GenesisConfigLoader;
import io.utxoledger.core.mempool.ValidationResult;
import io.utxoledger.core.metrics.LedgerMetrics;
import io.utxoledger.core.node.BlockExecution;
import io.utxoledger.core.node.LedgerNode;
import io.utxoledger.core.node.NodeConfig;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.Hashes;
import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.wallet.Wallet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        if (options.resetLedger()) {
            resetLedgerState(dataPath);
        }
        Files.createDirectories(dataPath);

        Wallet alice = demoWallet("alice");
        Wallet bob = demoWallet("bob");
        Wallet carol = demoWallet("carol");

        Path genesisFile = options.genesisFile() != null
                ? options.genesisFile()
                : dataPath.resolve("genesis.json");
        if (!Files.exists(genesisFile)) {
            GenesisConfigLoader.save(genesisFile, List.of(
                    new TransactionOutput(1_000_000L, alice.getPublicKey()),
                    new TransactionOutput(500_000L, bob.getPublicKey())
            ));
            LOG.info("Wrote default genesis config to " + genesisFile);
        }
        List<TransactionOutput> genesis = GenesisConfigLoader.load(genesisFile);

        NodeConfig config = new NodeConfig(genesis, dataPath.resolve("ledger").toString(), options.inMemory());
        try (LedgerNode node = LedgerNode.open(config)) {
            node.start();
            LOG.info("Alice key=" + alice.getPublicKey().hex());
            LOG.info("Bob   key=" + bob.getPublicKey().hex());

            if (options.demo()) {
                runDemoFlow(node, alice, bob, carol);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }
        }
    }

    private static void runDemoFlow(LedgerNode node, Wallet alice, Wallet bob, Wallet carol) {
        TransactionOutput aliceGenesis = new TransactionOutput(1_000_000L, alice.getPublicKey());
        Hash aliceOut = aliceGenesis.genesisId();

        Transaction pay = alice.signAll(Transaction.builder()
                .spend(aliceOut)
                .output(250_000L, bob.getPublicKey())
                .output(749_990L, alice.getPublicKey())
                .build());

        // bob forwards part of his new output before the payment is committed
        Transaction forward = bob.signAll(Transaction.builder()
                .spend(pay.outputId(0))
                .output(100_000L, carol.getPublicKey())
                .output(149_995L, bob.getPublicKey())
                .build());

        try {
            node.pool().add(forward);
            node.pool().add(pay);
        } catch (IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Demo transaction rejected by the pool", e);
        }
        LOG.info("Pool: ready=" + node.pool().readyCount() + " waiting=" + node.pool().futureCount());

        List<OwnerKey> authorities = List.of(alice.getPublicKey(), bob.getPublicKey(), carol.getPublicKey());
        BlockExecution block = node.executeBlock(node.pool().getBatch(100), authorities, 1L);
        for (Transaction tx : block.pending()) {
            ValidationResult again = node.spend(tx);
            LOG.info("Pending tx retried: " + again);
        }

        LOG.info("Carol output present=" + node.utxo(forward.outputId(0)).isPresent()
                + ", reward pool=" + node.rewardPool());
        LOG.info("Unspent outputs=" + node.store().size());
        LOG.info("=== Metrics ===\n" + LedgerMetrics.scrapeMetrics());
    }

    private static Wallet demoWallet(String alias) {
        return Wallet.fromSeed(Hashes.sha256(("utxo-ledger-demo:" + alias).getBytes(StandardCharsets.UTF_8)));
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load logging.properties", e);
        }
    }

    private static void resetLedgerState(Path dataPath) {
        Path ledgerDir = dataPath.resolve("ledger");
        if (!Files.exists(ledgerDir)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(ledgerDir)) {
            stream.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset ledger data in " + ledgerDir, e);
        }
        LOG.info("Cleared ledger data under " + ledgerDir + " (genesis config preserved).");
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path genesisFile,
            boolean inMemory,
            boolean resetLedger,
            boolean demo
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("UTXO_LEDGER_DATA_DIR", Path.of("./data/ledger"));
            Path genesisFile = envPath("UTXO_LEDGER_GENESIS", null);
            boolean inMemory = false;
            boolean reset = false;
            boolean demo = true;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--genesis=")) {
                        String value = arg.substring("--genesis=".length());
                        if (value.isBlank()) {
                            showHelp = true;
                            error = "Missing path for --genesis";
                        } else {
                            genesisFile = Path.of(value);
                        }
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--reset-ledger")) {
                        reset = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(showHelp, error, dataDir, genesisFile, inMemory, reset, demo);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: utxo-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data (default ./data/ledger)
  --genesis=<file>           Genesis config JSON (default <data-dir>/genesis.json)
  --in-memory                Keep the ledger in memory instead of RocksDB
  --reset-ledger             Delete ledger data (genesis config is preserved)
  --demo / --no-demo         Enable (default) or disable the demo transaction flow

Environment overrides:
  UTXO_LEDGER_DATA_DIR       Override --data-dir
  UTXO_LEDGER_GENESIS        Override --genesis
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }
    }
}
