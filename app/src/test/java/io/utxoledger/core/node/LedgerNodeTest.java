package io.utxoledger.core.node;

import io.utxoledger.core.LedgerFixtures;
import io.utxoledger.core.events.TransactionSuccess;
import io.utxoledger.core.mempool.ValidationError;
import io.utxoledger.core.mempool.ValidationResult;
import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.reward.DistributionResult;
import io.utxoledger.core.state.InMemoryUtxoStore;
import io.utxoledger.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LedgerNodeTest {

    private final Wallet alice = LedgerFixtures.wallet("alice");
    private final Wallet bob = LedgerFixtures.wallet("bob");
    private final Wallet carol = LedgerFixtures.wallet("carol");
    private final TransactionOutput genesis = new TransactionOutput(100, alice.getPublicKey());

    @Test
    void spendCommitsAndNotifies() {
        List<TransactionSuccess> events = new ArrayList<>();
        LedgerNode node = node(events);
        Transaction tx = alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(90, bob.getPublicKey())
                .build());

        ValidationResult result = node.spend(tx);

        assertTrue(result.isFullyValid());
        assertEquals(BigInteger.TEN, node.rewardPool());
        assertTrue(node.utxo(tx.outputId(0)).isPresent());
        assertEquals(1, events.size());
    }

    @Test
    void rejectedAndPendingSpendsChangeNothing() {
        List<TransactionSuccess> events = new ArrayList<>();
        LedgerNode node = node(events);
        Transaction overspend = alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(150, bob.getPublicKey())
                .build());
        Transaction orphan = bob.signAll(Transaction.builder()
                .spend(overspend.outputId(0))
                .output(1, bob.getPublicKey())
                .build());

        ValidationResult rejected = node.spend(overspend);
        ValidationResult pending = node.spend(orphan);

        assertEquals(ValidationError.INSUFFICIENT_INPUT_VALUE, ((ValidationResult.Rejected) rejected).error());
        assertTrue(pending.isPending());
        assertEquals(1, node.store().size());
        assertTrue(node.utxo(genesis.genesisId()).isPresent());
        assertTrue(events.isEmpty());
    }

    @Test
    void executeBlockAppliesInOrderThenPaysAuthorities() {
        LedgerNode node = node(new ArrayList<>());
        Transaction parent = alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(94, bob.getPublicKey())
                .build());
        Transaction child = bob.signAll(Transaction.builder()
                .spend(parent.outputId(0))
                .output(91, carol.getPublicKey())
                .build());
        List<OwnerKey> authorities = List.of(alice.getPublicKey(), bob.getPublicKey(), carol.getPublicKey());

        BlockExecution block = node.executeBlock(List.of(parent, child), authorities, 1L);

        assertEquals(List.of(parent, child), block.committed());
        assertTrue(block.pending().isEmpty());
        assertEquals(DistributionResult.Status.DISTRIBUTED, block.distribution().status());
        assertEquals(BigInteger.valueOf(3), block.distribution().share());
        assertEquals(BigInteger.ZERO, node.rewardPool());
        // carol's payment plus three payouts
        assertEquals(4, node.store().size());
    }

    @Test
    void childBeforeParentInOneBlockStaysPending() {
        LedgerNode node = node(new ArrayList<>());
        Transaction parent = alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(100, bob.getPublicKey())
                .build());
        Transaction child = bob.signAll(Transaction.builder()
                .spend(parent.outputId(0))
                .output(100, carol.getPublicKey())
                .build());

        BlockExecution block = node.executeBlock(List.of(child, parent), List.of(alice.getPublicKey()), 1L);

        assertEquals(List.of(parent), block.committed());
        assertEquals(List.of(child), block.pending());
        assertTrue(node.spend(child).isFullyValid());
    }

    @Test
    void finalizeWithoutAuthoritiesKeepsPool() {
        LedgerNode node = node(new ArrayList<>());
        node.spend(alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(95, bob.getPublicKey())
                .build()));

        DistributionResult result = node.finalizeBlock(List.of(), 1L);

        assertEquals(DistributionResult.Status.SKIPPED_NO_AUTHORITIES, result.status());
        assertEquals(BigInteger.valueOf(5), node.rewardPool());
    }

    private LedgerNode node(List<TransactionSuccess> events) {
        LedgerNode node = new LedgerNode(new InMemoryUtxoStore(), events::add, NodeConfig.inMemory(List.of(genesis)));
        node.start();
        return node;
    }
}
