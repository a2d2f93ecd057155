package io.utxoledger.core.state;

import io.utxoledger.core.LedgerFixtures;
import io.utxoledger.core.events.TransactionSuccess;
import io.utxoledger.core.mempool.TxValidator;
import io.utxoledger.core.mempool.ValidationResult;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.protocol.Values;
import io.utxoledger.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateMutatorTest {

    private final Wallet alice = LedgerFixtures.wallet("alice");
    private final Wallet bob = LedgerFixtures.wallet("bob");
    private final TransactionOutput genesis = new TransactionOutput(100, alice.getPublicKey());
    private final TxValidator validator = new TxValidator();

    @Test
    void commitMovesValueAndPoolsFee() {
        UtxoStore store = LedgerFixtures.storeWith(genesis);
        List<TransactionSuccess> events = new ArrayList<>();
        StateMutator mutator = new StateMutator(events::add);

        Transaction tx = pay(60);
        ValidationResult.FullyValid valid = (ValidationResult.FullyValid) validator.validate(tx, store);
        mutator.commit(tx, valid, store);

        assertFalse(store.contains(genesis.genesisId()));
        assertEquals(new TransactionOutput(60, bob.getPublicKey()), store.get(tx.outputId(0)).orElseThrow());
        assertEquals(BigInteger.valueOf(40), store.rewardPool());
        assertEquals(1, events.size());
        assertSame(tx, events.get(0).transaction());
        assertEquals(BigInteger.valueOf(40), events.get(0).reward());
    }

    @Test
    void rewardPoolOverflowAbortsWholeCommit() {
        UtxoStore store = LedgerFixtures.storeWith(genesis);
        LedgerFixtures.setRewardPool(store, Values.MAX);
        List<TransactionSuccess> events = new ArrayList<>();
        StateMutator mutator = new StateMutator(events::add);

        Transaction tx = pay(60);
        ValidationResult.FullyValid valid = (ValidationResult.FullyValid) validator.validate(tx, store);

        assertThrows(IllegalStateException.class, () -> mutator.commit(tx, valid, store));
        assertTrue(store.contains(genesis.genesisId()));
        assertFalse(store.contains(tx.outputId(0)));
        assertEquals(Values.MAX, store.rewardPool());
        assertTrue(events.isEmpty());
    }

    @Test
    void spentOutputIsNeverSpendableAgain() {
        UtxoStore store = LedgerFixtures.storeWith(genesis);
        StateMutator mutator = new StateMutator();
        Transaction first = pay(100);
        mutator.commit(first, (ValidationResult.FullyValid) validator.validate(first, store), store);

        Transaction second = alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(100, alice.getPublicKey())
                .build());
        ValidationResult again = validator.validate(second, store);

        assertTrue(again.isPending());
        assertEquals(List.of(genesis.genesisId()), again.requires());
    }

    @Test
    void conflictingCommitFromSameSnapshotIsRefused() {
        UtxoStore store = LedgerFixtures.storeWith(genesis);
        StateMutator mutator = new StateMutator();
        Transaction toBob = pay(100);
        Transaction toSelf = alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(100, alice.getPublicKey())
                .build());
        ValidationResult.FullyValid first = (ValidationResult.FullyValid) validator.validate(toBob, store);
        ValidationResult.FullyValid second = (ValidationResult.FullyValid) validator.validate(toSelf, store);

        mutator.commit(toBob, first, store);

        assertThrows(IllegalStateException.class, () -> mutator.commit(toSelf, second, store));
        assertEquals(1, store.size());
        assertTrue(store.contains(toBob.outputId(0)));
        assertFalse(store.contains(toSelf.outputId(0)));
        assertEquals(BigInteger.ZERO, store.rewardPool());
    }

    @Test
    void resultForAnotherTransactionIsRefused() {
        UtxoStore store = LedgerFixtures.storeWith(genesis);
        Transaction tx = pay(60);
        Transaction other = pay(50);
        ValidationResult.FullyValid otherValid = (ValidationResult.FullyValid) validator.validate(other, store);

        assertThrows(IllegalArgumentException.class, () -> new StateMutator().commit(tx, otherValid, store));
        assertTrue(store.contains(genesis.genesisId()));
        assertEquals(BigInteger.ZERO, store.rewardPool());
    }

    @Test
    void failingSinkDoesNotUndoCommit() {
        UtxoStore store = LedgerFixtures.storeWith(genesis);
        StateMutator mutator = new StateMutator(event -> { throw new IllegalStateException("sink down"); });

        Transaction tx = pay(100);
        mutator.commit(tx, (ValidationResult.FullyValid) validator.validate(tx, store), store);

        assertTrue(store.contains(tx.outputId(0)));
        assertEquals(BigInteger.ZERO, store.rewardPool());
    }

    private Transaction pay(long amount) {
        return alice.signAll(Transaction.builder()
                .spend(genesis.genesisId())
                .output(amount, bob.getPublicKey())
                .build());
    }
}
