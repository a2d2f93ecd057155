package io.utxoledger.core.protocol;

import io.utxoledger.core.LedgerFixtures;
import io.utxoledger.core.wallet.Wallet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTest {

    private final Wallet alice = LedgerFixtures.wallet("alice");
    private final Wallet bob = LedgerFixtures.wallet("bob");

    @Test
    void signingPayloadIgnoresSignatures() {
        Transaction unsigned = sampleTx();
        Transaction signed = alice.signAll(unsigned);

        assertArrayEquals(unsigned.signingPayload(), signed.signingPayload());
        assertArrayEquals(unsigned.serialize(), signed.signingPayload());
        assertFalse(Arrays.equals(signed.serialize(), signed.signingPayload()));
    }

    @Test
    void signingPayloadDependsOnInputOrder() {
        Hash a = Hashes.hashOf(new byte[] {1});
        Hash b = Hashes.hashOf(new byte[] {2});
        Transaction ab = Transaction.builder().spend(a).spend(b).output(5, bob.getPublicKey()).build();
        Transaction ba = Transaction.builder().spend(b).spend(a).output(5, bob.getPublicKey()).build();

        assertFalse(Arrays.equals(ab.signingPayload(), ba.signingPayload()));
    }

    @Test
    void outputIdIsDeterministicAndBoundToSignatures() {
        Transaction signed = alice.signAll(sampleTx());
        Transaction same = TransactionCodec.fromBytes(signed.serialize());

        assertEquals(signed.outputId(0), same.outputId(0));
        assertNotEquals(signed.outputId(0), signed.outputId(1));
        assertNotEquals(signed.outputId(0), sampleTx().outputId(0));
        assertEquals(Hashes.hashWithIndex(signed.serialize(), 1), signed.outputId(1));
    }

    @Test
    void genesisAndRewardIdsHashOutputContent() {
        TransactionOutput out = new TransactionOutput(100, alice.getPublicKey());

        assertEquals(Hashes.hashOf(out.serialize()), out.genesisId());
        assertEquals(Hashes.hashWithIndex(out.serialize(), 9L), out.rewardId(9L));
        assertNotEquals(out.rewardId(9L), out.rewardId(10L));
    }

    @Test
    void encodedSizeMatchesLayout() {
        Transaction tx = sampleTx();
        assertEquals(4 + 96 + 4 + 2 * 48, tx.serialize().length);
    }

    private Transaction sampleTx() {
        return Transaction.builder()
                .spend(Hashes.hashOf(new byte[] {42}))
                .output(60, bob.getPublicKey())
                .output(40, alice.getPublicKey())
                .build();
    }
}
