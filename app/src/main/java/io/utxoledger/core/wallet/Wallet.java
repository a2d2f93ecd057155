package io.utxoledger.core.wallet;

import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.SignatureUtil;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionInput;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;

import java.security.SecureRandom;
import java.util.List;

/** Ed25519 key holder that signs transaction inputs it owns. */
public class Wallet {
    private final Ed25519PrivateKeyParameters privateKey;
    private final OwnerKey publicKey;

    public Wallet(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = SignatureUtil.publicKeyOf(privateKey);
    }

    public static Wallet generate() {
        return new Wallet(new Ed25519PrivateKeyParameters(new SecureRandom()));
    }

    /** Deterministic wallet from a 32-byte seed (tests, fixtures). */
    public static Wallet fromSeed(byte[] seed) {
        if (seed == null || seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Seed must be 32 bytes");
        }
        return new Wallet(new Ed25519PrivateKeyParameters(seed, 0));
    }

    public OwnerKey getPublicKey() {
        return publicKey;
    }

    public byte[] sign(byte[] data) {
        return SignatureUtil.sign(data, privateKey);
    }

    public boolean verify(byte[] data, byte[] signature) {
        return SignatureUtil.verify(publicKey, data, signature);
    }

    /** Sign the signing payload of {@code tx} into the given input positions. */
    public Transaction signInputs(Transaction tx, int... inputIndexes) {
        byte[] payload = tx.signingPayload();
        byte[] sig = sign(payload);
        Transaction signed = tx;
        for (int index : inputIndexes) {
            signed = signed.withSignature(index, sig);
        }
        return signed;
    }

    /** Sign every input of {@code tx}; only meaningful when this wallet owns all of them. */
    public Transaction signAll(Transaction tx) {
        List<TransactionInput> inputs = tx.inputs();
        int[] all = new int[inputs.size()];
        for (int i = 0; i < all.length; i++) all[i] = i;
        return signInputs(tx, all);
    }
}
