package io.utxoledger.core.protocol;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * Ed25519 over raw 32-byte keys and 64-byte signatures.
 * Verification rejects non-canonical encodings, so one signature has one valid byte form.
 */
public final class SignatureUtil {
    private SignatureUtil() {}

    public static byte[] sign(byte[] data, Ed25519PrivateKeyParameters priv) {
        try {
            Ed25519Signer signer = new Ed25519Signer();
            signer.init(true, priv);
            signer.update(data, 0, data.length);
            return signer.generateSignature();
        } catch (RuntimeException e) {
            throw new RuntimeException("Signing failed", e);
        }
    }

    public static boolean verify(OwnerKey pub, byte[] data, byte[] signature) {
        if (pub == null || data == null || signature == null
                || signature.length != TransactionInput.SIGNATURE_LENGTH) {
            return false;
        }
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(pub.bytes(), 0));
            verifier.update(data, 0, data.length);
            return verifier.verifySignature(signature);
        } catch (RuntimeException e) {
            // key bytes that do not decode to a curve point
            return false;
        }
    }

    public static OwnerKey publicKeyOf(Ed25519PrivateKeyParameters priv) {
        return new OwnerKey(priv.generatePublicKey().getEncoded());
    }
}
