package io.utxoledger.core.mempool;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.SignatureUtil;
import io.utxoledger.core.protocol.Transaction;
import io.utxoledger.core.protocol.TransactionInput;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.protocol.Values;
import io.utxoledger.core.state.UtxoStore;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a transaction against the current unspent-output set.
 * Read-only: the store is never written here.
 */
public class TxValidator {

    public ValidationResult validate(Transaction tx, UtxoStore ledger) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        if (tx.inputs().isEmpty()) {
            return ValidationResult.rejected(ValidationError.EMPTY_INPUTS);
        }
        if (tx.outputs().isEmpty()) {
            return ValidationResult.rejected(ValidationError.EMPTY_OUTPUTS);
        }

        // equal (outPoint, signature) pairs, or one outPoint claimed under two signatures
        Set<Hash> claimed = new HashSet<>();
        for (TransactionInput input : tx.inputs()) {
            if (!claimed.add(input.outPoint())) {
                return ValidationResult.rejected(ValidationError.DUPLICATE_INPUT);
            }
        }
        if (new HashSet<>(tx.outputs()).size() != tx.outputs().size()) {
            return ValidationResult.rejected(ValidationError.DUPLICATE_OUTPUT);
        }

        byte[] signingPayload = tx.signingPayload();
        BigInteger totalInput = BigInteger.ZERO;
        BigInteger totalOutput = BigInteger.ZERO;
        Set<Hash> missing = new LinkedHashSet<>();
        List<Hash> provides = new ArrayList<>(tx.outputs().size());

        for (TransactionInput input : tx.inputs()) {
            Optional<TransactionOutput> spent = ledger.get(input.outPoint());
            if (spent.isEmpty()) {
                missing.add(input.outPoint());
                continue;
            }
            if (!SignatureUtil.verify(spent.get().ownerKey(), signingPayload, input.signature())) {
                return ValidationResult.rejected(ValidationError.INVALID_SIGNATURE);
            }
            try {
                totalInput = Values.checkedAdd(totalInput, spent.get().value());
            } catch (ArithmeticException e) {
                return ValidationResult.rejected(ValidationError.INPUT_OVERFLOW);
            }
        }

        byte[] encoded = tx.serialize();
        long index = 0;
        for (TransactionOutput output : tx.outputs()) {
            if (output.value().signum() == 0) {
                return ValidationResult.rejected(ValidationError.ZERO_VALUE_OUTPUT);
            }
            Hash id = Transaction.outputId(encoded, index);
            try {
                index = Math.addExact(index, 1L);
            } catch (ArithmeticException e) {
                return ValidationResult.rejected(ValidationError.INDEX_OVERFLOW);
            }
            if (ledger.contains(id)) {
                return ValidationResult.rejected(ValidationError.OUTPUT_COLLISION);
            }
            try {
                totalOutput = Values.checkedAdd(totalOutput, output.value());
            } catch (ArithmeticException e) {
                return ValidationResult.rejected(ValidationError.OUTPUT_OVERFLOW);
            }
            provides.add(id);
        }

        if (!missing.isEmpty()) {
            return ValidationResult.pending(new ArrayList<>(missing), provides);
        }
        if (totalInput.compareTo(totalOutput) < 0) {
            return ValidationResult.rejected(ValidationError.INSUFFICIENT_INPUT_VALUE);
        }
        BigInteger reward;
        try {
            reward = Values.checkedSub(totalInput, totalOutput);
        } catch (ArithmeticException e) {
            return ValidationResult.rejected(ValidationError.REWARD_UNDERFLOW);
        }
        return ValidationResult.fullyValid(provides, reward);
    }
}
