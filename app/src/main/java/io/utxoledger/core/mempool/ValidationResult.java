package io.utxoledger.core.mempool;

import io.utxoledger.core.protocol.Hash;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of {@link TxValidator#validate}: exactly one of {@link FullyValid},
 * {@link Pending} or {@link Rejected}. Only a {@code FullyValid} can be committed.
 */
public abstract class ValidationResult {

    private ValidationResult() {}

    public static FullyValid fullyValid(List<Hash> provides, BigInteger reward) {
        return new FullyValid(provides, reward);
    }

    public static Pending pending(List<Hash> requires, List<Hash> provides) {
        return new Pending(requires, provides);
    }

    public static Rejected rejected(ValidationError error) {
        return new Rejected(error);
    }

    /** Ids that must be present before the transaction can commit. */
    public abstract List<Hash> requires();

    /** Ids the transaction creates once committed. */
    public abstract List<Hash> provides();

    public boolean isFullyValid() { return this instanceof FullyValid; }
    public boolean isPending() { return this instanceof Pending; }
    public boolean isRejected() { return this instanceof Rejected; }

    /** Every input resolved and verified; value conserved. */
    public static final class FullyValid extends ValidationResult {
        private final List<Hash> provides;
        private final BigInteger reward;

        private FullyValid(List<Hash> provides, BigInteger reward) {
            this.provides = List.copyOf(provides);
            this.reward = reward;
        }

        @Override public List<Hash> requires() { return List.of(); }
        @Override public List<Hash> provides() { return provides; }

        /** Inputs minus outputs; accrues to the reward pool on commit. */
        public BigInteger reward() { return reward; }

        @Override public String toString() {
            return "FullyValid{provides=" + provides.size() + ", reward=" + reward + "}";
        }
    }

    /**
     * Some inputs reference ids not in the ledger yet. Every resolvable input was
     * verified; the rest are listed in {@link #requires()}.
     */
    public static final class Pending extends ValidationResult {
        private final List<Hash> requires;
        private final List<Hash> provides;

        private Pending(List<Hash> requires, List<Hash> provides) {
            this.requires = List.copyOf(requires);
            this.provides = List.copyOf(provides);
        }

        @Override public List<Hash> requires() { return requires; }
        @Override public List<Hash> provides() { return provides; }

        @Override public String toString() {
            return "Pending{requires=" + requires.size() + ", provides=" + provides.size() + "}";
        }
    }

    public static final class Rejected extends ValidationResult {
        private final ValidationError error;

        private Rejected(ValidationError error) {
            this.error = error;
        }

        public ValidationError error() { return error; }

        @Override public List<Hash> requires() { return List.of(); }
        @Override public List<Hash> provides() { return List.of(); }

        @Override public String toString() {
            return "ERR[" + error + "]: " + error.message();
        }
    }
}
