package io.utxoledger.core.reward;

import io.utxoledger.core.protocol.Hash;

import java.math.BigInteger;
import java.util.List;

/** What one block-finalization payout did to the reward pool. */
public final class DistributionResult {

    public enum Status {
        /** Shares minted; the remainder stays pooled. */
        DISTRIBUTED,
        /** No authorities: nothing divided, the pool is untouched. */
        SKIPPED_NO_AUTHORITIES,
        /** Pool smaller than the authority count: the whole pool is carried forward. */
        DEFERRED_SHARE_ZERO
    }

    private final Status status;
    private final BigInteger drained;
    private final BigInteger share;
    private final BigInteger carried;
    private final List<Hash> minted;
    private final int wasted;

    DistributionResult(Status status, BigInteger drained, BigInteger share, BigInteger carried,
                       List<Hash> minted, int wasted) {
        this.status = status;
        this.drained = drained;
        this.share = share;
        this.carried = carried;
        this.minted = List.copyOf(minted);
        this.wasted = wasted;
    }

    public Status status() { return status; }
    /** Pool value read at the start of the round. */
    public BigInteger drained() { return drained; }
    public BigInteger share() { return share; }
    /** Pool value after the round. */
    public BigInteger carried() { return carried; }
    public List<Hash> minted() { return minted; }
    /** Shares skipped because their output id already existed. */
    public int wasted() { return wasted; }

    @Override public String toString() {
        return "DistributionResult{" + status + ", drained=" + drained + ", share=" + share
                + ", carried=" + carried + ", minted=" + minted.size() + ", wasted=" + wasted + "}";
    }
}
