package io.utxoledger.core.reward;

import io.utxoledger.core.metrics.LedgerMetrics;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.OwnerKey;
import io.utxoledger.core.protocol.TransactionOutput;
import io.utxoledger.core.protocol.Values;
import io.utxoledger.core.state.LedgerUpdate;
import io.utxoledger.core.state.UtxoStore;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Splits the reward pool evenly between the current authorities at block finalization.
 *
 * <p>The remainder of the division is carried to the next round. When the pool is
 * smaller than the number of authorities the whole pool is carried forward instead of
 * minting zero-value outputs. Each payout is keyed by H(output || blockHeight); if that
 * id is already taken the share is wasted and logged.
 */
public final class RewardDistributor {
    private static final Logger LOG = Logger.getLogger(RewardDistributor.class.getName());

    public DistributionResult distribute(List<OwnerKey> authorities, long blockHeight, UtxoStore ledger) {
        BigInteger pool = ledger.rewardPool();

        if (authorities == null || authorities.isEmpty()) {
            LedgerMetrics.recordSkipped();
            LOG.warning("Reward distribution skipped at height " + blockHeight
                    + ": no authorities (pool " + pool + " kept)");
            return new DistributionResult(DistributionResult.Status.SKIPPED_NO_AUTHORITIES,
                    pool, BigInteger.ZERO, pool, List.of(), 0);
        }

        BigInteger n = BigInteger.valueOf(authorities.size());
        BigInteger share = pool.divide(n);
        if (share.signum() == 0) {
            LOG.fine(() -> "Reward pool " + pool + " below authority count " + n + ", carried forward");
            return new DistributionResult(DistributionResult.Status.DEFERRED_SHARE_ZERO,
                    pool, BigInteger.ZERO, pool, List.of(), 0);
        }
        BigInteger remainder = Values.checkedSub(pool, Values.checkedMul(share, n));

        LedgerUpdate.Builder update = LedgerUpdate.builder().rewardPool(remainder);
        List<Hash> minted = new ArrayList<>(authorities.size());
        int wasted = 0;
        for (OwnerKey authority : authorities) {
            TransactionOutput payout = new TransactionOutput(share, authority);
            Hash id = payout.rewardId(blockHeight);
            if (ledger.contains(id) || update.inserts(id)) {
                wasted++;
                LedgerMetrics.recordWasted();
                LOG.warning("Transaction reward wasted due to hash collision: " + id.hex());
                continue;
            }
            update.insert(id, payout);
            minted.add(id);
        }
        ledger.apply(update.build());

        LedgerMetrics.recordMinted(minted.size());
        for (Hash id : minted) {
            LOG.info("Transaction reward sent to " + id.hex());
        }
        return new DistributionResult(DistributionResult.Status.DISTRIBUTED,
                pool, share, remainder, minted, wasted);
    }
}
