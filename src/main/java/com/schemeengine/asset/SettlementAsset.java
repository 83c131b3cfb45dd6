package com.schemeengine.asset;

import java.math.BigInteger;

/**
 * Fungible settlement asset used as the custody and transfer rail for schemes.
 *
 * Participants deposit this asset into a scheme's custody account and are repaid
 * in it. The scheme engine never owns balances of this asset; it only asks the
 * asset to move them.
 *
 * FAILURE SEMANTICS:
 * A transfer either returns {@code true} having moved the full amount, or returns
 * {@code false} (or throws) having moved nothing. The scheme engine treats any
 * failure as fatal for the containing operation.
 *
 * ATOMICITY:
 * Scheme operations interleave several transfers with ledger updates. An
 * implementation that takes part in the caller's transaction (such as
 * {@link InternalSettlementAsset}) gets all-or-nothing behaviour for free.
 * Implementations backed by a remote system must provide compensation themselves.
 */
public interface SettlementAsset {

    /**
     * Pull funds from a holder into a destination account.
     * Used when a participant deposits into a scheme.
     *
     * @param source holder whose balance is debited
     * @param destination holder whose balance is credited
     * @param amount amount to move
     * @return true if the full amount moved
     */
    boolean transferFrom(String source, String destination, BigInteger amount);

    /**
     * Push funds from an account the engine controls to a destination.
     * Used for withdrawals, purchase payments and redemptions out of custody.
     *
     * @param source holder whose balance is debited (a scheme custody account)
     * @param destination holder whose balance is credited
     * @param amount amount to move
     * @return true if the full amount moved
     */
    boolean transfer(String source, String destination, BigInteger amount);

    /**
     * Get the balance of a holder. Unknown holders have a zero balance.
     */
    BigInteger balanceOf(String holder);

    /**
     * Get the name of this asset, used for logging.
     */
    String getAssetName();
}
