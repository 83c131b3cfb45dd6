package com.schemeengine.asset;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Settlement asset kept in the engine's own database.
 *
 * Every transfer joins the caller's transaction, so a scheme operation that fails
 * after moving funds rolls those movements back together with its ledger changes.
 * Destination accounts are opened on first credit.
 *
 * Accounts touched by a transfer are row-locked in holder order, so concurrent
 * operations of different schemes that share a participant cannot both spend the
 * same balance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InternalSettlementAsset implements SettlementAsset {

    private final SettlementAccountRepository accountRepository;

    /**
     * Credit a holder with newly issued funds.
     */
    @Transactional
    public void issue(String holder, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Issued amount must be positive");
        }
        SettlementAccount account = accountRepository.findForUpdate(holder)
            .orElseGet(() -> new SettlementAccount(holder));
        account.credit(amount);
        accountRepository.save(account);
        log.info("Issued {} to {}", amount, holder);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean transferFrom(String source, String destination, BigInteger amount) {
        return move(source, destination, amount);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean transfer(String source, String destination, BigInteger amount) {
        return move(source, destination, amount);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String holder) {
        return accountRepository.findById(holder)
            .map(SettlementAccount::getBalance)
            .orElse(BigInteger.ZERO);
    }

    @Override
    public String getAssetName() {
        return "InternalSettlementAsset";
    }

    private boolean move(String source, String destination, BigInteger amount) {
        if (amount.signum() < 0 || destination == null || destination.isBlank()) {
            log.warn("Rejected transfer of {} from {} to {}", amount, source, destination);
            return false;
        }
        if (source.equals(destination)) {
            log.warn("Rejected transfer of {} from {} to itself", amount, source);
            return false;
        }

        SettlementAccount from;
        SettlementAccount to;
        if (source.compareTo(destination) < 0) {
            from = lock(source);
            to = lock(destination);
        } else {
            to = lock(destination);
            from = lock(source);
        }

        if (from == null || !from.canCover(amount)) {
            log.info("Transfer of {} from {} to {} declined: insufficient funds", amount, source, destination);
            return false;
        }
        if (to == null) {
            to = new SettlementAccount(destination);
        }

        from.debit(amount);
        to.credit(amount);
        accountRepository.save(from);
        accountRepository.save(to);

        log.debug("Moved {} from {} to {}", amount, source, destination);
        return true;
    }

    private SettlementAccount lock(String holder) {
        return accountRepository.findForUpdate(holder).orElse(null);
    }
}
