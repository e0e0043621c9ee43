package com.chooserich.service;

import com.chooserich.model.GameKind;
import com.chooserich.model.GameSession;
import com.chooserich.model.LedgerTransaction;
import com.chooserich.model.TransactionKind;
import com.chooserich.repository.SessionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Keeps money movement and game outcome in step.
 *
 * <p>A session is only published after its stake has been debited, and only the request that stored a
 * terminal transition settles it, so each session is paid out at most once.
 */
@ApplicationScoped
public class SettlementCoordinator {

    private static final Logger LOG = Logger.getLogger(SettlementCoordinator.class);

    private final LedgerService ledgerService;
    private final SessionStore sessionStore;

    @Inject
    public SettlementCoordinator(LedgerService ledgerService, SessionStore sessionStore) {
        this.ledgerService = ledgerService;
        this.sessionStore = sessionStore;
    }

    public BigDecimal normalizeStake(BigDecimal stake) {
        if (stake == null || stake.signum() <= 0) {
            throw GameException.invalidConfiguration("Stake must be positive");
        }
        try {
            return stake.setScale(Payouts.SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw GameException.invalidConfiguration("Stake supports at most " + Payouts.SCALE + " decimals");
        }
    }

    /**
     * Debits the stake, records it and publishes the session.
     *
     * @return the stored version of the session
     */
    public long open(GameSession session, String description) {
        GameKind kind = session.getKind();
        String owner = session.getOwner();
        BigDecimal stake = session.getStake();

        boolean debited;
        try {
            debited = ledgerService.debitIfAvailable(owner, stake);
        } catch (RuntimeException e) {
            LOG.error("Stake debit failed for " + owner + " (" + kind.label() + ")", e);
            throw GameException.internal("Could not debit stake", e);
        }
        if (!debited) {
            throw GameException.insufficientFunds();
        }

        try {
            ledgerService.recordTransaction(transaction(session, TransactionKind.STAKE, stake, description));
            long version = sessionStore.put(kind, session.getId(), SessionStore.ABSENT, session);
            LOG.info("Opened " + kind.label() + " session " + session.getId() + " for " + owner + " with stake " + stake);
            return version;
        } catch (RuntimeException e) {
            refund(session, e);
            throw GameException.internal("Could not open " + kind.label() + " session", e);
        }
    }

    /**
     * Settles a session whose terminal state has already been stored by the caller.
     */
    public void settle(GameSession session, BigDecimal payout, String description) {
        String owner = session.getOwner();
        boolean won = payout != null && payout.signum() > 0;
        try {
            if (won) {
                ledgerService.credit(owner, payout);
                ledgerService.recordTransaction(transaction(session, TransactionKind.CASHOUT, payout,
                        description + " - paid " + payout + " on a stake of " + session.getStake()));
            }
            ledgerService.recordTransaction(transaction(session,
                    won ? TransactionKind.BET_WIN : TransactionKind.BET_LOSS, session.getStake(), description));
        } catch (RuntimeException e) {
            LOG.error("CRITICAL: settlement of " + session.getKind().label() + " session " + session.getId()
                    + " failed for " + owner + " (payout " + payout + ")", e);
            throw GameException.internal("Could not settle session", e);
        }
        LOG.info("Settled " + session.getKind().label() + " session " + session.getId() + " for " + owner
                + ": " + (won ? "won " + payout : "lost " + session.getStake()));
    }

    private void refund(GameSession session, RuntimeException cause) {
        LOG.error("Publishing session " + session.getId() + " failed after the stake was debited; refunding", cause);
        try {
            ledgerService.credit(session.getOwner(), session.getStake());
            ledgerService.recordTransaction(transaction(session, TransactionKind.REFUND, session.getStake(),
                    "Refund of stake for unopened " + session.getKind().label() + " session"));
        } catch (RuntimeException e) {
            LOG.error("CRITICAL: refund of " + session.getStake() + " to " + session.getOwner() + " failed", e);
        }
    }

    private static LedgerTransaction transaction(GameSession session, TransactionKind kind, BigDecimal amount,
            String description) {
        return new LedgerTransaction(UUID.randomUUID().toString(), session.getOwner(), kind, amount,
                session.getKind(), session.getId(), description, System.currentTimeMillis());
    }
}
