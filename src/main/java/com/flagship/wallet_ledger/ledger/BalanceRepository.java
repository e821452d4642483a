package com.flagship.wallet_ledger.ledger;

import com.flagship.wallet_ledger.store.Deadline;
import com.flagship.wallet_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Owns the balance rows. Every balance mutation in the system goes through here.
 *
 * Invariants enforced:
 * 1. A balance never goes negative: transfers check funds inside the same
 *    serializable transaction that debits the sender
 * 2. Transfers conserve money: the debit and the credit commit together
 * 3. Deposits are a single atomic increment, so concurrent deposits never lose an update
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceRepository {

    private final LedgerStore store;

    /**
     * Current balance, zero for an account that has never been touched.
     * Does not create the account.
     */
    public BigDecimal getBalance(String accountId) {
        return store.findBalance(accountId)
                .map(AccountBalance::getAmount)
                .orElse(Amounts.ZERO);
    }

    /**
     * Creates a zero balance if the account has none. Never overwrites an existing one.
     */
    public AccountBalance ensureInitialized(String accountId) {
        return store.ensureExists(accountId);
    }

    public AccountBalance deposit(String accountId, BigDecimal amount, Deadline deadline) {
        BigDecimal credited = Amounts.requirePositive(amount);
        AccountBalance updated = store.atomicIncrement(accountId, credited, deadline);
        log.debug("Deposited {} to {}: balance={} version={}",
                credited, accountId, updated.getAmount(), updated.getVersion());
        return updated;
    }

    public TransferOutcome transfer(String sender, String recipient, BigDecimal amount, Deadline deadline) {
        return transfer(sender, recipient, amount, deadline, false);
    }

    /**
     * Moves {@code amount} from sender to recipient in one store transaction.
     *
     * @param appendSentRecord also append the sender's TRANSFER_SENT record in the same transaction
     * @throws LedgerException INSUFFICIENT_FUNDS if the sender's balance is below {@code amount};
     *                         nothing is written in that case
     */
    public TransferOutcome transfer(String sender, String recipient, BigDecimal amount,
                                    Deadline deadline, boolean appendSentRecord) {
        BigDecimal moved = Amounts.requirePositive(amount);

        return store.runTransaction(tx -> {
            AccountBalance from = tx.read(sender).orElse(AccountBalance.empty(sender));
            if (!from.covers(moved)) {
                throw new LedgerException(ErrorKind.INSUFFICIENT_FUNDS,
                        String.format("%s has %s, transfer needs %s", sender, from.getAmount(), moved));
            }

            AccountBalance debited = tx.write(from.plus(moved.negate()));

            AccountBalance credited = tx.read(recipient)
                    .map(to -> tx.write(to.plus(moved)))
                    .orElseGet(() -> tx.insertIfAbsent(recipient, moved));

            TransactionRecord sent = appendSentRecord
                    ? tx.append(TransactionRecord.transferSent(sender, recipient, moved))
                    : null;

            return new TransferOutcome(debited, credited, sent);
        }, deadline);
    }
}
