package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.config.LedgerProperties;
import com.flagship.credit_ledger.exception.LedgerValidationException;
import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountStore;
import com.flagship.credit_ledger.ledger.LedgerJournal;
import com.flagship.credit_ledger.transaction.Transaction;
import com.flagship.credit_ledger.transaction.TransactionPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the ledger: balances and transaction history. Never takes locks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final AccountStore accountStore;
    private final LedgerJournal ledgerJournal;
    private final TransactionPersistenceService persistenceService;
    private final LedgerProperties properties;

    /**
     * One entry per account the user owns, ordered by asset type. Unknown users get an empty list.
     */
    public List<AccountBalance> getBalances(String userId) {
        List<Account> accounts = accountStore.findByUser(userId);
        log.debug("Reading balances of {} accounts for user {}", accounts.size(), userId);
        return accounts.stream()
            .map(account -> new AccountBalance(
                account.getAssetTypeCode(),
                account.getId(),
                ledgerJournal.balanceOf(account.getId())))
            .toList();
    }

    /**
     * Newest-first page of a user's transactions.
     *
     * @param limit page size, defaults to ledger.history.default-limit; must be within 1..max-limit
     * @param offset rows to skip, defaults to 0
     */
    public List<Transaction> getHistory(String userId, Integer limit, Integer offset) {
        LedgerProperties.History history = properties.getHistory();
        int pageSize = limit != null ? limit : history.getDefaultLimit();
        int skip = offset != null ? offset : 0;

        if (pageSize < 1 || pageSize > history.getMaxLimit()) {
            throw new LedgerValidationException("Limit must be between 1 and " + history.getMaxLimit());
        }
        if (skip < 0) {
            throw new LedgerValidationException("Offset must not be negative");
        }
        return persistenceService.history(userId, pageSize, skip);
    }
}
