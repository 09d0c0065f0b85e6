package com.flagship.credit_ledger.transaction;

import com.flagship.credit_ledger.exception.InsufficientBalanceException;
import com.flagship.credit_ledger.ledger.AccountStore;
import com.flagship.credit_ledger.ledger.LedgerJournal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes one transaction atomically.
 *
 * Inside a single unit of work:
 * 1. Lock both accounts in canonical (lexicographic id) order
 * 2. Re-check the idempotency key now that the lock is held
 * 3. For SPEND, read the user's balance under lock and reject if it is short
 * 4. Insert the transaction row, append the entry pair, bump account versions
 *
 * Every writer to a given account pair takes the locks in the same order,
 * so opposing-direction transactions on the same pair cannot deadlock.
 */
@Service
@Slf4j
public class LedgerPostingService {

    private final TransactionTemplate transactionTemplate;
    private final AccountStore accountStore;
    private final LedgerJournal ledgerJournal;
    private final TransactionPersistenceService persistenceService;

    public LedgerPostingService(@Qualifier("postingTransactionTemplate") TransactionTemplate transactionTemplate,
                                AccountStore accountStore,
                                LedgerJournal ledgerJournal,
                                TransactionPersistenceService persistenceService) {
        this.transactionTemplate = transactionTemplate;
        this.accountStore = accountStore;
        this.ledgerJournal = ledgerJournal;
        this.persistenceService = persistenceService;
    }

    /**
     * @throws InsufficientBalanceException if a SPEND exceeds the balance read under lock
     * @throws org.springframework.dao.DataIntegrityViolationException if a concurrent writer won the idempotency key
     */
    public TransactionResult post(PostingPlan plan) {
        return transactionTemplate.execute(status -> {
            List<String> lockOrder = lockOrder(plan.getDebitAccountId(), plan.getCreditAccountId());
            accountStore.lock(lockOrder);

            Optional<Transaction> existing = persistenceService.findByIdempotencyKey(plan.getIdempotencyKey());
            if (existing.isPresent()) {
                log.info("Idempotency key {} committed while waiting for locks, returning {}",
                    plan.getIdempotencyKey(), existing.get().getId());
                return TransactionResult.replayed(existing.get());
            }

            if (plan.getType().requiresFunds()) {
                BigDecimal balance = ledgerJournal.balanceOf(plan.getUserAccountId());
                if (balance.compareTo(plan.getAmount()) < 0) {
                    throw new InsufficientBalanceException(
                        plan.getUserId(), plan.getAssetTypeCode(), balance, plan.getAmount());
                }
            }

            Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
            Transaction transaction = Transaction.builder()
                .id(UUID.randomUUID().toString())
                .type(plan.getType())
                .status(TransactionStatus.COMPLETED)
                .userId(plan.getUserId())
                .assetTypeCode(plan.getAssetTypeCode())
                .amount(plan.getAmount())
                .debitAccountId(plan.getDebitAccountId())
                .creditAccountId(plan.getCreditAccountId())
                .idempotencyKey(plan.getIdempotencyKey())
                .description(plan.getType().describe(plan.getUserId()))
                .metadata(plan.getMetadata())
                .createdAt(now)
                .build();

            persistenceService.insert(transaction);
            ledgerJournal.append(transaction.getId(), plan.getDebitAccountId(), plan.getCreditAccountId(),
                plan.getAssetTypeCode(), plan.getAmount(), now);
            accountStore.incrementVersions(lockOrder, now);

            return TransactionResult.created(transaction);
        });
    }

    /**
     * Canonical lock order for two accounts: ascending by id.
     */
    static List<String> lockOrder(String firstAccountId, String secondAccountId) {
        return firstAccountId.compareTo(secondAccountId) <= 0
            ? List.of(firstAccountId, secondAccountId)
            : List.of(secondAccountId, firstAccountId);
    }
}
