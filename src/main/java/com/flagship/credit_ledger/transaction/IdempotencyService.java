package com.flagship.credit_ledger.transaction;

import com.flagship.credit_ledger.exception.LedgerValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Idempotency key lookup.
 *
 * Keys are global across users and types. The unique constraint on
 * transactions.idempotency_key is the source of truth; this service only reads it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private final TransactionPersistenceService persistenceService;

    /**
     * @return the transaction previously written under this key, if any
     * @throws LedgerValidationException if the key is blank
     */
    public Optional<Transaction> find(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new LedgerValidationException("Idempotency key is required");
        }
        return persistenceService.findByIdempotencyKey(idempotencyKey);
    }

    /**
     * Logs when a replayed key arrives with a different payload. The stored transaction still wins.
     */
    public void warnOnMismatch(Transaction existing, TransactionType type, String userId,
                               String assetTypeCode, BigDecimal amount) {
        boolean matches = existing.getType() == type
            && existing.getUserId().equals(userId)
            && existing.getAssetTypeCode().equals(assetTypeCode)
            && existing.getAmount().compareTo(amount) == 0;

        if (!matches) {
            log.warn("Idempotency key {} reused with a different request: stored {} {} {} for user {}, " +
                    "received {} {} {} for user {}",
                existing.getIdempotencyKey(),
                existing.getType(), existing.getAmount().toPlainString(), existing.getAssetTypeCode(), existing.getUserId(),
                type, amount.toPlainString(), assetTypeCode, userId);
        }
    }
}
