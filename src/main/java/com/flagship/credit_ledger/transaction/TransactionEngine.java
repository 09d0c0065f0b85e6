package com.flagship.credit_ledger.transaction;

import com.flagship.credit_ledger.asset.AssetRegistry;
import com.flagship.credit_ledger.config.LedgerProperties;
import com.flagship.credit_ledger.exception.InsufficientBalanceException;
import com.flagship.credit_ledger.exception.LedgerConflictException;
import com.flagship.credit_ledger.exception.LedgerException;
import com.flagship.credit_ledger.exception.LedgerIntegrityException;
import com.flagship.credit_ledger.exception.LedgerValidationException;
import com.flagship.credit_ledger.ledger.Account;
import com.flagship.credit_ledger.ledger.AccountStore;
import com.flagship.credit_ledger.ledger.LedgerEntry;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionTimedOutException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every balance-changing operation.
 *
 * process() validates the request, short-circuits known idempotency keys,
 * checks the asset is active, resolves the user and treasury accounts and hands a {@link PostingPlan} to
 * {@link LedgerPostingService}. Store failures are mapped to the ledger's error taxonomy:
 * - unique-key violation: re-read by key and return the winner as a replay
 * - lock timeout or transient failure: {@link LedgerConflictException}, safe to retry with the same key
 */
@Service
@Slf4j
public class TransactionEngine {

    static final int MAX_USER_ID_LENGTH = 100;
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final LedgerProperties properties;
    private final AssetRegistry assetRegistry;
    private final AccountStore accountStore;
    private final IdempotencyService idempotencyService;
    private final LedgerPostingService postingService;
    private final LedgerMetrics metrics;

    public TransactionEngine(LedgerProperties properties,
                             AssetRegistry assetRegistry,
                             AccountStore accountStore,
                             IdempotencyService idempotencyService,
                             LedgerPostingService postingService,
                             LedgerMetrics metrics) {
        this.properties = properties;
        this.assetRegistry = assetRegistry;
        this.accountStore = accountStore;
        this.idempotencyService = idempotencyService;
        this.postingService = postingService;
        this.metrics = metrics;
    }

    /**
     * Applies one credit movement exactly once per idempotency key.
     *
     * @return the transaction, flagged as replayed when the key had already been used
     * @throws LedgerValidationException for malformed input (nothing written)
     * @throws InsufficientBalanceException for a SPEND above the balance
     * @throws LedgerConflictException when the posting timed out or hit transient contention
     * @throws LedgerIntegrityException for an unrecoverable constraint violation
     */
    public TransactionResult process(TransactionType type, String userId, String assetTypeCode,
                                     BigDecimal amount, String idempotencyKey, Map<String, Object> metadata) {
        long startTime = System.nanoTime();
        String typeTag = type != null ? type.name() : "unknown";

        try {
            TransactionResult result = doProcess(type, userId, assetTypeCode, amount, idempotencyKey, metadata);
            metrics.recordTransaction(typeTag, result.isReplayed() ? "replayed" : "created");
            return result;
        } catch (LedgerException e) {
            metrics.recordTransaction(typeTag, e.getOutcome());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordTransaction(typeTag, "error");
            throw e;
        } finally {
            metrics.recordLatency(typeTag, Duration.ofNanos(System.nanoTime() - startTime));
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.USER_ID_MDC_KEY);
        }
    }

    private TransactionResult doProcess(TransactionType type, String userId, String assetTypeCode,
                                        BigDecimal amount, String idempotencyKey, Map<String, Object> metadata) {
        BigDecimal normalizedAmount = validate(type, userId, idempotencyKey, amount);

        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userId);

        Optional<Transaction> existing = idempotencyService.find(idempotencyKey);
        if (existing.isPresent()) {
            metrics.recordIdempotencyHit();
            return replay(existing.get(), type, userId, assetTypeCode, normalizedAmount);
        }
        metrics.recordIdempotencyMiss();

        // a committed key replays even after its asset is deactivated
        assetRegistry.findActive(assetTypeCode);

        Account userAccount = accountStore.resolveOrCreate(userId, assetTypeCode, Account.Kind.USER);
        Account treasuryAccount = accountStore.resolveOrCreate(
            properties.getTreasuryUserId(), assetTypeCode, Account.Kind.SYSTEM);
        requireKind(userAccount, Account.Kind.USER);
        requireKind(treasuryAccount, Account.Kind.SYSTEM);

        PostingPlan plan = PostingPlan.builder()
            .type(type)
            .userId(userId)
            .assetTypeCode(assetTypeCode)
            .amount(normalizedAmount)
            .idempotencyKey(idempotencyKey)
            .metadata(metadata)
            .userAccountId(userAccount.getId())
            .treasuryAccountId(treasuryAccount.getId())
            .build();

        TransactionResult result;
        try {
            result = postingService.post(plan);
        } catch (DataIntegrityViolationException e) {
            return recoverFromConstraintViolation(plan, e);
        } catch (TransientDataAccessException | TransactionTimedOutException e) {
            log.warn("Posting {} for user {} hit contention, rolled back: {}", type, userId, e.getMessage());
            throw new LedgerConflictException(
                "Transaction could not be completed in time; retry with the same idempotency key", e);
        }

        Transaction transaction = result.getTransaction();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId());
        if (result.isReplayed()) {
            log.info("Idempotency key {} already used, returning existing transaction", idempotencyKey);
        } else {
            log.info("{} accepted: {} {} for user {}",
                type, transaction.getAmount().toPlainString(), assetTypeCode, userId);
        }
        return result;
    }

    private TransactionResult replay(Transaction existing, TransactionType type, String userId,
                                     String assetTypeCode, BigDecimal amount) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, existing.getId());
        idempotencyService.warnOnMismatch(existing, type, userId, assetTypeCode, amount);
        log.info("Idempotency key {} already used, returning existing transaction", existing.getIdempotencyKey());
        return TransactionResult.replayed(existing);
    }

    /**
     * A concurrent request with the same key committed first. Anything else is an integrity failure.
     */
    private TransactionResult recoverFromConstraintViolation(PostingPlan plan, DataIntegrityViolationException e) {
        Optional<Transaction> winner = idempotencyService.find(plan.getIdempotencyKey());
        if (winner.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Lost idempotency race for key {}", plan.getIdempotencyKey());
            return replay(winner.get(), plan.getType(), plan.getUserId(), plan.getAssetTypeCode(), plan.getAmount());
        }
        log.error("Constraint violation posting {} for user {} with key {}",
            plan.getType(), plan.getUserId(), plan.getIdempotencyKey(), e);
        throw new LedgerIntegrityException("Ledger write rejected by a constraint: " + rootMessage(e), e);
    }

    private BigDecimal validate(TransactionType type, String userId, String idempotencyKey, BigDecimal amount) {
        if (type == null) {
            throw new LedgerValidationException("Transaction type is required");
        }
        if (!type.isSupported()) {
            throw new LedgerValidationException("Transaction type is not supported: " + type);
        }
        if (userId == null || userId.isBlank()) {
            throw new LedgerValidationException("User id is required");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new LedgerValidationException("User id must be at most " + MAX_USER_ID_LENGTH + " characters");
        }
        if (userId.equals(properties.getTreasuryUserId())) {
            throw new LedgerValidationException("User id is reserved: " + userId);
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new LedgerValidationException("Idempotency key is required");
        }
        if (idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new LedgerValidationException(
                "Idempotency key must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        return validateAmount(amount);
    }

    private BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null) {
            throw new LedgerValidationException("Amount is required");
        }
        if (amount.signum() <= 0) {
            throw new LedgerValidationException("Amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > LedgerEntry.AMOUNT_SCALE) {
            throw new LedgerValidationException(
                "Amount must have at most " + LedgerEntry.AMOUNT_SCALE + " decimal places: " + amount.toPlainString());
        }
        BigDecimal normalized = amount.setScale(LedgerEntry.AMOUNT_SCALE, RoundingMode.UNNECESSARY);

        LedgerProperties.Amount limits = properties.getAmount();
        if (normalized.compareTo(limits.getMin()) < 0 || normalized.compareTo(limits.getMax()) > 0) {
            throw new LedgerValidationException(String.format("Amount must be between %s and %s",
                limits.getMin().toPlainString(), limits.getMax().toPlainString()));
        }
        return normalized;
    }

    private static void requireKind(Account account, Account.Kind expected) {
        if (account.getKind() != expected) {
            throw new LedgerIntegrityException(String.format("Account %s is %s, expected %s",
                account.getId(), account.getKind(), expected));
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
