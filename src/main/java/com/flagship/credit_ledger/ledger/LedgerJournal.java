package com.flagship.credit_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only journal of balanced entry pairs; the only source of truth for balances.
 *
 * This service enforces the core invariants:
 * 1. Every append writes exactly two legs with the same transaction, asset and amount
 * 2. Legs are never updated or deleted
 * 3. Appends join the caller's unit of work and never commit on their own
 *
 * balance(X) = sum of DEBIT legs on X - sum of CREDIT legs on X
 */
@Service
@Slf4j
public class LedgerJournal {

    private static final String INSERT_ENTRY =
        "INSERT INTO ledger_entries " +
        "(id, transaction_id, entry_type, account_id, counterparty_account_id, asset_type_code, amount, created_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SIGNED_AMOUNT =
        "CASE WHEN entry_type = 'DEBIT' THEN amount ELSE -amount END";

    private final JdbcTemplate jdbcTemplate;

    public LedgerJournal(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Writes the balanced pair for one transaction inside the active unit of work.
     *
     * @return the two legs, DEBIT first
     * @throws IllegalArgumentException if the amount is not positive or both sides are the same account
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<LedgerEntry> append(String transactionId, String debitAccountId, String creditAccountId,
                                    String assetTypeCode, BigDecimal amount, Instant createdAt) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Ledger amount must be positive");
        }
        if (debitAccountId.equals(creditAccountId)) {
            throw new IllegalArgumentException("Debit and credit accounts must differ: " + debitAccountId);
        }

        BigDecimal scaled = amount.setScale(LedgerEntry.AMOUNT_SCALE, RoundingMode.UNNECESSARY);
        LedgerEntry debit = new LedgerEntry(UUID.randomUUID().toString(), transactionId, EntryType.DEBIT,
            debitAccountId, creditAccountId, assetTypeCode, scaled, createdAt);
        LedgerEntry credit = new LedgerEntry(UUID.randomUUID().toString(), transactionId, EntryType.CREDIT,
            creditAccountId, debitAccountId, assetTypeCode, scaled, createdAt);

        jdbcTemplate.batchUpdate(INSERT_ENTRY, List.of(toRow(debit), toRow(credit)));
        log.debug("Appended entry pair for transaction {}: {} -> {} {} {}",
            transactionId, creditAccountId, debitAccountId, scaled, assetTypeCode);

        return List.of(debit, credit);
    }

    /**
     * Derives the balance of an account from its legs. Zero when the account has no entries.
     */
    public BigDecimal balanceOf(String accountId) {
        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(" + SIGNED_AMOUNT + "), 0) FROM ledger_entries WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        return normalize(balance);
    }

    /**
     * Gets both legs of a transaction, DEBIT first.
     */
    public List<LedgerEntry> entriesFor(String transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, entry_type, account_id, counterparty_account_id, asset_type_code, " +
            "amount, created_at FROM ledger_entries WHERE transaction_id = ? ORDER BY entry_type DESC",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    /**
     * Signed sum of all legs per asset type. Every value is zero while the journal is consistent.
     */
    public Map<String, BigDecimal> totalByAsset() {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT asset_type_code, COALESCE(SUM(" + SIGNED_AMOUNT + "), 0) AS total " +
            "FROM ledger_entries GROUP BY asset_type_code ORDER BY asset_type_code",
            rs -> {
                totals.put(rs.getString("asset_type_code"), normalize(rs.getBigDecimal("total")));
            }
        );
        return totals;
    }

    private static BigDecimal normalize(BigDecimal value) {
        BigDecimal nonNull = value != null ? value : BigDecimal.ZERO;
        return nonNull.setScale(LedgerEntry.AMOUNT_SCALE, RoundingMode.UNNECESSARY);
    }

    private static Object[] toRow(LedgerEntry entry) {
        return new Object[] {
            entry.getId(),
            entry.getTransactionId(),
            entry.getEntryType().name(),
            entry.getAccountId(),
            entry.getCounterpartyAccountId(),
            entry.getAssetTypeCode(),
            entry.getAmount(),
            Timestamp.from(entry.getCreatedAt())
        };
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getString("id"),
            rs.getString("transaction_id"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("account_id"),
            rs.getString("counterparty_account_id"),
            rs.getString("asset_type_code"),
            normalize(rs.getBigDecimal("amount")),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
