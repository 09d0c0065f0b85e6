package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.exception.LedgerConflictException;
import com.flagship.credit_ledger.exception.LedgerIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Owns account identity and row locking.
 *
 * Lock ordering is NOT decided here: {@link #lock(List)} takes rows in exactly the
 * order it is given. The posting path is the single place that sorts ids.
 */
@Service
@Slf4j
public class AccountStore {

    private static final String SELECT_COLUMNS =
        "SELECT id, user_id, kind, asset_type_code, version, created_at, updated_at FROM accounts";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate accountCreationTemplate;

    public AccountStore(JdbcTemplate jdbcTemplate,
                        @Qualifier("accountCreationTransactionTemplate") TransactionTemplate accountCreationTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountCreationTemplate = accountCreationTemplate;
    }

    /**
     * Returns the account for (userId, assetTypeCode), creating it with version 0 if absent.
     *
     * Safe to call concurrently for the same pair: the loser of an insert race
     * re-reads the winner's row. The insert runs in its own transaction.
     */
    public Account resolveOrCreate(String userId, String assetTypeCode, Account.Kind kind) {
        Optional<Account> existing = findByOwner(userId, assetTypeCode);
        if (existing.isPresent()) {
            return existing.get();
        }

        Account candidate = Account.open(userId, assetTypeCode, kind, now());
        try {
            accountCreationTemplate.executeWithoutResult(status -> insert(candidate));
        } catch (DataAccessException e) {
            log.debug("Account {} was not inserted, re-reading: {}", candidate.getId(), e.getMessage());
            Optional<Account> winner = findByOwner(userId, assetTypeCode);
            if (winner.isPresent()) {
                return winner.get();
            }
            if (e instanceof TransientDataAccessException) {
                throw new LedgerConflictException(
                    "Could not open " + assetTypeCode + " account for user " + userId, e);
            }
            throw e;
        }

        log.info("Opened {} account {} for user {} ({})", kind, candidate.getId(), userId, assetTypeCode);
        return candidate;
    }

    /**
     * Takes exclusive row locks, one account at a time, in the order given.
     * Blocks until each lock is granted or the surrounding transaction times out.
     *
     * @throws LedgerIntegrityException if an id does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Account> lock(List<String> accountIds) {
        List<Account> locked = new ArrayList<>(accountIds.size());
        for (String accountId : accountIds) {
            List<Account> rows = jdbcTemplate.query(
                SELECT_COLUMNS + " WHERE id = ? FOR UPDATE",
                accountRowMapper(),
                accountId
            );
            if (rows.isEmpty()) {
                throw new LedgerIntegrityException("Account not found while locking: " + accountId);
            }
            locked.add(rows.get(0));
        }
        log.debug("Locked accounts {}", accountIds);
        return locked;
    }

    /**
     * Bumps the diagnostic version counter. Callers must already hold the row locks.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void incrementVersions(Collection<String> accountIds, Instant now) {
        for (String accountId : accountIds) {
            jdbcTemplate.update(
                "UPDATE accounts SET version = version + 1, updated_at = ? WHERE id = ?",
                Timestamp.from(now),
                accountId
            );
        }
    }

    public Optional<Account> findById(String accountId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst();
    }

    public Optional<Account> findByOwner(String userId, String assetTypeCode) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + " WHERE user_id = ? AND asset_type_code = ?",
                accountRowMapper(),
                userId,
                assetTypeCode
            )
            .stream()
            .findFirst();
    }

    public List<Account> findByUser(String userId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE user_id = ? ORDER BY asset_type_code",
            accountRowMapper(),
            userId
        );
    }

    /**
     * Owners of USER accounts with how many accounts each holds. Treasury owners are excluded.
     */
    public List<UserSummary> listUsers() {
        return jdbcTemplate.query(
            "SELECT user_id, COUNT(*) AS account_count FROM accounts WHERE kind = 'USER' " +
            "GROUP BY user_id ORDER BY user_id",
            (rs, rowNum) -> new UserSummary(rs.getString("user_id"), rs.getLong("account_count"))
        );
    }

    private void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (id, user_id, kind, asset_type_code, version, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getUserId(),
            account.getKind().name(),
            account.getAssetTypeCode(),
            account.getVersion(),
            Timestamp.from(account.getCreatedAt()),
            Timestamp.from(account.getUpdatedAt())
        );
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getString("id"),
            rs.getString("user_id"),
            Account.Kind.valueOf(rs.getString("kind")),
            rs.getString("asset_type_code"),
            rs.getLong("version"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
