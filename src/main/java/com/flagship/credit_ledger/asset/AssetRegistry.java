package com.flagship.credit_ledger.asset;

import com.flagship.credit_ledger.exception.LedgerValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Registry of asset types. Consulted by the engine for validation; holds no business logic.
 */
@Service
@Slf4j
public class AssetRegistry {

    private static final String SELECT_COLUMNS =
        "SELECT code, name, description, active, created_at FROM asset_types";

    private final JdbcTemplate jdbcTemplate;

    public AssetRegistry(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<AssetType> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE code = ?", assetTypeRowMapper(), code)
            .stream()
            .findFirst();
    }

    /**
     * Returns the asset type if it exists and accepts new transactions.
     *
     * @throws LedgerValidationException if the code is unknown or the asset is inactive
     */
    public AssetType findActive(String code) {
        if (code == null || code.isBlank()) {
            throw new LedgerValidationException("Asset type is required");
        }
        AssetType assetType = find(code)
            .orElseThrow(() -> new LedgerValidationException("Unknown asset type: " + code));
        if (!assetType.isActive()) {
            throw new LedgerValidationException("Asset type is not active: " + code);
        }
        return assetType;
    }

    public List<AssetType> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY code", assetTypeRowMapper());
    }

    public List<AssetType> findAllActive() {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE active = TRUE ORDER BY code", assetTypeRowMapper());
    }

    /**
     * Inserts the asset type unless one with the same code exists.
     * An existing row is left untouched, including its active flag.
     *
     * @return true if a new row was inserted
     */
    public boolean register(String code, String name, String description, boolean active) {
        if (find(code).isPresent()) {
            return false;
        }
        try {
            jdbcTemplate.update(
                "INSERT INTO asset_types (code, name, description, active, created_at) VALUES (?, ?, ?, ?, ?)",
                code, name, description, active, Timestamp.from(Instant.now().truncatedTo(ChronoUnit.MICROS))
            );
        } catch (DuplicateKeyException e) {
            log.debug("Asset type {} registered concurrently", code);
            return false;
        }
        log.info("Registered asset type {} ({})", code, name);
        return true;
    }

    public void setActive(String code, boolean active) {
        int updated = jdbcTemplate.update("UPDATE asset_types SET active = ? WHERE code = ?", active, code);
        if (updated == 0) {
            throw new LedgerValidationException("Unknown asset type: " + code);
        }
        log.info("Asset type {} is now {}", code, active ? "active" : "inactive");
    }

    private RowMapper<AssetType> assetTypeRowMapper() {
        return (rs, rowNum) -> new AssetType(
            rs.getString("code"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getBoolean("active"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
