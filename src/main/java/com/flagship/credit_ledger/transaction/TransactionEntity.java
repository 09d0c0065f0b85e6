package com.flagship.credit_ledger.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for transaction records.
 *
 * Rows are inserted once and never updated. Ids are assigned by the engine,
 * so {@link Persistable#isNew()} is tracked explicitly to make save() insert
 * without a preceding select.
 */
@Entity
@Immutable
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity implements Persistable<String> {

    @Id
    @Column(nullable = false, updatable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransactionStatus status;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "asset_type_code", nullable = false, updatable = false)
    private String assetTypeCode;

    @Column(nullable = false, updatable = false, precision = 20, scale = 2)
    private BigDecimal amount;

    @Column(name = "debit_account_id", nullable = false, updatable = false)
    private String debitAccountId;

    @Column(name = "credit_account_id", nullable = false, updatable = false)
    private String creditAccountId;

    @Column(name = "idempotency_key", nullable = false, updatable = false, unique = true)
    private String idempotencyKey;

    @Column(updatable = false)
    private String description;

    /**
     * Caller metadata serialized as JSON text.
     */
    @Column(updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity;

    static TransactionEntity fromDomain(Transaction transaction, String metadataJson) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getType(),
            transaction.getStatus(),
            transaction.getUserId(),
            transaction.getAssetTypeCode(),
            transaction.getAmount(),
            transaction.getDebitAccountId(),
            transaction.getCreditAccountId(),
            transaction.getIdempotencyKey(),
            transaction.getDescription(),
            metadataJson,
            transaction.getCreatedAt(),
            true
        );
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newEntity = false;
    }
}
