package com.flagship.credit_ledger.transaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.exception.LedgerIntegrityException;
import com.flagship.credit_ledger.exception.LedgerValidationException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bridges the Transaction domain object and its JPA entity.
 *
 * Writes only happen inside a posting unit of work; reads are standalone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionPersistenceService {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final TransactionRepository transactionRepository;
    private final ObjectMapper objectMapper;

    @PersistenceContext
    private EntityManager entityManager;

    /**
     * Inserts a transaction row and flushes it, so a duplicate idempotency key
     * surfaces here rather than at commit.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException on a unique-key violation
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction insert(Transaction transaction) {
        TransactionEntity entity = TransactionEntity.fromDomain(transaction, writeMetadata(transaction.getMetadata()));
        transactionRepository.saveAndFlush(entity);
        log.debug("Inserted transaction {} with idempotency key {}", transaction.getId(), transaction.getIdempotencyKey());
        return transaction;
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findById(String transactionId) {
        return transactionRepository.findById(transactionId)
            .map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findByIdempotencyKey(String idempotencyKey) {
        return transactionRepository.findByIdempotencyKey(idempotencyKey)
            .map(this::toDomain);
    }

    /**
     * Gets a page of a user's transactions, newest first. Ties on created_at are broken by id.
     */
    @Transactional(readOnly = true)
    public List<Transaction> history(String userId, int limit, int offset) {
        return entityManager.createQuery(
                "SELECT t FROM TransactionEntity t WHERE t.userId = :userId " +
                "ORDER BY t.createdAt DESC, t.id DESC",
                TransactionEntity.class)
            .setParameter("userId", userId)
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(this::toDomain)
            .toList();
    }

    private Transaction toDomain(TransactionEntity entity) {
        return Transaction.builder()
            .id(entity.getId())
            .type(entity.getType())
            .status(entity.getStatus())
            .userId(entity.getUserId())
            .assetTypeCode(entity.getAssetTypeCode())
            .amount(entity.getAmount())
            .debitAccountId(entity.getDebitAccountId())
            .creditAccountId(entity.getCreditAccountId())
            .idempotencyKey(entity.getIdempotencyKey())
            .description(entity.getDescription())
            .metadata(readMetadata(entity.getId(), entity.getMetadata()))
            .createdAt(entity.getCreatedAt())
            .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new LedgerValidationException("Metadata cannot be serialized: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> readMetadata(String transactionId, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new LedgerIntegrityException("Stored metadata is not valid JSON for transaction " + transactionId, e);
        }
    }
}
