package com.flagship.credit_ledger.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, String> {

    /**
     * Backed by the unique constraint on idempotency_key.
     */
    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);
}
