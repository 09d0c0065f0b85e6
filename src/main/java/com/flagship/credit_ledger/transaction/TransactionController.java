package com.flagship.credit_ledger.transaction;

import com.flagship.credit_ledger.exception.LedgerValidationException;
import com.flagship.credit_ledger.exception.TransactionNotFoundException;
import com.flagship.credit_ledger.ledger.LedgerJournal;
import com.flagship.credit_ledger.transaction.dto.CreateTransactionRequest;
import com.flagship.credit_ledger.transaction.dto.LedgerEntryResponse;
import com.flagship.credit_ledger.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for credit movements.
 *
 * Creation is idempotent on the body's idempotency_key: the first request gets
 * 201 Created, every repeat gets 200 OK with the same transaction.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionEngine transactionEngine;
    private final TransactionPersistenceService persistenceService;
    private final LedgerJournal ledgerJournal;

    /**
     * Typed endpoints: /topup, /bonus, /spend.
     */
    @PostMapping("/{type}")
    public ResponseEntity<TransactionResponse> createTyped(
            @PathVariable("type") String type,
            @Valid @RequestBody CreateTransactionRequest request) {

        TransactionType pathType = TransactionType.fromName(type);
        if (request.getType() != null && TransactionType.fromName(request.getType()) != pathType) {
            throw new LedgerValidationException(
                "Body type " + request.getType() + " does not match endpoint " + pathType);
        }
        return create(pathType, request);
    }

    @PostMapping
    public ResponseEntity<TransactionResponse> createTransaction(@Valid @RequestBody CreateTransactionRequest request) {
        return create(TransactionType.fromName(request.getType()), request);
    }

    @GetMapping("/{id}")
    public TransactionResponse getTransaction(@PathVariable("id") String id) {
        return persistenceService.findById(id)
            .map(TransactionResponse::from)
            .orElseThrow(() -> new TransactionNotFoundException(id));
    }

    @GetMapping("/{id}/entries")
    public List<LedgerEntryResponse> getEntries(@PathVariable("id") String id) {
        if (persistenceService.findById(id).isEmpty()) {
            throw new TransactionNotFoundException(id);
        }
        return ledgerJournal.entriesFor(id).stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }

    private ResponseEntity<TransactionResponse> create(TransactionType type, CreateTransactionRequest request) {
        log.info("Received {} request: user={}, asset={}, amount={}, idempotencyKey={}",
            type, request.getUserId(), request.getAssetType(), request.getAmount(), request.getIdempotencyKey());

        TransactionResult result = transactionEngine.process(
            type,
            request.getUserId(),
            request.getAssetType(),
            request.amountValue(),
            request.getIdempotencyKey(),
            request.getMetadata()
        );

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getTransaction()));
    }
}
