package com.flagship.credit_ledger.transaction;

import com.flagship.credit_ledger.exception.InsufficientBalanceException;
import com.flagship.credit_ledger.ledger.AccountStore;
import com.flagship.credit_ledger.ledger.LedgerJournal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Ordering rules inside the posting unit of work.
 */
class LedgerPostingServiceTest {

    private static final String LOW = "00000000-0000-3000-8000-000000000001";
    private static final String HIGH = "ffffffff-0000-3000-8000-000000000001";

    private PlatformTransactionManager transactionManager;
    private AccountStore accountStore;
    private LedgerJournal ledgerJournal;
    private TransactionPersistenceService persistenceService;
    private LedgerPostingService postingService;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        accountStore = mock(AccountStore.class);
        ledgerJournal = mock(LedgerJournal.class);
        persistenceService = mock(TransactionPersistenceService.class);
        when(persistenceService.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());

        postingService = new LedgerPostingService(new TransactionTemplate(transactionManager),
            accountStore, ledgerJournal, persistenceService);
    }

    private PostingPlan plan(TransactionType type, String userAccountId, String treasuryAccountId, String amount) {
        return PostingPlan.builder()
            .type(type)
            .userId("user-1")
            .assetTypeCode("GOLD_COINS")
            .amount(new BigDecimal(amount))
            .idempotencyKey("key-1")
            .userAccountId(userAccountId)
            .treasuryAccountId(treasuryAccountId)
            .build();
    }

    @Test
    @DisplayName("Lock order is ascending by id regardless of argument order")
    void testLockOrder() {
        assertEquals(List.of(LOW, HIGH), LedgerPostingService.lockOrder(LOW, HIGH));
        assertEquals(List.of(LOW, HIGH), LedgerPostingService.lockOrder(HIGH, LOW));
    }

    @Test
    @DisplayName("TOPUP and SPEND on the same pair lock in the same order")
    void testOpposingDirectionsShareLockOrder() {
        when(ledgerJournal.balanceOf(HIGH)).thenReturn(new BigDecimal("100.00"));

        postingService.post(plan(TransactionType.TOPUP, HIGH, LOW, "10.00"));
        postingService.post(plan(TransactionType.SPEND, HIGH, LOW, "10.00"));

        verify(accountStore, times(2)).lock(List.of(LOW, HIGH));
    }

    @Test
    @DisplayName("Locks are taken before the key re-check, balance read and writes")
    void testStepsRunUnderLock() {
        when(ledgerJournal.balanceOf(HIGH)).thenReturn(new BigDecimal("50.00"));

        TransactionResult result = postingService.post(plan(TransactionType.SPEND, HIGH, LOW, "25.00"));

        InOrder order = inOrder(accountStore, persistenceService, ledgerJournal, transactionManager);
        order.verify(transactionManager).getTransaction(any());
        order.verify(accountStore).lock(List.of(LOW, HIGH));
        order.verify(persistenceService).findByIdempotencyKey("key-1");
        order.verify(ledgerJournal).balanceOf(HIGH);
        order.verify(persistenceService).insert(any());
        order.verify(ledgerJournal).append(anyString(), eq(LOW),
            eq(HIGH), anyString(), any(), any());
        order.verify(accountStore).incrementVersions(eq(List.of(LOW, HIGH)), any());
        order.verify(transactionManager).commit(any());

        assertFalse(result.isReplayed());
        assertEquals(TransactionStatus.COMPLETED, result.getTransaction().getStatus());
        assertEquals(LOW, result.getTransaction().getDebitAccountId());
        assertEquals(HIGH, result.getTransaction().getCreditAccountId());
    }

    @Test
    @DisplayName("Short balance rolls back before anything is written")
    void testInsufficientBalanceWritesNothing() {
        when(ledgerJournal.balanceOf(HIGH)).thenReturn(new BigDecimal("10.00"));

        assertThrows(InsufficientBalanceException.class,
            () -> postingService.post(plan(TransactionType.SPEND, HIGH, LOW, "10.01")));

        verify(persistenceService, never()).insert(any());
        verify(ledgerJournal, never()).append(any(), any(), any(), any(), any(), any());
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("TOPUP never reads the balance")
    void testTopupSkipsBalanceCheck() {
        postingService.post(plan(TransactionType.TOPUP, HIGH, LOW, "10.00"));

        verify(ledgerJournal, never()).balanceOf(anyString());
    }

    @Test
    @DisplayName("A key committed while waiting for locks is returned without writing")
    void testReplayUnderLock() {
        Transaction existing = Transaction.builder().id("tx-1").idempotencyKey("key-1").build();
        when(persistenceService.findByIdempotencyKey("key-1")).thenReturn(Optional.of(existing));

        TransactionResult result = postingService.post(plan(TransactionType.TOPUP, HIGH, LOW, "10.00"));

        assertTrue(result.isReplayed());
        assertEquals("tx-1", result.getTransaction().getId());
        verify(persistenceService, never()).insert(any());
    }
}
