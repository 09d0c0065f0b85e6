package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.transaction.dto.TransactionResponse;
import com.flagship.credit_ledger.wallet.dto.WalletBalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final WalletService walletService;

    @GetMapping("/{userId}/balance")
    public WalletBalanceResponse getBalance(@PathVariable("userId") String userId) {
        return WalletBalanceResponse.from(userId, walletService.getBalances(userId));
    }

    /**
     * Transaction history, newest first.
     */
    @GetMapping("/{userId}/transactions")
    public List<TransactionResponse> getTransactions(
            @PathVariable("userId") String userId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {
        return walletService.getHistory(userId, limit, offset).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
