package com.flagship.credit_ledger.wallet;

import com.flagship.credit_ledger.ledger.AccountStore;
import com.flagship.credit_ledger.ledger.UserSummary;
import com.flagship.credit_ledger.wallet.dto.AccountResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists account owners and their accounts. Treasury accounts are not listed as users.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final AccountStore accountStore;

    @GetMapping
    public List<UserSummary> listUsers() {
        return accountStore.listUsers();
    }

    @GetMapping("/{userId}/accounts")
    public List<AccountResponse> listAccounts(@PathVariable("userId") String userId) {
        return accountStore.findByUser(userId).stream()
            .map(AccountResponse::from)
            .toList();
    }
}
