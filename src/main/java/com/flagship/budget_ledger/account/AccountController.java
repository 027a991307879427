package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.account.dto.AccountResponse;
import com.flagship.budget_ledger.account.dto.CreateAccountRequest;
import com.flagship.budget_ledger.account.dto.CreatePartyRequest;
import com.flagship.budget_ledger.account.dto.PartyResponse;
import com.flagship.budget_ledger.ledger.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Parties and their chart of accounts.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    static final String USER_HEADER = "X-User-Id";

    private final AccountService accountService;
    private final LedgerService ledgerService;

    @PostMapping("/api/parties")
    public ResponseEntity<PartyResponse> createParty(@Valid @RequestBody CreatePartyRequest request) {
        Party.PartyType type = request.getPartyType() != null ? request.getPartyType() : Party.PartyType.USER;
        Party party = accountService.createParty(type, request.getName());

        List<AccountResponse> accounts = request.isSeedDefaultAccounts()
            ? accountService.seedDefaultAccounts(party.getId()).stream().map(AccountResponse::from).toList()
            : List.of();

        return ResponseEntity.status(HttpStatus.CREATED).body(PartyResponse.from(party, accounts));
    }

    @PostMapping("/api/accounts")
    public ResponseEntity<AccountResponse> createAccount(
            @RequestHeader(USER_HEADER) UUID userId,
            @Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(userId, request.getName(), request.getAccountType(),
            request.getParentId(), request.getCurrency());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/api/accounts")
    public List<AccountResponse> listAccounts(
            @RequestHeader(USER_HEADER) UUID userId,
            @RequestParam(value = "type", required = false) AccountType type) {
        return accountService.getAccounts(userId, type).stream()
            .map(account -> AccountResponse.from(account, ledgerService.getAccountBalance(account.getId())))
            .toList();
    }

    @GetMapping("/api/accounts/categories")
    public List<AccountResponse> listCategories(@RequestHeader(USER_HEADER) UUID userId) {
        return accountService.getCategories(userId).stream()
            .map(AccountResponse::from)
            .toList();
    }

    @DeleteMapping("/api/accounts/{id}")
    public ResponseEntity<Void> deactivateAccount(
            @RequestHeader(USER_HEADER) UUID userId,
            @PathVariable("id") UUID accountId) {
        accountService.deactivateAccount(userId, accountId);
        return ResponseEntity.noContent().build();
    }
}
