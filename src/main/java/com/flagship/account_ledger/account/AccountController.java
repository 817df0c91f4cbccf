package com.flagship.account_ledger.account;

import com.flagship.account_ledger.account.command.AccountCommand;
import com.flagship.account_ledger.account.dto.AccountResponse;
import com.flagship.account_ledger.account.dto.AccountsResponse;
import com.flagship.account_ledger.account.dto.AmountRequest;
import com.flagship.account_ledger.observability.CorrelationContext;
import com.flagship.account_ledger.runtime.AccountEntityRuntime;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * REST controller for accounts.
 *
 * Commands go through the {@link AccountEntityRuntime} and answer with the post-state
 * of the aggregate. Queries read the projected read-model, which may lag behind.
 */
@RestController
@RequestMapping("/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountEntityRuntime entityRuntime;
    private final AccountRepository accountRepository;

    @GetMapping
    public ResponseEntity<AccountsResponse> listAccounts() {
        List<AccountResponse> accounts;
        try (Stream<Account> stream = accountRepository.accounts()) {
            accounts = stream.map(AccountResponse::from).collect(Collectors.toList());
        }
        return ResponseEntity.ok(new AccountsResponse(accounts));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") UUID id) {
        return accountRepository.accountById(id)
            .map(account -> ResponseEntity.ok(AccountResponse.from(account)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount() {
        UUID id = AccountIds.newId();
        Account account = handle(id, new AccountCommand.CreateAccount());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @PostMapping("/{id}/deposits")
    public ResponseEntity<AccountResponse> deposit(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AmountRequest request) {
        Account account = handle(id, new AccountCommand.Deposit(request.getAmount()));
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @PostMapping("/{id}/withdrawals")
    public ResponseEntity<AccountResponse> withdraw(
            @PathVariable("id") UUID id,
            @Valid @RequestBody AmountRequest request) {
        Account account = handle(id, new AccountCommand.Withdraw(request.getAmount()));
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    private Account handle(UUID id, AccountCommand command) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, id.toString());
        try {
            log.info("Received command: command={}, accountId={}", command.name(), id);
            return entityRuntime.handle(id, command);
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }
}
