package com.flagship.account_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_ledger.account.Account;
import lombok.Value;

import java.util.UUID;

@Value
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("balance")
    long balance;

    public static AccountResponse from(Account account) {
        return new AccountResponse(account.getId(), account.getBalance());
    }
}
