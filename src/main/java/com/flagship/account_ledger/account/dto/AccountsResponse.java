package com.flagship.account_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Response body of the account listing.
 */
@Value
public class AccountsResponse {

    @JsonProperty("accounts")
    List<AccountResponse> accounts;
}
