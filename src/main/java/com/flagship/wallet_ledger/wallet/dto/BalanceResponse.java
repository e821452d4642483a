package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("balance")
    BigDecimal balance;
}
