package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Body of POST /api/wallet/deposits.
 *
 * The amount is kept as text: clients send either a JSON number or a string
 * such as "50,00", and parsing belongs to the ledger.
 */
@Value
public class DepositRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    String amount;
}
