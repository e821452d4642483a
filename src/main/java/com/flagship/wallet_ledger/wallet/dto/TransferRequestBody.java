package com.flagship.wallet_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Body of POST /api/wallet/transfers. The sender is the authenticated caller.
 *
 * Only the amount is checked here; the recipient is validated by the
 * transfer engine after the amount, so the first failing check is reported.
 */
@Value
public class TransferRequestBody {

    @JsonProperty("recipient")
    String recipient;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    String amount;
}
