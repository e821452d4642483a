package com.flagship.wallet_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Input of a transfer. Not persisted: validated by the transfer engine and discarded.
 */
@Value
public class TransferRequest {
    String sender;
    String recipient;
    BigDecimal amount;

    public static TransferRequest of(String sender, String recipient, BigDecimal amount) {
        return new TransferRequest(sender, recipient, amount);
    }

    public boolean isSelfTransfer() {
        return sender != null && sender.equals(recipient);
    }
}
