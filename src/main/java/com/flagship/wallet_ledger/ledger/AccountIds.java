package com.flagship.wallet_ledger.ledger;

import java.util.regex.Pattern;

/**
 * Syntax rules for account identifiers issued by the identity provider.
 */
public final class AccountIds {

    public static final int MAX_LENGTH = 128;

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_-]{1," + MAX_LENGTH + "}$");

    private AccountIds() {
    }

    public static boolean isWellFormed(String accountId) {
        return accountId != null && VALID.matcher(accountId).matches();
    }

    /**
     * Rejects an identifier that did not come from the identity provider.
     * Recipient ids typed by users are checked by the transfer engine instead.
     */
    public static String requireWellFormed(String accountId) {
        if (!isWellFormed(accountId)) {
            throw new IllegalArgumentException("Malformed account id: " + accountId);
        }
        return accountId;
    }
}
