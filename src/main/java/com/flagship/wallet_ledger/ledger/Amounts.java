package com.flagship.wallet_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Parsing and validation of monetary amounts.
 *
 * Amounts have at most two fraction digits and are always returned at scale 2,
 * so equal values compare equal with {@link BigDecimal#equals(Object)}.
 */
public final class Amounts {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    /** Integer digits that fit the NUMERIC(19,2) balance column. */
    public static final int MAX_INTEGER_DIGITS = 17;

    private Amounts() {
    }

    /**
     * Parses user input such as {@code "50.00"} or {@code "50,00"}.
     *
     * @throws LedgerException with {@link ErrorKind#INVALID_AMOUNT} if the text is not a positive amount
     */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT, "Amount is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(text.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT, "Amount is not a number: " + text);
        }
        return requirePositive(value);
    }

    /**
     * Checks that the amount is positive with at most two decimals.
     *
     * @return the amount at scale 2
     */
    public static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                    String.format("Amount must be positive: %s", amount));
        }
        // precision - scale is the integer digit count; checked before any rescaling
        if ((long) amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                    String.format("Amount has more than %d integer digits", MAX_INTEGER_DIGITS));
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                    String.format("Amount has more than %d decimal places: %s", SCALE, amount));
        }
        return normalize(amount);
    }

    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
