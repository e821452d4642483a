package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.wallet.exception.MissingIdentityException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Supplies the account id of the authenticated caller.
 *
 * Authentication itself happens upstream; implementations only read the
 * identity it established.
 */
public interface AccountIdentityResolver {

    /**
     * @throws MissingIdentityException if the request carries no usable identity
     */
    String resolve(HttpServletRequest request);
}
