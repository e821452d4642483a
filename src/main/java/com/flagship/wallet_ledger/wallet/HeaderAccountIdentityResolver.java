package com.flagship.wallet_ledger.wallet;

import com.flagship.wallet_ledger.ledger.AccountIds;
import com.flagship.wallet_ledger.wallet.exception.MissingIdentityException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reads the caller's account id from a header set by the authenticating proxy.
 */
@Component
public class HeaderAccountIdentityResolver implements AccountIdentityResolver {

    public static final String DEFAULT_HEADER = "X-Account-Id";

    private final String headerName;

    public HeaderAccountIdentityResolver(@Value("${wallet.identity.header:" + DEFAULT_HEADER + "}") String headerName) {
        this.headerName = headerName;
    }

    @Override
    public String resolve(HttpServletRequest request) {
        String accountId = request.getHeader(headerName);
        if (accountId == null || accountId.isBlank()) {
            throw new MissingIdentityException("Header '" + headerName + "' is missing");
        }
        if (!AccountIds.isWellFormed(accountId)) {
            throw new MissingIdentityException("Header '" + headerName + "' does not hold a valid account id");
        }
        return accountId;
    }
}
