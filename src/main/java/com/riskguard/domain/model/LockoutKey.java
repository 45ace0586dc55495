package com.riskguard.domain.model;

/**
 * Identity of a lockout. The symbol key is "*" for account-wide lockouts so that the
 * key can be stored in a non-null unique column.
 */
public record LockoutKey(String accountId, String symbolKey) {

    public static final String ACCOUNT_WIDE = "*";

    public static LockoutKey of(String accountId, String symbol) {
        return new LockoutKey(accountId, symbol == null ? ACCOUNT_WIDE : symbol.toUpperCase());
    }

    public String symbol() {
        return ACCOUNT_WIDE.equals(symbolKey) ? null : symbolKey;
    }
}
