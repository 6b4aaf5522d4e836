package com.example.statements.util;

/**
 * Masks account numbers before they are written to logs or error messages.
 */
public final class AccountNumberMasker {

    private AccountNumberMasker() {
    }

    /**
     * Keeps the last four characters and replaces the rest with {@code X}.
     *
     * @param accountNumber raw or canonical account number
     * @return masked value, e.g. {@code XXXXXXXXXXX1944}
     */
    public static String mask(String accountNumber) {
        if (accountNumber == null || accountNumber.length() <= 4) {
            return "XXXX";
        }
        int visibleFrom = accountNumber.length() - 4;
        return "X".repeat(visibleFrom) + accountNumber.substring(visibleFrom);
    }
}
