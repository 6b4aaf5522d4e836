package com.example.statements.domain.service;

import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.ExtractedField;
import com.example.statements.util.AccountNumberMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Closed list of accounts statements can be filed against.
 * Instances are immutable; the application builds one from configuration at startup and tests build their own.
 */
public final class AccountRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistry.class);
    private static final Pattern NOISE = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern MASK = Pattern.compile("[Xx]{4,}");

    private final Map<String, AccountReference> accountsById;

    /**
     * Creates a registry over the given entries.
     *
     * @param accounts registry entries in display order
     * @throws IllegalArgumentException when the list is empty or a canonical id repeats
     */
    public AccountRegistry(List<AccountReference> accounts) {
        if (accounts == null || accounts.isEmpty()) {
            throw new IllegalArgumentException("Account registry requires at least one account.");
        }
        Map<String, AccountReference> byId = new LinkedHashMap<>();
        for (AccountReference account : accounts) {
            if (byId.putIfAbsent(account.canonicalId(), account) != null) {
                throw new IllegalArgumentException("Duplicate canonical account id ending in " + account.lastFour());
            }
        }
        this.accountsById = Collections.unmodifiableMap(byId);
    }

    /**
     * @return registry with the five accounts the business files statements for
     */
    public static AccountRegistry defaultRegistry() {
        return new AccountRegistry(List.of(
                new AccountReference("000000228239080", "Apex Cloud Holdings LLC", "JPMorgan Chase Bank", 12, "Business"),
                new AccountReference("000000954291944", "IT DevOps LLC", "JPMorgan Chase Bank", 12, "Business"),
                new AccountReference("000000333721212", "Summit Data Services Inc", "JPMorgan Chase Bank", 12, "Checking"),
                new AccountReference("00085695149", "Garden State Ventures LLC", "Valley Bank", 11, "Business"),
                new AccountReference("000000880865188", "Harbor Digital Partners LLC", "JPMorgan Chase Bank", 12, "Savings")
        ));
    }

    public List<AccountReference> findAll() {
        return List.copyOf(accountsById.values());
    }

    public Optional<AccountReference> findByCanonicalId(String canonicalId) {
        return Optional.ofNullable(accountsById.get(canonicalId));
    }

    /**
     * Resolves a raw account number as printed on a statement.
     * Masked numbers ({@code XXXX1944}) are resolved through the company hint and must match exactly one entry;
     * unmasked numbers must equal a canonical id once separators are removed. There is no fuzzy matching.
     *
     * @param raw         account number text, may be {@code null}
     * @param companyHint text naming the account holder, may be {@code null}
     * @return resolved account or an absent field carrying the raw text
     */
    public ExtractedField<AccountReference> normalize(String raw, String companyHint) {
        if (raw == null || raw.isBlank()) {
            return ExtractedField.absent();
        }
        String stripped = NOISE.matcher(raw).replaceAll("");
        if (stripped.isEmpty()) {
            return ExtractedField.rejected(raw);
        }
        if (MASK.matcher(stripped).find()) {
            return resolveMasked(raw, companyHint);
        }
        AccountReference account = accountsById.get(stripped);
        if (account == null) {
            log.debug("Account {} is not in the registry", AccountNumberMasker.mask(stripped));
            return ExtractedField.rejected(raw);
        }
        return ExtractedField.of(account, raw);
    }

    private ExtractedField<AccountReference> resolveMasked(String raw, String companyHint) {
        if (companyHint == null || companyHint.isBlank()) {
            return ExtractedField.rejected(raw);
        }
        String hint = companyHint.toLowerCase(Locale.ROOT);
        List<AccountReference> matches = accountsById.values().stream()
                .filter(account -> {
                    String name = account.companyName().toLowerCase(Locale.ROOT);
                    return hint.contains(name) || name.contains(hint.strip());
                })
                .toList();
        if (matches.size() != 1) {
            log.debug("Masked account {} matched {} registry entries", AccountNumberMasker.mask(raw.strip()), matches.size());
            return ExtractedField.rejected(raw);
        }
        return ExtractedField.of(matches.get(0), raw);
    }
}
