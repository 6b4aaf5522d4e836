package com.example.statements.domain.service;

import com.example.statements.domain.model.TaxCategory;

import java.util.List;
import java.util.Locale;

/**
 * Assigns a tax category to a withdrawal description.
 * Rules are checked in order and the first match wins, so {@code PayPal Loan Payment} is an international
 * subcontractor payment rather than a loan payment.
 * <p>
 * Keywords are plain substrings, not words: {@code irs} also matches inside {@code First Republic}, so such a
 * description is filed as a tax payment.
 */
public class TransactionClassifier {

    private final List<Rule> rules;
    private final TaxCategory fallback;

    public TransactionClassifier() {
        this(defaultRules(), TaxCategory.DOMESTIC_BUSINESS_EXPENSE);
    }

    public TransactionClassifier(List<Rule> rules, TaxCategory fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
    }

    /**
     * Classifies one description. Matching is a case-insensitive substring test.
     *
     * @param description sanitized description, may be {@code null}
     * @return category of the first matching rule, or the fallback category
     */
    public TaxCategory classify(String description) {
        if (description == null) {
            return fallback;
        }
        String normalized = description.toLowerCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (rule.matches(normalized)) {
                return rule.category();
            }
        }
        return fallback;
    }

    public List<Rule> rules() {
        return rules;
    }

    public static List<Rule> defaultRules() {
        return List.of(
                new Rule(TaxCategory.INTERNATIONAL_SUBCONTRACTORS,
                        List.of("paypal", "international wire", "intl wire", "foreign wire")),
                new Rule(TaxCategory.TAX_PAYMENT, List.of("irs", "tax")),
                new Rule(TaxCategory.LOAN_PAYMENT, List.of("loan")),
                new Rule(TaxCategory.UTILITY_PAYMENT, List.of("utility", "electric", "water", "gas bill")),
                new Rule(TaxCategory.TRANSFER, List.of("transfer")),
                new Rule(TaxCategory.PROFESSIONAL_SERVICES, List.of(
                        "consulting", "consultant", "legal", "attorney", "law firm",
                        "accounting", "accountant", "bookkeeping", "advisory"))
        );
    }

    /**
     * One classification rule.
     *
     * @param category category assigned on match
     * @param keywords lowercase substrings, any of which triggers the rule
     */
    public record Rule(TaxCategory category, List<String> keywords) {

        public Rule {
            keywords = keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
        }

        boolean matches(String normalizedDescription) {
            return keywords.stream().anyMatch(normalizedDescription::contains);
        }
    }
}
