package com.example.statements.domain.extraction;

import com.example.statements.domain.model.ExtractedField;
import com.example.statements.domain.model.ExtractedStatement;
import com.example.statements.domain.model.TransactionRow;
import com.example.statements.domain.model.TransactionSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the text of a bank statement and collects candidate values for every output field.
 * Header fields are read from labeled lines, transactions from the deposit and withdrawal sections.
 * Nothing here decides whether a statement is acceptable; absent or rejected fields are handed on as such.
 */
public class StatementTextScanner {

    private static final Logger log = LoggerFactory.getLogger(StatementTextScanner.class);

    private static final Pattern ACCOUNT_LABEL = Pattern.compile(
            "^(?:primary\\s+)?account\\s*(?:number|no\\.?|#)?\\s*[:#]?\\s*(?<value>[0-9X][0-9X\\s-]{3,})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HOLDER_LABEL = Pattern.compile(
            "^(?:account\\s+holder|company|business\\s+name|customer)\\s*:\\s*(?<value>.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATEMENT_DATE_LABEL = Pattern.compile(
            "^statement\\s+date\\s*:?\\s*(?<value>.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PERIOD_START_LABEL = Pattern.compile(
            "^period\\s+(?:start|begin(?:ning)?)\\s*(?:date)?\\s*:?\\s*(?<value>.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PERIOD_END_LABEL = Pattern.compile(
            "^period\\s+end(?:ing)?\\s*(?:date)?\\s*:?\\s*(?<value>.*)$", Pattern.CASE_INSENSITIVE);
    private static final String RANGE_DATE = "(?:\\d{2}/\\d{2}/\\d{4}|(?:January|February|March|April|May|June|July"
            + "|August|September|October|November|December)\\s+\\d{1,2},?\\s+\\d{4})";
    private static final Pattern PERIOD_RANGE_LABEL = Pattern.compile(
            "^(?:statement\\s+)?period\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_PERIOD_RANGE = Pattern.compile(
            "^" + RANGE_DATE + "\\s+(?:through|thru)\\s+" + RANGE_DATE + "\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BEGINNING_BALANCE_LABEL = Pattern.compile(
            "^(?:beginning|opening|starting|previous)\\s+balance\\b(?<value>.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENDING_BALANCE_LABEL = Pattern.compile(
            "^(?:ending|closing|new)\\s+balance\\b(?<value>.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FEES_LABEL = Pattern.compile(
            "^(?:total\\s+fees|fees\\s+charged|service\\s+(?:fees|charges?))\\b(?<value>.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NOTES_LABEL = Pattern.compile(
            "^important\\s+notes?\\s*:?\\s*(?<value>.*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DEPOSIT_HEADER = Pattern.compile(
            "^(?:deposits(?:\\s+and\\s+(?:additions|credits))?|credits|additions)$");
    private static final Pattern WITHDRAWAL_HEADER = Pattern.compile(
            "^(?:(?:electronic|atm\\s*&\\s*debit\\s+card|atm\\s+and\\s+debit\\s+card|other)\\s+)?withdrawals"
                    + "(?:\\s+and\\s+(?:debits|subtractions))?$|^checks\\s+paid$|^debits$");
    private static final Pattern SECTION_END = Pattern.compile(
            "^(?:total\\b|daily\\s+(?:ending\\s+)?balance|service\\s+charge\\s+summary|checking\\s+summary"
                    + "|account\\s+summary|important\\s+notes?)");
    private static final Pattern ROW_START = Pattern.compile("^(?<date>\\d{2}/\\d{2}(?:/\\d{4})?)(?:\\s+(?<rest>.*))?$");
    private static final Pattern FULL_ROW_DATE = Pattern.compile("\\d{2}/\\d{2}/\\d{4}");
    private static final Pattern TWO_DECIMAL_AMOUNT = Pattern.compile("^[-(]?\\$?[\\d,]*\\d\\.\\d{2}\\)?$");

    private final DateExtractor dateExtractor;
    private final AmountExtractor amountExtractor;
    private final FreeTextExtractor freeTextExtractor;

    public StatementTextScanner() {
        this(new DateExtractor(), new AmountExtractor(), new FreeTextExtractor());
    }

    public StatementTextScanner(DateExtractor dateExtractor, AmountExtractor amountExtractor,
                                FreeTextExtractor freeTextExtractor) {
        this.dateExtractor = dateExtractor;
        this.amountExtractor = amountExtractor;
        this.freeTextExtractor = freeTextExtractor;
    }

    /**
     * Scans one statement text.
     *
     * @param text raw statement text
     * @return candidate values, each possibly absent
     */
    public ExtractedStatement scan(String text) {
        List<String> lines = text == null ? List.of() : text.lines().map(String::strip).toList();
        HeaderFields header = scanHeader(lines);
        List<TransactionRow> rows = scanTransactions(lines, header);
        log.debug("Scanned {} lines: account label {}, {} transaction rows",
                lines.size(), header.accountNumber.present() ? "found" : "missing", rows.size());

        return new ExtractedStatement(
                header.accountNumber,
                header.companyHint != null ? header.companyHint : text,
                header.statementDate,
                header.periodStart,
                header.periodEnd,
                header.beginningBalance,
                header.endingBalance,
                header.totalFees.isAbsent() && !header.totalFees.isRejected()
                        ? ExtractedField.of(BigDecimal.ZERO.setScale(2), null)
                        : header.totalFees,
                header.importantNotes.present() ? header.importantNotes : ExtractedField.of("", null),
                rows
        );
    }

    /**
     * Reads the labeled header lines. The first occurrence of each label wins.
     * An unlabeled {@code <date> through <date>} line is only taken as the period when it starts with a date;
     * labeled lines are matched before the {@code Statement Period} label so dates inside notes never become the period.
     *
     * @param lines stripped statement lines
     * @return header candidates
     */
    private HeaderFields scanHeader(List<String> lines) {
        HeaderFields header = new HeaderFields();
        for (String line : lines) {
            if (line.isEmpty()) {
                continue;
            }
            if (BARE_PERIOD_RANGE.matcher(line).find()) {
                if (!header.periodStartSeen && !header.periodEndSeen) {
                    readPeriodRange(line, header);
                }
                continue;
            }
            if (ROW_START.matcher(line).matches()) {
                continue;
            }
            Matcher matcher;
            if (header.accountNumber.isAbsent() && (matcher = ACCOUNT_LABEL.matcher(line)).find()) {
                String value = matcher.group("value").strip();
                header.accountNumber = ExtractedField.of(value, value);
            } else if (header.companyHint == null && (matcher = HOLDER_LABEL.matcher(line)).find()) {
                header.companyHint = matcher.group("value").strip();
            } else if (!header.statementDateSeen && (matcher = STATEMENT_DATE_LABEL.matcher(line)).find()) {
                header.statementDateSeen = true;
                header.statementDate = dateExtractor.extract(matcher.group("value"));
            } else if (!header.periodStartSeen && (matcher = PERIOD_START_LABEL.matcher(line)).find()) {
                header.periodStartSeen = true;
                header.periodStart = dateExtractor.extract(matcher.group("value"));
            } else if (!header.periodEndSeen && (matcher = PERIOD_END_LABEL.matcher(line)).find()) {
                header.periodEndSeen = true;
                header.periodEnd = dateExtractor.extract(matcher.group("value"));
            } else if (!header.beginningBalanceSeen && (matcher = BEGINNING_BALANCE_LABEL.matcher(line)).find()) {
                header.beginningBalanceSeen = true;
                header.beginningBalance = amountExtractor.extract(matcher.group("value"));
            } else if (!header.endingBalanceSeen && (matcher = ENDING_BALANCE_LABEL.matcher(line)).find()) {
                header.endingBalanceSeen = true;
                header.endingBalance = amountExtractor.extract(matcher.group("value"));
            } else if (!header.totalFeesSeen && (matcher = FEES_LABEL.matcher(line)).find()
                    && readFees(matcher.group("value"), header)) {
                continue;
            } else if (header.importantNotes.isAbsent() && (matcher = NOTES_LABEL.matcher(line)).find()) {
                header.importantNotes = freeTextExtractor.extract(matcher.group("value"));
            } else if (!header.periodStartSeen && !header.periodEndSeen && PERIOD_RANGE_LABEL.matcher(line).find()) {
                readPeriodRange(line, header);
            }
        }
        return header;
    }

    /**
     * Reads a {@code <start> through <end>} line. Lines with fewer than two dates are left for the other labels.
     *
     * @param line   candidate period line
     * @param header accumulator
     * @return {@code true} when the line supplied both period dates
     */
    private boolean readPeriodRange(String line, HeaderFields header) {
        List<ExtractedField<LocalDate>> dates = dateExtractor.extractAll(line);
        if (dates.size() < 2) {
            return false;
        }
        header.periodStartSeen = true;
        header.periodEndSeen = true;
        header.periodStart = dates.get(0);
        header.periodEnd = dates.get(1);
        return true;
    }

    /**
     * Reads a fee line. Banners such as {@code Service Charge Summary} carry no number and are skipped.
     *
     * @param value  text after the fee label
     * @param header accumulator
     * @return {@code true} when the line carried a fee token, parsable or not
     */
    private boolean readFees(String value, HeaderFields header) {
        ExtractedField<BigDecimal> fees = amountExtractor.extract(value);
        if (fees.isAbsent() && !fees.isRejected()) {
            return false;
        }
        header.totalFeesSeen = true;
        header.totalFees = fees;
        return true;
    }

    /**
     * Reads the transaction rows of every deposit and withdrawal section.
     * A section runs until a total line, a summary banner or the next section header.
     *
     * @param lines  stripped statement lines
     * @param header header candidates, used to give year-less row dates their year
     * @return rows in statement order
     */
    private List<TransactionRow> scanTransactions(List<String> lines, HeaderFields header) {
        List<TransactionRow> rows = new ArrayList<>();
        TransactionSection section = null;
        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line.isEmpty()) {
                continue;
            }
            String normalized = normalizeBanner(line);
            if (DEPOSIT_HEADER.matcher(normalized).matches()) {
                section = TransactionSection.DEPOSITS;
                continue;
            }
            if (WITHDRAWAL_HEADER.matcher(normalized).matches()) {
                section = TransactionSection.WITHDRAWALS;
                continue;
            }
            if (SECTION_END.matcher(normalized).find()) {
                section = null;
                continue;
            }
            if (section == null || BARE_PERIOD_RANGE.matcher(line).find()) {
                continue;
            }
            Matcher row = ROW_START.matcher(line);
            if (row.matches()) {
                rows.add(toRow(section, index + 1, row.group("date"), row.group("rest"), header));
            }
        }
        return rows;
    }

    /**
     * Splits a row into date, description and trailing amount.
     *
     * @param section    current section
     * @param lineNumber 1-based line number
     * @param dateToken  leading date token
     * @param rest       remainder of the line, may be {@code null}
     * @param header     header candidates for year resolution
     * @return candidate row
     */
    private TransactionRow toRow(TransactionSection section, int lineNumber, String dateToken, String rest,
                                 HeaderFields header) {
        ExtractedField<LocalDate> date = FULL_ROW_DATE.matcher(dateToken).matches()
                ? dateExtractor.parseToken(dateToken)
                : dateExtractor.resolveMonthDay(dateToken,
                header.periodStart.orElse(null),
                header.periodEnd.orElse(null),
                header.statementDate.orElse(null));

        ExtractedField<BigDecimal> amount = ExtractedField.absent();
        String descriptionText = "";
        if (rest != null && !rest.isBlank()) {
            String remainder = rest.strip();
            int split = remainder.lastIndexOf(' ');
            String lastToken = split < 0 ? remainder : remainder.substring(split + 1);
            if (lastToken.chars().anyMatch(Character::isDigit)) {
                descriptionText = split < 0 ? "" : remainder.substring(0, split).strip();
                int previousSplit = descriptionText.lastIndexOf(' ');
                String previousToken = previousSplit < 0 ? descriptionText : descriptionText.substring(previousSplit + 1);
                if (TWO_DECIMAL_AMOUNT.matcher(lastToken).matches() && TWO_DECIMAL_AMOUNT.matcher(previousToken).matches()) {
                    // amount followed by a running balance: the amount column is ambiguous
                    amount = ExtractedField.rejected(previousToken + " " + lastToken);
                    descriptionText = previousSplit < 0 ? "" : descriptionText.substring(0, previousSplit);
                } else {
                    amount = amountExtractor.parse(lastToken);
                }
            } else {
                descriptionText = remainder;
            }
        }
        ExtractedField<String> description = freeTextExtractor.extract(descriptionText);
        return new TransactionRow(section, lineNumber, date, description, amount, null);
    }

    private static String normalizeBanner(String line) {
        return line.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .replaceAll("[:\\s]+$", "");
    }

    /**
     * Mutable accumulator used while walking the header lines.
     */
    private static final class HeaderFields {
        private ExtractedField<String> accountNumber = ExtractedField.absent();
        private String companyHint;
        private ExtractedField<LocalDate> statementDate = ExtractedField.absent();
        private ExtractedField<LocalDate> periodStart = ExtractedField.absent();
        private ExtractedField<LocalDate> periodEnd = ExtractedField.absent();
        private ExtractedField<BigDecimal> beginningBalance = ExtractedField.absent();
        private ExtractedField<BigDecimal> endingBalance = ExtractedField.absent();
        private ExtractedField<BigDecimal> totalFees = ExtractedField.absent();
        private ExtractedField<String> importantNotes = ExtractedField.absent();
        private boolean statementDateSeen;
        private boolean periodStartSeen;
        private boolean periodEndSeen;
        private boolean beginningBalanceSeen;
        private boolean endingBalanceSeen;
        private boolean totalFeesSeen;
    }
}
