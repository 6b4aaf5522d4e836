package com.example.statements.application.service;

import com.example.statements.domain.exception.StatementRejectedException;
import com.example.statements.domain.extraction.FilenameExtractor;
import com.example.statements.domain.extraction.StatementTextScanner;
import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.ExtractedField;
import com.example.statements.domain.model.ExtractedStatement;
import com.example.statements.domain.model.StatementRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.domain.model.StatementSource;
import com.example.statements.domain.model.TransactionRow;
import com.example.statements.domain.model.TransactionSection;
import com.example.statements.domain.service.AccountRegistry;
import com.example.statements.domain.service.RecordValidator;
import com.example.statements.domain.service.TransactionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns one statement text into a success or error response.
 * It runs extraction, account resolution, classification and validation in that order and never lets an
 * exception escape: every failure ends up as an error envelope.
 */
@Service
public class StatementExtractionService {

    private static final Logger log = LoggerFactory.getLogger(StatementExtractionService.class);

    private final StatementTextScanner scanner;
    private final FilenameExtractor filenameExtractor;
    private final AccountRegistry accountRegistry;
    private final TransactionClassifier classifier;
    private final RecordValidator validator;
    private final StatementResponseBuilder responseBuilder;

    /**
     * Creates the service with the engine collaborators.
     *
     * @param scanner           reads candidate fields from statement text
     * @param filenameExtractor reduces and checks the source filename
     * @param accountRegistry   closed list of known accounts
     * @param classifier        assigns tax categories to withdrawals
     * @param validator         accepts or rejects the extracted statement
     * @param responseBuilder   builds the response envelope
     */
    public StatementExtractionService(StatementTextScanner scanner,
                                      FilenameExtractor filenameExtractor,
                                      AccountRegistry accountRegistry,
                                      TransactionClassifier classifier,
                                      RecordValidator validator,
                                      StatementResponseBuilder responseBuilder) {
        this.scanner = scanner;
        this.filenameExtractor = filenameExtractor;
        this.accountRegistry = accountRegistry;
        this.classifier = classifier;
        this.validator = validator;
        this.responseBuilder = responseBuilder;
    }

    public StatementResponse extract(StatementSource source) {
        if (source == null) {
            return parseError("No statement was supplied.");
        }
        return extract(source.text(), source.filename());
    }

    /**
     * Processes a single statement.
     *
     * @param text     statement text as read from the PDF text layer
     * @param filename source filename or path
     * @return success response with the validated record, or error response with exactly one code
     */
    public StatementResponse extract(String text, String filename) {
        if (text == null || text.isBlank()) {
            log.warn("Rejected statement {}: no text", filename);
            return parseError("Statement text is empty.");
        }
        try {
            ExtractedField<String> reducedFilename = filenameExtractor.extract(filename);
            ExtractedStatement extracted = scanner.scan(text);
            ExtractedField<AccountReference> account =
                    accountRegistry.normalize(extracted.accountNumber().value(), extracted.companyHint());
            ExtractedStatement classified = extracted.withTransactions(classify(extracted.transactions()));

            StatementRecord record = validator.validate(reducedFilename, account, classified);
            log.info("Extracted statement {} for account ending {}: {} deposits, {} withdrawals",
                    record.filename(), record.account().lastFour(),
                    record.deposits().size(), record.withdrawals().size());
            return responseBuilder.success(record);
        } catch (StatementRejectedException ex) {
            log.warn("Rejected statement {}: {} ({})", filename, ex.getCode(), ex.getMessage());
            return responseBuilder.error(ex.toErrorRecord());
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while extracting statement {}", filename, ex);
            return parseError("Statement could not be processed.");
        }
    }

    /**
     * Same as {@link #extract(String, String)} but rendered as JSON.
     *
     * @param text     statement text
     * @param filename source filename
     * @return response JSON
     */
    public String extractAsJson(String text, String filename) {
        return responseBuilder.toJson(extract(text, filename));
    }

    public List<AccountReference> listAccounts() {
        return accountRegistry.findAll();
    }

    private List<TransactionRow> classify(List<TransactionRow> rows) {
        return rows.stream()
                .map(row -> row.section() == TransactionSection.WITHDRAWALS && row.hasDescription()
                        ? row.withTaxCategory(classifier.classify(row.description().value()))
                        : row)
                .toList();
    }

    private StatementResponse parseError(String message) {
        return responseBuilder.error(new ErrorRecord(ErrorCode.PARSE_ERROR, message));
    }
}
