package com.example.statements.application.service;

import com.example.statements.domain.exception.PdfFileRequiredException;
import com.example.statements.domain.exception.UnsupportedPdfFormatException;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.infrastructure.exception.PdfProcessingException;
import com.example.statements.infrastructure.pdf.PdfBoxTextReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

/**
 * Application-layer service for uploaded PDF statements.
 * It validates the upload, delegates text extraction to PDFBox and hands the text to the extraction engine.
 */
@Service
public class PdfStatementService {

    private static final Logger log = LoggerFactory.getLogger(PdfStatementService.class);

    private final PdfBoxTextReader textReader;
    private final StatementExtractionService extractionService;

    /**
     * @param textReader        infrastructure helper reading the PDF text layer
     * @param extractionService engine entry point
     */
    public PdfStatementService(PdfBoxTextReader textReader, StatementExtractionService extractionService) {
        this.textReader = textReader;
        this.extractionService = extractionService;
    }

    /**
     * Extracts a statement from an uploaded PDF.
     *
     * @param file uploaded PDF file
     * @return engine response; unreadable PDFs become a {@code PARSE_ERROR} response
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type and name do not look like a PDF
     */
    public StatementResponse extract(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        String fileName = resolveFileName(file);
        String text;
        try {
            text = textReader.readText(file.getBytes(), fileName);
        } catch (IOException | PdfProcessingException e) {
            log.warn("Could not read uploaded PDF {}: {}", fileName, e.getMessage());
            return StatementResponse.error(new ErrorRecord(ErrorCode.PARSE_ERROR,
                    "The uploaded PDF could not be read."));
        }
        return extractionService.extract(text, fileName);
    }

    /**
     * Performs a lightweight MIME/extension check before handing bytes to PDFBox.
     *
     * @param file uploaded file
     * @return {@code true} when the file looks like a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
