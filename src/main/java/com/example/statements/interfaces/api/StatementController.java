package com.example.statements.interfaces.api;

import com.example.statements.application.service.PdfStatementService;
import com.example.statements.application.service.StatementBatchService;
import com.example.statements.application.service.StatementExtractionService;
import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.BatchItemResult;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.interfaces.api.dto.ParseStatementRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Interfaces-layer REST controller for statement extraction.
 * Both success and rejected statements are returned with HTTP 200; the envelope's {@code status} tells them apart.
 */
@RestController
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class StatementController {

    private final StatementExtractionService extractionService;
    private final PdfStatementService pdfStatementService;
    private final StatementBatchService batchService;

    /**
     * Creates the controller with the required application services.
     *
     * @param extractionService   engine entry point for statement text
     * @param pdfStatementService service reading uploaded PDFs
     * @param batchService        service running many statements in parallel
     */
    public StatementController(StatementExtractionService extractionService,
                               PdfStatementService pdfStatementService,
                               StatementBatchService batchService) {
        this.extractionService = extractionService;
        this.pdfStatementService = pdfStatementService;
        this.batchService = batchService;
    }

    /**
     * Extracts a statement from text that was already pulled out of a PDF.
     *
     * @param request statement text and source filename
     * @return response envelope
     */
    @PostMapping(value = "/api/statements/parse", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatementResponse> parse(@RequestBody ParseStatementRequest request) {
        return ResponseEntity.ok(extractionService.extract(request.toSource()));
    }

    /**
     * Extracts a statement from an uploaded text-layer PDF.
     *
     * @param file uploaded PDF
     * @return response envelope
     */
    @PostMapping(value = "/api/statements/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StatementResponse> upload(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(pdfStatementService.extract(file));
    }

    @PostMapping(value = "/api/statements/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<BatchItemResult>> batch(@RequestBody List<ParseStatementRequest> requests) {
        return ResponseEntity.ok(batchService.process(requests.stream()
                .map(request -> request == null ? null : request.toSource())
                .toList()));
    }

    @GetMapping("/api/accounts")
    public ResponseEntity<List<AccountReference>> accounts() {
        return ResponseEntity.ok(extractionService.listAccounts());
    }
}
