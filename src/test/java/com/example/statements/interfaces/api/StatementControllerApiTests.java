package com.example.statements.interfaces.api;

import com.example.statements.application.exception.BatchRequestValidationException;
import com.example.statements.application.service.PdfStatementService;
import com.example.statements.application.service.StatementBatchService;
import com.example.statements.application.service.StatementExtractionService;
import com.example.statements.domain.exception.PdfFileRequiredException;
import com.example.statements.domain.model.BatchItemResult;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.domain.model.StatementSource;
import com.example.statements.domain.service.AccountRegistry;
import com.example.statements.infrastructure.exception.PdfProcessingException;
import com.example.statements.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = StatementController.class)
@Import(GlobalExceptionHandler.class)
class StatementControllerApiTests {

    private static final StatementResponse BALANCE_MISSING =
            StatementResponse.error(new ErrorRecord(ErrorCode.MISSING_BALANCE, "Balance missing."));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StatementExtractionService extractionService;

    @MockBean
    private PdfStatementService pdfStatementService;

    @MockBean
    private StatementBatchService batchService;

    /**
     * Rejected statements are regular responses; the envelope carries the error.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void parseReturnsErrorEnvelopeWithOk() throws Exception {
        BDDMockito.given(extractionService.extract(BDDMockito.any(StatementSource.class)))
                .willReturn(BALANCE_MISSING);

        mockMvc.perform(post("/api/statements/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Statement Date: 01/31/2023\",\"filename\":\"jan.pdf\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.error.code").value("MISSING_BALANCE"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void malformedJsonMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/statements/parse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "jan.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(pdfStatementService.extract(BDDMockito.any(MultipartFile.class)))
                .willThrow(new PdfFileRequiredException());

        mockMvc.perform(multipart("/api/statements/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "jan.pdf", "application/pdf", "data".getBytes());
        BDDMockito.given(pdfStatementService.extract(BDDMockito.any(MultipartFile.class)))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/statements/upload").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void batchReturnsResultPerDocument() throws Exception {
        BDDMockito.given(batchService.process(anyList()))
                .willReturn(List.of(new BatchItemResult("jan.pdf", BALANCE_MISSING)));

        mockMvc.perform(post("/api/statements/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"text\":\"x\",\"filename\":\"jan.pdf\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].filename").value("jan.pdf"))
                .andExpect(jsonPath("$[0].response.error.code").value("MISSING_BALANCE"));
    }

    @Test
    void emptyBatchMappedToBadRequest() throws Exception {
        BDDMockito.given(batchService.process(anyList()))
                .willThrow(new BatchRequestValidationException("A batch must contain at least one statement."));

        mockMvc.perform(post("/api/statements/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    @Test
    void accountsListsRegistryWithSnakeCaseFields() throws Exception {
        BDDMockito.given(extractionService.listAccounts())
                .willReturn(AccountRegistry.defaultRegistry().findAll());

        mockMvc.perform(get("/api/accounts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(5))
                .andExpect(jsonPath("$[1].canonical_id").value("000000954291944"))
                .andExpect(jsonPath("$[1].company_name").value("IT DevOps LLC"))
                .andExpect(jsonPath("$[3].digit_length").value(11));
    }
}
