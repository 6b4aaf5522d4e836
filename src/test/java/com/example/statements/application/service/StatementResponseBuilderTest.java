package com.example.statements.application.service;

import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.Deposit;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.FilenameStrategy;
import com.example.statements.domain.model.StatementRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.domain.model.TaxCategory;
import com.example.statements.domain.model.Withdrawal;
import com.example.statements.domain.service.AccountRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatementResponseBuilderTest {

    private static final AccountReference IT_DEVOPS = AccountRegistry.defaultRegistry()
            .findByCanonicalId("000000954291944").orElseThrow();

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void successJsonHasFixedFieldOrderAndTwoDecimalAmounts() {
        StatementResponseBuilder builder = new StatementResponseBuilder(FilenameStrategy.SOURCE, objectMapper);

        String json = builder.toJson(builder.success(record()));

        assertThat(json).isEqualTo("{\"status\":\"success\",\"data\":{"
                + "\"statement_filename\":\"jan.pdf\","
                + "\"account_number\":\"000000954291944\","
                + "\"statement_date\":\"01/31/2023\","
                + "\"period_start\":\"01/01/2023\","
                + "\"period_end\":\"01/31/2023\","
                + "\"beginning_balance\":5000.00,"
                + "\"ending_balance\":13571.27,"
                + "\"total_fees\":0.00,"
                + "\"important_notes\":\"\","
                + "\"deposits\":[{\"date\":\"01/05/2023\",\"description\":\"Online Transfer\",\"amount\":10000.00}],"
                + "\"withdrawals\":[{\"date\":\"01/17/2023\",\"description\":\"Online International Wire Transfer\","
                + "\"amount\":1428.73,\"tax_category\":\"International Subcontractors\"}]}}");
    }

    @Test
    void errorJsonCarriesOnlyStatusAndError() {
        StatementResponseBuilder builder = new StatementResponseBuilder(FilenameStrategy.SOURCE, objectMapper);

        String json = builder.toJson(builder.error(new ErrorRecord(ErrorCode.MISSING_BALANCE, "Balance missing.")));

        assertThat(json).isEqualTo(
                "{\"status\":\"error\",\"error\":{\"code\":\"MISSING_BALANCE\",\"message\":\"Balance missing.\"}}");
    }

    @Test
    void accountMonthYearStrategyRenamesOutputFile() {
        StatementResponseBuilder builder =
                new StatementResponseBuilder(FilenameStrategy.ACCOUNT_MONTH_YEAR, objectMapper);

        StatementResponse response = builder.success(record());

        assertThat(response.data().statementFilename()).isEqualTo("1944-01-2023.pdf");
    }

    private static StatementRecord record() {
        return new StatementRecord("jan.pdf", IT_DEVOPS,
                LocalDate.of(2023, 1, 31), LocalDate.of(2023, 1, 1), LocalDate.of(2023, 1, 31),
                new BigDecimal("5000.00"), new BigDecimal("13571.27"), new BigDecimal("0.00"), null,
                List.of(new Deposit(LocalDate.of(2023, 1, 5), "Online Transfer", new BigDecimal("10000.00"))),
                List.of(new Withdrawal(LocalDate.of(2023, 1, 17), "Online International Wire Transfer",
                        new BigDecimal("1428.73"), TaxCategory.INTERNATIONAL_SUBCONTRACTORS)));
    }
}
