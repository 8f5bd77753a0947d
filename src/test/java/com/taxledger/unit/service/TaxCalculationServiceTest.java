package com.taxledger.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.taxledger.api.dto.request.TransactionRequest;
import com.taxledger.api.dto.response.ReportExportResponse;
import com.taxledger.config.ImportConfig;
import com.taxledger.core.engine.TaxLotEngine;
import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.OptionContract;
import com.taxledger.domain.model.TaxRunResult;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.exception.MalformedRecordException;
import com.taxledger.exception.ResourceNotFoundException;
import com.taxledger.export.ReportWriter;
import com.taxledger.importer.CsvTransactionImporter;
import com.taxledger.importer.DirectionMapper;
import com.taxledger.importer.TransactionRecordValidator;
import com.taxledger.instrument.OptionSymbolParser;
import com.taxledger.reporting.TaxYearPolicy;
import com.taxledger.service.TaxCalculationService;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for TaxCalculationService with a mocked engine: input normalization, report export and
 * option lookup.
 */
@ExtendWith(MockitoExtension.class)
class TaxCalculationServiceTest {

    @Mock
    private TaxLotEngine taxLotEngine;

    @Captor
    private ArgumentCaptor<List<TransactionRecord>> recordsCaptor;

    private TaxCalculationService taxCalculationService;

    @BeforeEach
    void setUp() {
        ImportConfig importConfig = new ImportConfig();
        OptionSymbolParser optionSymbolParser = new OptionSymbolParser();
        TransactionRecordValidator validator = new TransactionRecordValidator();
        taxCalculationService = new TaxCalculationService(
                taxLotEngine,
                new CsvTransactionImporter(importConfig, new DirectionMapper(importConfig), optionSymbolParser, validator),
                validator,
                optionSymbolParser,
                new ReportWriter(TaxYearPolicy.calendarYear()));
    }

    private static TaxRunResult emptyResult() {
        return TaxRunResult.builder()
                .runId("run-1")
                .ledgerRows(List.of())
                .annualSummaries(List.of())
                .anomalies(List.of())
                .cashFlows(List.of())
                .annualCashFlows(List.of())
                .lotSnapshots(List.of())
                .build();
    }

    private static TransactionRequest.TransactionRequestBuilder buy(String instrument) {
        return TransactionRequest.builder()
                .accountId("ACC-1")
                .instrumentId(instrument)
                .action(TransactionAction.BUY)
                .quantity(new BigDecimal("10"))
                .unitPrice(new BigDecimal("100"))
                .feeTotal(BigDecimal.ONE)
                .currency("USD")
                .timestamp(LocalDateTime.parse("2024-03-01T10:00:00"));
    }

    @Nested
    @DisplayName("JSON transactions")
    class JsonRuns {

        @Test
        @DisplayName("Records keep request order, get sequences and a classified instrument type")
        void mapsInOrder() {
            when(taxLotEngine.run(anyList())).thenReturn(emptyResult());

            taxCalculationService.run(List.of(
                    buy("US.AAPL").timestamp(LocalDateTime.parse("2024-03-05T10:00:00")).build(),
                    buy("US.AAPL240419C200000").unitPrice(new BigDecimal("250")).build(),
                    buy("US.MSFT").instrumentType(InstrumentType.STOCK).build()));

            verify(taxLotEngine).run(recordsCaptor.capture());
            List<TransactionRecord> records = recordsCaptor.getValue();
            assertThat(records).extracting(TransactionRecord::getSequence).containsExactly(1L, 2L, 3L);
            assertThat(records).extracting(TransactionRecord::getInstrumentType)
                    .containsExactly(InstrumentType.STOCK, InstrumentType.OPTION, InstrumentType.STOCK);
            assertThat(records.get(1).getUnitPrice()).isEqualByComparingTo("250");
        }

        @Test
        @DisplayName("Fees charged in another currency are rejected before the engine runs")
        void feeCurrencyMismatch() {
            List<TransactionRequest> requests = List.of(buy("US.AAPL").feeCurrency("HKD").build());

            assertThatThrownBy(() -> taxCalculationService.run(requests))
                    .isInstanceOf(MalformedRecordException.class)
                    .hasMessageContaining("HKD");
            verify(taxLotEngine, never()).run(anyList());
        }

        @Test
        @DisplayName("Trades without quantity are rejected")
        void missingQuantity() {
            List<TransactionRequest> requests = List.of(buy("US.AAPL").quantity(null).build());

            assertThatThrownBy(() -> taxCalculationService.run(requests))
                    .isInstanceOf(MalformedRecordException.class);
            verify(taxLotEngine, never()).run(anyList());
        }
    }

    @Test
    @DisplayName("CSV input is imported and sorted before the engine runs")
    void csvRun() {
        when(taxLotEngine.run(anyList())).thenReturn(emptyResult());

        taxCalculationService.runCsv(String.join(
                "\n",
                "account_id,instrument_code,direction,quantity,price,fee,currency,executed_at",
                "ACC-1,US.AAPL,SELL,5,120,1,USD,2024-04-01 10:00:00",
                "ACC-1,US.AAPL,BUY,10,100,1,USD,2024-03-01 10:00:00"));

        verify(taxLotEngine).run(recordsCaptor.capture());
        assertThat(recordsCaptor.getValue()).extracting(TransactionRecord::getAction)
                .containsExactly(TransactionAction.BUY, TransactionAction.SELL);
    }

    @Test
    @DisplayName("Export writes the report folder and returns file names")
    void export(@TempDir Path outputDir) {
        TransactionRecord shortSale = TransactionRecord.builder()
                .sequence(1)
                .accountId("ACC-1")
                .instrumentId("US.TSLA")
                .instrumentType(InstrumentType.STOCK)
                .action(TransactionAction.SELL)
                .quantity(new BigDecimal("5"))
                .unitPrice(new BigDecimal("200"))
                .currency("USD")
                .timestamp(LocalDateTime.parse("2024-03-01T10:00:00"))
                .build();
        TaxRunResult result = TaxRunResult.builder()
                .runId("run-1")
                .ledgerRows(List.of())
                .annualSummaries(List.of())
                .anomalies(List.of(AnomalyRecord.builder()
                        .record(shortSale)
                        .reason(AnomalyReason.NO_OPENING_POSITION)
                        .openQuantity(BigDecimal.ZERO)
                        .message("No open position in US.TSLA")
                        .build()))
                .cashFlows(List.of())
                .annualCashFlows(List.of())
                .lotSnapshots(List.of())
                .build();

        ReportExportResponse response = taxCalculationService.export(result, outputDir);

        assertThat(response.getRunId()).isEqualTo("run-1");
        assertThat(response.getFiles()).containsExactly("ledger.csv", "anomalies.csv", "cash_flow.csv");
        assertThat(response.getAnomalyCount()).isEqualTo(1);
        assertThat(outputDir.resolve("anomalies.csv")).exists();
    }

    @Nested
    @DisplayName("Option lookup")
    class OptionLookup {

        @Test
        @DisplayName("Decodes a broker option code")
        void decodes() {
            OptionContract contract = taxCalculationService.parseOption("US.AAPL240419C200000");

            assertThat(contract.getUnderlying()).isEqualTo("AAPL");
            assertThat(contract.getStrike()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Unparseable code is reported as not found")
        void notFound() {
            assertThatThrownBy(() -> taxCalculationService.parseOption("US.AAPL"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("US.AAPL");
        }
    }
}
