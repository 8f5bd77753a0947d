package com.taxledger.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.taxledger.config.LedgerConfig;
import com.taxledger.domain.enums.AnomalyReason;
import com.taxledger.domain.enums.DisposalType;
import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.domain.model.AnomalyRecord;
import com.taxledger.domain.model.LedgerRow;
import com.taxledger.domain.model.LotKey;
import com.taxledger.domain.model.LotState;
import com.taxledger.domain.model.SplitEvent;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.exception.DataOrderingException;
import com.taxledger.instrument.OptionSymbolParser;
import com.taxledger.ledger.AnomalyFlagger;
import com.taxledger.ledger.DisposalResolver;
import com.taxledger.ledger.LedgerPartitionResult;
import com.taxledger.ledger.LotLedger;
import com.taxledger.ledger.SplitAdjuster;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for LotLedger, the per-lot state machine: acquisitions, disposals, anomalies, splits and
 * auto-expiration of options.
 */
class LotLedgerTest {

    private static final String ACCOUNT = "ACC-1";
    private static final String AAPL = "US.AAPL";
    private static final String AAPL_CALL = "US.AAPL240419C200000";
    private static final LotKey AAPL_KEY = LotKey.of(ACCOUNT, AAPL);

    private LedgerConfig ledgerConfig;
    private DisposalResolver disposalResolver;
    private AnomalyFlagger anomalyFlagger;
    private OptionSymbolParser optionSymbolParser;
    private LotLedger ledger;
    private long sequence;

    @BeforeEach
    void setUp() {
        ledgerConfig = new LedgerConfig();
        disposalResolver = new DisposalResolver(ledgerConfig);
        anomalyFlagger = new AnomalyFlagger();
        optionSymbolParser = new OptionSymbolParser();
        ledger = ledgerWith(SplitAdjuster.none());
        sequence = 0;
    }

    private LotLedger ledgerWith(SplitAdjuster splitAdjuster) {
        return new LotLedger(disposalResolver, anomalyFlagger, splitAdjuster, MathContext.DECIMAL64);
    }

    private TransactionRecord record(
            String instrument,
            InstrumentType type,
            TransactionAction action,
            String quantity,
            String price,
            String fee,
            String timestamp) {
        return TransactionRecord.builder()
                .sequence(++sequence)
                .accountId(ACCOUNT)
                .instrumentId(instrument)
                .instrumentType(type)
                .action(action)
                .quantity(new BigDecimal(quantity))
                .unitPrice(new BigDecimal(price))
                .currency("USD")
                .feeTotal(new BigDecimal(fee))
                .timestamp(LocalDateTime.parse(timestamp))
                .build();
    }

    private TransactionRecord stock(TransactionAction action, String quantity, String price, String fee, String timestamp) {
        return record(AAPL, InstrumentType.STOCK, action, quantity, price, fee, timestamp);
    }

    private LotState aaplLot() {
        return ledger.lot(AAPL_KEY).orElseThrow();
    }

    @Nested
    @DisplayName("Acquisitions")
    class Acquisitions {

        @Test
        @DisplayName("First buy sets the average to price plus fee per unit")
        void firstBuyIncludesFee() {
            ledger.apply(stock(TransactionAction.BUY, "100", "10", "5", "2024-01-02T10:00:00"));

            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("100");
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo("10.05");
            assertThat(aaplLot().getCurrency()).isEqualTo("USD");
        }

        @Test
        @DisplayName("Buy fee is recovered by a sale at cost plus fee per unit, realizing zero")
        void buyFeeAllocatedToBasis() {
            ledger.apply(stock(TransactionAction.BUY, "10", "10.00", "5", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "10", "10.50", "0", "2024-01-03T10:00:00"));

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(row.getMatchedUnitCost()).isEqualByComparingTo("10.50");
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Average cost is the same whatever the order of the buys")
        void averageIndependentOfBuyOrder() {
            String[][] buys = {{"1", "1"}, {"2", "0"}, {"3", "0"}, {"7", "13.37"}, {"11", "0.01"}};
            LotLedger forward = ledgerWith(SplitAdjuster.none());
            LotLedger reverse = ledgerWith(SplitAdjuster.none());

            for (int i = 0; i < buys.length; i++) {
                String time = LocalDateTime.parse("2024-01-02T10:00:00").plusDays(i).toString();
                String[] first = buys[i];
                String[] last = buys[buys.length - 1 - i];
                forward.apply(stock(TransactionAction.BUY, first[0], first[1], "0", time));
                reverse.apply(stock(TransactionAction.BUY, last[0], last[1], "0", time));
            }

            BigDecimal expected = new BigDecimal("94.70").divide(new BigDecimal("24"), MathContext.DECIMAL64);
            BigDecimal forwardAverage = forward.lot(AAPL_KEY).orElseThrow().getAverageUnitCost();
            BigDecimal reverseAverage = reverse.lot(AAPL_KEY).orElseThrow().getAverageUnitCost();
            assertThat(forwardAverage).isEqualTo(reverseAverage).isEqualByComparingTo(expected);
        }

        @Test
        @DisplayName("Second buy blends into a weighted average including both fees")
        void weightedAverage() {
            ledger.apply(stock(TransactionAction.BUY, "100", "10", "5", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.BUY, "50", "13", "5", "2024-01-03T10:00:00"));

            BigDecimal expected = new BigDecimal("1660").divide(new BigDecimal("150"), MathContext.DECIMAL64);
            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("150");
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo(expected);
        }

        @Test
        @DisplayName("Assignment with positive quantity on a stock is an acquisition at the strike")
        void assignmentReceive() {
            ledger.apply(stock(TransactionAction.OPTION_ASSIGN, "100", "45", "0", "2024-01-02T10:00:00"));

            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("100");
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo("45");
        }

        @Test
        @DisplayName("A closed lot reopens at the new purchase price only")
        void reopenAfterClose() {
            ledger.apply(stock(TransactionAction.BUY, "10", "100", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "10", "120", "0", "2024-01-03T10:00:00"));
            ledger.apply(stock(TransactionAction.BUY, "5", "80", "1", "2024-01-04T10:00:00"));

            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("5");
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo("80.2");
        }
    }

    @Nested
    @DisplayName("Disposals")
    class Disposals {

        @Test
        @DisplayName("Partial sale leaves the average cost untouched")
        void averageUnchangedBySale() {
            ledger.apply(stock(TransactionAction.BUY, "100", "10", "5", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.BUY, "50", "13", "5", "2024-01-03T10:00:00"));
            BigDecimal before = aaplLot().getAverageUnitCost();

            ledger.apply(stock(TransactionAction.SELL, "30", "12", "1", "2024-01-04T10:00:00"));

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo(before);
            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("120");
            assertThat(row.getDisposalType()).isEqualTo(DisposalType.SALE);
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("27.0000");
            assertThat(row.getMatchedUnitCost()).isEqualByComparingTo("11.0667");
        }

        @Test
        @DisplayName("Full buy-buy-sell cycle realizes proceeds minus total basis minus sale fee")
        void fullCycle() {
            ledger.apply(stock(TransactionAction.BUY, "10", "100", "2", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.BUY, "10", "110", "2", "2024-01-03T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "20", "120", "3", "2024-01-04T10:00:00"));

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(row.getProceeds()).isEqualByComparingTo("2400");
            assertThat(row.getCostBasis()).isEqualByComparingTo("2104");
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("293");
            assertThat(aaplLot().isOpen()).isFalse();
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo("105.2");
        }

        @Test
        @DisplayName("Sale quantity sign is ignored")
        void negativeSellQuantity() {
            ledger.apply(stock(TransactionAction.BUY, "10", "100", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "-4", "110", "0", "2024-01-03T10:00:00"));

            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("6");
            assertThat(ledger.result(4).getLedgerRows().get(0).getRealizedGainLoss()).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("Assignment with negative quantity delivers shares at the strike")
        void assignmentDelivery() {
            ledger.apply(stock(TransactionAction.BUY, "100", "50", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.OPTION_ASSIGN, "-100", "55", "0", "2024-01-19T16:00:00"));

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(row.getDisposalType()).isEqualTo(DisposalType.ASSIGNMENT);
            assertThat(row.getQuantity()).isEqualByComparingTo("100");
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("500");
            assertThat(aaplLot().isOpen()).isFalse();
        }

        @Test
        @DisplayName("Expiration closes the whole position at zero, realizing the full basis as a loss")
        void expirationZeroesBasis() {
            ledger.apply(record(AAPL_CALL, InstrumentType.OPTION, TransactionAction.BUY, "2", "150", "1.3",
                    "2024-04-01T10:00:00"));
            ledger.apply(record(AAPL_CALL, InstrumentType.OPTION, TransactionAction.OPTION_EXPIRE, "99", "0", "0",
                    "2024-04-19T16:00:00"));

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(row.getDisposalType()).isEqualTo(DisposalType.EXPIRATION);
            assertThat(row.getQuantity()).isEqualByComparingTo("2");
            assertThat(row.getProceeds()).isEqualByComparingTo("0");
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("-301.3");
            assertThat(ledger.lot(LotKey.of(ACCOUNT, AAPL_CALL)).orElseThrow().isOpen()).isFalse();
        }
    }

    @Nested
    @DisplayName("Anomalies")
    class Anomalies {

        @Test
        @DisplayName("Oversell is flagged and the lot is left exactly as it was")
        void oversell() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "15", "6", "0", "2024-01-03T10:00:00"));

            LedgerPartitionResult result = ledger.result(4);
            assertThat(result.getLedgerRows()).isEmpty();
            assertThat(result.getAnomalies()).singleElement().satisfies(anomaly -> {
                assertThat(anomaly.getReason()).isEqualTo(AnomalyReason.OVERSELL);
                assertThat(anomaly.getOpenQuantity()).isEqualByComparingTo("10");
            });
            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("10");
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo("5");
        }

        @Test
        @DisplayName("Sale without any prior purchase has no opening position")
        void noOpeningPosition() {
            ledger.apply(stock(TransactionAction.SELL, "5", "6", "0", "2024-01-03T10:00:00"));

            AnomalyRecord anomaly = ledger.result(4).getAnomalies().get(0);
            assertThat(anomaly.getReason()).isEqualTo(AnomalyReason.NO_OPENING_POSITION);
            assertThat(anomaly.getOpenQuantity()).isEqualByComparingTo("0");
            assertThat(ledger.lot(AAPL_KEY)).isEmpty();
        }

        @Test
        @DisplayName("Processing continues after an anomaly")
        void continuesAfterAnomaly() {
            ledger.apply(stock(TransactionAction.SELL, "5", "6", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-03T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "10", "6", "0", "2024-01-04T10:00:00"));

            assertThat(ledger.result(4).getAnomalies()).hasSize(1);
            assertThat(ledger.result(4).getLedgerRows()).hasSize(1);
        }

        @Test
        @DisplayName("Unsupported instruments are flagged, not accounted")
        void unsupportedInstrument() {
            ledger.apply(record("HK.12345", InstrumentType.UNSUPPORTED, TransactionAction.BUY, "1000", "0.2", "0",
                    "2024-01-02T10:00:00"));

            assertThat(ledger.result(4).getAnomalies().get(0).getReason())
                    .isEqualTo(AnomalyReason.UNRECOGNIZED_INSTRUMENT_TYPE);
            assertThat(ledger.lot(LotKey.of(ACCOUNT, "HK.12345"))).isEmpty();
        }

        @Test
        @DisplayName("Expiration of a stock is flagged")
        void expireOnStock() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.OPTION_EXPIRE, "10", "0", "0", "2024-01-03T10:00:00"));

            assertThat(ledger.result(4).getAnomalies().get(0).getReason())
                    .isEqualTo(AnomalyReason.UNRECOGNIZED_INSTRUMENT_TYPE);
            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("Receiving an option by assignment is flagged")
        void assignReceiveOnOption() {
            ledger.apply(record(AAPL_CALL, InstrumentType.OPTION, TransactionAction.OPTION_ASSIGN, "1", "0", "0",
                    "2024-01-02T10:00:00"));

            assertThat(ledger.result(4).getAnomalies().get(0).getReason())
                    .isEqualTo(AnomalyReason.UNRECOGNIZED_INSTRUMENT_TYPE);
        }

        @Test
        @DisplayName("Sale in a different currency from the open lot is flagged")
        void currencyMismatch() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "10", "6", "0", "2024-01-03T10:00:00").toBuilder()
                    .currency("HKD")
                    .build());

            assertThat(ledger.result(4).getAnomalies().get(0).getReason()).isEqualTo(AnomalyReason.CURRENCY_MISMATCH);
            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("A closed lot may reopen in another currency")
        void reopenInOtherCurrency() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "10", "6", "0", "2024-01-03T10:00:00"));
            ledger.apply(stock(TransactionAction.BUY, "10", "40", "0", "2024-01-04T10:00:00").toBuilder()
                    .currency("HKD")
                    .build());

            assertThat(ledger.result(4).getAnomalies()).isEmpty();
            assertThat(aaplLot().getCurrency()).isEqualTo("HKD");
        }
    }

    @Nested
    @DisplayName("Ordering and cash flows")
    class OrderingAndCashFlows {

        @Test
        @DisplayName("A record older than the last applied one for its lot fails the run")
        void outOfOrder() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-03T10:00:00"));
            TransactionRecord late = stock(TransactionAction.SELL, "5", "6", "0", "2024-01-02T10:00:00");

            assertThatThrownBy(() -> ledger.apply(late))
                    .isInstanceOf(DataOrderingException.class)
                    .hasMessageContaining(AAPL_KEY.toString());
        }

        @Test
        @DisplayName("Equal timestamps are applied in input order")
        void equalTimestamps() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-02T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "10", "6", "0", "2024-01-02T10:00:00"));

            assertThat(ledger.result(4).getLedgerRows()).hasSize(1);
        }

        @Test
        @DisplayName("Other lots are not affected by ordering of a different lot")
        void orderingIsPerLot() {
            ledger.apply(stock(TransactionAction.BUY, "10", "5", "0", "2024-01-03T10:00:00"));
            ledger.apply(record("US.MSFT", InstrumentType.STOCK, TransactionAction.BUY, "1", "400", "0",
                    "2024-01-02T10:00:00"));

            assertThat(ledger.lot(LotKey.of(ACCOUNT, "US.MSFT"))).isPresent();
        }

        @Test
        @DisplayName("Dividends pass through as cash flows without creating a lot")
        void dividend() {
            TransactionRecord dividend = stock(TransactionAction.DIVIDEND, "0", "0", "0", "2024-02-15T00:00:00")
                    .toBuilder()
                    .amount(new BigDecimal("24.00"))
                    .build();

            ledger.apply(dividend);

            assertThat(ledger.result(4).getCashFlows()).singleElement().satisfies(cashFlow -> {
                assertThat(cashFlow.getAction()).isEqualTo(TransactionAction.DIVIDEND);
                assertThat(cashFlow.getAmount()).isEqualByComparingTo("24");
            });
            assertThat(ledger.lot(AAPL_KEY)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Stock splits")
    class Splits {

        private final SplitEvent twoForOne =
                SplitEvent.parse(AAPL, LocalDate.parse("2024-06-10"), "2:1");

        @Test
        @DisplayName("Split before a sale doubles quantity and halves the average, preserving basis")
        void splitBeforeSale() {
            ledger = ledgerWith(new SplitAdjuster(List.of(twoForOne)));
            ledger.apply(stock(TransactionAction.BUY, "10", "100", "0", "2024-06-01T10:00:00"));
            BigDecimal basisBefore = aaplLot().getOpenQuantity().multiply(aaplLot().getAverageUnitCost());

            ledger.apply(stock(TransactionAction.SELL, "20", "60", "0", "2024-06-15T10:00:00"));

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(row.getMatchedUnitCost()).isEqualByComparingTo("50");
            assertThat(row.getCostBasis()).isEqualByComparingTo(basisBefore);
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("200");
            assertThat(aaplLot().isOpen()).isFalse();
        }

        @Test
        @DisplayName("Lots opened after the split are not split again")
        void lotOpenedAfterSplit() {
            ledger = ledgerWith(new SplitAdjuster(List.of(twoForOne)));
            ledger.apply(stock(TransactionAction.BUY, "20", "55", "0", "2024-06-12T10:00:00"));
            ledger.apply(stock(TransactionAction.SELL, "20", "60", "0", "2024-06-15T10:00:00"));

            assertThat(ledger.result(4).getLedgerRows().get(0).getRealizedGainLoss()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Splits effective by the as-of date are applied when the ledger finishes")
        void splitAppliedAtFinish() {
            ledger = ledgerWith(new SplitAdjuster(List.of(twoForOne)));
            ledger.apply(stock(TransactionAction.BUY, "10", "100", "0", "2024-06-01T10:00:00"));

            ledger.finish(LocalDate.parse("2024-12-31"), true, optionSymbolParser);

            assertThat(aaplLot().getOpenQuantity()).isEqualByComparingTo("20");
            assertThat(aaplLot().getAverageUnitCost()).isEqualByComparingTo("50");
            assertThat(ledger.result(4).getLedgerRows()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Auto-expiration")
    class AutoExpiration {

        private void buyCall() {
            ledger.apply(record(AAPL_CALL, InstrumentType.OPTION, TransactionAction.BUY, "2", "300", "0",
                    "2024-04-01T10:00:00"));
        }

        @Test
        @DisplayName("Open option past its expiry gets a synthetic expiration row")
        void pastExpiry() {
            buyCall();

            ledger.finish(LocalDate.parse("2024-05-01"), true, optionSymbolParser);

            LedgerRow row = ledger.result(4).getLedgerRows().get(0);
            assertThat(row.isSynthetic()).isTrue();
            assertThat(row.getDisposalType()).isEqualTo(DisposalType.EXPIRATION);
            assertThat(row.getTimestamp()).isEqualTo(LocalDateTime.parse("2024-04-19T23:59:59"));
            assertThat(row.getRealizedGainLoss()).isEqualByComparingTo("-600");
            assertThat(row.getNote()).contains("2024-04-19");
        }

        @Test
        @DisplayName("Option expiring on the as-of date is still open")
        void expiryOnAsOfDate() {
            buyCall();

            ledger.finish(LocalDate.parse("2024-04-19"), true, optionSymbolParser);

            assertThat(ledger.result(4).getLedgerRows()).isEmpty();
        }

        @Test
        @DisplayName("Nothing is expired when auto-expiration is off")
        void disabled() {
            buyCall();

            ledger.finish(LocalDate.parse("2024-05-01"), false, optionSymbolParser);

            assertThat(ledger.result(4).getLedgerRows()).isEmpty();
        }

        @Test
        @DisplayName("Option without an expiry in its code expires on its last trade date")
        void unparseableCodeUsesLastTradeDate() {
            ledger.apply(record("US.WEIRD", InstrumentType.OPTION, TransactionAction.BUY, "2", "100", "0",
                    "2024-04-01T10:00:00"));
            ledger.apply(record("US.WEIRD", InstrumentType.OPTION, TransactionAction.SELL, "1", "150", "0",
                    "2024-04-03T10:00:00"));

            ledger.finish(LocalDate.parse("2025-01-01"), true, optionSymbolParser);

            List<LedgerRow> rows = ledger.result(4).getLedgerRows();
            assertThat(rows).hasSize(2);
            LedgerRow expiry = rows.get(1);
            assertThat(expiry.isSynthetic()).isTrue();
            assertThat(expiry.getTimestamp()).isEqualTo(LocalDateTime.parse("2024-04-03T23:59:59"));
            assertThat(expiry.getRealizedGainLoss()).isEqualByComparingTo("-100");
            assertThat(expiry.getNote()).contains("2024-04-03", "last trade date");
            assertThat(ledger.lot(LotKey.of(ACCOUNT, "US.WEIRD")).orElseThrow().isOpen()).isFalse();
        }

        @Test
        @DisplayName("Option without an expiry in its code stays open while its last trade is not before the as-of date")
        void unparseableCodeTradedOnAsOfDate() {
            ledger.apply(record("US.WEIRD", InstrumentType.OPTION, TransactionAction.BUY, "1", "100", "0",
                    "2024-04-01T10:00:00"));

            ledger.finish(LocalDate.parse("2024-04-01"), true, optionSymbolParser);

            assertThat(ledger.result(4).getLedgerRows()).isEmpty();
            assertThat(ledger.lot(LotKey.of(ACCOUNT, "US.WEIRD")).orElseThrow().isOpen()).isTrue();
        }
    }
}
