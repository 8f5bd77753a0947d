package com.taxledger.unit.instrument;

import static org.assertj.core.api.Assertions.assertThat;

import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.model.OptionContract;
import com.taxledger.instrument.OptionSymbolParser;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for OptionSymbolParser: option code decoding, instrument classification and expiry lookup. */
class OptionSymbolParserTest {

    private final OptionSymbolParser parser = new OptionSymbolParser();

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("US option code decodes market, underlying, expiry, right and strike")
        void usCall() {
            OptionContract contract = parser.parse("US.KWEB250919C36000").orElseThrow();

            assertThat(contract.getMarket()).isEqualTo("US");
            assertThat(contract.getUnderlying()).isEqualTo("KWEB");
            assertThat(contract.getExpiry()).isEqualTo(LocalDate.parse("2025-09-19"));
            assertThat(contract.getRight()).isEqualTo('C');
            assertThat(contract.getStrike()).isEqualByComparingTo("36");
        }

        @Test
        @DisplayName("HK put with a fractional strike")
        void hkPut() {
            OptionContract contract = parser.parse("HK.TCH251030P552500").orElseThrow();

            assertThat(contract.getMarket()).isEqualTo("HK");
            assertThat(contract.getRight()).isEqualTo('P');
            assertThat(contract.getStrike()).isEqualByComparingTo("552.5");
        }

        @Test
        @DisplayName("Code without market prefix still parses")
        void noPrefix() {
            assertThat(parser.parse("TSLA240419C200000")).hasValueSatisfying(contract -> {
                assertThat(contract.getMarket()).isNull();
                assertThat(contract.getUnderlying()).isEqualTo("TSLA");
            });
        }

        @Test
        @DisplayName("Impossible expiry dates and non-option codes are empty")
        void invalid() {
            assertThat(parser.parse("US.AAPL241332C200000")).isEmpty();
            assertThat(parser.parse("US.AAPL")).isEmpty();
            assertThat(parser.parse(null)).isEmpty();
            assertThat(parser.expiryOf("US.AAPL")).isEmpty();
        }
    }

    @Test
    @DisplayName("Only market-prefixed option codes classify as options")
    void classify() {
        assertThat(parser.classify("US.AAPL240419C200000")).isEqualTo(InstrumentType.OPTION);
        assertThat(parser.classify("TSLA240419C200000")).isEqualTo(InstrumentType.STOCK);
        assertThat(parser.classify("US.AAPL")).isEqualTo(InstrumentType.STOCK);
        assertThat(parser.classify("00700")).isEqualTo(InstrumentType.STOCK);
    }
}
