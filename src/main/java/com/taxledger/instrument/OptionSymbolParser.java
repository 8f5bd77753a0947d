package com.taxledger.instrument;

import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.model.OptionContract;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes the broker's option codes and classifies instrument codes.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code US.KWEB250919C36000}: market prefix, underlying, yyMMdd expiry, right, strike x1000</li>
 *   <li>{@code HK.TCH251030C550000}</li>
 *   <li>{@code TSLA240419C200000}: no prefix; parseable, but not classified as an option</li>
 * </ul>
 *
 * <p>Classification requires the market prefix so that bare tickers are never mistaken for
 * option contracts.
 */
@Component
public class OptionSymbolParser {

    private static final Logger log = LoggerFactory.getLogger(OptionSymbolParser.class);

    private static final Pattern OPTION_CODE =
            Pattern.compile("^(?:(US|HK)\\.)?([A-Z0-9]+)(\\d{6})([CP])(\\d+)$");

    private static final BigDecimal STRIKE_DIVISOR = new BigDecimal("1000");

    /**
     * Parses an option code.
     *
     * @return the decoded contract, or empty when the code is not an option code or its expiry
     *     digits are not a real date
     */
    public Optional<OptionContract> parse(String code) {
        if (code == null) {
            return Optional.empty();
        }
        Matcher matcher = OPTION_CODE.matcher(code.trim());
        if (!matcher.matches()) {
            log.debug("Code '{}' does not match the option code format", code);
            return Optional.empty();
        }

        String digits = matcher.group(3);
        LocalDate expiry;
        try {
            expiry = LocalDate.of(
                    2000 + Integer.parseInt(digits.substring(0, 2)),
                    Integer.parseInt(digits.substring(2, 4)),
                    Integer.parseInt(digits.substring(4, 6)));
        } catch (DateTimeException e) {
            log.warn("Option code '{}' carries an invalid expiry '{}'", code, digits);
            return Optional.empty();
        }

        return Optional.of(OptionContract.builder()
                .code(code.trim())
                .market(matcher.group(1))
                .underlying(matcher.group(2))
                .expiry(expiry)
                .right(matcher.group(4).charAt(0))
                .strike(new BigDecimal(matcher.group(5)).divide(STRIKE_DIVISOR))
                .build());
    }

    public Optional<LocalDate> expiryOf(String code) {
        return parse(code).map(OptionContract::getExpiry);
    }

    /** OPTION for market-prefixed option codes, STOCK for everything else. */
    public InstrumentType classify(String code) {
        return parse(code)
                .filter(contract -> contract.getMarket() != null)
                .map(contract -> InstrumentType.OPTION)
                .orElse(InstrumentType.STOCK);
    }
}
