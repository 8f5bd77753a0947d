package com.taxledger.importer;

import com.taxledger.config.ImportConfig;
import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.exception.MalformedRecordException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps the broker's direction strings ("OrderSide.Buy", "卖出", "sell_short", ...) to
 * {@link TransactionAction}s. Matching is case-insensitive and ignores surrounding whitespace.
 *
 * <p>{@code sell_short} and {@code buy_back} map to SELL and BUY; the ledger then flags the short
 * sale as a disposal with no opening position.
 */
@Component
public class DirectionMapper {

    private static final Logger log = LoggerFactory.getLogger(DirectionMapper.class);

    private static final Map<TransactionAction, List<String>> DEFAULTS = Map.of(
            TransactionAction.BUY, List.of("buy", "orderside.buy", "买入", "buy_back"),
            TransactionAction.SELL, List.of("sell", "orderside.sell", "卖出", "sell_short"),
            TransactionAction.OPTION_ASSIGN, List.of("assign", "assignment", "option_assign", "行权"),
            TransactionAction.OPTION_EXPIRE, List.of("expire", "expiration", "option_expire", "到期"),
            TransactionAction.DIVIDEND, List.of("dividend", "股息", "派息"),
            TransactionAction.TAX_WITHHOLDING, List.of("tax_withholding", "withholding", "预扣税"));

    private final Map<String, TransactionAction> lookup;

    public DirectionMapper(ImportConfig importConfig) {
        Map<TransactionAction, List<String>> merged = new EnumMap<>(DEFAULTS);
        merged.putAll(importConfig.getDirectionMapping());

        this.lookup = new HashMap<>();
        merged.forEach((action, values) -> values.forEach(value -> lookup.put(normalize(value), action)));
        log.debug("Direction mapping: {}", lookup);
    }

    /**
     * @throws MalformedRecordException if the direction is blank or not mapped
     */
    public TransactionAction map(String rawDirection) {
        if (rawDirection == null || rawDirection.isBlank()) {
            throw new MalformedRecordException("Direction is missing");
        }
        TransactionAction action = lookup.get(normalize(rawDirection));
        if (action == null) {
            throw new MalformedRecordException(
                    "Unknown direction '" + rawDirection.trim() + "'", Map.of("direction", rawDirection.trim()));
        }
        return action;
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
