package com.taxledger.ledger;

import com.taxledger.domain.model.LotState;
import com.taxledger.domain.model.SplitEvent;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies configured splits to lots lazily, right before the first transaction on or after each
 * split's effective date. Lots opened after a split start with that split already counted, since
 * their purchase prices are post-split.
 */
public class SplitAdjuster {

    private static final Logger log = LoggerFactory.getLogger(SplitAdjuster.class);

    private final Map<String, List<SplitEvent>> splitsByInstrument;

    public SplitAdjuster(List<SplitEvent> splits) {
        this.splitsByInstrument = splits.stream()
                .collect(Collectors.groupingBy(
                        SplitEvent::getInstrumentId,
                        Collectors.collectingAndThen(Collectors.toList(), list -> list.stream()
                                .sorted(Comparator.comparing(SplitEvent::getEffectiveDate))
                                .toList())));
    }

    public static SplitAdjuster none() {
        return new SplitAdjuster(List.of());
    }

    /** Number of splits for the instrument already in effect on {@code date}. */
    public int countEffective(String instrumentId, LocalDate date) {
        return (int) splitsFor(instrumentId).stream()
                .filter(split -> !split.getEffectiveDate().isAfter(date))
                .count();
    }

    /** Applies every split effective on or before {@code date} that the lot has not seen yet. */
    public void applyDue(LotState lot, LocalDate date, MathContext mathContext) {
        List<SplitEvent> splits = splitsFor(lot.getKey().getInstrumentId());
        while (lot.getAppliedSplits() < splits.size()) {
            SplitEvent next = splits.get(lot.getAppliedSplits());
            if (next.getEffectiveDate().isAfter(date)) {
                return;
            }
            lot.applySplit(next, mathContext);
            log.info(
                    "Applied {}:{} split effective {} to {}: open={}, avgCost={}",
                    next.getNumerator(),
                    next.getDenominator(),
                    next.getEffectiveDate(),
                    lot.getKey(),
                    lot.getOpenQuantity().toPlainString(),
                    lot.getAverageUnitCost());
        }
    }

    private List<SplitEvent> splitsFor(String instrumentId) {
        return splitsByInstrument.getOrDefault(instrumentId, List.of());
    }
}
