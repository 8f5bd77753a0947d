package com.taxledger.importer;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.taxledger.config.ImportConfig;
import com.taxledger.domain.enums.InstrumentType;
import com.taxledger.domain.enums.TransactionAction;
import com.taxledger.domain.model.TransactionRecord;
import com.taxledger.exception.MalformedRecordException;
import com.taxledger.instrument.OptionSymbolParser;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes broker history exports into {@link TransactionRecord}s.
 *
 * <p>Pipeline per row: map the direction, classify the instrument, parse numbers and the
 * execution time, convert option prices from per-share to per-contract. Rows without an
 * execution time, or trade rows without quantity or price, are skipped with a warning, the way
 * the broker's cancelled-order rows are. Anything present but unparseable is a
 * {@link MalformedRecordException}.
 *
 * <p>All rows from all sources are then stably sorted by execution time and numbered, so rows
 * with equal timestamps keep file order and earlier files win ties.
 */
@Component
public class CsvTransactionImporter {

    private static final Logger log = LoggerFactory.getLogger(CsvTransactionImporter.class);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/M/d H:mm"));

    private final ImportConfig importConfig;
    private final DirectionMapper directionMapper;
    private final OptionSymbolParser optionSymbolParser;
    private final TransactionRecordValidator validator;
    private final ObjectReader rowReader;

    public CsvTransactionImporter(
            ImportConfig importConfig,
            DirectionMapper directionMapper,
            OptionSymbolParser optionSymbolParser,
            TransactionRecordValidator validator) {
        this.importConfig = importConfig;
        this.directionMapper = directionMapper;
        this.optionSymbolParser = optionSymbolParser;
        this.validator = validator;

        CsvMapper csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        this.rowReader = csvMapper.readerFor(CsvTransactionRow.class).with(CsvSchema.emptySchema().withHeader());
    }

    /** Imports CSV text, e.g. a request body. */
    public List<TransactionRecord> importCsv(String content) {
        return normalize(List.of(new SourceRows("request", read(new StringReader(content), "request"))));
    }

    /** Imports and merges several exports into one time-ordered stream. */
    public List<TransactionRecord> importFiles(List<Path> files) {
        List<SourceRows> sources = new ArrayList<>();
        for (Path file : files) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                List<CsvTransactionRow> rows = read(reader, file.toString());
                log.info("Read {} rows from {}", rows.size(), file);
                sources.add(new SourceRows(file.toString(), rows));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read transaction export " + file, e);
            }
        }
        return normalize(sources);
    }

    private List<CsvTransactionRow> read(Reader reader, String sourceName) {
        try (MappingIterator<CsvTransactionRow> iterator = rowReader.readValues(reader)) {
            return iterator.readAll();
        } catch (IOException | RuntimeException e) {
            throw new MalformedRecordException(
                    "Cannot parse CSV from " + sourceName + ": " + e.getMessage(), Map.of("source", sourceName), e);
        }
    }

    private List<TransactionRecord> normalize(List<SourceRows> sources) {
        List<TransactionRecord> unordered = new ArrayList<>();
        int skipped = 0;
        for (SourceRows source : sources) {
            for (int i = 0; i < source.rows().size(); i++) {
                // header is line 1
                int line = i + 2;
                TransactionRecord record = toRecord(source.rows().get(i), source.name(), line);
                if (record == null) {
                    skipped++;
                } else {
                    unordered.add(record);
                }
            }
        }

        unordered.sort(Comparator.comparing(TransactionRecord::getTimestamp));
        List<TransactionRecord> records = IntStream.range(0, unordered.size())
                .mapToObj(i -> unordered.get(i).toBuilder().sequence(i + 1L).build())
                .toList();
        validator.validateAll(records);

        log.info("Imported {} transactions from {} source(s), skipped {} incomplete rows",
                records.size(), sources.size(), skipped);
        return records;
    }

    private TransactionRecord toRecord(CsvTransactionRow row, String source, int line) {
        try {
            if (isBlank(row.getExecutedAt())) {
                log.warn("{}:{} has no execution time; skipped", source, line);
                return null;
            }
            TransactionAction action = directionMapper.map(row.getDirection());
            boolean trade = !action.isCashFlow() && action != TransactionAction.OPTION_EXPIRE;
            if (trade && (isBlank(row.getQuantity()) || isBlank(row.getPrice()))) {
                log.warn("{}:{} {} {} has no quantity or price; skipped", source, line, action, row.getInstrumentCode());
                return null;
            }
            if (action.isCashFlow() && isBlank(row.getAmount())) {
                log.warn("{}:{} {} {} has no amount; skipped", source, line, action, row.getInstrumentCode());
                return null;
            }

            String currency = isBlank(row.getCurrency()) ? null : row.getCurrency().trim().toUpperCase(Locale.ROOT);
            validator.validateFeeCurrency(line, currency, row.getFeeCurrency());

            String instrumentId = isBlank(row.getInstrumentCode()) ? null : row.getInstrumentCode().trim();
            InstrumentType instrumentType = instrumentType(row.getInstrumentType(), instrumentId);
            BigDecimal unitPrice = decimal(row.getPrice(), "price");
            if (unitPrice != null && instrumentType == InstrumentType.OPTION) {
                unitPrice = unitPrice.multiply(importConfig.getOptionContractMultiplier());
            }

            return TransactionRecord.builder()
                    .accountId(isBlank(row.getAccountId()) ? importConfig.getDefaultAccountId() : row.getAccountId().trim())
                    .instrumentId(instrumentId)
                    .instrumentType(instrumentType)
                    .action(action)
                    .quantity(decimal(row.getQuantity(), "quantity"))
                    .unitPrice(unitPrice)
                    .currency(currency)
                    .feeTotal(isBlank(row.getFee()) ? BigDecimal.ZERO : decimal(row.getFee(), "fee"))
                    .amount(decimal(row.getAmount(), "amount"))
                    .timestamp(timestamp(row.getExecutedAt()))
                    .build();
        } catch (MalformedRecordException e) {
            Map<String, Object> details = new HashMap<>(e.getDetails());
            details.put("source", source);
            details.put("line", line);
            throw new MalformedRecordException(source + ":" + line + ": " + e.getMessage(), details, e);
        }
    }

    private InstrumentType instrumentType(String declared, String instrumentId) {
        if (isBlank(declared)) {
            return optionSymbolParser.classify(instrumentId);
        }
        try {
            return InstrumentType.valueOf(declared.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Instrument type '{}' of {} is not modelled", declared, instrumentId);
            return InstrumentType.UNSUPPORTED;
        }
    }

    private static BigDecimal decimal(String value, String field) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return new BigDecimal(value.trim().replace(",", ""));
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Field '" + field + "' is not a number: '" + value + "'",
                    Map.of(field, value));
        }
    }

    private static LocalDateTime timestamp(String value) {
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", trimmed, format);
            }
        }
        try {
            return LocalDate.parse(trimmed).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("Unrecognized execution time '" + value + "'",
                    Map.of("executedAt", value));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record SourceRows(String name, List<CsvTransactionRow> rows) {}
}
