package com.flagship.payments_engine.csv;

import com.flagship.payments_engine.money.Money;
import com.flagship.payments_engine.observability.EngineMetrics;
import com.flagship.payments_engine.transaction.Transaction;
import com.flagship.payments_engine.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Reads transactions from CSV with the header {@code type, client, tx, amount}.
 *
 * Whitespace around values is trimmed, the type is case-insensitive and
 * the trailing amount column may be left out for dispute rows.
 * A row that cannot be parsed is logged and skipped; only I/O failures
 * end the read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CsvTransactionReader {

    public static final String TYPE = "type";
    public static final String CLIENT = "client";
    public static final String TX = "tx";
    public static final String AMOUNT = "amount";

    // cells of a single line; the header is supplied once it has been read
    private static final CSVFormat LINE_FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreHeaderCase(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final EngineMetrics metrics;

    /**
     * Parses every row of the source and hands each transaction to the sink, in order.
     *
     * Each line is parsed on its own, so a row with broken quoting is skipped
     * like any other malformed row and the following lines are still read.
     * Blank lines are ignored.
     *
     * @param source CSV text; not closed by this method
     * @param sink receiver of the parsed transactions
     * @return how many rows were read and how many were skipped
     * @throws IOException if the source cannot be read or its header line cannot be parsed
     */
    public ReadSummary read(Reader source, TransactionSink sink) throws IOException, InterruptedException {
        BufferedReader lines = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        long lineNumber = 0;
        long read = 0;
        long malformed = 0;

        CSVFormat rowFormat = null;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }

            if (rowFormat == null) {
                rowFormat = LINE_FORMAT.builder().setHeader(parseHeader(line, lineNumber)).build();
                continue;
            }

            List<CSVRecord> records;
            try {
                records = parseLine(line, rowFormat);
            } catch (IOException | UncheckedIOException e) {
                log.warn("Skipping unparsable line {}: {}. Line: {}", lineNumber, e.getMessage(), line);
                metrics.recordRowMalformed();
                malformed++;
                continue;
            }

            for (CSVRecord csvRecord : records) {
                Transaction transaction;
                try {
                    transaction = parseRecord(csvRecord);
                } catch (IllegalArgumentException | ArithmeticException e) {
                    log.warn("Skipping malformed line {}: {}. Record: {}",
                            lineNumber, e.getMessage(), csvRecord.toList());
                    metrics.recordRowMalformed();
                    malformed++;
                    continue;
                }

                sink.accept(transaction);
                metrics.recordRowRead();
                read++;
            }
        }

        return new ReadSummary(read, malformed);
    }

    private static String[] parseHeader(String line, long lineNumber) throws IOException {
        List<CSVRecord> records;
        try {
            records = parseLine(line, LINE_FORMAT);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        if (records.isEmpty()) {
            throw new IOException("Missing CSV header at line " + lineNumber);
        }
        return records.get(0).toList().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toArray(String[]::new);
    }

    // the source is a String, so any IOException here is a lexer error, not a read failure
    private static List<CSVRecord> parseLine(String line, CSVFormat format) throws IOException {
        try (CSVParser parser = CSVParser.parse(line, format)) {
            return parser.getRecords();
        }
    }

    /**
     * Maps one CSV record to a transaction.
     *
     * @throws IllegalArgumentException if a field is missing or out of range
     */
    Transaction parseRecord(CSVRecord csvRecord) {
        TransactionType type = TransactionType.fromText(csvRecord.get(TYPE));
        int clientId = Integer.parseInt(csvRecord.get(CLIENT));
        long transactionId = Long.parseLong(csvRecord.get(TX));

        Money amount = null;
        if (csvRecord.isSet(AMOUNT) && !csvRecord.get(AMOUNT).isBlank()) {
            amount = Money.parse(csvRecord.get(AMOUNT));
        }

        return new Transaction(type, transactionId, clientId, amount);
    }
}
