package com.flagship.payments_engine.processor;

import com.flagship.payments_engine.account.AccountsSnapshot;
import com.flagship.payments_engine.csv.CsvAccountWriter;
import com.flagship.payments_engine.csv.CsvTransactionReader;
import com.flagship.payments_engine.csv.ReadSummary;
import com.flagship.payments_engine.engine.PaymentsEngine;
import com.flagship.payments_engine.observability.EngineMetrics;
import com.flagship.payments_engine.observability.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one input source through a fresh engine and reports the final balances.
 *
 * This service:
 * 1. Starts a new {@link PaymentsEngine} (no state survives between runs)
 * 2. Streams the CSV rows into the engine's queue
 * 3. Closes the engine and waits for the drained snapshot
 * 4. Writes the snapshot as CSV
 *
 * I/O failures and a failed consumer abort the run; everything else a
 * row can do wrong is discarded with a diagnostic.
 */
@Service
@Slf4j
public class PaymentsProcessor {

    private final CsvTransactionReader reader;
    private final CsvAccountWriter writer;
    private final EngineMetrics metrics;
    private final int queueCapacity;

    public PaymentsProcessor(CsvTransactionReader reader,
                             CsvAccountWriter writer,
                             EngineMetrics metrics,
                             @Value("${engine.queue-capacity:100}") int queueCapacity) {
        this.reader = reader;
        this.writer = writer;
        this.metrics = metrics;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Processes a CSV file and writes the resulting accounts to {@code out}.
     *
     * @throws IOException if the input cannot be read or the output cannot be written
     * @throws com.flagship.payments_engine.engine.EngineFailedException if the consumer failed
     */
    public void run(Path input, Writer out) throws IOException, InterruptedException {
        AccountsSnapshot snapshot = process(input);
        writer.write(snapshot, out);
    }

    /**
     * Processes a CSV file and returns the final state of every account.
     */
    public AccountsSnapshot process(Path input) throws IOException, InterruptedException {
        try (Reader source = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return process(source, input.toString());
        }
    }

    /**
     * Processes CSV text from an open reader; the reader is not closed.
     */
    public AccountsSnapshot process(Reader source, String sourceName) throws IOException, InterruptedException {
        long startTime = System.currentTimeMillis();
        String runId = RunContext.begin();
        log.info("Processing transactions from {}", sourceName);

        try {
            PaymentsEngine engine = new PaymentsEngine(queueCapacity, metrics);
            CompletableFuture<AccountsSnapshot> result = engine.serve();

            ReadSummary summary;
            try {
                summary = reader.read(source, engine::submit);
            } finally {
                engine.close();
            }
            AccountsSnapshot snapshot = PaymentsEngine.await(result);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordRunDuration(Duration.ofMillis(duration));
            log.info("Run {} complete: read={}, malformed={}, accounts={}, duration={}ms",
                    runId, summary.getRead(), summary.getMalformed(), snapshot.size(), duration);

            return snapshot;
        } finally {
            RunContext.end();
        }
    }
}
