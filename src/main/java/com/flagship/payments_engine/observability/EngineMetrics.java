package com.flagship.payments_engine.observability;

import com.flagship.payments_engine.account.Outcome;
import com.flagship.payments_engine.transaction.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for the payments engine.
 *
 * Metrics exposed:
 * - transactions.received: Counter of transactions taken off the queue, by type
 * - transactions.applied: Counter of transactions that changed an account, by type
 * - transactions.rejected: Counter of discarded transactions, by type and reason
 * - accounts.locked: Counter of accounts frozen by a chargeback, once per account
 * - csv.rows.read / csv.rows.malformed: Counters for the input adapter
 * - engine.run.duration: Timer for a complete run
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter accountsLocked;
    private final Counter rowsRead;
    private final Counter rowsMalformed;
    private final Timer runTimer;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsLocked = Counter.builder("accounts.locked")
                .description("Number of accounts frozen by a chargeback")
                .register(registry);

        this.rowsRead = Counter.builder("csv.rows.read")
                .description("Number of input rows parsed into transactions")
                .register(registry);

        this.rowsMalformed = Counter.builder("csv.rows.malformed")
                .description("Number of input rows skipped because they could not be parsed")
                .register(registry);

        this.runTimer = Timer.builder("engine.run.duration")
                .description("Time taken to process one input source")
                .register(registry);
    }

    // ==================== Engine ====================

    public void recordReceived(TransactionType type) {
        registry.counter("transactions.received", "type", tag(type)).increment();
    }

    /**
     * Records the outcome of a transaction the engine has finished with.
     */
    public void recordOutcome(TransactionType type, Outcome outcome) {
        if (outcome.isApplied()) {
            registry.counter("transactions.applied", "type", tag(type)).increment();
        } else {
            registry.counter("transactions.rejected",
                    "type", tag(type),
                    "reason", outcome.name().toLowerCase(Locale.ROOT)
            ).increment();
        }
    }

    /**
     * Records an account moving from unlocked to locked. A chargeback on an
     * account that is already frozen does not count again.
     */
    public void recordAccountLocked() {
        accountsLocked.increment();
    }

    // ==================== Input ====================

    public void recordRowRead() {
        rowsRead.increment();
    }

    public void recordRowMalformed() {
        rowsMalformed.increment();
    }

    // ==================== Timers ====================

    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    private String tag(TransactionType type) {
        return type.toText();
    }
}
