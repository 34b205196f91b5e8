package com.flagship.payments_engine.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and helpers for tagging log lines of a run.
 *
 * The run ID is set by the processor for the calling thread and copied
 * onto the engine's consumer thread; the client and transaction IDs are
 * set by the consumer while it applies one transaction.
 */
public final class RunContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String CLIENT_ID_MDC_KEY = "clientId";
    public static final String TRANSACTION_ID_MDC_KEY = "txId";

    private RunContext() {
        // Utility class
    }

    /**
     * Generates a new run ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Starts a run on the current thread, returning its ID.
     */
    public static String begin() {
        String runId = generateRunId();
        MDC.put(RUN_ID_MDC_KEY, runId);
        return runId;
    }

    public static void end() {
        MDC.remove(RUN_ID_MDC_KEY);
    }

    public static void enterTransaction(int clientId, long transactionId) {
        MDC.put(CLIENT_ID_MDC_KEY, Integer.toString(clientId));
        MDC.put(TRANSACTION_ID_MDC_KEY, Long.toString(transactionId));
    }

    public static void exitTransaction() {
        MDC.remove(CLIENT_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }
}
