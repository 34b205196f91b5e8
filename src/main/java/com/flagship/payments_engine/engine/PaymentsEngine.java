package com.flagship.payments_engine.engine;

import com.flagship.payments_engine.account.AccountsSnapshot;
import com.flagship.payments_engine.account.ClientAccount;
import com.flagship.payments_engine.account.Outcome;
import com.flagship.payments_engine.observability.EngineMetrics;
import com.flagship.payments_engine.observability.RunContext;
import com.flagship.payments_engine.transaction.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single-writer processing loop for a stream of transactions.
 *
 * Producers hand transactions over through a bounded queue; one consumer
 * thread takes them off in FIFO order and applies them to a
 * {@link TransactionAggregator}, the only place account state changes.
 *
 * Lifecycle:
 * <pre>
 * PaymentsEngine engine = new PaymentsEngine(100, metrics);
 * CompletableFuture&lt;AccountsSnapshot&gt; result = engine.serve();
 * engine.submit(tx);     // any number of times, from any number of threads
 * engine.close();        // end of input
 * AccountsSnapshot snapshot = result.join();
 * </pre>
 *
 * Backpressure: {@link #submit(Transaction)} blocks while the queue is full.
 * After {@link #close()} the consumer drains what is already queued and
 * then completes the future. There is no cancellation and no per-transaction
 * timeout. An engine serves a single run.
 */
@Slf4j
public class PaymentsEngine {

    public static final int DEFAULT_QUEUE_CAPACITY = 100;

    private static final long OFFER_POLL_MILLIS = 100;

    private final BlockingQueue<Item> queue;
    private final TransactionAggregator aggregator = new TransactionAggregator();
    private final EngineMetrics metrics;

    // submit() holds the read lock while enqueueing, close() the write lock,
    // so nothing can be enqueued behind the end marker
    private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean closed;
    private volatile Throwable failure;

    public PaymentsEngine(int queueCapacity, EngineMetrics metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + queueCapacity);
        }
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.metrics = metrics;
    }

    public PaymentsEngine(EngineMetrics metrics) {
        this(DEFAULT_QUEUE_CAPACITY, metrics);
    }

    /**
     * Starts the consumer on a dedicated thread.
     *
     * @return future completed with the final snapshot once the engine is
     *         closed and drained, or exceptionally with {@link EngineFailedException}
     * @throws IllegalStateException if the engine was already started
     */
    public CompletableFuture<AccountsSnapshot> serve() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine is already serving");
        }

        CompletableFuture<AccountsSnapshot> result = new CompletableFuture<>();
        Map<String, String> callerContext = MDC.getCopyOfContextMap();

        Thread consumer = new Thread(() -> {
            if (callerContext != null) {
                MDC.setContextMap(callerContext);
            }
            try {
                result.complete(consume());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = e;
                result.completeExceptionally(new EngineFailedException("Consumer was interrupted", e));
            } catch (RuntimeException | Error e) {
                failure = e;
                log.error("Consumer failed: {}", e.getMessage(), e);
                result.completeExceptionally(new EngineFailedException("Consumer failed: " + e.getMessage(), e));
            } finally {
                MDC.clear();
            }
        }, "payments-engine-consumer");
        consumer.setDaemon(true);
        consumer.start();

        return result;
    }

    /**
     * Enqueues a transaction, blocking while the queue is full.
     *
     * @throws IllegalStateException if the engine has been closed
     * @throws EngineFailedException if the consumer has stopped
     */
    public void submit(Transaction tx) throws InterruptedException {
        Objects.requireNonNull(tx, "tx");
        closeLock.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Engine is closed, cannot accept " + tx);
            }
            enqueue(new Item(tx));
        } finally {
            closeLock.readLock().unlock();
        }
    }

    /**
     * Signals end of input. Idempotent.
     */
    public void close() throws InterruptedException {
        closeLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (failure == null) {
                enqueue(Item.END);
            }
        } finally {
            closeLock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Runs a finite sequence through a fresh consumer and waits for the result.
     */
    public AccountsSnapshot process(Iterable<Transaction> transactions) throws InterruptedException {
        CompletableFuture<AccountsSnapshot> result = serve();
        try {
            for (Transaction tx : transactions) {
                submit(tx);
            }
        } finally {
            close();
        }
        return await(result);
    }

    /**
     * Waits for a snapshot future, unwrapping the consumer's failure.
     */
    public static AccountsSnapshot await(CompletableFuture<AccountsSnapshot> result) throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof EngineFailedException failed) {
                throw failed;
            }
            throw new EngineFailedException("Engine failed: " + e.getCause(), e.getCause());
        }
    }

    private void enqueue(Item item) throws InterruptedException {
        while (!queue.offer(item, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (failure != null) {
                throw new EngineFailedException("Consumer has stopped", failure);
            }
        }
    }

    private AccountsSnapshot consume() throws InterruptedException {
        long applied = 0;
        long rejected = 0;

        while (true) {
            Item item = queue.take();
            if (item == Item.END) {
                break;
            }

            Transaction tx = item.transaction();
            metrics.recordReceived(tx.getType());
            RunContext.enterTransaction(tx.getClientId(), tx.getTransactionId());
            try {
                boolean wasLocked = isLocked(tx.getClientId());
                Outcome outcome = aggregator.apply(tx);
                metrics.recordOutcome(tx.getType(), outcome);
                if (!wasLocked && isLocked(tx.getClientId())) {
                    metrics.recordAccountLocked();
                }
                if (outcome.isApplied()) {
                    applied++;
                    log.debug("Applied {}", tx);
                } else {
                    rejected++;
                }
            } finally {
                RunContext.exitTransaction();
            }
        }

        log.debug("Input drained: applied={}, rejected={}, accounts={}",
                applied, rejected, aggregator.accountCount());
        return aggregator.snapshot();
    }

    private boolean isLocked(int clientId) {
        return aggregator.findAccount(clientId)
                .map(ClientAccount::isLocked)
                .orElse(false);
    }

    /**
     * Queue element; END marks the end of input.
     */
    private record Item(Transaction transaction) {
        private static final Item END = new Item(null);
    }
}
