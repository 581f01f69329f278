package com.echelon.kernel.audit;

import com.echelon.kernel.json.Json;
import com.echelon.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-behind audit log.
 * <p>
 * {@link #record(AuditEntry)} never blocks and never fails the request: entries go into a
 * bounded queue drained by one daemon worker into the {@link AuditSink}. A full queue or a
 * failing sink writes the entry to the {@code echelon.audit.fallback} logger instead.
 */
public class AuditLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    public static final String FALLBACK_LOGGER_NAME = "echelon.audit.fallback";

    private static final Logger fallback = LoggerFactory.getLogger(FALLBACK_LOGGER_NAME);

    private final AuditSink sink;
    private final BlockingQueue<AuditEntry> queue;
    private final Duration flushInterval;
    private final AtomicInteger pending = new AtomicInteger();
    private final Counter dropped;
    private final Counter failed;
    private final Thread worker;
    private volatile boolean running = true;

    /**
     * @param sink          destination
     * @param capacity      queue bound
     * @param flushInterval longest time an entry waits in the queue while the worker is idle
     * @param metrics       optional metric factory for dropped/failed counters
     */
    public AuditLog(AuditSink sink, int capacity, Duration flushInterval, MetricFactory metrics) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.flushInterval = flushInterval == null ? Duration.ofMillis(200) : flushInterval;
        this.dropped = metrics == null ? null
                : metrics.counter("echelon.audit.dropped", "Audit entries dropped because the queue was full");
        this.failed = metrics == null ? null
                : metrics.counter("echelon.audit.failed", "Audit entries the sink failed to store");
        if (metrics != null) {
            metrics.gauge("echelon.audit.pending", "Audit entries queued or being written", pending::get);
        }
        this.worker = new Thread(this::drain, "echelon-audit-writer");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Queues an entry. Never throws.
     */
    public void record(AuditEntry entry) {
        pending.incrementAndGet();
        if (!running || !queue.offer(entry)) {
            pending.decrementAndGet();
            increment(dropped);
            writeFallback("Audit queue full, entry not persisted", entry, null);
        }
    }

    /**
     * Waits until every entry queued so far has been handed to the sink.
     *
     * @return true if drained within the timeout
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    /** Entries queued or being written. */
    public int pending() {
        return pending.get();
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            AuditEntry entry;
            try {
                entry = queue.poll(flushInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (entry != null) {
                write(entry);
            }
        }
        AuditEntry remaining;
        while ((remaining = queue.poll()) != null) {
            write(remaining);
        }
    }

    private void write(AuditEntry entry) {
        try {
            sink.append(entry);
        } catch (Exception e) {
            increment(failed);
            writeFallback("Audit sink failed, entry not persisted", entry, e);
        } finally {
            pending.decrementAndGet();
        }
    }

    private void writeFallback(String reason, AuditEntry entry, Exception cause) {
        String json;
        try {
            json = Json.write(entry);
        } catch (RuntimeException e) {
            json = String.valueOf(entry);
        }
        if (cause == null) {
            fallback.error("{}: {}", reason, json);
        } else {
            fallback.error("{}: {}", reason, json, cause);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    /**
     * Stops accepting entries and drains the queue, waiting up to five seconds.
     */
    @Override
    public void close() {
        running = false;
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Audit log closed ({} entries pending)", pending.get());
    }
}
