package com.cra.trace;

import com.cra.config.CraProperties;
import com.cra.error.BackpressureException;
import com.cra.error.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous chaining of trace events.
 *
 * Producers hand raw events to {@link #record}, which never blocks: a full
 * queue is reported as {@link BackpressureException}. A single worker thread
 * takes events in arrival order, assigns each its sequence and previous hash,
 * hashes it and appends it to the {@link TraceLog}. The worker is the only
 * writer of chains, so per-session sequences stay contiguous whatever the
 * number of producers.
 */
public class TraceProcessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TraceProcessor.class);

    private final TraceLog traceLog;
    private final BlockingQueue<RawEvent> queue;
    private final int capacity;
    private final Duration pollInterval;
    private final Thread worker;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong chained = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    private final ReentrantLock intakeLock = new ReentrantLock();
    private final ReentrantLock progressLock = new ReentrantLock();
    private final Condition progressed = progressLock.newCondition();
    private long completed;

    private volatile boolean accepting = true;
    private volatile boolean running = true;

    public TraceProcessor(TraceLog traceLog, CraProperties.Trace settings) {
        this.traceLog = traceLog;
        this.capacity = settings.queueCapacity();
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.pollInterval = settings.pollInterval();
        this.worker = new Thread(this::drainLoop, "cra-trace-worker");
        this.worker.setDaemon(true);
        this.worker.start();
        log.info("Trace processor started capacity={} genesis={}...", capacity,
            traceLog.genesisSeed().substring(0, Math.min(8, traceLog.genesisSeed().length())));
    }

    public TraceLog traceLog() {
        return traceLog;
    }

    /**
     * Enqueues an event for chaining.
     *
     * @throws BackpressureException if the queue is full; nothing is enqueued
     * @throws InvalidStateException if the processor has been closed
     */
    public void record(RawEvent event) {
        recordAll(List.of(event));
    }

    /**
     * Enqueues a batch of events back to back, or none of them.
     *
     * @throws BackpressureException if the queue cannot take the whole batch; nothing is enqueued
     * @throws InvalidStateException if the processor has been closed
     */
    public void recordAll(List<RawEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        intakeLock.lock();
        try {
            if (!accepting) {
                throw new InvalidStateException("trace processor is closed");
            }
            RawEvent first = events.get(0);
            if (queue.remainingCapacity() < events.size()) {
                log.warn("Trace queue full, rejecting {} event(s) starting with {} event_id={} session={}",
                    events.size(), first.eventType().getValue(), first.eventId(), first.sessionId());
                throw new BackpressureException(capacity, first.eventId());
            }
            // only this lock's holder adds to the queue, so the capacity check holds
            for (RawEvent event : events) {
                queue.add(event);
            }
            submitted.addAndGet(events.size());
        } finally {
            intakeLock.unlock();
        }
    }

    /**
     * Waits until every event recorded before this call has been processed.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean flush(Duration timeout) {
        long target = submitted.get();
        long remaining = timeout.toNanos();
        progressLock.lock();
        try {
            while (completed < target) {
                if (remaining <= 0) {
                    log.warn("Trace flush timed out after {} with {} of {} events processed",
                        timeout, completed, target);
                    return false;
                }
                remaining = progressed.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Trace flush interrupted with {} of {} events processed", completed, target);
            return false;
        } finally {
            progressLock.unlock();
        }
    }

    public long submittedCount() {
        return submitted.get();
    }

    public long chainedCount() {
        return chained.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    public int queueDepth() {
        return queue.size();
    }

    public boolean isRunning() {
        return worker.isAlive();
    }

    /** Stops intake, lets the worker drain what is queued, then stops it. */
    @Override
    public void close() {
        if (!stopIntake()) {
            return;
        }
        try {
            worker.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the trace worker to drain");
        }
        log.info("Trace processor stopped chained={} rejected={}", chained.get(), rejected.get());
    }

    /**
     * Closes intake under the intake lock, so any batch accepted before this
     * returns is already queued when the worker next checks for work.
     *
     * @return {@code false} if intake was already closed
     */
    private boolean stopIntake() {
        intakeLock.lock();
        try {
            if (!accepting) {
                return false;
            }
            accepting = false;
            running = false;
            return true;
        } finally {
            intakeLock.unlock();
        }
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            RawEvent event;
            try {
                event = queue.poll(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException ex) {
                log.warn("Trace worker interrupted, draining {} queued events before exit", queue.size());
                stopIntake();
                continue;
            }
            if (event == null) {
                continue;
            }
            try {
                chain(event);
            } catch (RuntimeException ex) {
                rejected.incrementAndGet();
                log.error("Failed to chain event {} for session {}", event.eventId(), event.sessionId(), ex);
            } finally {
                markCompleted();
            }
        }
    }

    private void chain(RawEvent event) {
        ChainTip tip = traceLog.tip(event.sessionId());
        if (tip.frozen()) {
            rejected.incrementAndGet();
            log.warn("Rejecting {} event_id={} for ended session {}",
                event.eventType().getValue(), event.eventId(), event.sessionId());
            return;
        }
        TraceEvent sealed = TraceEvent.seal(event, tip.nextSequence(), tip.hash());
        traceLog.append(sealed);
        chained.incrementAndGet();
        if (event.eventType() == EventType.SESSION_ENDED) {
            traceLog.freeze(event.sessionId());
        }
        log.debug("Chained {} session={} seq={} hash={}",
            sealed.eventType().getValue(), sealed.sessionId(), sealed.sequence(), sealed.eventHash());
    }

    private void markCompleted() {
        progressLock.lock();
        try {
            completed++;
            progressed.signalAll();
        } finally {
            progressLock.unlock();
        }
    }
}
