package com.cra.error;

/**
 * Thrown by the trace ingest path when its bounded queue is full. Nothing is
 * enqueued; the caller decides whether to drop, retry or escalate.
 */
public class BackpressureException extends CraException {

    private final int capacity;

    public BackpressureException(int capacity, String eventId) {
        super(ErrorCode.BACKPRESSURE,
            "trace ingest queue is full (capacity " + capacity + "), rejected event_id=" + eventId);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
