package com.questrail.ucca.trace;

import com.questrail.ucca.api.TemporalEngineException;

/**
 * Indicates that a trace handed to the evaluator is not non-decreasing in
 * timestamp.
 *
 * The engine never reorders a trace on the caller's behalf. A trace in the
 * wrong order usually means the trace producer has a bug, so the evaluate
 * call is rejected instead.
 */
public final class InvalidTraceOrderException extends TemporalEngineException
{
    private final int index;
    private final long previousTimestamp;
    private final long timestamp;

    public InvalidTraceOrderException(int index, long previousTimestamp, long timestamp) {
        super("Trace is not ordered by timestamp: event " + index + " at t=" + timestamp
                + " precedes its predecessor at t=" + previousTimestamp);
        this.index = index;
        this.previousTimestamp = previousTimestamp;
        this.timestamp = timestamp;
    }

    /**
     * Index of the first event whose timestamp is lower than its predecessor's.
     */
    public int index() {
        return index;
    }

    public long previousTimestamp() {
        return previousTimestamp;
    }

    public long timestamp() {
        return timestamp;
    }
}
