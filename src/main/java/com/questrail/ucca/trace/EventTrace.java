package com.questrail.ucca.trace;

import com.questrail.ucca.api.Subject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * EventTrace
 * -----------------------------------------------------------------------------
 * An immutable, finite sequence of {@link TimedEvent}s in the order the caller
 * recorded them.
 *
 * <h2>Ordering contract</h2>
 * The evaluator requires a trace that is non-decreasing in timestamp. Events
 * with equal timestamps keep their insertion order and are treated as
 * simultaneous.
 * <p>
 * {@code EventTrace} itself accepts events in any order and <b>never</b> sorts
 * them implicitly. Silently reordering would hide a defect in whatever built
 * the trace. Callers may:
 * <ul>
 *   <li>check {@link #firstOutOfOrderIndex()} or call {@link #requireOrdered()}</li>
 *   <li>explicitly ask for {@link #sortedByTimestamp()}, a stable sorted copy</li>
 * </ul>
 *
 * <h2>Construction</h2>
 * Use {@link #of(TimedEvent...)}, {@link #of(List)}, or {@link #builder()} when
 * events are appended one at a time (e.g. by an interactive simulator).
 */
public final class EventTrace implements Iterable<TimedEvent>
{
    private static final EventTrace EMPTY = new EventTrace(List.of());

    private final List<TimedEvent> events;

    private EventTrace(List<TimedEvent> events) {
        this.events = events;
    }

    public static EventTrace empty() {
        return EMPTY;
    }

    public static EventTrace of(TimedEvent... events) {
        Objects.requireNonNull(events, "events");
        return of(Arrays.asList(events));
    }

    public static EventTrace of(List<TimedEvent> events) {
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return EMPTY;
        }
        List<TimedEvent> copy = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            copy.add(Objects.requireNonNull(events.get(i), "event at index " + i));
        }
        return new EventTrace(Collections.unmodifiableList(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TimedEvent> events() {
        return events;
    }

    public TimedEvent get(int index) {
        return events.get(index);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public Iterator<TimedEvent> iterator() {
        return events.iterator();
    }

    /**
     * Timestamp of the first recorded event, or empty for an empty trace.
     */
    public OptionalLong startTimestamp() {
        return events.isEmpty() ? OptionalLong.empty() : OptionalLong.of(events.get(0).timestamp());
    }

    /**
     * Timestamp of the last recorded event, or empty for an empty trace.
     */
    public OptionalLong endTimestamp() {
        return events.isEmpty()
                ? OptionalLong.empty()
                : OptionalLong.of(events.get(events.size() - 1).timestamp());
    }

    /**
     * Offset of the given event from the start of this trace.
     *
     * @throws IllegalArgumentException if this trace is empty
     */
    public long relativeTimestamp(TimedEvent event) {
        Objects.requireNonNull(event, "event");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Empty trace has no start timestamp");
        }
        return event.timestamp() - events.get(0).timestamp();
    }

    /**
     * Returns the index of the first event whose timestamp is lower than the
     * timestamp of the event before it.
     *
     * @return the offending index, or empty if the trace is correctly ordered
     */
    public OptionalInt firstOutOfOrderIndex() {
        for (int i = 1; i < events.size(); i++) {
            if (events.get(i).timestamp() < events.get(i - 1).timestamp()) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean isOrdered() {
        return firstOutOfOrderIndex().isEmpty();
    }

    /**
     * Verifies the ordering contract.
     *
     * @throws InvalidTraceOrderException if any event precedes its predecessor
     */
    public void requireOrdered() {
        OptionalInt bad = firstOutOfOrderIndex();
        if (bad.isPresent()) {
            int i = bad.getAsInt();
            throw new InvalidTraceOrderException(i, events.get(i - 1).timestamp(), events.get(i).timestamp());
        }
    }

    /**
     * Returns a copy of this trace sorted by timestamp. The sort is stable, so
     * equal timestamps keep their recorded order.
     */
    public EventTrace sortedByTimestamp() {
        if (isOrdered()) {
            return this;
        }
        List<TimedEvent> copy = new ArrayList<>(events);
        copy.sort(Comparator.comparingLong(TimedEvent::timestamp));
        return new EventTrace(Collections.unmodifiableList(copy));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventTrace)) return false;
        return events.equals(((EventTrace) o).events);
    }

    @Override
    public int hashCode() {
        return events.hashCode();
    }

    @Override
    public String toString() {
        return "EventTrace" + events;
    }

    /**
     * Appends events in caller order. The builder does not sort.
     */
    public static final class Builder {
        private final List<TimedEvent> events = new ArrayList<>();

        public Builder append(TimedEvent event) {
            events.add(Objects.requireNonNull(event, "event"));
            return this;
        }

        public Builder provided(long timestamp, String controllerId, String actionId) {
            return append(new TimedEvent(timestamp, controllerId, actionId, true));
        }

        public Builder provided(long timestamp, Subject subject) {
            return append(TimedEvent.provided(timestamp, subject));
        }

        public Builder withheld(long timestamp, String controllerId, String actionId) {
            return append(new TimedEvent(timestamp, controllerId, actionId, false));
        }

        public Builder withheld(long timestamp, Subject subject) {
            return append(TimedEvent.withheld(timestamp, subject));
        }

        public EventTrace build() {
            return EventTrace.of(events);
        }
    }
}
