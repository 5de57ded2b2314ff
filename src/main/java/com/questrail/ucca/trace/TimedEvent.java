package com.questrail.ucca.trace;

import com.questrail.ucca.api.Subject;

import java.util.Objects;

/**
 * TimedEvent
 * -----------------------------------------------------------------------------
 * One recorded occurrence in an event trace: "controller C provided (or
 * withheld) action A at time T".
 *
 * <ul>
 *   <li>{@code provided = true}: the action was issued</li>
 *   <li>{@code provided = false}: the action was explicitly withheld, or checked
 *       for absence, at that instant</li>
 * </ul>
 *
 * The timestamp is an integer tick (normally milliseconds). Events are
 * immutable once recorded.
 */
public record TimedEvent(long timestamp, String controllerId, String actionId, boolean provided)
{
    public TimedEvent {
        Objects.requireNonNull(controllerId, "controllerId");
        Objects.requireNonNull(actionId, "actionId");
    }

    public static TimedEvent provided(long timestamp, Subject subject) {
        return new TimedEvent(timestamp, subject.controllerId(), subject.actionId(), true);
    }

    public static TimedEvent withheld(long timestamp, Subject subject) {
        return new TimedEvent(timestamp, subject.controllerId(), subject.actionId(), false);
    }

    /**
     * Returns the {@code (controllerId, actionId)} pair this event is about.
     */
    public Subject subject() {
        return new Subject(controllerId, actionId);
    }

    @Override
    public String toString() {
        return "t=" + timestamp + " " + controllerId + "/" + actionId
                + (provided ? " provided" : " withheld");
    }
}
