package com.questrail.ucca.api;

import java.util.Locale;
import java.util.Objects;

/**
 * ControlAction
 * -----------------------------------------------------------------------------
 * Read-only view of a control action from the analysis catalog.
 *
 * A control action belongs to exactly one controller ({@link #controllerId()})
 * and is described by a verb and an object, e.g. {@code "apply" / "brakes"}.
 * The verb and object are descriptive, but the generator also matches keywords
 * in the verb to choose default timing bounds.
 */
public record ControlAction(String id, String controllerId, String verb, String object)
{
    public ControlAction {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(controllerId, "controllerId");
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(object, "object");
    }

    /**
     * Returns {@code "<verb> <object>"}, the phrase used in descriptions.
     */
    public String phrase() {
        return (verb + " " + object).trim();
    }

    /**
     * Returns true if the verb contains the keyword, ignoring case.
     */
    public boolean verbContains(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        return verb.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }
}
