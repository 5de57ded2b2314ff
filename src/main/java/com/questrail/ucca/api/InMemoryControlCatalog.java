package com.questrail.ucca.api;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link ControlCatalog} over fixed collections of controllers and
 * actions. Actions are keyed by controller and identifier. Later entries with a
 * duplicate key replace earlier ones.
 */
public final class InMemoryControlCatalog implements ControlCatalog
{
    private final Map<String, Controller> controllers;
    private final Map<Subject, ControlAction> actions;

    public InMemoryControlCatalog(Collection<Controller> controllers,
                                  Collection<ControlAction> actions) {
        Objects.requireNonNull(controllers, "controllers");
        Objects.requireNonNull(actions, "actions");

        Map<String, Controller> c = new LinkedHashMap<>();
        for (Controller controller : controllers) {
            c.put(controller.id(), controller);
        }
        Map<Subject, ControlAction> a = new LinkedHashMap<>();
        for (ControlAction action : actions) {
            a.put(Subject.of(action), action);
        }
        this.controllers = Collections.unmodifiableMap(c);
        this.actions = Collections.unmodifiableMap(a);
    }

    @Override
    public Optional<Controller> controller(String controllerId) {
        Objects.requireNonNull(controllerId, "controllerId");
        return Optional.ofNullable(controllers.get(controllerId));
    }

    @Override
    public Optional<ControlAction> action(String actionId) {
        Objects.requireNonNull(actionId, "actionId");
        for (ControlAction action : actions.values()) {
            if (action.id().equals(actionId)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<ControlAction> action(Subject subject) {
        Objects.requireNonNull(subject, "subject");
        return Optional.ofNullable(actions.get(subject));
    }
}
