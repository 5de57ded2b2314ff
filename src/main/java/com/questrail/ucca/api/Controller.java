package com.questrail.ucca.api;

import java.util.Objects;

/**
 * Controller
 * -----------------------------------------------------------------------------
 * Read-only view of a controller from the analysis catalog.
 *
 * The catalog and its lifecycle are owned elsewhere; the temporal engine only
 * reads the identifier and, for descriptions, the name.
 */
public record Controller(String id, String name, ControllerType type)
{
    public Controller {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
