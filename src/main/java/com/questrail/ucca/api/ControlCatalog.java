package com.questrail.ucca.api;

import java.util.Optional;

/**
 * ControlCatalog
 * -----------------------------------------------------------------------------
 * Read-only lookup boundary onto the analysis catalog.
 *
 * The catalog (controllers, control actions, hazards) is maintained by the
 * surrounding editor. The temporal engine consumes it only through this
 * interface and never mutates it.
 *
 * <h2>Lookup semantics</h2>
 * <ul>
 *   <li>Lookups are by identifier only</li>
 *   <li>Action identifiers are unique within their controller, not across
 *       controllers; {@link #action(Subject)} is the exact lookup</li>
 *   <li>An unknown identifier yields {@link Optional#empty()}, never an
 *       exception</li>
 * </ul>
 */
public interface ControlCatalog
{
    /**
     * Returns the controller with the given identifier, if known.
     */
    Optional<Controller> controller(String controllerId);

    /**
     * Returns the first known control action with the given identifier. When
     * several controllers share the identifier, prefer {@link #action(Subject)}.
     */
    Optional<ControlAction> action(String actionId);

    /**
     * Returns the control action a subject refers to, if known.
     */
    Optional<ControlAction> action(Subject subject);
}
