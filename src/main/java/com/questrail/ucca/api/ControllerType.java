package com.questrail.ucca.api;

/**
 * ControllerType
 * -----------------------------------------------------------------------------
 * Coarse classification of a controller in the control structure.
 *
 * The temporal engine never branches on this value. It is carried so that
 * catalog lookups can be passed through unchanged to the presentation layer.
 */
public enum ControllerType
{
    /** An automated controller (software or firmware). */
    SOFTWARE("S"),

    /** A single human operator. */
    HUMAN("H"),

    /** A team acting as one controller. */
    TEAM("T"),

    /** An organisation acting as one controller. */
    ORGANISATION("O");

    private final String code;

    ControllerType(String code) {
        this.code = code;
    }

    /**
     * Returns the one-letter code used by the analysis catalog.
     */
    public String code() {
        return code;
    }
}
