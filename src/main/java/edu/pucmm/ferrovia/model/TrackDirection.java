package edu.pucmm.ferrovia.model;

/**
 * Sentido en el que un tren recorre la vía principal.
 */
public enum TrackDirection {
    EAST("East"),
    WEST("West");

    private final String description;

    TrackDirection(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Sentido contrario, usado por la regla de balanceo.
     */
    public TrackDirection opposite() {
        return this == EAST ? WEST : EAST;
    }
}
