package edu.pucmm.ferrovia.model;

public enum TrainPriority {
    HIGH("Alta"),
    LOW("Baja");

    private final String description;

    TrainPriority(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
