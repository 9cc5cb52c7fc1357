package edu.pucmm.ferrovia.model;

/**
 * Etapas del ciclo de vida de un tren.
 */
public enum TrainState {
    CREATED,
    LOADING,
    READY,
    WAITING,   // en su cola, esperando que el despachador le otorgue la vía
    CROSSING,
    DONE
}
