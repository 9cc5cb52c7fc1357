package edu.pucmm.ferrovia.core;

/**
 * Un hilo de la simulación terminó con un error inesperado.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
