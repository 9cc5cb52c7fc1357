package edu.pucmm.ferrovia.core;

/**
 * No se pudo lanzar el despachador o el hilo de algún tren.
 * Los hilos ya lanzados se cancelan antes de propagarla.
 */
public class WorkerStartException extends RuntimeException {

    public WorkerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
