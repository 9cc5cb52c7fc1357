package edu.pucmm.ferrovia.core;

import java.util.List;

/**
 * Resultado de una corrida.
 *
 * @param dispatchOrder  ids en el orden en que recibieron la vía
 * @param elapsedNanos   duración total
 * @param trainsFinished trenes que completaron el cruce
 */
public record SimulationResult(List<Integer> dispatchOrder, long elapsedNanos, int trainsFinished) {

    public SimulationResult {
        dispatchOrder = List.copyOf(dispatchOrder);
    }
}
