package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.TrainCategory;

/**
 * Decide de qué cola sale el próximo tren en recibir la vía.
 * Se invoca con el monitor del planificador tomado; no debe bloquear ni modificar las colas.
 */
public interface DispatchPolicy {

    /**
     * @param queues  colas de listos actuales
     * @param history historial de cruces completados
     * @return la categoría cuyo primer tren debe pasar, o null si no hay candidatos
     */
    TrainCategory select(ReadyQueueSet queues, TrackHistory history);
}
