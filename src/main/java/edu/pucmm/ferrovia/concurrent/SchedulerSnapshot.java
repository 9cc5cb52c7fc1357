package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.ReadyEntry;
import edu.pucmm.ferrovia.model.TrainCategory;

import java.util.List;
import java.util.Map;

/**
 * Instantánea inmutable del planificador para la vista.
 *
 * @param queues         contenido ordenado de cada cola
 * @param trainOnTrack   id del tren en la vía, o null si está libre
 * @param trainsFinished trenes que ya cruzaron
 * @param trainCount     total de trenes de la lista
 * @param history        historial de sentidos
 */
public record SchedulerSnapshot(
        Map<TrainCategory, List<ReadyEntry>> queues,
        Integer trainOnTrack,
        int trainsFinished,
        int trainCount,
        TrackHistory history
) {
    public boolean isTrackFree() {
        return trainOnTrack == null;
    }
}
