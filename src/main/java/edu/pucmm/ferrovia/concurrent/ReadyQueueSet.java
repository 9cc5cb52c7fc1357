package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.ReadyEntry;
import edu.pucmm.ferrovia.model.TrackDirection;
import edu.pucmm.ferrovia.model.TrainCategory;
import edu.pucmm.ferrovia.model.TrainPriority;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Las cuatro colas de listos, una por categoría. Pre-pobladas para evitar nulls.
 */
public class ReadyQueueSet {
    private final EnumMap<TrainCategory, ReadyQueue> queues = new EnumMap<>(TrainCategory.class);

    public ReadyQueueSet() {
        for (TrainCategory category : TrainCategory.values()) {
            queues.put(category, new ReadyQueue(category));
        }
    }

    public ReadyQueue queue(TrainCategory category) {
        return queues.get(category);
    }

    public ReadyQueue queue(TrackDirection direction, TrainPriority priority) {
        return queues.get(TrainCategory.of(direction, priority));
    }

    /**
     * @return true si alguna de las cuatro colas tiene un candidato
     */
    public boolean anyReady() {
        for (ReadyQueue queue : queues.values()) {
            if (!queue.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true si el sentido dado tiene algún tren esperando, de cualquier prioridad
     */
    public boolean anyReady(TrackDirection direction) {
        return !queue(direction, TrainPriority.HIGH).isEmpty()
                || !queue(direction, TrainPriority.LOW).isEmpty();
    }

    public int totalWaiting() {
        int total = 0;
        for (ReadyQueue queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }

    public Map<TrainCategory, List<ReadyEntry>> snapshot() {
        EnumMap<TrainCategory, List<ReadyEntry>> copy = new EnumMap<>(TrainCategory.class);
        queues.forEach((category, queue) -> copy.put(category, List.copyOf(queue.snapshot())));
        return copy;
    }
}
