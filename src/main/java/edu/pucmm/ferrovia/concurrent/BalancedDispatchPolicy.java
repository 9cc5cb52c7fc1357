package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.ReadyEntry;
import edu.pucmm.ferrovia.model.TrackDirection;
import edu.pucmm.ferrovia.model.TrainCategory;
import edu.pucmm.ferrovia.model.TrainPriority;

import java.util.logging.Logger;

/**
 * Política de despacho con prioridad y balanceo de sentidos.
 * Reglas, en orden:
 * <ol>
 *   <li>Arranque: antes del primer cruce, si hay un tren al oeste listo, pasa el oeste
 *       (alta antes que baja) sin importar el este.</li>
 *   <li>Balanceo: tras {@value #STREAK_LIMIT} cruces seguidos en un sentido, pasa el sentido
 *       contrario si tiene trenes esperando, de cualquier prioridad.</li>
 *   <li>Normal: alta prioridad antes que baja; entre los dos sentidos gana el que quedó
 *       listo antes y, en empate, el id menor.</li>
 * </ol>
 */
public class BalancedDispatchPolicy implements DispatchPolicy {
    private static final Logger logger = Logger.getLogger(BalancedDispatchPolicy.class.getName());

    public static final int STREAK_LIMIT = 2;
    public static final TrackDirection BOOTSTRAP_DIRECTION = TrackDirection.WEST;

    @Override
    public TrainCategory select(ReadyQueueSet queues, TrackHistory history) {
        if (!history.haveEverCrossed() && queues.anyReady(BOOTSTRAP_DIRECTION)) {
            TrainCategory chosen = firstNonEmpty(queues, BOOTSTRAP_DIRECTION);
            logger.fine("Regla de arranque: primer cruce para " + chosen);
            return chosen;
        }

        if (history.sameDirectionStreak() >= STREAK_LIMIT) {
            TrackDirection opposite = history.lastDirection().opposite();
            if (queues.anyReady(opposite)) {
                TrainCategory chosen = firstNonEmpty(queues, opposite);
                logger.fine("Regla de balanceo: racha de " + history.sameDirectionStreak()
                        + " hacia " + history.lastDirection() + ", pasa " + chosen);
                return chosen;
            }
        }

        TrainCategory chosen = earlierHead(queues, TrainPriority.HIGH);
        if (chosen == null) {
            chosen = earlierHead(queues, TrainPriority.LOW);
        }
        return chosen;
    }

    private static TrainCategory firstNonEmpty(ReadyQueueSet queues, TrackDirection direction) {
        if (!queues.queue(direction, TrainPriority.HIGH).isEmpty()) {
            return TrainCategory.of(direction, TrainPriority.HIGH);
        }
        if (!queues.queue(direction, TrainPriority.LOW).isEmpty()) {
            return TrainCategory.of(direction, TrainPriority.LOW);
        }
        return null;
    }

    /**
     * Compara los primeros de ambos sentidos para una prioridad.
     */
    private static TrainCategory earlierHead(ReadyQueueSet queues, TrainPriority priority) {
        ReadyEntry east = queues.queue(TrackDirection.EAST, priority).peek();
        ReadyEntry west = queues.queue(TrackDirection.WEST, priority).peek();
        if (east == null && west == null) {
            return null;
        }
        if (west == null || (east != null && east.comesBefore(west))) {
            return TrainCategory.of(TrackDirection.EAST, priority);
        }
        return TrainCategory.of(TrackDirection.WEST, priority);
    }
}
