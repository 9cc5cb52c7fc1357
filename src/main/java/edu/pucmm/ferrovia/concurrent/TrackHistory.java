package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.TrackDirection;

/**
 * Historial de cruces completados que consulta la política de despacho.
 *
 * @param haveEverCrossed     si ya terminó al menos un cruce en la corrida
 * @param lastDirection       sentido del último cruce completado
 * @param sameDirectionStreak cruces consecutivos completados en ese sentido
 */
public record TrackHistory(boolean haveEverCrossed, TrackDirection lastDirection, int sameDirectionStreak) {

    /** Estado antes del primer cruce. El sentido inicial es arbitrario. */
    public static final TrackHistory INITIAL = new TrackHistory(false, TrackDirection.EAST, 0);

    public TrackHistory {
        if (lastDirection == null) {
            throw new IllegalArgumentException("lastDirection requerido");
        }
        if (sameDirectionStreak < 0) {
            throw new IllegalArgumentException("racha negativa: " + sameDirectionStreak);
        }
    }

    /**
     * Historial resultante de completar un cruce en el sentido dado.
     */
    public TrackHistory afterCrossing(TrackDirection direction) {
        // la racha inicial es 0, así que el primer cruce hacia el este también queda en 1
        if (direction == lastDirection) {
            return new TrackHistory(true, direction, sameDirectionStreak + 1);
        }
        return new TrackHistory(true, direction, 1);
    }
}
