package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.Train;

/**
 * Observador de los eventos de cada tren. Se invoca desde los hilos de los trenes,
 * sin el monitor del planificador tomado.
 */
public interface TrackEventListener {

    void onReady(Train train, long elapsedNanos);

    void onEnterTrack(Train train, long elapsedNanos);

    void onLeaveTrack(Train train, long elapsedNanos);
}
