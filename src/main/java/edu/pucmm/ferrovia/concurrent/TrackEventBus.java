package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.Train;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reparte los eventos de los trenes entre los observadores registrados.
 */
public class TrackEventBus implements TrackEventListener {
    private static final Logger logger = Logger.getLogger(TrackEventBus.class.getName());

    private final List<TrackEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(TrackEventListener listener) {
        listeners.add(listener);
    }

    @Override
    public void onReady(Train train, long elapsedNanos) {
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Tren " + train.getId() + " listo en t=" + elapsedNanos + "ns");
        }
        for (TrackEventListener listener : listeners) {
            listener.onReady(train, elapsedNanos);
        }
    }

    @Override
    public void onEnterTrack(Train train, long elapsedNanos) {
        for (TrackEventListener listener : listeners) {
            listener.onEnterTrack(train, elapsedNanos);
        }
    }

    @Override
    public void onLeaveTrack(Train train, long elapsedNanos) {
        for (TrackEventListener listener : listeners) {
            listener.onLeaveTrack(train, elapsedNanos);
        }
    }
}
