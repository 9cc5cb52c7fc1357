package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.core.SimulationClock;
import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainState;

import java.util.logging.Logger;

/**
 * Tarea de un tren: carga, queda listo, espera la vía, cruza y la devuelve.
 * Las esperas de carga y cruce ocurren sin el monitor tomado. Una vez otorgada,
 * la vía se devuelve aunque el cruce falle, para que el despachador no quede bloqueado.
 */
public class TrainTask implements Runnable {
    private static final Logger logger = Logger.getLogger(TrainTask.class.getName());

    private final Train train;
    private final SchedulerCore core;
    private final SimulationClock clock;
    private final TrackEventListener events;

    public TrainTask(Train train, SchedulerCore core, SimulationClock clock, TrackEventListener events) {
        this.train = train;
        this.core = core;
        this.clock = clock;
        this.events = events;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("Tren-" + train.getId());
        try {
            load();
            becomeReady();
            waitForTrack();
            cross();
            train.setState(TrainState.DONE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Tren " + train.getId() + " interrumpido en estado " + train.getState());
        }
    }

    private void load() throws InterruptedException {
        train.setState(TrainState.LOADING);
        clock.sleepUnits(train.getLoadingTime());
    }

    private void becomeReady() {
        long readyNanos = clock.elapsedNanos();
        train.markReady(readyNanos);
        events.onReady(train, readyNanos);
    }

    private void waitForTrack() throws InterruptedException {
        core.submitReady(train);
        train.awaitGrant();
    }

    private void cross() throws InterruptedException {
        train.setState(TrainState.CROSSING);
        try {
            events.onEnterTrack(train, clock.elapsedNanos());
            clock.sleepUnits(train.getCrossingTime());
            events.onLeaveTrack(train, clock.elapsedNanos());
        } finally {
            core.releaseTrack(train);
        }
    }
}
