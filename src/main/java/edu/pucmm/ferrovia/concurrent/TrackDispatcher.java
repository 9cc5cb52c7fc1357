package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.Train;

import java.util.logging.Logger;

/**
 * Hilo despachador: espera candidato con la vía libre, elige y otorga, hasta que
 * todos los trenes hayan cruzado.
 */
public class TrackDispatcher implements Runnable {
    private static final Logger logger = Logger.getLogger(TrackDispatcher.class.getName());

    private final SchedulerCore core;

    public TrackDispatcher(SchedulerCore core) {
        this.core = core;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("Despachador");
        logger.info("Despachador iniciado para " + core.getTrainCount() + " trenes");
        try {
            Train granted;
            while ((granted = core.dispatchNext()) != null) {
                logger.info(String.format("Vía otorgada al tren #%d [%s] (despacho %d de %d)",
                        granted.getId(),
                        granted.getCategory(),
                        core.getDispatchOrder().size(),
                        core.getTrainCount()));
            }
            logger.info("Despachador terminado: " + core.getTrainsFinished() + " trenes cruzaron");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Despachador interrumpido");
        }
    }
}
