package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.ReadyEntry;
import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainCategory;
import edu.pucmm.ferrovia.model.TrainState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Estado compartido del planificador y su monitor.
 * <p>
 * Todo cambio en las colas, la ocupación de la vía y los contadores ocurre con {@code lock}
 * tomado. La vía se reserva con {@code trackInUse}: el despachador nunca otorga mientras está
 * activa, y el tren que la tiene cruza con el monitor liberado.
 */
public class SchedulerCore {
    private static final Logger logger = Logger.getLogger(SchedulerCore.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private final Map<Integer, Train> roster;
    private final DispatchPolicy policy;
    private final ReadyQueueSet queues = new ReadyQueueSet();
    private final Set<Integer> submitted = new HashSet<>();
    private final List<Integer> dispatchOrder = new ArrayList<>();

    private boolean trackInUse;
    private Train holder;
    private int trainsFinished;
    private TrackHistory history = TrackHistory.INITIAL;

    public SchedulerCore(Collection<Train> trains, DispatchPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("política de despacho requerida");
        }
        this.policy = policy;
        this.roster = new LinkedHashMap<>();
        for (Train train : trains) {
            if (roster.putIfAbsent(train.getId(), train) != null) {
                throw new IllegalArgumentException("id de tren duplicado: " + train.getId());
            }
        }
        logger.info("SchedulerCore inicializado con " + roster.size() + " trenes");
    }

    public SchedulerCore(Collection<Train> trains) {
        this(trains, new BalancedDispatchPolicy());
    }

    /**
     * Encola un tren que ya fijó su instante de listo y despierta al despachador.
     * No espera el permiso: el tren lo espera luego con {@link Train#awaitGrant()}.
     */
    public void submitReady(Train train) {
        lock.lock();
        try {
            if (roster.get(train.getId()) != train) {
                throw new IllegalArgumentException("tren " + train.getId() + " no pertenece a la lista");
            }
            if (!train.isReadyStamped()) {
                throw new IllegalStateException("tren " + train.getId() + " encolado sin instante de listo");
            }
            if (!submitted.add(train.getId())) {
                throw new IllegalStateException("tren " + train.getId() + " ya fue encolado");
            }
            queues.queue(train.getCategory()).push(train.getId(), train.getReadyNanos());
            train.setState(TrainState.WAITING);
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Un paso del despachador: espera a que haya un candidato y la vía esté libre,
     * elige según la política y otorga la vía a ese único tren.
     *
     * @return el tren al que se otorgó la vía, o null cuando ya terminaron todos
     */
    public Train dispatchNext() throws InterruptedException {
        lock.lock();
        try {
            while ((!queues.anyReady() || trackInUse) && trainsFinished < roster.size()) {
                stateChanged.await();
            }
            if (trainsFinished >= roster.size()) {
                return null;
            }

            TrainCategory category = policy.select(queues, history);
            if (category == null) {
                throw new IllegalStateException("la política no eligió candidato con trenes en espera");
            }
            ReadyEntry entry = queues.queue(category).pop();
            if (entry == null) {
                throw new IllegalStateException("la política eligió la cola vacía " + category);
            }
            Train train = roster.get(entry.trainId());

            trackInUse = true;
            holder = train;
            dispatchOrder.add(train.getId());
            train.grant();
            return train;
        } finally {
            lock.unlock();
        }
    }

    /**
     * El tren que tiene la vía la devuelve al terminar de cruzar, también si el cruce falló.
     * En ambos casos cuenta como terminado.
     *
     * @throws IllegalStateException si el tren no es quien tiene la vía
     */
    public void releaseTrack(Train train) {
        lock.lock();
        try {
            if (!trackInUse || holder != train) {
                throw new IllegalStateException("tren " + train.getId() + " libera la vía sin tenerla");
            }
            trackInUse = false;
            holder = null;
            history = history.afterCrossing(train.getDirection());
            trainsFinished++;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Espera hasta que todos los trenes terminen.
     *
     * @return false si se agotó el tiempo
     */
    public boolean awaitAllFinished(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (trainsFinished < roster.size()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTrackInUse() {
        lock.lock();
        try {
            return trackInUse;
        } finally {
            lock.unlock();
        }
    }

    public int getTrainsFinished() {
        lock.lock();
        try {
            return trainsFinished;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFinished() {
        lock.lock();
        try {
            return trainsFinished >= roster.size();
        } finally {
            lock.unlock();
        }
    }

    public TrackHistory getHistory() {
        lock.lock();
        try {
            return history;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids de los trenes en el orden en que recibieron la vía.
     */
    public List<Integer> getDispatchOrder() {
        lock.lock();
        try {
            return List.copyOf(dispatchOrder);
        } finally {
            lock.unlock();
        }
    }

    public int getTrainCount() {
        return roster.size();
    }

    public SchedulerSnapshot snapshot() {
        lock.lock();
        try {
            return new SchedulerSnapshot(
                    queues.snapshot(),
                    holder == null ? null : holder.getId(),
                    trainsFinished,
                    roster.size(),
                    history
            );
        } finally {
            lock.unlock();
        }
    }
}
