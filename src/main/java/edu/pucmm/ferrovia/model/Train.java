package edu.pucmm.ferrovia.model;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Tren de la lista de entrada.
 * Los datos de la lista son inmutables; el instante de listo se fija una sola vez
 * y el permiso de vía es una señal de un solo uso que completa el despachador.
 */
public class Train {
    public static final int MIN_DURATION = 1;
    public static final int MAX_DURATION = 99;
    public static final long NOT_READY = -1L;

    private final int id;
    private final TrainCategory category;
    private final int loadingTime;
    private final int crossingTime;

    private volatile long readyNanos = NOT_READY;
    private volatile TrainState state = TrainState.CREATED;
    private final CompletableFuture<Void> grantSignal = new CompletableFuture<>();

    public Train(int id, TrainCategory category, int loadingTime, int crossingTime) {
        if (id < 0) {
            throw new IllegalArgumentException("id de tren negativo: " + id);
        }
        if (category == null) {
            throw new IllegalArgumentException("categoría requerida para tren " + id);
        }
        checkDuration("carga", loadingTime);
        checkDuration("cruce", crossingTime);
        this.id = id;
        this.category = category;
        this.loadingTime = loadingTime;
        this.crossingTime = crossingTime;
    }

    private static void checkDuration(String name, int value) {
        if (value < MIN_DURATION || value > MAX_DURATION) {
            throw new IllegalArgumentException("tiempo de " + name + " fuera de rango ["
                    + MIN_DURATION + "," + MAX_DURATION + "]: " + value);
        }
    }

    /**
     * Fija el instante en que el tren quedó listo.
     *
     * @param nanos nanosegundos desde el inicio de la simulación
     * @throws IllegalStateException si ya fue fijado
     */
    public synchronized void markReady(long nanos) {
        if (nanos < 0) {
            throw new IllegalArgumentException("instante de listo negativo: " + nanos);
        }
        if (readyNanos != NOT_READY) {
            throw new IllegalStateException("tren " + id + " ya tiene instante de listo");
        }
        readyNanos = nanos;
        state = TrainState.READY;
    }

    public boolean isReadyStamped() {
        return readyNanos != NOT_READY;
    }

    /**
     * Otorga la vía a este tren. Solo el despachador la llama, con el monitor tomado.
     *
     * @throws IllegalStateException si ya se le había otorgado
     */
    public void grant() {
        if (!grantSignal.complete(null)) {
            throw new IllegalStateException("tren " + id + " ya recibió la vía");
        }
    }

    public boolean isGranted() {
        return grantSignal.isDone();
    }

    /**
     * Bloquea hasta recibir la vía.
     */
    public void awaitGrant() throws InterruptedException {
        while (!isGranted()) {
            try {
                grantSignal.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("señal de permiso inválida para tren " + id, e.getCause());
            }
        }
    }

    public ReadyEntry toReadyEntry() {
        if (!isReadyStamped()) {
            throw new IllegalStateException("tren " + id + " aún no está listo");
        }
        return new ReadyEntry(id, readyNanos);
    }

    public int getId() {
        return id;
    }

    public TrainCategory getCategory() {
        return category;
    }

    public TrackDirection getDirection() {
        return category.getDirection();
    }

    public TrainPriority getPriority() {
        return category.getPriority();
    }

    public int getLoadingTime() {
        return loadingTime;
    }

    public int getCrossingTime() {
        return crossingTime;
    }

    public long getReadyNanos() {
        return readyNanos;
    }

    public TrainState getState() {
        return state;
    }

    public void setState(TrainState state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return "Train#" + id + "[" + category + ", carga=" + loadingTime + ", cruce=" + crossingTime + "]";
    }
}
