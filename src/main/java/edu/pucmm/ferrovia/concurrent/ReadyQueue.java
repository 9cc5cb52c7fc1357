package edu.pucmm.ferrovia.concurrent;

import edu.pucmm.ferrovia.model.ReadyEntry;
import edu.pucmm.ferrovia.model.TrainCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cola de trenes listos de una categoría (sentido × prioridad).
 * Mantiene el orden por instante de listo; en empate sale primero el id menor.
 * <p>
 * No es thread-safe por sí sola: solo se toca con el monitor de {@link SchedulerCore} tomado.
 */
public class ReadyQueue {
    private static final Logger logger = Logger.getLogger(ReadyQueue.class.getName());

    private final TrainCategory category;
    private final PriorityQueue<ReadyEntry> heap = new PriorityQueue<>();

    public ReadyQueue(TrainCategory category) {
        this.category = category;
    }

    /**
     * Inserta un tren manteniendo el orden (instante de listo, id).
     */
    public void push(int trainId, long readyNanos) {
        ReadyEntry entry = new ReadyEntry(trainId, readyNanos);
        heap.offer(entry);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Tren " + trainId + " encolado en " + category + " (t=" + readyNanos + "ns, tamaño=" + heap.size() + ")");
        }
    }

    /**
     * Remueve y devuelve el primero de la cola.
     *
     * @return la entrada mínima, o null si la cola está vacía
     */
    public ReadyEntry pop() {
        return heap.poll();
    }

    /**
     * Consulta el primero sin removerlo.
     *
     * @return la entrada mínima, o null si la cola está vacía
     */
    public ReadyEntry peek() {
        return heap.peek();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public int size() {
        return heap.size();
    }

    public TrainCategory getCategory() {
        return category;
    }

    /**
     * Copia ordenada del contenido, para observadores.
     */
    public List<ReadyEntry> snapshot() {
        List<ReadyEntry> copy = new ArrayList<>(heap);
        copy.sort(null);
        return copy;
    }
}
