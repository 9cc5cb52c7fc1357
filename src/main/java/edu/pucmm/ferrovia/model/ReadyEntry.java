package edu.pucmm.ferrovia.model;

/**
 * Nodo de una cola de listos. Se ordena por instante de listo y, en empate, por id.
 *
 * @param trainId    id del tren
 * @param readyNanos nanosegundos desde el inicio de la simulación en que quedó listo
 */
public record ReadyEntry(int trainId, long readyNanos) implements Comparable<ReadyEntry> {

    public ReadyEntry {
        if (trainId < 0) {
            throw new IllegalArgumentException("id de tren negativo: " + trainId);
        }
        if (readyNanos < 0) {
            throw new IllegalArgumentException("instante de listo negativo para tren " + trainId);
        }
    }

    /**
     * @return true si esta entrada debe salir antes que la otra
     */
    public boolean comesBefore(ReadyEntry other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(ReadyEntry other) {
        int byTime = Long.compare(readyNanos, other.readyNanos);
        if (byTime != 0) {
            return byTime;
        }
        return Integer.compare(trainId, other.trainId);
    }
}
