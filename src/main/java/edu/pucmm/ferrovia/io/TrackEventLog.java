package edu.pucmm.ferrovia.io;

import edu.pucmm.ferrovia.concurrent.TrackEventListener;
import edu.pucmm.ferrovia.core.SimulationClock;
import edu.pucmm.ferrovia.model.Train;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registro de eventos de la vía, una línea por evento con el tiempo transcurrido.
 * Las escrituras de varios hilos se serializan para que las líneas no se mezclen.
 */
public class TrackEventLog implements TrackEventListener, Closeable {
    private final Writer out;
    private final ReentrantLock writeLock = new ReentrantLock();

    public TrackEventLog(Writer out) {
        this.out = out;
    }

    @Override
    public void onReady(Train train, long elapsedNanos) {
        write(readyLine(train, elapsedNanos));
    }

    @Override
    public void onEnterTrack(Train train, long elapsedNanos) {
        write(enterLine(train, elapsedNanos));
    }

    @Override
    public void onLeaveTrack(Train train, long elapsedNanos) {
        write(leaveLine(train, elapsedNanos));
    }

    public static String readyLine(Train train, long elapsedNanos) {
        return String.format("%s Train %2d is ready to go %4s",
                SimulationClock.formatElapsed(elapsedNanos), train.getId(), train.getDirection().getDescription());
    }

    public static String enterLine(Train train, long elapsedNanos) {
        return String.format("%s Train %2d is ON the main track going %4s",
                SimulationClock.formatElapsed(elapsedNanos), train.getId(), train.getDirection().getDescription());
    }

    public static String leaveLine(Train train, long elapsedNanos) {
        return String.format("%s Train %2d is OFF the main track after going %4s",
                SimulationClock.formatElapsed(elapsedNanos), train.getId(), train.getDirection().getDescription());
    }

    private void write(String line) {
        writeLock.lock();
        try {
            out.write(line);
            out.write('\n');
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo escribir el registro de eventos", e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        writeLock.lock();
        try {
            out.close();
        } finally {
            writeLock.unlock();
        }
    }
}
