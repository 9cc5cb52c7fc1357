package edu.pucmm.ferrovia.core;

import java.util.concurrent.TimeUnit;

/**
 * Reloj monotónico de la simulación. Los tiempos de carga y cruce se expresan en
 * unidades; una unidad dura {@code tickMillis} milisegundos (100 ms = una décima de segundo).
 */
public class SimulationClock {
    private static final long NANOS_PER_TENTH = 100_000_000L;

    private final long startNanos;
    private final long tickMillis;

    public SimulationClock(long tickMillis) {
        if (tickMillis <= 0) {
            throw new IllegalArgumentException("tickMillis debe ser positivo: " + tickMillis);
        }
        this.tickMillis = tickMillis;
        this.startNanos = System.nanoTime();
    }

    /**
     * Nanosegundos transcurridos desde la creación del reloj.
     */
    public long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    public void sleepUnits(int units) throws InterruptedException {
        TimeUnit.MILLISECONDS.sleep(units * tickMillis);
    }

    public long getTickMillis() {
        return tickMillis;
    }

    /**
     * Formatea un tiempo transcurrido como {@code HH:MM:SS.d} (décimas truncadas).
     */
    public static String formatElapsed(long nanos) {
        long totalTenths = nanos / NANOS_PER_TENTH;
        long tenths = totalTenths % 10;
        long totalSeconds = totalTenths / 10;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        return String.format("%02d:%02d:%02d.%d", hours, minutes, seconds, tenths);
    }
}
