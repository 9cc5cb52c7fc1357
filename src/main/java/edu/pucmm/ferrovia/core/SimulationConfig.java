package edu.pucmm.ferrovia.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuración de la simulación.
 * Se lee de {@code ferrovia.properties} en el classpath y cada clave puede
 * sobrescribirse con una propiedad de sistema del mismo nombre ({@code -Dferrovia.tick.millis=10}).
 */
public final class SimulationConfig {
    private static final Logger logger = Logger.getLogger(SimulationConfig.class.getName());

    public static final String RESOURCE = "/ferrovia.properties";
    public static final String TICK_MILLIS_KEY = "ferrovia.tick.millis";
    public static final String OUTPUT_FILE_KEY = "ferrovia.output.file";
    public static final String SHUTDOWN_TIMEOUT_KEY = "ferrovia.shutdown.timeout.seconds";

    public static final long DEFAULT_TICK_MILLIS = 100;
    public static final String DEFAULT_OUTPUT_FILE = "output.txt";
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final long tickMillis;
    private final Path outputFile;
    private final long shutdownTimeoutSeconds;

    public SimulationConfig(long tickMillis, Path outputFile, long shutdownTimeoutSeconds) {
        if (tickMillis <= 0) {
            throw new IllegalArgumentException(TICK_MILLIS_KEY + " debe ser positivo: " + tickMillis);
        }
        if (outputFile == null) {
            throw new IllegalArgumentException(OUTPUT_FILE_KEY + " requerido");
        }
        if (shutdownTimeoutSeconds <= 0) {
            throw new IllegalArgumentException(SHUTDOWN_TIMEOUT_KEY + " debe ser positivo: " + shutdownTimeoutSeconds);
        }
        this.tickMillis = tickMillis;
        this.outputFile = outputFile;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(DEFAULT_TICK_MILLIS, Path.of(DEFAULT_OUTPUT_FILE), DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    /**
     * Carga el recurso del classpath y aplica las propiedades de sistema encima.
     */
    public static SimulationConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SimulationConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.fine("Sin " + RESOURCE + " en el classpath, usando valores por defecto");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + RESOURCE, e);
        }
        for (String key : new String[]{TICK_MILLIS_KEY, OUTPUT_FILE_KEY, SHUTDOWN_TIMEOUT_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    public static SimulationConfig fromProperties(Properties properties) {
        long tick = parseLong(properties, TICK_MILLIS_KEY, DEFAULT_TICK_MILLIS);
        String output = properties.getProperty(OUTPUT_FILE_KEY, DEFAULT_OUTPUT_FILE).trim();
        long timeout = parseLong(properties, SHUTDOWN_TIMEOUT_KEY, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
        if (output.isEmpty()) {
            throw new IllegalArgumentException(OUTPUT_FILE_KEY + " vacío");
        }
        return new SimulationConfig(tick, Path.of(output), timeout);
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valor inválido para " + key + ": " + raw, e);
        }
    }

    public SimulationConfig withOutputFile(Path outputFile) {
        return new SimulationConfig(tickMillis, outputFile, shutdownTimeoutSeconds);
    }

    public long getTickMillis() {
        return tickMillis;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "SimulationConfig[tick=" + tickMillis + "ms, salida=" + outputFile
                + ", timeout=" + shutdownTimeoutSeconds + "s]";
    }
}
