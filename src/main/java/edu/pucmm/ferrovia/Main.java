package edu.pucmm.ferrovia;

import edu.pucmm.ferrovia.core.SimulationConfig;
import edu.pucmm.ferrovia.core.SimulationException;
import edu.pucmm.ferrovia.core.TrackSimulation;
import edu.pucmm.ferrovia.core.WorkerStartException;
import edu.pucmm.ferrovia.io.RosterLoadException;
import edu.pucmm.ferrovia.io.RosterLoader;
import edu.pucmm.ferrovia.io.TrackEventLog;
import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.view.TrackMonitorApp;
import javafx.application.Application;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Punto de entrada.
 * <pre>
 *   Main &lt;archivo-de-entrada&gt;         simulación sin interfaz, escribe output.txt
 *   Main --gui &lt;archivo-de-entrada&gt;   monitor JavaFX
 * </pre>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final String GUI_FLAG = "--gui";

    public static void main(String[] args) {
        configureLogging();
        if (args.length == 2 && GUI_FLAG.equals(args[0])) {
            Application.launch(TrackMonitorApp.class, Arrays.copyOfRange(args, 1, 2));
            return;
        }
        System.exit(run(args, SimulationConfig.load(), System.err));
    }

    /**
     * Corre la simulación sin interfaz.
     *
     * @return código de salida del proceso
     */
    static int run(String[] args, SimulationConfig config, PrintStream err) {
        if (args.length != 1) {
            err.println("Uso: Main [" + GUI_FLAG + "] <archivo-de-entrada>");
            return EXIT_FAILURE;
        }

        List<Train> trains;
        try {
            trains = new RosterLoader().load(Path.of(args[0]));
        } catch (RosterLoadException e) {
            err.println("No se pudo cargar la lista de trenes " + args[0] + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        try (TrackEventLog eventLog = new TrackEventLog(
                Files.newBufferedWriter(config.getOutputFile(), StandardCharsets.UTF_8))) {
            TrackSimulation simulation = new TrackSimulation(trains, config);
            simulation.addListener(eventLog);
            simulation.run();
            return EXIT_OK;
        } catch (IOException e) {
            err.println("No se pudo escribir " + config.getOutputFile() + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (WorkerStartException | SimulationException e) {
            err.println(e.getMessage() + ": " + e.getCause());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Simulación interrumpida");
            return EXIT_FAILURE;
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.warning("No se pudo leer logging.properties: " + e.getMessage());
        }
    }
}
