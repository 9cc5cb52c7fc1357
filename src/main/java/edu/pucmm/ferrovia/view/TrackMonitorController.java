package edu.pucmm.ferrovia.view;

import edu.pucmm.ferrovia.concurrent.SchedulerSnapshot;
import edu.pucmm.ferrovia.concurrent.TrackEventListener;
import edu.pucmm.ferrovia.core.SimulationConfig;
import edu.pucmm.ferrovia.core.SimulationResult;
import edu.pucmm.ferrovia.core.TrackSimulation;
import edu.pucmm.ferrovia.io.RosterLoadException;
import edu.pucmm.ferrovia.io.RosterLoader;
import edu.pucmm.ferrovia.io.TrackEventLog;
import edu.pucmm.ferrovia.model.ReadyEntry;
import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainCategory;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Platform;
import javafx.fxml.FXML;
import javafx.scene.control.Label;
import javafx.scene.control.ListView;
import javafx.scene.control.TextArea;
import javafx.scene.paint.Color;
import javafx.util.Duration;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Monitor en vivo: colas de listos, tren en la vía, contadores y registro de eventos.
 */
public class TrackMonitorController {
    private static final Logger logger = Logger.getLogger(TrackMonitorController.class.getName());
    private static final Duration REFRESH_INTERVAL = Duration.millis(100);

    @FXML
    private ListView<String> eastHighList;
    @FXML
    private ListView<String> eastLowList;
    @FXML
    private ListView<String> westHighList;
    @FXML
    private ListView<String> westLowList;
    @FXML
    private Label trackLabel;
    @FXML
    private Label statusLabel;
    @FXML
    private TextArea eventLog;

    private final Map<TrainCategory, ListView<String>> queueViews = new EnumMap<>(TrainCategory.class);
    private Timeline refresher;
    private volatile TrackSimulation simulation;

    @FXML
    public void initialize() {
        queueViews.put(TrainCategory.EAST_HIGH, eastHighList);
        queueViews.put(TrainCategory.EAST_LOW, eastLowList);
        queueViews.put(TrainCategory.WEST_HIGH, westHighList);
        queueViews.put(TrainCategory.WEST_LOW, westLowList);
        trackLabel.setText("Vía libre");
        statusLabel.setText("Sin simulación");
    }

    /**
     * Carga la lista de trenes y lanza la simulación en un hilo aparte.
     */
    public void startSimulation(Path input) {
        List<Train> trains;
        try {
            trains = new RosterLoader().load(input);
        } catch (RosterLoadException e) {
            statusLabel.setTextFill(Color.RED);
            statusLabel.setText(e.getMessage());
            logger.warning("Lista de trenes inválida: " + e.getMessage());
            return;
        }

        TrackSimulation sim = new TrackSimulation(trains, SimulationConfig.load());
        sim.addListener(new EventLogAppender());
        simulation = sim;

        refresher = new Timeline(new KeyFrame(REFRESH_INTERVAL, e -> refresh(sim.getCore().snapshot())));
        refresher.setCycleCount(Timeline.INDEFINITE);
        refresher.play();

        Thread runner = new Thread(() -> runSimulation(sim), "Simulacion-UI");
        runner.setDaemon(true);
        runner.start();
    }

    private void runSimulation(TrackSimulation sim) {
        try {
            SimulationResult result = sim.run();
            Platform.runLater(() -> {
                refresh(sim.getCore().snapshot());
                refresher.stop();
                statusLabel.setText("Terminado. Orden de despacho: " + result.dispatchOrder());
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Simulación de la interfaz interrumpida");
        } catch (RuntimeException e) {
            logger.severe("Falló la simulación: " + e.getMessage());
            Platform.runLater(() -> {
                refresher.stop();
                statusLabel.setTextFill(Color.RED);
                statusLabel.setText("Error: " + e.getMessage());
            });
        }
    }

    private void refresh(SchedulerSnapshot snapshot) {
        snapshot.queues().forEach((category, entries) ->
                queueViews.get(category).getItems().setAll(describe(entries)));
        trackLabel.setText(snapshot.isTrackFree()
                ? "Vía libre"
                : "En la vía: tren #" + snapshot.trainOnTrack());
        statusLabel.setText(String.format("Cruzaron %d de %d | último sentido %s, racha %d",
                snapshot.trainsFinished(),
                snapshot.trainCount(),
                snapshot.history().haveEverCrossed() ? snapshot.history().lastDirection().getDescription() : "-",
                snapshot.history().sameDirectionStreak()));
    }

    private static List<String> describe(List<ReadyEntry> entries) {
        return entries.stream()
                .map(entry -> "#" + entry.trainId() + " (" + entry.readyNanos() / 1_000_000 + " ms)")
                .toList();
    }

    public void shutdown() {
        if (refresher != null) {
            refresher.stop();
        }
        TrackSimulation sim = simulation;
        if (sim != null && sim.isStarted() && !sim.getCore().isFinished()) {
            sim.abort();
        }
    }

    /**
     * Pasa las líneas del registro de eventos al hilo de JavaFX.
     */
    private class EventLogAppender implements TrackEventListener {
        @Override
        public void onReady(Train train, long elapsedNanos) {
            append(TrackEventLog.readyLine(train, elapsedNanos));
        }

        @Override
        public void onEnterTrack(Train train, long elapsedNanos) {
            append(TrackEventLog.enterLine(train, elapsedNanos));
        }

        @Override
        public void onLeaveTrack(Train train, long elapsedNanos) {
            append(TrackEventLog.leaveLine(train, elapsedNanos));
        }

        private void append(String line) {
            Platform.runLater(() -> eventLog.appendText(line + "\n"));
        }
    }
}
