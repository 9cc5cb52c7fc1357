package edu.pucmm.ferrovia.view;

import javafx.application.Application;
import javafx.fxml.FXMLLoader;
import javafx.scene.Scene;
import javafx.stage.Stage;

import java.nio.file.Path;
import java.util.List;

public class TrackMonitorApp extends Application {

    private TrackMonitorController controller;

    @Override
    public void start(Stage primaryStage) throws Exception {
        FXMLLoader loader = new FXMLLoader(getClass().getResource("/view/monitor.fxml"));
        Scene scene = new Scene(loader.load());
        controller = loader.getController();

        primaryStage.setTitle("Despacho de trenes - vía principal");
        primaryStage.setScene(scene);
        primaryStage.setOnCloseRequest(e -> controller.shutdown());
        primaryStage.show();

        List<String> args = getParameters().getRaw();
        if (!args.isEmpty()) {
            controller.startSimulation(Path.of(args.get(0)));
        }
    }

    @Override
    public void stop() {
        if (controller != null) {
            controller.shutdown();
        }
    }
}
