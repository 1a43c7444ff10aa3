package com.example.burialviewer;

import java.io.File;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Node;
import javafx.scene.Scene;
import javafx.scene.control.Tab;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class BurialViewerApp extends Application {

    // --- UI and State Components ---
    private Stage primaryStage;
    private StepSeriesStore seriesStore;
    private SeriesTableView seriesTableView;
    private PlotOverlayView plotOverlayView;
    private ClickOverlayView clickOverlayView;

    // --- Configuration Constants ---
    private static final String APP_TITLE = "Cool Burial App";
    private static final int WINDOW_WIDTH_PIXELS = 800;
    private static final int WINDOW_HEIGHT_PIXELS = 600;
    // Resolved against the working directory, like the saved data it points to
    static final String LAST_SAVED_POINTER_FILE = "last_saved_file.txt";

    public static void main(String[] args) {
        Application.launch(args);
    }

    @Override
    public void start(Stage primaryStage) {
        this.primaryStage = primaryStage;
        primaryStage.setTitle(APP_TITLE);

        // --- Init core components ---
        seriesStore = new StepSeriesStore(
                new CsvSeriesTableFile(),
                new FileLastPathStore(new File(LAST_SAVED_POINTER_FILE)));
        seriesStore.load();

        // --- Init tabs; each owns its own state ---
        seriesTableView = new SeriesTableView(primaryStage, seriesStore);
        plotOverlayView = new PlotOverlayView(primaryStage);
        clickOverlayView = new ClickOverlayView(primaryStage);

        TabPane notebook = new TabPane(
                createTab("Data Graph", seriesTableView),
                createTab("Line Graph", plotOverlayView),
                createTab("Click Data", clickOverlayView));

        Scene scene = new Scene(notebook, WINDOW_WIDTH_PIXELS, WINDOW_HEIGHT_PIXELS);
        primaryStage.setScene(scene);
        primaryStage.setResizable(true);
        primaryStage.setOnCloseRequest(event -> stopApp());
        primaryStage.show();
    }

    private static Tab createTab(String title, Node content) {
        Tab tab = new Tab(title, content);
        tab.setClosable(false);
        return tab;
    }

    private void stopApp() {
        System.out.println("Exiting application.");
        Platform.exit();
    }
}
