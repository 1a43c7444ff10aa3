package com.example.burialviewer;

import java.io.File;
import java.io.IOException;
import java.util.OptionalInt;

import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.SelectionMode;
import javafx.scene.control.TableColumn;
import javafx.scene.control.TableRow;
import javafx.scene.control.TableView;
import javafx.scene.control.TextField;
import javafx.scene.input.KeyCode;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

/**
 * "Data Graph" tab: the dense burial-depth table with upload, search and save.
 */
public class SeriesTableView extends VBox {
    private static final String ODD_ROW_COLOR = "#f9f9f9";
    private static final String EVEN_ROW_COLOR = "#e0e0e0";
    private static final String ACCENT_COLOR = "#4CAF50";

    private final Stage ownerStage;
    private final StepSeriesStore store;

    private final TableView<DepthStep> table;
    private final ObservableList<DepthStep> tableData = FXCollections.observableArrayList();
    private final TextField searchField;
    private final Label statusLabel;

    public SeriesTableView(Stage ownerStage, StepSeriesStore store) {
        super(5);
        this.ownerStage = ownerStage;
        this.store = store;
        setPadding(new Insets(5));
        setStyle("-fx-background-color: #f0f0f0;");

        Font labelFont = Font.font("Arial", FontWeight.BOLD, 10);

        Button uploadButton = createAccentButton("Upload Data", labelFont);
        uploadButton.setOnAction(event -> handleUpload());

        Label searchLabel = new Label("Search X Value:");
        searchLabel.setFont(labelFont);
        searchLabel.setTextFill(Color.web("#333333"));

        searchField = new TextField();
        searchField.setOnKeyPressed(event -> {
            if (event.getCode() == KeyCode.ENTER) {
                handleSearch();
            }
        });
        HBox.setHgrow(searchField, Priority.ALWAYS);

        Button saveButton = createAccentButton("Save", labelFont);
        saveButton.setOnAction(event -> handleSave());

        HBox toolbar = new HBox(10, uploadButton, searchLabel, searchField, saveButton);
        toolbar.setAlignment(Pos.CENTER_LEFT);

        table = new TableView<>(tableData);
        table.getSelectionModel().setSelectionMode(SelectionMode.SINGLE);
        table.setStyle("-fx-font-family: 'Arial'; -fx-font-size: 10px;"
                + " -fx-selection-bar: " + ACCENT_COLOR + "; -fx-selection-bar-non-focused: " + ACCENT_COLOR + ";");
        table.setRowFactory(tv -> new TableRow<>() {
            @Override
            protected void updateItem(DepthStep item, boolean empty) {
                super.updateItem(item, empty);
                if (empty || item == null) {
                    setStyle("");
                } else {
                    String color = (getIndex() % 2 == 0) ? ODD_ROW_COLOR : EVEN_ROW_COLOR;
                    setStyle("-fx-control-inner-background: " + color + ";");
                }
            }
        });

        TableColumn<DepthStep, Integer> xCol = new TableColumn<>("Distance from BMH Value (M)");
        xCol.setCellValueFactory(p -> new ReadOnlyObjectWrapper<>(p.getValue().getX()));
        xCol.setSortable(false);
        TableColumn<DepthStep, Integer> yCol = new TableColumn<>("Burial Depth Value (CM)");
        yCol.setCellValueFactory(p -> new ReadOnlyObjectWrapper<>(p.getValue().getY()));
        yCol.setSortable(false);
        xCol.prefWidthProperty().bind(table.widthProperty().divide(2).subtract(1));
        yCol.prefWidthProperty().bind(table.widthProperty().divide(2).subtract(1));

        table.getColumns().setAll(xCol, yCol);
        table.setPlaceholder(new Label("No data loaded"));
        VBox.setVgrow(table, Priority.ALWAYS);

        statusLabel = new Label("");
        statusLabel.setPadding(new Insets(2, 5, 2, 5));
        statusLabel.setMaxWidth(Double.MAX_VALUE);

        getChildren().addAll(toolbar, table, statusLabel);
        refreshTable();
    }

    private Button createAccentButton(String text, Font font) {
        Button button = new Button(text);
        button.setFont(font);
        button.setStyle("-fx-background-color: " + ACCENT_COLOR + "; -fx-text-fill: white;");
        button.setOnMouseEntered(e -> button.setStyle("-fx-background-color: #45a049; -fx-text-fill: white;"));
        button.setOnMouseExited(e -> button.setStyle("-fx-background-color: " + ACCENT_COLOR + "; -fx-text-fill: white;"));
        return button;
    }

    /** Re-reads the store into the table, e.g. after the startup restore. */
    public void refreshTable() {
        tableData.setAll(store.current().getSteps());
    }

    private void handleUpload() {
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Upload Survey Data");
        fileChooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV Files", CsvSeriesTableFile.EXTENSION));
        File file = fileChooser.showOpenDialog(ownerStage);
        if (file == null) { statusLabel.setText("Upload cancelled."); return; }
        try {
            DenseSeries series = store.upload(file);
            refreshTable();
            statusLabel.setText("Loaded " + series.size() + " rows from " + file.getName());
        } catch (IOException e) {
            statusLabel.setText("Error reading " + file.getName() + ": " + e.getMessage());
            e.printStackTrace();
            showError("Upload Error", "Could not read survey data", e.getMessage());
        }
    }

    private void handleSearch() {
        OptionalInt match = SearchIndex.find(store.current(), searchField.getText());
        if (match.isEmpty()) return;
        int row = match.getAsInt();
        table.getSelectionModel().clearAndSelect(row);
        table.scrollTo(row);
    }

    private void handleSave() {
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Save Survey Data");
        fileChooser.setInitialFileName("burial_data.csv");
        fileChooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV Files", CsvSeriesTableFile.EXTENSION));
        File file = fileChooser.showSaveDialog(ownerStage);
        if (file == null) { statusLabel.setText("Save cancelled."); return; }
        if (!file.getName().contains(".")) {
            file = new File(file.getParentFile(), file.getName() + ".csv");
        }
        try {
            store.save(file);
            statusLabel.setText("Saved: " + file.getName());
        } catch (IOException e) {
            statusLabel.setText("Error saving: " + e.getMessage());
            e.printStackTrace();
            showError("Save Error", "Could not save survey data", e.getMessage());
        }
    }

    private void showError(String title, String header, String content) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.initOwner(ownerStage);
        alert.setTitle(title);
        alert.setHeaderText(header);
        alert.setContentText(content);
        alert.showAndWait();
    }
}
