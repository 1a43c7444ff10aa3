package com.example.burialviewer;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

import javafx.geometry.Insets;
import javafx.geometry.Point2D;
import javafx.geometry.Pos;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.image.Image;
import javafx.scene.input.MouseButton;
import javafx.scene.input.MouseEvent;
import javafx.scene.layout.Pane;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.stage.Stage;

/**
 * "Click Data" tab: a reference image shown as a centred thumbnail. Clicking it reports the
 * position in survey units.
 */
public class ClickOverlayView extends VBox {
    private final Stage ownerStage;
    private final Canvas canvas;
    private final GraphicsContext gc;
    private final Label coordLabel;

    private Image image;
    private Thumbnail thumbnail;

    public ClickOverlayView(Stage ownerStage) {
        super(10);
        this.ownerStage = ownerStage;
        setAlignment(Pos.TOP_CENTER);
        setPadding(new Insets(0, 0, 10, 0));

        canvas = new Canvas();
        gc = canvas.getGraphicsContext2D();
        Pane canvasHolder = new Pane(canvas);
        canvasHolder.setMinSize(0, 0);
        canvas.widthProperty().bind(canvasHolder.widthProperty());
        canvas.heightProperty().bind(canvasHolder.heightProperty());
        canvas.widthProperty().addListener((obs, oldW, newW) -> displayImage());
        canvas.heightProperty().addListener((obs, oldH, newH) -> displayImage());
        canvas.setOnMouseClicked(this::handleClick);
        VBox.setVgrow(canvasHolder, Priority.ALWAYS);

        Button uploadButton = new Button("Upload Image");
        uploadButton.setOnAction(event -> handleUploadImage());

        coordLabel = new Label("Coordinates: X=0, Y=0");

        getChildren().addAll(canvasHolder, uploadButton, coordLabel);
    }

    private void handleUploadImage() {
        File file = ImageFiles.choosePng(ownerStage);
        if (file == null) return;
        try {
            image = ImageFiles.load(file);
        } catch (IOException e) {
            System.err.println("Error loading click image: " + e.getMessage());
            e.printStackTrace();
            ImageFiles.showLoadError(ownerStage, e);
            return;
        }
        displayImage();
    }

    /** Refits the thumbnail to the current canvas size and redraws it centred. */
    private void displayImage() {
        gc.clearRect(0, 0, canvas.getWidth(), canvas.getHeight());
        if (image == null) return;

        int canvasWidth = (int) canvas.getWidth();
        int canvasHeight = (int) canvas.getHeight();
        if (canvasWidth <= 0 || canvasHeight <= 0) return;

        thumbnail = Thumbnail.fit((int) image.getWidth(), (int) image.getHeight(), canvasWidth, canvasHeight);
        int xOffset = Math.floorDiv(canvasWidth - thumbnail.getWidth(), 2);
        int yOffset = Math.floorDiv(canvasHeight - thumbnail.getHeight(), 2);

        gc.setFill(Color.WHITE);
        gc.fillRect(0, 0, canvasWidth, canvasHeight);
        gc.drawImage(image, xOffset, yOffset, thumbnail.getWidth(), thumbnail.getHeight());
    }

    private void handleClick(MouseEvent event) {
        if (event.getButton() != MouseButton.PRIMARY || image == null || thumbnail == null) return;

        Point2D coords = ClickCoordinateMapper.map(
                event.getX(), event.getY(),
                thumbnail.getWidth(), thumbnail.getHeight(),
                (int) canvas.getWidth(), (int) canvas.getHeight());
        coordLabel.setText(ClickCoordinateMapper.readout(coords));
        System.out.println(String.format(Locale.US, "Selected Coordinates: X=%s, Y=%s", coords.getX(), coords.getY()));
    }
}
