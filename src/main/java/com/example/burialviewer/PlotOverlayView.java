package com.example.burialviewer;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

import javafx.geometry.Insets;
import javafx.geometry.Point2D;
import javafx.geometry.Pos;
import javafx.geometry.VPos;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.image.Image;
import javafx.scene.input.MouseEvent;
import javafx.scene.layout.Pane;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.scene.text.Font;
import javafx.scene.text.TextAlignment;
import javafx.stage.Stage;

/**
 * "Line Graph" tab: a reference image stretched over the fixed survey extent
 * (0..1000 m by 0..225 cm) with a live cursor read-out.
 */
public class PlotOverlayView extends VBox {
    // Margins leave room for tick labels around the plot rectangle
    private static final double MARGIN_LEFT = 50;
    private static final double MARGIN_RIGHT = 20;
    private static final double MARGIN_TOP = 20;
    private static final double MARGIN_BOTTOM = 35;

    private static final double X_TICK_STEP = 200;
    private static final double Y_TICK_STEP = 25;
    private static final double TICK_LENGTH_PIXELS = 5.0;
    private static final Font AXIS_NUMBER_FONT = Font.font("Arial", 10);
    private static final Color AXIS_COLOR = Color.rgb(60, 60, 60);

    private final Stage ownerStage;
    private final Label cursorLabel;
    private final Pane canvasHolder;
    private final Canvas canvas;
    private final GraphicsContext gc;

    private Image image;

    public PlotOverlayView(Stage ownerStage) {
        super(5);
        this.ownerStage = ownerStage;
        setAlignment(Pos.TOP_CENTER);
        setPadding(new Insets(5));

        cursorLabel = new Label("");
        cursorLabel.setFont(Font.font("Arial", 14));

        Button uploadButton = new Button("Upload Image");
        uploadButton.setOnAction(event -> handleUploadImage());

        canvas = new Canvas();
        gc = canvas.getGraphicsContext2D();
        canvasHolder = new Pane(canvas);
        canvasHolder.setMinSize(0, 0);
        canvas.widthProperty().bind(canvasHolder.widthProperty());
        canvas.heightProperty().bind(canvasHolder.heightProperty());
        canvas.widthProperty().addListener((obs, oldW, newW) -> redraw());
        canvas.heightProperty().addListener((obs, oldH, newH) -> redraw());
        VBox.setVgrow(canvasHolder, Priority.ALWAYS);

        canvas.setOnMouseMoved(this::handleMouseMoved);
        canvas.setOnMouseExited(event -> cursorLabel.setText(CoordinateMapper.readout(null)));

        getChildren().addAll(cursorLabel, uploadButton, canvasHolder);
    }

    /**
     * Space for the current canvas size. Once an image is shown its top edge is depth 0, so the
     * domain y axis runs downward like the image rows.
     */
    CoordinateSpace plotSpace() {
        return new CoordinateSpace(
                0, CoordinateMapper.DOMAIN_X_MAX,
                0, CoordinateMapper.DOMAIN_Y_MAX,
                MARGIN_LEFT, canvas.getWidth() - MARGIN_RIGHT,
                MARGIN_TOP, canvas.getHeight() - MARGIN_BOTTOM,
                image == null);
    }

    private void handleMouseMoved(MouseEvent event) {
        Point2D logical = plotSpace().toDomain(event.getX(), event.getY());
        cursorLabel.setText(CoordinateMapper.readout(logical));
    }

    private void handleUploadImage() {
        File file = ImageFiles.choosePng(ownerStage);
        if (file == null) return;
        try {
            image = ImageFiles.load(file);
        } catch (IOException e) {
            System.err.println("Error loading plot image: " + e.getMessage());
            e.printStackTrace();
            ImageFiles.showLoadError(ownerStage, e);
            return;
        }
        System.out.println("Plot image loaded: " + file.getName()
                + " (" + (int) image.getWidth() + "x" + (int) image.getHeight() + ")");
        redraw();

        ownerStage.setFullScreenExitHint("Press Esc to exit full screen.");
        ownerStage.setFullScreen(true);
    }

    private void redraw() {
        double w = canvas.getWidth();
        double h = canvas.getHeight();
        gc.setFill(Color.WHITE);
        gc.fillRect(0, 0, w, h);
        if (w <= MARGIN_LEFT + MARGIN_RIGHT || h <= MARGIN_TOP + MARGIN_BOTTOM) return;

        CoordinateSpace space = plotSpace();
        Point2D topLeft = space.toPixel(0, space.isFlipY() ? CoordinateMapper.DOMAIN_Y_MAX : 0);
        Point2D bottomRight = space.toPixel(CoordinateMapper.DOMAIN_X_MAX, space.isFlipY() ? 0 : CoordinateMapper.DOMAIN_Y_MAX);
        double plotW = bottomRight.getX() - topLeft.getX();
        double plotH = bottomRight.getY() - topLeft.getY();

        if (image != null) {
            gc.drawImage(image, topLeft.getX(), topLeft.getY(), plotW, plotH);
        }

        gc.setStroke(AXIS_COLOR);
        gc.setFill(AXIS_COLOR);
        gc.setLineWidth(1);
        gc.strokeRect(topLeft.getX(), topLeft.getY(), plotW, plotH);
        drawAxisTicks(space, bottomRight.getY(), topLeft.getX());
    }

    private void drawAxisTicks(CoordinateSpace space, double axisY, double axisX) {
        gc.setFont(AXIS_NUMBER_FONT);

        gc.setTextAlign(TextAlignment.CENTER);
        gc.setTextBaseline(VPos.TOP);
        for (double x = 0; x <= CoordinateMapper.DOMAIN_X_MAX; x += X_TICK_STEP) {
            double px = space.toPixel(x, 0).getX();
            gc.strokeLine(px, axisY, px, axisY + TICK_LENGTH_PIXELS);
            gc.fillText(String.format(Locale.US, "%.0f", x), px, axisY + TICK_LENGTH_PIXELS + 2);
        }

        gc.setTextAlign(TextAlignment.RIGHT);
        gc.setTextBaseline(VPos.CENTER);
        for (double y = 0; y <= CoordinateMapper.DOMAIN_Y_MAX; y += Y_TICK_STEP) {
            double py = space.toPixel(0, y).getY();
            gc.strokeLine(axisX - TICK_LENGTH_PIXELS, py, axisX, py);
            gc.fillText(String.format(Locale.US, "%.0f", y), axisX - TICK_LENGTH_PIXELS - 2, py);
        }
    }
}
