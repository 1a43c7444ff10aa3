package com.example.burialviewer;

import java.io.File;
import java.io.IOException;

import javafx.scene.control.Alert;
import javafx.scene.image.Image;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

/**
 * Shared PNG picking and decoding for the two image tabs.
 */
final class ImageFiles {
    static final String PNG_EXTENSION = "*.png";

    private ImageFiles() {
    }

    /** Shows an open dialog; null when the user cancels. */
    static File choosePng(Stage ownerStage) {
        FileChooser fileChooser = new FileChooser();
        fileChooser.setTitle("Upload Image");
        fileChooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("PNG Files", PNG_EXTENSION));
        return fileChooser.showOpenDialog(ownerStage);
    }

    /** Decodes synchronously so the caller can report a bad file straight away. */
    static Image load(File file) throws IOException {
        Image image = new Image(file.toURI().toString(), false);
        if (image.isError()) {
            Exception cause = image.getException();
            throw new IOException("Could not decode " + file.getName()
                    + (cause != null ? ": " + cause.getMessage() : ""), cause);
        }
        return image;
    }

    static void showLoadError(Stage ownerStage, IOException e) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.initOwner(ownerStage);
        alert.setTitle("Image Error");
        alert.setHeaderText("Could not open image");
        alert.setContentText(e.getMessage());
        alert.showAndWait();
    }
}
