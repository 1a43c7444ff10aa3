package com.example.burialviewer;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Keeps the last saved path as the only line of a plain text file.
 */
public class FileLastPathStore implements LastPathStore {
    private final File pointerFile;

    public FileLastPathStore(File pointerFile) {
        this.pointerFile = pointerFile;
    }

    @Override
    public Optional<String> get() {
        if (!pointerFile.isFile()) return Optional.empty();
        try (BufferedReader reader = new BufferedReader(new FileReader(pointerFile, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            if (line == null || line.isBlank()) return Optional.empty();
            return Optional.of(line.strip());
        } catch (IOException e) {
            System.err.println("Could not read " + pointerFile + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(String path) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(pointerFile, StandardCharsets.UTF_8))) {
            writer.write(path);
        }
    }
}
