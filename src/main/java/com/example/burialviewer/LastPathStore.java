package com.example.burialviewer;

import java.io.IOException;
import java.util.Optional;

/**
 * Single-key store remembering the file the last series was saved to.
 */
public interface LastPathStore {

    /** The remembered path, or empty when nothing was saved or it can't be read. */
    Optional<String> get();

    void set(String path) throws IOException;
}
