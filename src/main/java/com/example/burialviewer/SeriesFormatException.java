package com.example.burialviewer;

import java.io.IOException;

/**
 * Thrown when a series file has a row that does not hold two numeric columns.
 * Carries the 1-based line number and the raw line text.
 */
public class SeriesFormatException extends IOException {
    private final int lineNumber;
    private final String rawLine;

    public SeriesFormatException(String message, int lineNumber, String rawLine, Throwable cause) {
        super(message + " (line " + lineNumber + ": \"" + rawLine + "\")", cause);
        this.lineNumber = lineNumber;
        this.rawLine = rawLine;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getRawLine() {
        return rawLine;
    }
}
