package com.example.terminal_relay_service.service;

import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public class ScrollbackBuffer {

    public static final int DEFAULT_MAX_LINES = 5000;

    private final int maxLines;
    private final Deque<String> lines = new ArrayDeque<>();

    public ScrollbackBuffer(int maxLines) {
        Validate.isTrue(maxLines > 0, "maxLines must be positive");
        this.maxLines = maxLines;
    }

    /**
     * Splits the chunk on '\n' and appends every piece as a line, including a trailing
     * empty piece when the chunk ends with a newline.
     */
    public void append(String chunk) {
        for (String line : chunk.split("\n", -1)) {
            lines.addLast(line);
        }
        while (lines.size() > maxLines) {
            lines.removeFirst();
        }
    }

    public List<String> snapshot() {
        return List.copyOf(lines);
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public int getMaxLines() {
        return maxLines;
    }
}
