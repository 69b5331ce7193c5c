package com.example.cmdpalette.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Most-recently-used list of executed inputs, newest first. Re-recording an
 * input moves it to the front; the oldest entries fall off past the limit.
 */
public class CommandHistory {
    private final List<String> entries = new ArrayList<>();
    private final int maxEntries;

    public CommandHistory(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.maxEntries = maxEntries;
    }

    public CommandHistory() {
        this(PaletteConfig.DEFAULT_MAX_HISTORY);
    }

    public void record(String input) {
        entries.remove(input);
        entries.add(0, input);
        while (entries.size() > maxEntries) {
            entries.remove(entries.size() - 1);
        }
    }

    /**
     * Copy of the entries, most recent first.
     */
    public List<String> getAll() {
        return new ArrayList<>(entries);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
