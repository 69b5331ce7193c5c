package com.example.cmdpalette.model;

/**
 * Point-in-time counters describing a registry.
 */
public class RegistryStats {
    private final int totalCommands;
    private final int totalAliases;
    private final int totalCategories;
    private final int historyLength;
    private final int availableCommands;

    public RegistryStats(int totalCommands, int totalAliases, int totalCategories,
                         int historyLength, int availableCommands) {
        this.totalCommands = totalCommands;
        this.totalAliases = totalAliases;
        this.totalCategories = totalCategories;
        this.historyLength = historyLength;
        this.availableCommands = availableCommands;
    }

    public int getTotalCommands() { return totalCommands; }
    public int getTotalAliases() { return totalAliases; }
    public int getTotalCategories() { return totalCategories; }
    public int getHistoryLength() { return historyLength; }
    public int getAvailableCommands() { return availableCommands; }

    @Override
    public String toString() {
        return "commands=" + totalCommands
                + ", aliases=" + totalAliases
                + ", categories=" + totalCategories
                + ", history=" + historyLength
                + ", available=" + availableCommands;
    }
}
