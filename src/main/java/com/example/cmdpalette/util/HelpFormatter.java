package com.example.cmdpalette.util;

import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.model.CommandParameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.ArrayList;

/**
 * Man-style help text for commands.
 */
public final class HelpFormatter {

    private HelpFormatter() {}

    public static String formatManPage(CommandDefinition cmd) {
        StringBuilder sb = new StringBuilder();
        sb.append("NAME\n    ").append(cmd.getName()).append(" - ").append(cmd.getDescription()).append("\n\n");
        sb.append("SYNOPSIS\n    ").append(cmd.getUsage()).append("\n\n");
        if (!cmd.getAliases().isEmpty()) {
            sb.append("ALIASES\n    ").append(String.join(", ", cmd.getAliases())).append("\n\n");
        }
        if (!cmd.getParameters().isEmpty()) {
            sb.append("PARAMETERS\n");
            for (CommandParameter p : cmd.getParameters()) {
                sb.append("    ").append(p.getName());
                sb.append(p.isRequired() ? " (required" : " (optional");
                if (p.getType() != null) {
                    sb.append(", ").append(p.getType().getLabel());
                }
                sb.append(')');
                if (!p.getDescription().isEmpty()) {
                    sb.append("  ").append(p.getDescription());
                }
                sb.append('\n');
            }
            sb.append('\n');
        }
        if (!cmd.getShortcut().isEmpty()) {
            sb.append("SHORTCUT\n    ").append(cmd.getShortcut()).append("\n\n");
        }
        sb.append("CATEGORY\n    ").append(cmd.getCategory()).append('\n');
        return sb.toString();
    }

    /**
     * Commands grouped under their category headings, categories alphabetical.
     */
    public static String formatListing(List<CommandDefinition> commands) {
        Map<String, List<CommandDefinition>> byCategory = new TreeMap<>();
        for (CommandDefinition cmd : commands) {
            byCategory.computeIfAbsent(cmd.getCategory(), k -> new ArrayList<>()).add(cmd);
        }
        int width = 0;
        for (CommandDefinition cmd : commands) {
            width = Math.max(width, cmd.getDisplayName().length());
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<CommandDefinition>> e : byCategory.entrySet()) {
            sb.append('[').append(e.getKey()).append("]\n");
            for (CommandDefinition cmd : e.getValue()) {
                sb.append("  ").append(pad(cmd.getDisplayName(), width)).append("  ")
                        .append(cmd.getDescription()).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Category name to number of available commands, categories alphabetical.
     */
    public static Map<String, Integer> countByCategory(List<CommandDefinition> commands) {
        Map<String, Integer> counts = new TreeMap<>();
        for (CommandDefinition cmd : commands) {
            counts.merge(cmd.getCategory(), 1, Integer::sum);
        }
        return new LinkedHashMap<>(counts);
    }

    private static String pad(String s, int width) {
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) sb.append(' ');
        return sb.toString();
    }
}
