package com.example.cmdpalette.registry;

import com.example.cmdpalette.model.ParsedCommand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Splits raw input into a command name and arguments using longest-match-first
 * resolution against every registered name and alias, so that multi-word names
 * such as "search advanced" win over their single-word prefix "search".
 * <p>
 * Parsing never fails: when no name matches, the first token becomes the name
 * and the dispatcher reports it as not found.
 */
public class CommandParser {

    private static final Comparator<String> LONGEST_FIRST =
            Comparator.comparingInt(String::length).reversed();

    private final CommandRegistry registry;
    private final String shortcutPrefix;

    // Sorted candidates, rebuilt when the registry changes
    private List<String> candidates = Collections.emptyList();
    private long candidatesVersion = -1;

    public CommandParser(CommandRegistry registry, String shortcutPrefix) {
        this.registry = registry;
        this.shortcutPrefix = shortcutPrefix;
    }

    public ParsedCommand parse(String input) {
        String raw = input == null ? "" : input;
        String trimmed = raw.trim();

        boolean shortcut = !shortcutPrefix.isEmpty() && trimmed.startsWith(shortcutPrefix);
        String searchInput = shortcut ? trimmed.substring(shortcutPrefix.length()) : trimmed;

        // Among candidates of the matched length, an exact-case match beats a case-insensitive one
        String match = null;
        int matchLength = -1;
        for (String candidate : sortedCandidates()) {
            if (match != null && candidate.length() < matchLength) break;
            String checkName = shortcut && candidate.startsWith(shortcutPrefix)
                    ? candidate.substring(shortcutPrefix.length())
                    : candidate;
            if (checkName.isEmpty() || searchInput.length() < checkName.length()) continue;
            if (!searchInput.regionMatches(true, 0, checkName, 0, checkName.length())) continue;

            String remainder = searchInput.substring(checkName.length());
            if (remainder.isEmpty() || Character.isWhitespace(remainder.charAt(0))) {
                if (searchInput.startsWith(checkName)) {
                    return new ParsedCommand(candidate, splitArgs(remainder), raw, searchInput);
                }
                if (match == null) {
                    match = candidate;
                    matchLength = candidate.length();
                }
            }
        }
        if (match != null) {
            String checkName = shortcut && match.startsWith(shortcutPrefix)
                    ? match.substring(shortcutPrefix.length())
                    : match;
            return new ParsedCommand(match, splitArgs(searchInput.substring(checkName.length())), raw, searchInput);
        }

        // No registered name matched: first token is the name
        List<String> parts = splitArgs(searchInput);
        String first = parts.isEmpty() ? "" : parts.get(0);
        String name = shortcut ? shortcutPrefix + first : first;
        List<String> args = parts.isEmpty() ? new ArrayList<>() : new ArrayList<>(parts.subList(1, parts.size()));
        return new ParsedCommand(name, args, raw, searchInput);
    }

    private List<String> sortedCandidates() {
        long version = registry.getModificationCount();
        if (version != candidatesVersion) {
            List<String> names = registry.getAllNamesAndAliases();
            names.sort(LONGEST_FIRST);
            candidates = names;
            candidatesVersion = version;
        }
        return candidates;
    }

    private static List<String> splitArgs(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(trimmed.split("\\s+")));
    }

    public String getShortcutPrefix() {
        return shortcutPrefix;
    }
}
