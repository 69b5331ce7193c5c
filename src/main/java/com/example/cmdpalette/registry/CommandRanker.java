package com.example.cmdpalette.registry;

import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.util.PaletteConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks commands against a palette query. Runs on every keystroke and reads the
 * registry as it is at the moment of the call; nothing is cached.
 * <p>
 * Normal queries sum independent signals (name tiers, word matches, aliases,
 * description, category) and fall back to a subsequence test only when nothing
 * else scored. Queries starting with the shortcut prefix match aliases only.
 */
public class CommandRanker {

    private static final Logger logger = LoggerFactory.getLogger(CommandRanker.class);

    public static final int SHORTCUT_EXACT = 2000;
    public static final int SHORTCUT_PREFIX = 1000;

    public static final int NAME_EXACT = 1000;
    public static final int NAME_PREFIX = 800;
    public static final int NAME_CONTAINS = 600;
    public static final int ALL_WORDS = 750;
    public static final int SOME_WORDS_BASE = 400;
    public static final int PER_WORD = 100;
    public static final int FIRST_WORD_PREFIX = 550;
    public static final int ALIAS_EXACT = 900;
    public static final int ALIAS_PREFIX = 700;
    public static final int ALIAS_CONTAINS = 500;
    public static final int DESCRIPTION_CONTAINS = 200;
    public static final int CATEGORY_CONTAINS = 100;
    public static final int FUZZY_NAME = 300;
    public static final int FUZZY_DESCRIPTION = 100;

    private final CommandRegistry registry;
    private final CommandParser parser;
    private final int maxResults;
    private final boolean shortcutPrefixMatching;
    private final int fuzzyMinLength;

    public CommandRanker(CommandRegistry registry, CommandParser parser, PaletteConfig config) {
        this.registry = registry;
        this.parser = parser;
        this.maxResults = config.getMaxSearchResults();
        this.shortcutPrefixMatching = config.isShortcutPrefixMatching();
        this.fuzzyMinLength = config.getFuzzyMinLength();
    }

    /**
     * Best matches for the query, highest score first, at most {@code maxResults}.
     * An empty query lists the first available commands by name.
     */
    public List<CommandDefinition> search(String query) {
        if (query == null || query.isBlank()) {
            List<CommandDefinition> all = registry.getAllCommands();
            return new ArrayList<>(all.subList(0, Math.min(maxResults, all.size())));
        }

        String prefix = parser.getShortcutPrefix();
        boolean shortcut = query.trim().startsWith(prefix);
        String searchQuery = shortcut ? shortcutToken(query, prefix) : query.trim().toLowerCase(Locale.ROOT);

        List<Scored> scored = new ArrayList<>();
        for (CommandDefinition cmd : registry.getRegisteredCommands()) {
            if (!cmd.isAvailable()) continue;
            int score = shortcut ? shortcutScore(cmd, searchQuery) : score(cmd, searchQuery);
            if (score > 0) {
                scored.add(new Scored(cmd, score));
            }
        }
        scored.sort(Comparator.comparingInt((Scored s) -> s.score).reversed()
                .thenComparing(s -> s.command, CommandRegistry.BY_NAME));

        List<CommandDefinition> results = new ArrayList<>();
        for (int i = 0; i < scored.size() && i < maxResults; i++) {
            results.add(scored.get(i).command);
        }
        logger.trace("search '{}' -> {} of {} matches", query, results.size(), scored.size());
        return results;
    }

    // The parser strips any trailing arguments; the sentinel is kept for alias comparison
    private String shortcutToken(String query, String prefix) {
        String name = parser.parse(query).getName();
        if (!name.startsWith(prefix)) {
            name = prefix + name;
        }
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Score for a shortcut-style query, already lower-cased and including the prefix.
     */
    public int shortcutScore(CommandDefinition command, String query) {
        int score = 0;
        for (String alias : command.getAliases()) {
            String aliasLower = alias.toLowerCase(Locale.ROOT);
            if (aliasLower.equals(query)) {
                return SHORTCUT_EXACT;
            }
            if (shortcutPrefixMatching && aliasLower.startsWith(query)) {
                score += SHORTCUT_PREFIX;
            }
        }
        return score;
    }

    /**
     * Composite relevance score for a normal query, already lower-cased and trimmed.
     * Zero means no match.
     */
    public int score(CommandDefinition command, String query) {
        int score = 0;

        String name = command.getName().toLowerCase(Locale.ROOT);
        String description = command.getDescription().toLowerCase(Locale.ROOT);
        String category = command.getCategory().toLowerCase(Locale.ROOT);

        if (name.equals(query)) {
            score += NAME_EXACT;
        } else if (name.startsWith(query)) {
            score += NAME_PREFIX;
        } else if (name.contains(query)) {
            score += NAME_CONTAINS;
        }

        String[] nameWords = name.trim().split("\\s+");
        String[] queryWords = query.split("\\s+");
        if (queryWords.length > 1 && nameWords.length > 1) {
            int matching = 0;
            for (String queryWord : queryWords) {
                for (String nameWord : nameWords) {
                    if (nameWord.startsWith(queryWord)) {
                        matching++;
                        break;
                    }
                }
            }
            if (matching == queryWords.length) {
                score += ALL_WORDS;
            } else if (matching > 0) {
                score += SOME_WORDS_BASE + matching * PER_WORD;
            }
        }

        if (nameWords.length > 0 && nameWords[0].startsWith(query)) {
            score += FIRST_WORD_PREFIX;
        }

        for (String alias : command.getAliases()) {
            String aliasLower = alias.toLowerCase(Locale.ROOT);
            if (aliasLower.equals(query)) {
                score += ALIAS_EXACT;
            } else if (aliasLower.startsWith(query)) {
                score += ALIAS_PREFIX;
            } else if (aliasLower.contains(query)) {
                score += ALIAS_CONTAINS;
            }
        }

        if (description.contains(query)) {
            score += DESCRIPTION_CONTAINS;
        }
        if (category.contains(query)) {
            score += CATEGORY_CONTAINS;
        }

        if (score == 0 && query.length() >= fuzzyMinLength) {
            if (FuzzyMatcher.matches(name, query)) {
                score += FUZZY_NAME;
            } else if (FuzzyMatcher.matches(description, query)) {
                score += FUZZY_DESCRIPTION;
            }
        }
        return score;
    }

    public int getMaxResults() {
        return maxResults;
    }

    private static final class Scored {
        final CommandDefinition command;
        final int score;

        Scored(CommandDefinition command, int score) {
            this.command = command;
            this.score = score;
        }
    }
}
