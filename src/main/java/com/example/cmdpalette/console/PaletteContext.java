package com.example.cmdpalette.console;

import com.example.cmdpalette.commands.CommandDispatcher;
import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.model.ParsedCommand;
import com.example.cmdpalette.registry.CommandParser;
import com.example.cmdpalette.registry.CommandRanker;
import com.example.cmdpalette.registry.CommandRegistry;
import com.example.cmdpalette.util.CommandHistory;
import com.example.cmdpalette.util.PaletteConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Wires the registry, parser, ranker, history and dispatcher together. Create one
 * at application start and hand it to whatever registers or runs commands.
 */
public class PaletteContext {

    private static final Logger logger = LoggerFactory.getLogger(PaletteContext.class);

    private final PaletteConfig config;
    private final CommandRegistry registry;
    private final CommandParser parser;
    private final CommandRanker ranker;
    private final CommandHistory history;
    private final CommandDispatcher dispatcher;

    private PaletteContext(PaletteConfig config) {
        this.config = config;
        this.registry = new CommandRegistry();
        this.parser = new CommandParser(registry, config.getShortcutPrefix());
        this.ranker = new CommandRanker(registry, parser, config);
        this.history = new CommandHistory(config.getMaxHistoryEntries());
        this.dispatcher = new CommandDispatcher(registry, parser, history);
    }

    public static PaletteContext init(PaletteConfig config) {
        PaletteContext ctx = new PaletteContext(config);
        logger.info("Command palette ready (history={}, maxResults={}, shortcutPrefix='{}')",
                config.getMaxHistoryEntries(), config.getMaxSearchResults(), config.getShortcutPrefix());
        return ctx;
    }

    public static PaletteContext init() {
        return init(PaletteConfig.load());
    }

    public void register(CommandDefinition command) {
        registry.register(command);
    }

    public List<CommandDefinition> search(String query) {
        return ranker.search(query);
    }

    public ParsedCommand parse(String input) {
        return parser.parse(input);
    }

    public CompletableFuture<Object> execute(String input) {
        return dispatcher.execute(input);
    }

    public PaletteConfig getConfig() { return config; }
    public CommandRegistry getRegistry() { return registry; }
    public CommandParser getParser() { return parser; }
    public CommandRanker getRanker() { return ranker; }
    public CommandHistory getHistory() { return history; }
    public CommandDispatcher getDispatcher() { return dispatcher; }
}
