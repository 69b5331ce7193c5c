package com.example.cmdpalette.console;

import com.example.cmdpalette.commands.CommandContext;
import com.example.cmdpalette.commands.CommandHandler;
import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.model.CommandParameter;
import com.example.cmdpalette.model.ParameterType;
import com.example.cmdpalette.registry.CommandRegistry;
import com.example.cmdpalette.util.CommandHistory;
import com.example.cmdpalette.util.HelpFormatter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Commands about the palette itself: help, history, clear history, categories, stats.
 */
public class BuiltinCommands implements CommandHandler {

    public static final String CATEGORY = "palette";

    private final PaletteContext palette;

    private BuiltinCommands(PaletteContext palette) {
        this.palette = palette;
    }

    /**
     * Register all built-in commands against the context's registry.
     */
    public static void register(PaletteContext palette) {
        BuiltinCommands handler = new BuiltinCommands(palette);
        palette.getRegistry().registerAll(List.of(
                CommandDefinition.builder("help")
                        .description("show available commands or help for one command")
                        .category(CATEGORY)
                        .icon("❓")
                        .aliases(":h")
                        .parameter(new CommandParameter("command", false, ParameterType.STRING, "Command to describe"))
                        .handler(handler)
                        .build(),
                CommandDefinition.builder("history")
                        .description("list recently executed commands")
                        .category(CATEGORY)
                        .aliases(":hist")
                        .handler(handler)
                        .build(),
                CommandDefinition.builder("clear history")
                        .description("forget recently executed commands")
                        .category(CATEGORY)
                        .aliases(":ch")
                        .handler(handler)
                        .build(),
                CommandDefinition.builder("categories")
                        .description("list command categories")
                        .category(CATEGORY)
                        .aliases(":cat")
                        .handler(handler)
                        .build(),
                CommandDefinition.builder("stats")
                        .description("show registry statistics")
                        .category(CATEGORY)
                        .handler(handler)
                        .build()));
    }

    @Override
    public CompletionStage<?> handle(CommandContext ctx) {
        switch (ctx.command.getName()) {
            case "help":
                return done(handleHelp(ctx));
            case "history":
                return done(handleHistory());
            case "clear history":
                palette.getHistory().clear();
                return done("History cleared.");
            case "categories":
                return done(handleCategories());
            case "stats":
                return done(palette.getDispatcher().getStats().toString());
            default:
                throw new IllegalStateException("Not a built-in command: " + ctx.command.getName());
        }
    }

    private String handleHelp(CommandContext ctx) {
        CommandRegistry registry = palette.getRegistry();
        String topic = ctx.getArgsText();
        if (topic.isEmpty()) {
            return HelpFormatter.formatListing(registry.getAllCommands());
        }
        CommandDefinition cmd = registry.getCommand(topic);
        if (cmd == null || !cmd.isAvailable()) {
            return "No help for '" + topic + "'.";
        }
        return HelpFormatter.formatManPage(cmd);
    }

    private String handleHistory() {
        CommandHistory history = palette.getHistory();
        List<String> entries = history.getAll();
        if (entries.isEmpty()) {
            return "History is empty.";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < entries.size(); i++) {
            sb.append(String.format("%3d  %s%n", i + 1, entries.get(i)));
        }
        return sb.toString();
    }

    private String handleCategories() {
        StringBuilder sb = new StringBuilder();
        Map<String, Integer> counts = HelpFormatter.countByCategory(palette.getRegistry().getAllCommands());
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            sb.append(e.getKey()).append(" (").append(e.getValue()).append(")\n");
        }
        return sb.toString();
    }

    private static CompletionStage<Object> done(Object value) {
        return CompletableFuture.completedFuture(value);
    }
}
