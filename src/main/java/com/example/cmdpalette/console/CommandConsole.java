package com.example.cmdpalette.console;

import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.util.PaletteConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Line-oriented front end for a {@link PaletteContext}.
 * <ul>
 *   <li>{@code ?query} prints the ranked search results for {@code query}</li>
 *   <li>{@code exit} or {@code quit} ends the session</li>
 *   <li>anything else is executed as a command</li>
 * </ul>
 */
public class CommandConsole {

    private static final Logger logger = LoggerFactory.getLogger(CommandConsole.class);

    private static final String SEARCH_PREFIX = "?";

    private final PaletteContext palette;
    private final BufferedReader in;
    private final PrintWriter out;

    public CommandConsole(PaletteContext palette, BufferedReader in, PrintWriter out) {
        this.palette = palette;
        this.in = in;
        this.out = out;
    }

    /**
     * Read and handle lines until end of input or an exit command.
     */
    public void run() throws IOException {
        out.println("Type ?text to search, help for commands, exit to leave.");
        out.flush();
        String line;
        while ((line = in.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;
            if (trimmed.equalsIgnoreCase("exit") || trimmed.equalsIgnoreCase("quit")) {
                out.println("Bye.");
                break;
            }
            if (trimmed.startsWith(SEARCH_PREFIX)) {
                printSearch(trimmed.substring(SEARCH_PREFIX.length()));
            } else if (!runCommand(trimmed)) {
                break;
            }
            out.flush();
        }
        out.flush();
    }

    private void printSearch(String query) {
        List<CommandDefinition> results = palette.search(query);
        if (results.isEmpty()) {
            out.println("No matching commands.");
            return;
        }
        for (CommandDefinition cmd : results) {
            out.println(cmd.getIcon() + " " + cmd.getDisplayName() + " - " + cmd.getDescription());
        }
    }

    /**
     * @return false if the console was interrupted and should stop
     */
    private boolean runCommand(String input) {
        try {
            Object result = palette.execute(input).get();
            printResult(result);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            out.println("Error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while running '{}'", input);
            return false;
        }
        return true;
    }

    private void printResult(Object result) {
        if (result == null) {
            out.println("OK");
        } else if (result instanceof Collection) {
            for (Object item : (Collection<?>) result) {
                out.println(item);
            }
        } else {
            String text = result.toString();
            out.print(text.endsWith("\n") ? text : text + "\n");
        }
    }

    public static void main(String[] args) {
        PaletteContext palette = PaletteContext.init(PaletteConfig.load());
        BuiltinCommands.register(palette);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        try {
            new CommandConsole(palette, in, out).run();
        } catch (IOException e) {
            logger.error("Console failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
