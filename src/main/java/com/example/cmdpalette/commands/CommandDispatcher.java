package com.example.cmdpalette.commands;

import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.model.CommandParameter;
import com.example.cmdpalette.model.ParsedCommand;
import com.example.cmdpalette.model.RegistryStats;
import com.example.cmdpalette.registry.CommandParser;
import com.example.cmdpalette.registry.CommandRegistry;
import com.example.cmdpalette.util.CommandHistory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Resolves parsed input to a registered command, validates its arguments,
 * records the input in history and runs the command's handler.
 * <p>
 * Every failure, whether raised here or by the handler, is reported to the
 * registered {@link CommandListener}s and then returned to the caller through
 * the failed future. Handler errors are passed on unchanged.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandRegistry registry;
    private final CommandParser parser;
    private final CommandHistory history;
    private final List<CommandListener> listeners = new CopyOnWriteArrayList<>();

    public CommandDispatcher(CommandRegistry registry, CommandParser parser, CommandHistory history) {
        this.registry = registry;
        this.parser = parser;
        this.history = history;
    }

    /**
     * Execute a raw input line.
     *
     * @return a future completing with the handler's result, or failing with a
     *         {@link CommandException} or whatever the handler threw
     */
    public CompletableFuture<Object> execute(String input) {
        final CommandDefinition command;
        final ParsedCommand parsed;
        final CompletionStage<?> stage;
        try {
            parsed = parser.parse(input);
            command = registry.getCommand(parsed.getName());
            if (command == null) {
                throw CommandException.notFound(parsed.getName());
            }
            if (!command.isAvailable()) {
                throw CommandException.unavailable(parsed.getName());
            }
            if (!command.getParameters().isEmpty()) {
                validateParameters(command, parsed.getArgs());
            }

            history.record(input);
            logger.debug("Executing '{}' with args {}", command.getName(), parsed.getArgs());
            CompletionStage<?> returned = command.getHandler().handle(new CommandContext(command, parsed));
            stage = returned == null ? CompletableFuture.completedFuture(null) : returned;
        } catch (CommandException e) {
            logger.warn("Rejected input '{}': {}", input, e.getMessage());
            fireError(input, e);
            return CompletableFuture.failedFuture(e);
        } catch (Exception e) {
            logger.warn("Command failed for input '{}'", input, e);
            fireError(input, e);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Object> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                logger.warn("Command '{}' failed", command.getName(), cause);
                fireError(input, cause);
                result.completeExceptionally(cause);
            } else {
                fireExecute(command, parsed.getArgs(), value);
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * Check supplied arguments against a command's declared parameters.
     * Extra arguments beyond the declared list are not checked.
     *
     * @throws CommandException MISSING_PARAMETERS or INVALID_PARAMETER_TYPE
     */
    public void validateParameters(CommandDefinition command, List<String> args) {
        List<CommandParameter> parameters = command.getParameters();
        List<CommandParameter> required = new ArrayList<>();
        for (CommandParameter p : parameters) {
            if (p.isRequired()) required.add(p);
        }

        if (args.size() < required.size()) {
            List<String> missing = new ArrayList<>();
            for (CommandParameter p : required.subList(args.size(), required.size())) {
                missing.add(p.getName());
            }
            throw CommandException.missingParameters(command.getName(), missing);
        }

        for (int i = 0; i < parameters.size() && i < args.size(); i++) {
            CommandParameter param = parameters.get(i);
            if (param.getType() != null && !param.getType().accepts(args.get(i))) {
                throw CommandException.invalidParameterType(command.getName(), param.getName(), param.getType());
            }
        }
    }

    public void addListener(CommandListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(CommandListener listener) {
        return listeners.remove(listener);
    }

    private void fireExecute(CommandDefinition command, List<String> args, Object result) {
        for (CommandListener l : listeners) {
            try {
                l.onExecute(command, args, result);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed on execute of '{}'", l, command.getName(), e);
            }
        }
    }

    private void fireError(String input, Throwable error) {
        for (CommandListener l : listeners) {
            try {
                l.onError(input, error);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed on error for '{}'", l, input, e);
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    public RegistryStats getStats() {
        return new RegistryStats(
                registry.getCommandCount(),
                registry.getAliasCount(),
                registry.getCategoryCount(),
                history.size(),
                registry.getAllCommands().size());
    }

    public CommandHistory getHistory() {
        return history;
    }
}
