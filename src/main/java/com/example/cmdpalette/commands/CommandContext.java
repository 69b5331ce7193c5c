package com.example.cmdpalette.commands;

import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.model.ParsedCommand;

import java.util.List;

/**
 * Context object passed to command handlers: the resolved command plus the
 * parse result of the input that triggered it.
 */
public class CommandContext {
    public final CommandDefinition command;
    public final ParsedCommand parsed;

    public CommandContext(CommandDefinition command, ParsedCommand parsed) {
        this.command = command;
        this.parsed = parsed;
    }

    public List<String> getArgs() {
        return parsed.getArgs();
    }

    /**
     * Positional argument, or null when not supplied.
     */
    public String getArg(int index) {
        List<String> args = parsed.getArgs();
        return index < args.size() ? args.get(index) : null;
    }

    /**
     * All arguments joined with single spaces (empty when none).
     */
    public String getArgsText() {
        return parsed.getArgsText();
    }

    /**
     * The name as it appeared after parsing; may be an alias.
     */
    public String getCommandName() {
        return parsed.getName();
    }
}
