package com.example.cmdpalette.model;

import java.util.Collections;
import java.util.List;

/**
 * Result of parsing a raw input line: the resolved command name (or best guess)
 * and the whitespace-separated arguments that follow it.
 */
public class ParsedCommand {
    private final String name;
    private final List<String> args;
    private final String rawInput;
    private final String cleanInput;

    public ParsedCommand(String name, List<String> args, String rawInput, String cleanInput) {
        this.name = name;
        this.args = args == null ? Collections.emptyList() : Collections.unmodifiableList(args);
        this.rawInput = rawInput;
        this.cleanInput = cleanInput;
    }

    public String getName() { return name; }
    public List<String> getArgs() { return args; }
    public String getRawInput() { return rawInput; }
    /** Trimmed input with any leading shortcut sentinel removed. */
    public String getCleanInput() { return cleanInput; }

    /**
     * Arguments joined back with single spaces.
     */
    public String getArgsText() {
        return String.join(" ", args);
    }

    @Override
    public String toString() {
        return "ParsedCommand{name='" + name + "', args=" + args + "}";
    }
}
