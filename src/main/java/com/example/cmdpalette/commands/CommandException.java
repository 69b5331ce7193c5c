package com.example.cmdpalette.commands;

import com.example.cmdpalette.model.ParameterType;

import java.util.Collections;
import java.util.List;

/**
 * Failure raised by the registry or dispatcher. Errors thrown by command
 * handlers themselves are never wrapped in this type.
 */
public class CommandException extends RuntimeException {

    public enum Kind {
        INVALID_COMMAND,
        COMMAND_NOT_FOUND,
        COMMAND_UNAVAILABLE,
        MISSING_PARAMETERS,
        INVALID_PARAMETER_TYPE
    }

    private final Kind kind;
    private final String commandName;
    private final List<String> missingParameters;

    private CommandException(Kind kind, String commandName, List<String> missingParameters, String message) {
        super(message);
        this.kind = kind;
        this.commandName = commandName;
        this.missingParameters = missingParameters == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(missingParameters);
    }

    public static CommandException invalidCommand(String name, String message) {
        return new CommandException(Kind.INVALID_COMMAND, name, null, message);
    }

    public static CommandException notFound(String name) {
        return new CommandException(Kind.COMMAND_NOT_FOUND, name, null,
                "Command \"" + name + "\" not found");
    }

    public static CommandException unavailable(String name) {
        return new CommandException(Kind.COMMAND_UNAVAILABLE, name, null,
                "Command \"" + name + "\" is not available in current context");
    }

    public static CommandException missingParameters(String name, List<String> missing) {
        return new CommandException(Kind.MISSING_PARAMETERS, name, missing,
                "Missing required parameters: " + String.join(", ", missing));
    }

    public static CommandException invalidParameterType(String name, String parameter, ParameterType type) {
        return new CommandException(Kind.INVALID_PARAMETER_TYPE, name, null,
                "Parameter \"" + parameter + "\" must be of type " + type.getLabel());
    }

    public Kind getKind() { return kind; }
    public String getCommandName() { return commandName; }
    /** Names of unfilled required parameters; empty unless kind is MISSING_PARAMETERS. */
    public List<String> getMissingParameters() { return missingParameters; }
}
