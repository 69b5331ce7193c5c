package com.example.cmdpalette.model;

/**
 * A positional parameter declared by a command.
 */
public class CommandParameter {

    private final String name;
    private final boolean required;
    private final ParameterType type;
    private final String description;

    public CommandParameter(String name, boolean required, ParameterType type, String description) {
        this.name = name;
        this.required = required;
        this.type = type;
        this.description = description == null ? "" : description;
    }

    public CommandParameter(String name, boolean required, ParameterType type) {
        this(name, required, type, "");
    }

    public static CommandParameter required(String name, ParameterType type) {
        return new CommandParameter(name, true, type);
    }

    public static CommandParameter optional(String name, ParameterType type) {
        return new CommandParameter(name, false, type);
    }

    public String getName() { return name; }
    public boolean isRequired() { return required; }
    /** May be null, in which case any argument is accepted. */
    public ParameterType getType() { return type; }
    public String getDescription() { return description; }

    /**
     * Usage fragment: {@code <name>} when required, {@code [name]} otherwise.
     */
    public String getUsageToken() {
        return required ? "<" + name + ">" : "[" + name + "]";
    }
}
