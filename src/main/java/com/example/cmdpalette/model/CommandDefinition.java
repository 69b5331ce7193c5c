package com.example.cmdpalette.model;

import com.example.cmdpalette.commands.AvailabilityCondition;
import com.example.cmdpalette.commands.CommandHandler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Defines metadata for a single invocable command.
 * Instances are immutable; use {@link #builder(String)} to create one.
 */
public class CommandDefinition {

    public static final String DEFAULT_CATEGORY = "general";
    public static final String DEFAULT_ICON = "⚡";

    private final String name;
    private final String description;
    private final String category;
    private final String icon;
    private final String shortcut;
    private final List<String> aliases;
    private final List<CommandParameter> parameters;
    private final AvailabilityCondition condition;
    private final CommandHandler handler;
    private final Instant registeredAt;

    private CommandDefinition(Builder b) {
        this.name = b.name;
        this.description = isBlank(b.description) ? "Execute " + b.name : b.description;
        this.category = isBlank(b.category) ? DEFAULT_CATEGORY : b.category;
        this.icon = b.icon == null ? DEFAULT_ICON : b.icon;
        this.shortcut = b.shortcut == null ? "" : b.shortcut;
        this.aliases = Collections.unmodifiableList(new ArrayList<>(b.aliases));
        this.parameters = Collections.unmodifiableList(new ArrayList<>(b.parameters));
        this.condition = b.condition == null ? AvailabilityCondition.ALWAYS : b.condition;
        this.handler = b.handler;
        this.registeredAt = b.registeredAt;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public String getIcon() { return icon; }
    public String getShortcut() { return shortcut; }
    public List<String> getAliases() { return aliases; }
    public List<CommandParameter> getParameters() { return parameters; }
    public AvailabilityCondition getCondition() { return condition; }
    public CommandHandler getHandler() { return handler; }
    /** Null until the definition has been stamped by a registry. */
    public Instant getRegisteredAt() { return registeredAt; }

    public boolean isAvailable() {
        return condition.isAvailable();
    }

    /**
     * Returns the display name for listings (e.g., "save (:s)" if it has alias ":s").
     */
    public String getDisplayName() {
        if (aliases.isEmpty()) {
            return name;
        }
        return name + " (" + aliases.get(0) + ")";
    }

    /**
     * Returns a synopsis line such as {@code fold level <level>}.
     */
    public String getUsage() {
        if (parameters.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name);
        for (CommandParameter p : parameters) {
            sb.append(' ').append(p.getUsageToken());
        }
        return sb.toString();
    }

    /**
     * Copy of this definition carrying the given registration time.
     */
    public CommandDefinition withRegisteredAt(Instant when) {
        return toBuilder().registeredAt(when).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(name)
                .description(description)
                .category(category)
                .icon(icon)
                .shortcut(shortcut)
                .aliases(aliases)
                .condition(condition)
                .handler(handler)
                .registeredAt(registeredAt);
        b.parameters.addAll(parameters);
        return b;
    }

    @Override
    public String toString() {
        return "CommandDefinition{name='" + name + "', category='" + category + "', aliases=" + aliases + "}";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static class Builder {
        private final String name;
        private String description;
        private String category;
        private String icon;
        private String shortcut;
        private final List<String> aliases = new ArrayList<>();
        private final List<CommandParameter> parameters = new ArrayList<>();
        private AvailabilityCondition condition;
        private CommandHandler handler;
        private Instant registeredAt;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder icon(String icon) { this.icon = icon; return this; }
        public Builder shortcut(String shortcut) { this.shortcut = shortcut; return this; }
        public Builder condition(AvailabilityCondition condition) { this.condition = condition; return this; }
        public Builder handler(CommandHandler handler) { this.handler = handler; return this; }

        public Builder aliases(String... aliases) {
            return aliases(Arrays.asList(aliases));
        }

        public Builder aliases(List<String> aliases) {
            this.aliases.clear();
            if (aliases != null) this.aliases.addAll(aliases);
            return this;
        }

        public Builder parameter(CommandParameter parameter) {
            this.parameters.add(parameter);
            return this;
        }

        public Builder parameter(String name, boolean required, ParameterType type) {
            return parameter(new CommandParameter(name, required, type));
        }

        Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public CommandDefinition build() {
            return new CommandDefinition(this);
        }
    }
}
