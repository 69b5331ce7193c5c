package com.example.cmdpalette.registry;

import com.example.cmdpalette.commands.CommandException;
import com.example.cmdpalette.model.CommandDefinition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Table of all registered commands with their aliases and category groupings.
 * This is the single source of truth for command names, aliases and categories.
 * <p>
 * Not thread-safe: callers serialize registration against search and execution.
 */
public class CommandRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

    static final Comparator<CommandDefinition> BY_NAME =
            Comparator.comparing(CommandDefinition::getName, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(CommandDefinition::getName);

    private final Map<String, CommandDefinition> commands = new LinkedHashMap<>();
    private final Map<String, String> aliasToCanonical = new HashMap<>();
    private final Map<String, List<String>> categories = new HashMap<>();
    private final Clock clock;
    private long modificationCount;

    public CommandRegistry() {
        this(Clock.systemUTC());
    }

    public CommandRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register a command. Registering a name that is already present replaces the
     * earlier command together with its aliases and category membership.
     *
     * @throws CommandException of kind INVALID_COMMAND if the name is blank, the
     *         handler is missing, or a name/alias collides with another command
     */
    public void register(CommandDefinition command) {
        if (command == null || command.getName() == null || command.getName().isBlank()
                || command.getHandler() == null) {
            String name = command == null ? null : command.getName();
            throw CommandException.invalidCommand(name, "Command must have name and handler");
        }
        String name = command.getName();
        checkCollisions(command);

        if (commands.containsKey(name)) {
            logger.debug("Replacing command '{}'", name);
            removeInternal(name);
        }

        commands.put(name, command.withRegisteredAt(clock.instant()));
        for (String alias : command.getAliases()) {
            aliasToCanonical.put(alias, name);
        }
        categories.computeIfAbsent(command.getCategory(), k -> new ArrayList<>()).add(name);
        modificationCount++;
        logger.debug("Registered command '{}' in category '{}' with aliases {}",
                name, command.getCategory(), command.getAliases());
    }

    private void checkCollisions(CommandDefinition command) {
        String name = command.getName();
        String aliasOwner = aliasToCanonical.get(name);
        if (aliasOwner != null && !aliasOwner.equals(name)) {
            throw CommandException.invalidCommand(name,
                    "Command name '" + name + "' is already an alias of '" + aliasOwner + "'");
        }
        Set<String> seen = new HashSet<>();
        for (String alias : command.getAliases()) {
            if (alias == null || alias.isBlank()) {
                throw CommandException.invalidCommand(name, "Command '" + name + "' has a blank alias");
            }
            if (alias.equals(name)) {
                throw CommandException.invalidCommand(name, "Alias '" + alias + "' repeats its command name");
            }
            if (!seen.add(alias)) {
                throw CommandException.invalidCommand(name, "Alias '" + alias + "' is listed twice");
            }
            if (commands.containsKey(alias)) {
                throw CommandException.invalidCommand(name,
                        "Alias '" + alias + "' is already a command name");
            }
            String owner = aliasToCanonical.get(alias);
            if (owner != null && !owner.equals(name)) {
                throw CommandException.invalidCommand(name,
                        "Alias '" + alias + "' is already used by '" + owner + "'");
            }
        }
    }

    /**
     * Register several commands in order. Stops at the first invalid one; the
     * commands before it stay registered.
     */
    public void registerAll(Collection<CommandDefinition> definitions) {
        for (CommandDefinition def : definitions) {
            register(def);
        }
    }

    /**
     * Remove a command, its aliases and its category membership.
     *
     * @return false if no command with that exact name exists
     */
    public boolean unregister(String name) {
        if (name == null || !commands.containsKey(name)) {
            return false;
        }
        removeInternal(name);
        modificationCount++;
        logger.debug("Unregistered command '{}'", name);
        return true;
    }

    private void removeInternal(String name) {
        CommandDefinition removed = commands.remove(name);
        for (String alias : removed.getAliases()) {
            aliasToCanonical.remove(alias);
        }
        List<String> members = categories.get(removed.getCategory());
        if (members != null) {
            members.remove(name);
            if (members.isEmpty()) {
                categories.remove(removed.getCategory());
            }
        }
    }

    /**
     * Get a command definition by name or alias (exact, case-sensitive).
     */
    public CommandDefinition getCommand(String nameOrAlias) {
        if (nameOrAlias == null) return null;
        String canonical = aliasToCanonical.getOrDefault(nameOrAlias, nameOrAlias);
        return commands.get(canonical);
    }

    /**
     * Get the canonical name for a command (resolves aliases).
     */
    public String getCanonicalName(String nameOrAlias) {
        CommandDefinition def = getCommand(nameOrAlias);
        return def == null ? null : def.getName();
    }

    /**
     * Check if a command name or alias exists, regardless of availability.
     */
    public boolean hasCommand(String nameOrAlias) {
        return getCommand(nameOrAlias) != null;
    }

    /**
     * Get all currently available commands, sorted by name.
     */
    public List<CommandDefinition> getAllCommands() {
        List<CommandDefinition> result = new ArrayList<>();
        for (CommandDefinition cmd : commands.values()) {
            if (cmd.isAvailable()) {
                result.add(cmd);
            }
        }
        result.sort(BY_NAME);
        return result;
    }

    /**
     * Get all currently available commands in a category, sorted by name.
     */
    public List<CommandDefinition> getCommandsByCategory(String category) {
        List<String> members = categories.getOrDefault(category, Collections.emptyList());
        List<CommandDefinition> result = new ArrayList<>();
        for (String name : members) {
            CommandDefinition cmd = commands.get(name);
            if (cmd != null && cmd.isAvailable()) {
                result.add(cmd);
            }
        }
        result.sort(BY_NAME);
        return result;
    }

    /**
     * Every registered command in registration order, available or not.
     */
    public Collection<CommandDefinition> getRegisteredCommands() {
        return Collections.unmodifiableCollection(commands.values());
    }

    /**
     * Get all category names, sorted alphabetically.
     */
    public List<String> getCategories() {
        List<String> names = new ArrayList<>(categories.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Get all command names and aliases, in no particular order.
     * Used for longest-match resolution in the parser.
     */
    public List<String> getAllNamesAndAliases() {
        List<String> names = new ArrayList<>(commands.size() + aliasToCanonical.size());
        names.addAll(commands.keySet());
        names.addAll(aliasToCanonical.keySet());
        return names;
    }

    public int getCommandCount() {
        return commands.size();
    }

    public int getAliasCount() {
        return aliasToCanonical.size();
    }

    public int getCategoryCount() {
        return categories.size();
    }

    /**
     * Incremented on every successful register or unregister.
     */
    public long getModificationCount() {
        return modificationCount;
    }
}
