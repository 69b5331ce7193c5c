package com.example.cmdpalette;

import com.example.cmdpalette.commands.CommandException;
import com.example.cmdpalette.commands.CommandHandler;
import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.registry.CommandRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for registration, lookup and removal in the command table.
 */
@DisplayName("CommandRegistry Tests")
public class CommandRegistryTest {

    private static final CommandHandler NOOP = ctx -> CompletableFuture.completedFuture(null);

    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry();
    }

    private static CommandDefinition.Builder cmd(String name) {
        return CommandDefinition.builder(name).handler(NOOP);
    }

    private static List<String> names(List<CommandDefinition> defs) {
        return defs.stream().map(CommandDefinition::getName).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Registered command is found by name and by alias")
    void registerAndLookup() {
        registry.register(cmd("test").description("Test command").category("test").aliases("t").build());

        CommandDefinition byName = registry.getCommand("test");
        assertNotNull(byName);
        assertEquals("Test command", byName.getDescription());
        assertNotNull(byName.getRegisteredAt());

        CommandDefinition byAlias = registry.getCommand("t");
        assertNotNull(byAlias);
        assertEquals("test", byAlias.getName());
        assertEquals("test", registry.getCanonicalName("t"));
        assertTrue(registry.hasCommand("t"));
    }

    @Test
    @DisplayName("Missing description and category get defaults")
    void defaultsApplied() {
        registry.register(cmd("save").build());

        CommandDefinition def = registry.getCommand("save");
        assertEquals("Execute save", def.getDescription());
        assertEquals("general", def.getCategory());
        assertEquals(CommandDefinition.DEFAULT_ICON, def.getIcon());
        assertTrue(def.isAvailable());
    }

    @Test
    @DisplayName("Registration without a name or handler is rejected")
    void invalidCommandRejected() {
        CommandException noHandler = assertThrows(CommandException.class,
                () -> registry.register(CommandDefinition.builder("x").build()));
        assertEquals(CommandException.Kind.INVALID_COMMAND, noHandler.getKind());
        assertEquals("Command must have name and handler", noHandler.getMessage());

        CommandException blankName = assertThrows(CommandException.class,
                () -> registry.register(cmd("  ").build()));
        assertEquals(CommandException.Kind.INVALID_COMMAND, blankName.getKind());

        assertThrows(CommandException.class, () -> registry.register(cmd(null).build()));
        assertEquals(0, registry.getCommandCount());
    }

    @Test
    @DisplayName("Unregister removes aliases and category membership")
    void unregisterSymmetry() {
        registry.register(cmd("new document").category("document").aliases(":n").build());
        registry.register(cmd("save").category("document").aliases(":s").build());

        assertTrue(registry.unregister("new document"));

        assertNull(registry.getCommand(":n"));
        assertNull(registry.getCommand("new document"));
        assertEquals(List.of("save"), names(registry.getCommandsByCategory("document")));
        assertEquals(List.of("save"), names(registry.getAllCommands()));
        assertEquals(1, registry.getAliasCount());
    }

    @Test
    @DisplayName("Unregister is idempotent")
    void unregisterTwice() {
        registry.register(cmd("new document").build());

        assertTrue(registry.unregister("new document"));
        assertFalse(registry.unregister("new document"));
        assertFalse(registry.unregister("never registered"));
        assertFalse(registry.unregister(null));
    }

    @Test
    @DisplayName("Empty categories disappear from the category list")
    void emptyCategoryRemoved() {
        registry.register(cmd("outline").category("navigation").build());
        registry.register(cmd("save").category("document").build());

        assertEquals(List.of("document", "navigation"), registry.getCategories());
        registry.unregister("outline");
        assertEquals(List.of("document"), registry.getCategories());
    }

    @Test
    @DisplayName("getAllCommands is sorted by name and skips unavailable commands")
    void allCommandsSortedAndFiltered() {
        registry.register(cmd("zoom").build());
        registry.register(cmd("alpha").build());
        registry.register(cmd("hidden").condition(() -> false).build());
        registry.register(cmd("Beta").build());

        assertEquals(List.of("alpha", "Beta", "zoom"), names(registry.getAllCommands()));
        // still registered, just not offered
        assertTrue(registry.hasCommand("hidden"));
        assertEquals(4, registry.getCommandCount());
    }

    @Test
    @DisplayName("getCommandsByCategory respects conditions and sorts by name")
    void categoryListing() {
        registry.register(cmd("search").category("search").build());
        registry.register(cmd("find all").category("search").build());
        registry.register(cmd("github pull").category("search").condition(() -> false).build());

        assertEquals(List.of("find all", "search"), names(registry.getCommandsByCategory("search")));
        assertTrue(registry.getCommandsByCategory("nothing").isEmpty());
    }

    @Test
    @DisplayName("Alias colliding with another command's name is rejected without mutation")
    void aliasCollidesWithName() {
        registry.register(cmd("save").build());

        CommandException e = assertThrows(CommandException.class,
                () -> registry.register(cmd("store").aliases("save").build()));
        assertEquals(CommandException.Kind.INVALID_COMMAND, e.getKind());
        assertNull(registry.getCommand("store"));
        assertEquals(1, registry.getCommandCount());
    }

    @Test
    @DisplayName("Alias colliding with another command's alias is rejected")
    void aliasCollidesWithAlias() {
        registry.register(cmd("save").aliases(":s").build());

        assertThrows(CommandException.class,
                () -> registry.register(cmd("search").aliases(":s").build()));
        assertEquals("save", registry.getCanonicalName(":s"));
    }

    @Test
    @DisplayName("Name colliding with an existing alias is rejected")
    void nameCollidesWithAlias() {
        registry.register(cmd("save").aliases("s").build());

        assertThrows(CommandException.class, () -> registry.register(cmd("s").build()));
    }

    @Test
    @DisplayName("Re-registering a name replaces the command and drops its old aliases")
    void reRegisterReplaces() {
        registry.register(cmd("paramtest").category("test").aliases(":p").build());
        registry.register(cmd("paramtest").category("other").aliases(":pt").description("v2").build());

        assertEquals(1, registry.getCommandCount());
        assertEquals("v2", registry.getCommand("paramtest").getDescription());
        assertNull(registry.getCommand(":p"));
        assertNotNull(registry.getCommand(":pt"));
        assertEquals(List.of("other"), registry.getCategories());
    }

    @Test
    @DisplayName("registerAll registers in order")
    void registerAll() {
        registry.registerAll(List.of(cmd("a").build(), cmd("b").aliases(":b").build()));

        assertEquals(2, registry.getCommandCount());
        assertEquals(1, registry.getAliasCount());
        assertEquals(1, registry.getCategoryCount());
        assertTrue(registry.getAllNamesAndAliases().containsAll(List.of("a", "b", ":b")));
    }

    @Test
    @DisplayName("registerAll stops at the first invalid command and keeps the earlier ones")
    void registerAllStopsAtInvalid() {
        List<CommandDefinition> batch = List.of(
                cmd("a").build(),
                cmd("b").aliases("a").build(),
                cmd("c").build());

        CommandException e = assertThrows(CommandException.class, () -> registry.registerAll(batch));
        assertEquals(CommandException.Kind.INVALID_COMMAND, e.getKind());
        assertTrue(registry.hasCommand("a"));
        assertFalse(registry.hasCommand("b"));
        assertFalse(registry.hasCommand("c"));
        assertEquals(1, registry.getCommandCount());
    }

    @Test
    @DisplayName("Modification count moves on register and unregister only")
    void modificationCount() {
        long start = registry.getModificationCount();
        registry.register(cmd("a").build());
        registry.unregister("a");
        registry.unregister("a");
        assertEquals(start + 2, registry.getModificationCount());
    }
}
