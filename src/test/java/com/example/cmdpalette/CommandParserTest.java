package com.example.cmdpalette;

import com.example.cmdpalette.commands.CommandHandler;
import com.example.cmdpalette.model.CommandDefinition;
import com.example.cmdpalette.model.ParsedCommand;
import com.example.cmdpalette.registry.CommandParser;
import com.example.cmdpalette.registry.CommandRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandParser Tests")
public class CommandParserTest {

    private static final CommandHandler NOOP = ctx -> CompletableFuture.completedFuture(null);

    private CommandRegistry registry;
    private CommandParser parser;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry();
        parser = new CommandParser(registry, ":");
        register("test", "t");
        register("search", ":f");
        register("search advanced", ":sa");
        register("documents", ":d");
        register("fold level", ":fl");
    }

    private void register(String name, String... aliases) {
        registry.register(CommandDefinition.builder(name).aliases(aliases).handler(NOOP).build());
    }

    @Test
    @DisplayName("Longest registered name wins over its single-word prefix")
    void longestMatchWins() {
        ParsedCommand c = parser.parse("search advanced now");
        assertEquals("search advanced", c.getName());
        assertEquals(List.of("now"), c.getArgs());
    }

    @Test
    @DisplayName("Shorter name still resolves when the longer one does not match")
    void shorterNameResolves() {
        ParsedCommand c = parser.parse("search advice column");
        assertEquals("search", c.getName());
        assertEquals(List.of("advice", "column"), c.getArgs());
    }

    @Test
    @DisplayName("Names differing only in case resolve to the exact-case one")
    void exactCasePreferred() {
        register("Save");
        register("save");
        register("save all");

        assertEquals("save", parser.parse("save").getName());
        ParsedCommand upper = parser.parse("Save draft");
        assertEquals("Save", upper.getName());
        assertEquals(List.of("draft"), upper.getArgs());
        // Longer case-insensitive match still wins over a shorter exact one
        assertEquals("save all", parser.parse("Save All").getName());
    }

    @Test
    @DisplayName("A name must be followed by whitespace or the end of input")
    void nameBoundaryRequired() {
        ParsedCommand c = parser.parse("searchx foo");
        assertEquals("searchx", c.getName());
        assertEquals(List.of("foo"), c.getArgs());
    }

    @ParameterizedTest
    @CsvSource({
        "test, test, 0",
        "test arg1 arg2, test, 2",
        "t, t, 0",
        ":d, :d, 0",
        ":d notes, :d, 1",
        ":fl 2, :fl, 1",
        "fold level 3, fold level, 1",
        "FOLD LEVEL 3, fold level, 1"
    })
    @DisplayName("parse resolves names and aliases and counts arguments")
    void parseTable(String input, String expectedName, int expectedArgs) {
        ParsedCommand c = parser.parse(input);
        assertEquals(expectedName, c.getName());
        assertEquals(expectedArgs, c.getArgs().size());
    }

    @Test
    @DisplayName("Shortcut prefix is stripped when matching plain names")
    void shortcutPrefixOnPlainName() {
        ParsedCommand c = parser.parse(":test");
        assertEquals("test", c.getName());
        assertEquals("test", c.getCleanInput());
        assertEquals(":test", c.getRawInput());
    }

    @Test
    @DisplayName("Extra whitespace is ignored around name and arguments")
    void extraWhitespace() {
        ParsedCommand c = parser.parse("  :test  arg1  arg2  ");
        assertEquals("test", c.getName());
        assertEquals(List.of("arg1", "arg2"), c.getArgs());
        assertEquals("arg1 arg2", c.getArgsText());
    }

    @Test
    @DisplayName("Unknown input falls back to first token as name")
    void unknownFallsBack() {
        ParsedCommand c = parser.parse("unknown a b");
        assertEquals("unknown", c.getName());
        assertEquals(List.of("a", "b"), c.getArgs());
    }

    @Test
    @DisplayName("Unknown shortcut keeps its prefix in the fallback name")
    void unknownShortcutKeepsPrefix() {
        ParsedCommand c = parser.parse(":zz q");
        assertEquals(":zz", c.getName());
        assertEquals(List.of("q"), c.getArgs());
        assertEquals("zz q", c.getCleanInput());
    }

    @Test
    @DisplayName("parse never fails on empty or null input")
    void emptyInput() {
        ParsedCommand empty = parser.parse("");
        assertEquals("", empty.getName());
        assertTrue(empty.getArgs().isEmpty());

        ParsedCommand nothing = parser.parse(null);
        assertEquals("", nothing.getName());
        assertEquals("", nothing.getRawInput());

        ParsedCommand blank = parser.parse("   ");
        assertEquals("", blank.getName());
    }

    @Test
    @DisplayName("Newly registered names are picked up by later parses")
    void seesRegistryChanges() {
        assertEquals("search", parser.parse("search replace x").getName());

        register("search replace");
        ParsedCommand c = parser.parse("search replace x");
        assertEquals("search replace", c.getName());
        assertEquals(List.of("x"), c.getArgs());

        registry.unregister("search replace");
        assertEquals("search", parser.parse("search replace x").getName());
    }

    @Test
    @DisplayName("Arguments keep their case")
    void argumentCasePreserved() {
        ParsedCommand c = parser.parse("test Hello World");
        assertEquals(List.of("Hello", "World"), c.getArgs());
    }
}
