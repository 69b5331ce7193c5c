package com.example.cmdpalette;

import com.example.cmdpalette.util.CommandHistory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CommandHistory Tests")
public class CommandHistoryTest {

    @Test
    @DisplayName("Re-recording an input moves it to the front without duplicating")
    void dedupAndPromote() {
        CommandHistory history = new CommandHistory();
        history.record("a");
        history.record("b");
        history.record("a");

        assertEquals(List.of("a", "b"), history.getAll());
    }

    @Test
    @DisplayName("Only the 50 most recent distinct inputs are kept")
    void boundedToFifty() {
        CommandHistory history = new CommandHistory();
        for (int i = 0; i < 60; i++) {
            history.record("cmd" + i);
        }

        List<String> all = history.getAll();
        assertEquals(50, all.size());
        assertEquals("cmd59", all.get(0));
        assertEquals("cmd10", all.get(49));
        assertFalse(all.contains("cmd9"));
    }

    @Test
    @DisplayName("Custom limit evicts oldest first")
    void customLimit() {
        CommandHistory history = new CommandHistory(2);
        history.record("one");
        history.record("two");
        history.record("three");

        assertEquals(List.of("three", "two"), history.getAll());
        assertEquals(2, history.getMaxEntries());
    }

    @Test
    @DisplayName("getAll returns a copy")
    void getAllIsCopy() {
        CommandHistory history = new CommandHistory();
        history.record("save");

        List<String> snapshot = history.getAll();
        snapshot.clear();
        assertEquals(1, history.size());
    }

    @Test
    @DisplayName("clear empties the history")
    void clear() {
        CommandHistory history = new CommandHistory();
        history.record("save");
        history.record("open");
        history.clear();

        assertTrue(history.getAll().isEmpty());
        assertEquals(0, history.size());
    }

    @Test
    @DisplayName("Limit below one is rejected")
    void invalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new CommandHistory(0));
    }
}
