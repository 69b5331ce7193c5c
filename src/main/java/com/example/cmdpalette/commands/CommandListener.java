package com.example.cmdpalette.commands;

import com.example.cmdpalette.model.CommandDefinition;

import java.util.List;

/**
 * Observer notified by {@link CommandDispatcher} after each execution attempt.
 * Both callbacks run on the thread that completes the execution.
 */
public interface CommandListener {

    /**
     * A command ran to completion.
     */
    default void onExecute(CommandDefinition command, List<String> args, Object result) {
    }

    /**
     * An execution attempt failed, either before the handler ran or inside it.
     */
    default void onError(String input, Throwable error) {
    }
}
