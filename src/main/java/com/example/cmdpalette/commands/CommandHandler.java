package com.example.cmdpalette.commands;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * The behavior behind a command. Handlers may complete later; the dispatcher
 * waits on the returned stage without imposing a timeout.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Execute the command.
     *
     * @param ctx arguments and parse result for this invocation
     * @return a stage completing with the command's result
     * @throws Exception any failure; it reaches the caller of execute unchanged
     */
    CompletionStage<?> handle(CommandContext ctx) throws Exception;

    /**
     * Adapt a handler that produces its result immediately.
     */
    static CommandHandler sync(SyncHandler handler) {
        return ctx -> CompletableFuture.completedFuture(handler.handle(ctx));
    }

    @FunctionalInterface
    interface SyncHandler {
        Object handle(CommandContext ctx) throws Exception;
    }
}
