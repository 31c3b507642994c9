package com.exprgraph.wiring;

import java.util.concurrent.CompletableFuture;

import com.exprgraph.engine.MutationResult;

/**
 * Ring buffer slot carrying one {@link GraphCommand} and the future its
 * submitter is waiting on.
 *
 * Pattern: Flyweight / Mutable Event. Slots are pre-allocated by the ring
 * buffer and reused; {@link #clear()} drops references once a command has run
 * so finished results are not pinned by the buffer.
 */
public final class CommandEvent {
    private GraphCommand command;
    private CompletableFuture<MutationResult> completion;

    public void set(GraphCommand command, CompletableFuture<MutationResult> completion) {
        this.command = command;
        this.completion = completion;
    }

    public GraphCommand command() {
        return command;
    }

    public CompletableFuture<MutationResult> completion() {
        return completion;
    }

    public void clear() {
        command = null;
        completion = null;
    }
}
