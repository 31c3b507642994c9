package com.exprgraph.wiring;

import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.exprgraph.engine.GraphStore;
import com.exprgraph.engine.MutationResult;
import com.exprgraph.util.ErrorRateLimiter;
import com.lmax.disruptor.EventHandler;

/**
 * Disruptor EventHandler that applies commands to a store, one at a time, on
 * the consumer thread.
 *
 * This is the only code that touches the store while a
 * {@link GraphCommandBus} runs, which is what keeps the store single-writer.
 * A command that throws (an unknown id, a duplicate label) completes its
 * future exceptionally and the consumer keeps going, so no submitter is left
 * waiting on a future that never completes.
 */
public final class CommandHandler implements EventHandler<CommandEvent> {
    private static final Logger log = LogManager.getLogger(CommandHandler.class);

    private final GraphStore store;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long applied;
    private long rejected;
    private long batches;

    public CommandHandler(GraphStore store) {
        this.store = store;
    }

    @Override
    public void onEvent(CommandEvent event, long sequence, boolean endOfBatch) {
        GraphCommand command = event.command();
        CompletableFuture<MutationResult> completion = event.completion();
        event.clear();
        if (command == null) {
            log.error("Empty command slot at sequence {}", sequence);
            return;
        }

        try {
            MutationResult result = command.apply(store);
            applied++;
            if (completion != null)
                completion.complete(result);
        } catch (Throwable e) {
            rejected++;
            errLimiter.error(String.format("Command at sequence %d rejected: %s", sequence, e.getMessage()), e);
            if (completion != null)
                completion.completeExceptionally(e);
        }

        if (endOfBatch) {
            batches++;
            log.debug("Batch {} done at sequence {}, store revision {}", batches, sequence, store.revision());
        }
    }

    public long appliedCount() {
        return applied;
    }

    public long rejectedCount() {
        return rejected;
    }

    public long batchCount() {
        return batches;
    }
}
