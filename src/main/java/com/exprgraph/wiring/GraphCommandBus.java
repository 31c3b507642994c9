package com.exprgraph.wiring;

import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.exprgraph.engine.GraphStore;
import com.exprgraph.engine.MutationResult;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

/**
 * Single-writer front end for a {@link GraphStore}.
 *
 * <p>
 * Any thread may {@link #submit} commands; they are published into an LMAX
 * Disruptor ring buffer and applied in sequence order by one consumer thread.
 * The store itself stays unsynchronized. Once a bus is started, nothing else
 * should call the store directly.
 */
public final class GraphCommandBus implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(GraphCommandBus.class);

    private final Disruptor<CommandEvent> disruptor;
    private final RingBuffer<CommandEvent> ringBuffer;
    private final CommandHandler handler;

    /**
     * @param store      The store to drive.
     * @param bufferSize Ring size, must be a power of two.
     */
    public GraphCommandBus(GraphStore store, int bufferSize) {
        this.handler = new CommandHandler(store);
        this.disruptor = new Disruptor<>(
                CommandEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.info("Command bus started (buffer={})", bufferSize);
    }

    public GraphCommandBus(GraphStore store) {
        this(store, 1024);
    }

    /**
     * Queues a command.
     *
     * @return Completes with the command's result on the consumer thread, or
     *         exceptionally if the store rejected it.
     */
    public CompletableFuture<MutationResult> submit(GraphCommand command) {
        if (command == null)
            throw new IllegalArgumentException("Command is required");
        CompletableFuture<MutationResult> completion = new CompletableFuture<>();
        ringBuffer.publishEvent((event, sequence, cmd, fut) -> event.set(cmd, fut), command, completion);
        return completion;
    }

    public CommandHandler handler() {
        return handler;
    }

    /** Drains every queued command, then stops the consumer thread. */
    @Override
    public void close() {
        disruptor.shutdown();
        log.info("Command bus stopped: {} applied, {} rejected", handler.appliedCount(), handler.rejectedCount());
    }
}
