package com.finplan.mgraph.disruptor;

import com.finplan.mgraph.MetricGraph;
import com.finplan.mgraph.model.InputValue;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Serializes updates to one {@link MetricGraph} through an LMAX Disruptor ring
 * buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Any number of producer threads call {@link #publishInput} or
 * {@link #publishFullRecompute}; each claims a slot and fills the
 * pre-allocated {@link ModelUpdateEvent}.</li>
 * <li>The single consumer thread applies events in sequence order, so the
 * model sees exactly one writer.</li>
 * <li>The returned future completes on the consumer thread with the
 * recomputed metric ids, or exceptionally with the model's error.</li>
 * </ol>
 *
 * <p>
 * A failing update never stops the consumer; later events still run.
 */
@Log4j2
public final class ModelPublisher implements EventHandler<ModelUpdateEvent>, AutoCloseable {
    private final MetricGraph graph;
    private final Disruptor<ModelUpdateEvent> disruptor;
    private final RingBuffer<ModelUpdateEvent> ringBuffer;
    private volatile boolean closed;
    private volatile long processed;

    public ModelPublisher(MetricGraph graph) {
        this(graph, graph.config().getRingBufferSize());
    }

    public ModelPublisher(MetricGraph graph, int bufferSize) {
        this.graph = graph;
        this.disruptor = new Disruptor<>(
                ModelUpdateEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(this);
        this.ringBuffer = disruptor.start();
        log.info("Update ring buffer for model {} started ({} slots)", graph.name(), bufferSize);
    }

    /** Queues a coordinate-scoped input update. */
    public CompletableFuture<List<String>> publishInput(String metricId, List<InputValue> values, String actor) {
        ensureOpen();
        CompletableFuture<List<String>> done = new CompletableFuture<>();
        List<InputValue> payload = List.copyOf(values);
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setInput(metricId, payload, actor, done);
        } finally {
            ringBuffer.publish(sequence);
        }
        return done;
    }

    /** Queues a recompute of every calculated metric. */
    public CompletableFuture<List<String>> publishFullRecompute() {
        ensureOpen();
        CompletableFuture<List<String>> done = new CompletableFuture<>();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).setFullRecompute(done);
        } finally {
            ringBuffer.publish(sequence);
        }
        return done;
    }

    @Override
    public void onEvent(ModelUpdateEvent event, long sequence, boolean endOfBatch) {
        CompletableFuture<List<String>> done = event.completion();
        try {
            List<String> affected = switch (event.kind()) {
                case INPUT -> graph.updateInput(event.metricId(), event.values(), event.actor());
                case FULL_RECOMPUTE -> graph.fullRecompute().affected();
            };
            processed++;
            done.complete(affected);
        } catch (RuntimeException e) {
            log.warn("Update #{} ({} {}) failed: {}", sequence, event.kind(), event.metricId(), e.getMessage());
            done.completeExceptionally(e);
        } finally {
            event.clear();
        }
    }

    /** Events applied successfully. */
    public long processedCount() {
        return processed;
    }

    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Publisher for model " + graph.name() + " is closed");
    }

    /** Drains queued updates, then stops the consumer thread. The model stays open. */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        log.info("Update ring buffer for model {} stopped after {} updates", graph.name(), processed);
    }
}
