package com.finplan.mgraph.disruptor;

import com.finplan.mgraph.model.InputValue;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A mutable holder for one model update inside the ring buffer.
 *
 * <p>
 * <b>Flyweight:</b> instances are pre-allocated when the ring buffer is built
 * and reused for every update; {@link #clear()} drops references once the
 * consumer is done so payloads are not retained.
 */
public final class ModelUpdateEvent {

    public enum Kind {
        INPUT, FULL_RECOMPUTE
    }

    private Kind kind;
    private String metricId;
    private List<InputValue> values;
    private String actor;
    private CompletableFuture<List<String>> completion;

    void setInput(String metricId, List<InputValue> values, String actor, CompletableFuture<List<String>> completion) {
        this.kind = Kind.INPUT;
        this.metricId = metricId;
        this.values = values;
        this.actor = actor;
        this.completion = completion;
    }

    void setFullRecompute(CompletableFuture<List<String>> completion) {
        this.kind = Kind.FULL_RECOMPUTE;
        this.metricId = null;
        this.values = null;
        this.actor = null;
        this.completion = completion;
    }

    public Kind kind() {
        return kind;
    }

    public String metricId() {
        return metricId;
    }

    public List<InputValue> values() {
        return values;
    }

    public String actor() {
        return actor;
    }

    public CompletableFuture<List<String>> completion() {
        return completion;
    }

    public void clear() {
        kind = null;
        metricId = null;
        values = null;
        actor = null;
        completion = null;
    }
}
