package com.finplan.mgraph.error;

/**
 * Base type of all failures raised by the metric graph.
 *
 * <p>
 * Structural and configuration failures are thrown to the caller of the
 * offending method. Evaluation failures are raised inside a node evaluation and
 * recovered by the scheduler; they never escape a recompute batch.
 */
public abstract class ModelException extends RuntimeException {
    private final ErrorKind kind;

    protected ModelException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ModelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
