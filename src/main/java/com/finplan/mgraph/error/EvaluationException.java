package com.finplan.mgraph.error;

/**
 * A formula failed to evaluate for one node. Recovered by the scheduler: the
 * node is zeroed and marked stale, the rest of the batch continues.
 */
public class EvaluationException extends ModelException {
    public EvaluationException(String message) {
        super(ErrorKind.EVALUATION, message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(ErrorKind.EVALUATION, message, cause);
    }

    protected EvaluationException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
