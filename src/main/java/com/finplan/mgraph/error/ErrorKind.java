package com.finplan.mgraph.error;

/**
 * Classification carried by every {@link ModelException}, so an embedding
 * layer can map failures without inspecting exception classes.
 */
public enum ErrorKind {
    CIRCULAR_DEPENDENCY,
    FORMULA_SYNTAX,
    CONFIGURATION,
    EVALUATION,
    SHAPE
}
