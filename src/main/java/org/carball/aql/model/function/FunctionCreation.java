package org.carball.aql.model.function;

/**
 * Outcome of creating a function: {@code isNew} is false when an existing function
 * with the same name was replaced.
 */
public record FunctionCreation(boolean isNew) {}
