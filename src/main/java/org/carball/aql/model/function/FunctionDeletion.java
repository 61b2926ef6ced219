package org.carball.aql.model.function;

/**
 * Number of functions removed by a delete, more than one when a whole namespace was deleted.
 */
public record FunctionDeletion(int deleted) {}
