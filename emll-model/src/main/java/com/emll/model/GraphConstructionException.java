package com.emll.model;

/**
 * Exception thrown when a node cannot be added to a {@link Model}, most often because one of its
 * input coordinates does not refer to a node already in the model.
 */
public class GraphConstructionException extends RuntimeException {
    /**
     * Create a new graph construction exception.
     *
     * @param message Error message
     */
    public GraphConstructionException(String message) {
        super(message);
    }
}
