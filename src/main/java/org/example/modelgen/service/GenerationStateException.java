package org.example.modelgen.service;

/**
 * Exception thrown when product or generation-log state needed by a pipeline step is missing.
 */
public class GenerationStateException extends RuntimeException {

    public GenerationStateException(String message) {
        super(message);
    }
}
