package org.example.modelgen.service.gateway;

/**
 * Exception thrown when the generation service cannot be reached or answers with an error.
 */
public class GenerationGatewayException extends RuntimeException {

    public GenerationGatewayException(String message) {
        super(message);
    }

    public GenerationGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
