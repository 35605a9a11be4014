package dev.llumos.exception;

/** No provider is both allowed by the organization's plan and configured on this deployment. */
public class BatchConfigurationException extends RuntimeException {
    public BatchConfigurationException(String message) {
        super(message);
    }
}
