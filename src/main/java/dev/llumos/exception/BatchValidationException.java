package dev.llumos.exception;

/** The request cannot produce a job: missing or unknown organization, or no active prompts. */
public class BatchValidationException extends RuntimeException {
    public BatchValidationException(String message) {
        super(message);
    }
}
