package dev.llumos.exception;

import dev.llumos.dto.response.BatchRunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Batch endpoints always answer 200 with {@code success = false, action = error} so cron callers
 * and the dashboard read one body shape. Authorization failures keep their status as RFC 7807
 * problem details.
 *
 * <p>Messages of unexpected exceptions are logged, not returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleForbidden(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.FORBIDDEN, ex.getMessage());
        problem.setType(URI.create("https://llumos.dev/errors/forbidden"));
        problem.setTitle("Forbidden");
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    @ExceptionHandler({BatchValidationException.class, BatchConfigurationException.class, JobNotFoundException.class})
    public BatchRunResponse handleBatchError(RuntimeException ex) {
        log.warn("Batch request rejected: {}", ex.getMessage());
        return BatchRunResponse.error(ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public BatchRunResponse handleBadRequest(Exception ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return BatchRunResponse.error("Invalid request");
    }

    @ExceptionHandler(Exception.class)
    public BatchRunResponse handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return BatchRunResponse.error("An unexpected error occurred. Please try again later.");
    }
}
