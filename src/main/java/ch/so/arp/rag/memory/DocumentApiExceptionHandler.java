package ch.so.arp.rag.memory;

import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates store failures into {@code error} envelopes.
 */
@RestControllerAdvice(assignableTypes = DocumentController.class)
public class DocumentApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<StoreResponse> handleValidation(ValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<StoreResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<StoreResponse> handleEmbeddingUnavailable(EmbeddingUnavailableException ex) {
        LOGGER.error("Embedding service unavailable: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<StoreResponse> handlePersistence(PersistenceException ex) {
        LOGGER.error("Persistence failure ({} committed): {}", ex.committedCount(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    private static ResponseEntity<StoreResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(StoreResponse.message(StoreResponse.ERROR, message));
    }
}
