package shop.eda.catalog.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GlobalExceptionHandler
 * Handles API errors for all controllers using a consistent envelope.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private Map<String, Object> errorBody(HttpServletRequest request, String error, String message, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("error", error);
        body.put("message", message);
        body.put("path", request != null ? request.getRequestURI() : "");
        if (details != null && !details.isEmpty()) {
            body.put("details", details);
        }
        return body;
    }

    @ExceptionHandler(ProductNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProductNotFound(ProductNotFoundException ex,
                                                                     HttpServletRequest request) {
        logger.warn("Product not found: {}", ex.getProductId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(request, "Not Found", ex.getMessage(), null));
    }

    /**
     * Non-numeric path variables, e.g. /catalog/stock/abc (400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                  HttpServletRequest request) {
        logger.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(ex.getName(), "must be an integer");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "Bad Request", "Invalid path parameter", details));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            logger.warn("Request failed with status {}: {}", status.value(), ex.getMessage());
            HttpStatus resolved = HttpStatus.resolve(status.value());
            String error = resolved != null ? resolved.getReasonPhrase() : "Error";
            return ResponseEntity.status(status)
                    .body(errorBody(request, error, ex.getMessage(), null));
        }
        logger.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(request, "Internal Server Error", "Internal server error", null));
    }
}
