package shop.eda.order.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GlobalExceptionHandler
 * Maps order intake failures to HTTP responses using one error envelope:
 * {timestamp, error, message, path, details?}.
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

    /**
     * Handle bean validation errors (400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex,
                                                                          HttpServletRequest request) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(err ->
                fieldErrors.putIfAbsent(err.getField(), err.getDefaultMessage())
        );

        logger.warn("Validation failed: {}", fieldErrors);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fieldErrors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "Bad Request", "Validation error", details));
    }

    /**
     * Handle malformed JSON or invalid request body (400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedJson(HttpMessageNotReadableException ex,
                                                                   HttpServletRequest request) {
        String errorMsg = ex.getMessage() != null ? ex.getMessage() : "";
        logger.warn("Malformed JSON or invalid request body: {}", errorMsg);

        String message = "Invalid request body";
        if (errorMsg.contains("Required request body is missing")) {
            message = "Request body is required";
        } else if (errorMsg.contains("JSON parse error")
                && (errorMsg.contains("Cannot deserialize value of type") || errorMsg.contains("Cannot coerce"))) {
            message = "Invalid data type in request body";
        } else if (errorMsg.contains("JSON parse error")) {
            message = "Malformed JSON syntax";
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "Bad Request", message, null));
    }

    @ExceptionHandler(OrderValidationException.class)
    public ResponseEntity<Map<String, Object>> handleOrderValidation(OrderValidationException ex,
                                                                     HttpServletRequest request) {
        logger.warn("Order rejected: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fieldErrors", Map.of(ex.getField(), ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(request, "Bad Request", "Validation error", details));
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleOrderNotFound(OrderNotFoundException ex,
                                                                   HttpServletRequest request) {
        logger.warn("Order not found: {}", ex.getOrderId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(errorBody(request, "Not Found", ex.getMessage(), null));
    }

    @ExceptionHandler(DuplicateOrderException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicateOrder(DuplicateOrderException ex,
                                                                    HttpServletRequest request) {
        logger.warn("Duplicate order: {}", ex.getOrderId());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(errorBody(request, "Conflict", ex.getMessage(), null));
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientStock(InsufficientStockException ex,
                                                                       HttpServletRequest request) {
        logger.warn("Insufficient stock: item_id={}, requested={}, available={}",
                ex.getItemId(), ex.getRequested(), ex.getAvailable());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("item_id", ex.getItemId());
        details.put("requested", ex.getRequested());
        details.put("available", ex.getAvailable());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(errorBody(request, "Conflict", "Item out of stock", details));
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleCatalogUnavailable(CatalogUnavailableException ex,
                                                                        HttpServletRequest request) {
        logger.error("Catalog unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody(request, "Service Unavailable", "Catalog service is unavailable", null));
    }

    @ExceptionHandler(OrderPersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(OrderPersistenceException ex,
                                                                 HttpServletRequest request) {
        logger.error("Order could not be stored: orderId={}, message={}", ex.getOrderId(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody(request, "Service Unavailable", "Order could not be stored, try again later", null));
    }

    /**
     * Handle publication failures after the inline retry budget (503).
     * The order is kept; the body carries its id so the client can follow up.
     */
    @ExceptionHandler(OrderPublicationPendingException.class)
    public ResponseEntity<Map<String, Object>> handlePublicationPending(OrderPublicationPendingException ex,
                                                                        HttpServletRequest request) {
        logger.error("Publication pending: type={}, orderId={}, ambiguous={}",
                ex.getType(), ex.getOrderId(), ex.isAmbiguous());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("order_id", ex.getOrderId());
        details.put("type", ex.getType());
        details.put("ambiguous", ex.isAmbiguous());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(errorBody(request, "Service Unavailable", ex.getMessage(), details));
    }

    /**
     * Handle all other unhandled exceptions (500).
     * Framework errors that already carry a status (unknown path, wrong method) keep it.
     */
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
