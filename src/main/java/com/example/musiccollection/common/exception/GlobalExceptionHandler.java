package com.example.musiccollection.common.exception;

import com.example.musiccollection.api.response.ApiResponse;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Turns failures into an {@link ApiResponse} whose HTTP status matches its {@code code}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        return ResponseEntity.status(e.getStatus()).body(ApiResponse.fail(e));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiResponse<Void>> handleValidationException(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid request parameters", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException e) {
        return respond(HttpStatus.BAD_REQUEST, "Missing parameter: " + e.getParameterName(), null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid value for parameter: " + e.getName(), null);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ApiResponse<Void>> handleDuplicateKeyException(DuplicateKeyException e) {
        return respond(HttpStatus.CONFLICT, "Duplicate data, check unique constraints", null);
    }

    @ExceptionHandler(LibraryConnectionException.class)
    public ResponseEntity<ApiResponse<Void>> handleLibraryConnection(LibraryConnectionException e) {
        log.warn("LIBRARY_UNAVAILABLE reason={}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Library core unavailable",
                "Check that the library bridge is running and retry");
    }

    @ExceptionHandler(LibraryNavigationException.class)
    public ResponseEntity<ApiResponse<Void>> handleLibraryNavigation(LibraryNavigationException e) {
        log.warn("LIBRARY_MENU_MISSING menu={}", e.getMenuTitle());
        return respond(HttpStatus.BAD_GATEWAY, "Library menu not found: " + e.getMenuTitle(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String message, String userAction) {
        return ResponseEntity.status(status).body(ApiResponse.fail(status, message, userAction));
    }
}
