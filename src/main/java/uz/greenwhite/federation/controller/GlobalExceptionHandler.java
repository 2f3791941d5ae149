package uz.greenwhite.federation.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import uz.greenwhite.federation.error.ApiError;
import uz.greenwhite.federation.error.ErrorKind;
import uz.greenwhite.federation.error.FederationException;

import java.time.Instant;
import java.util.Map;

/**
 * Every failure leaves as an {@link ApiError} with the status of its {@link ErrorKind}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FederationException.class)
    public ResponseEntity<ApiError> handleFederation(FederationException ex) {
        if (ex.getKind().getHttpStatus() >= 500) {
            log.error("Request failed [{}]: {}", ex.getKind(), ex.getMessage());
        } else {
            log.debug("Request rejected [{}]: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getKind().getHttpStatus()).body(ApiError.of(ex));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(error(ErrorKind.VALIDATION, "Malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.internalServerError()
                .body(error(ErrorKind.INTERNAL, "Internal server error: " + ex.getMessage()));
    }

    private static ApiError error(ErrorKind kind, String message) {
        return ApiError.builder()
                .kind(kind)
                .code(kind.getCode())
                .message(message)
                .details(Map.of())
                .timestamp(Instant.now())
                .build();
    }
}
