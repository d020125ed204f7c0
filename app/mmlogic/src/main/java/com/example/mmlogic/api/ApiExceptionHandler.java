package com.example.mmlogic.api;

import com.example.mmlogic.repository.StoreException;
import com.example.mmlogic.service.FilterTooLargeException;
import com.example.mmlogic.service.PoolQueryCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidMmlogicRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidMmlogicRequestException ex) {
    return error(HttpStatus.BAD_REQUEST, "MMLOGIC_BAD_REQUEST", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return error(HttpStatus.BAD_REQUEST, "MMLOGIC_VALIDATION_ERROR", "request validation failed");
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, "MMLOGIC_VALIDATION_ERROR", "request body is not readable");
  }

  @ExceptionHandler(ProfileNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleProfileNotFound(ProfileNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "MMLOGIC_PROFILE_NOT_FOUND", ex.getMessage());
  }

  @ExceptionHandler(InvalidProfileException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidProfile(InvalidProfileException ex) {
    logger.error("stored profile is invalid", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "MMLOGIC_PROFILE_INVALID", ex.getMessage());
  }

  @ExceptionHandler(FilterTooLargeException.class)
  public ResponseEntity<ApiErrorResponse> handleFilterTooLarge(FilterTooLargeException ex) {
    return error(HttpStatus.UNPROCESSABLE_ENTITY, "MMLOGIC_FILTER_TOO_LARGE", ex.getMessage());
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ApiErrorResponse> handleStore(StoreException ex) {
    logger.error("store access failed query={} key={}", ex.query(), ex.key(), ex);
    return error(HttpStatus.SERVICE_UNAVAILABLE, "MMLOGIC_STORE_ERROR", ex.getMessage());
  }

  @ExceptionHandler(PoolQueryCancelledException.class)
  public ResponseEntity<ApiErrorResponse> handleCancelled(PoolQueryCancelledException ex) {
    return error(HttpStatus.GATEWAY_TIMEOUT, "MMLOGIC_QUERY_CANCELLED", ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled mmlogic error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "MMLOGIC_INTERNAL_ERROR", ex.getMessage());
  }

  // ストリーム用エンドポイントでも JSON で返すため content type を固定する
  private ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ApiErrorResponse(code, message));
  }
}
