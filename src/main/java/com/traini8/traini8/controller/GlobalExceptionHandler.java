package com.traini8.traini8.controller;

import com.traini8.traini8.exception.StoreException;
import java.util.Collections;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * 모든 실패 응답은 {"error": "..."} 형태로 내려준다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * 검증 실패, 코드 중복(400), 저장 실패(500) 등 ResponseStatusException 계열
   */
  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, String>> handleResponseStatusException(ResponseStatusException ex) {
    return error(ex.getStatusCode().value(), ex.getReason());
  }

  /** 본문이 비었거나 JSON 이 깨졌거나 타입이 맞지 않는 경우 */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    log.debug("Unreadable request body: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST.value(), ex.getMessage());
  }

  @ExceptionHandler({ServletRequestBindingException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex) {
    return error(HttpStatus.BAD_REQUEST.value(), ex.getMessage());
  }

  /**
   * 서비스 밖(커밋 시점 등)에서 올라온 저장소 오류
   */
  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<Map<String, String>> handleStoreFailure(Exception ex) {
    log.error("Store failure escaped service layer", ex);
    Throwable root = ex instanceof DataAccessException dae ? dae.getMostSpecificCause() : ex;
    return error(HttpStatus.INTERNAL_SERVER_ERROR.value(), StoreException.PREFIX + root.getMessage());
  }

  private ResponseEntity<Map<String, String>> error(int status, String message) {
    return ResponseEntity
        .status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(Collections.singletonMap("error", message));
  }
}
