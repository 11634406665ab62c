package com.traini8.traini8.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 요청 값 검증 실패 시 400 반환
 */
@Getter
public class ValidationException extends ResponseStatusException {

  private final ValidationErrorType type;
  private final String field;

  public ValidationException(ValidationErrorType type, String field, String reason) {
    super(HttpStatus.BAD_REQUEST, reason);
    this.type = type;
    this.field = field;
  }
}
