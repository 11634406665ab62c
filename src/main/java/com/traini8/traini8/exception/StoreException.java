package com.traini8.traini8.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 저장소 커밋 실패 (늦게 발견된 코드 중복 포함). 500 반환
 */
public class StoreException extends ResponseStatusException {

  public static final String PREFIX = "Database error: ";

  public StoreException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, PREFIX + detail, cause);
  }
}
