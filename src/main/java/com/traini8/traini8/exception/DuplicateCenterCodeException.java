package com.traini8.traini8.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 이미 등록된 center_code 로 생성 요청 시 400 반환
 */
public class DuplicateCenterCodeException extends ResponseStatusException {
  public DuplicateCenterCodeException() {
    super(HttpStatus.BAD_REQUEST, "A training center with this CenterCode already exists");
  }
}
