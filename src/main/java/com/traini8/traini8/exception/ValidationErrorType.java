package com.traini8.traini8.exception;

/**
 * 입력 검증 실패 종류
 */
public enum ValidationErrorType {
  MISSING_FIELD,
  FIELD_TOO_LONG,
  INVALID_LENGTH,
  INVALID_FORMAT,
  INCOMPLETE_ADDRESS
}
