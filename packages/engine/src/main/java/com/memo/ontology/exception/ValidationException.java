package com.memo.ontology.exception;

import java.util.Map;

/** Input validation failure: self-loop, weight out of range, unknown enum, missing field. */
public class ValidationException extends MemoException {
  public ValidationException(String message) {
    super(MemoErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(MemoErrorCode.INVALID_ARGUMENT, message, context);
  }

  public ValidationException(String message, Throwable cause) {
    super(MemoErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
