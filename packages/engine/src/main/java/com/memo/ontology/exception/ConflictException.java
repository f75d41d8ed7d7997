package com.memo.ontology.exception;

import java.util.Map;

/** A uniqueness invariant would be violated (e.g. the same typed edge already links two nodes). */
public class ConflictException extends MemoException {
  public ConflictException(String message) {
    super(MemoErrorCode.ALREADY_EXISTS, message);
  }

  public ConflictException(String message, Map<String, ?> context) {
    super(MemoErrorCode.ALREADY_EXISTS, message, context);
  }
}
