package com.memo.ontology.exception;

import java.util.Map;

/**
 * Resource requested was not found. Also raised when the resource exists but belongs to another
 * owner, so callers cannot tell foreign ids from missing ones.
 */
public class NotFoundException extends MemoException {
  public NotFoundException(String message) {
    super(MemoErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(MemoErrorCode.NOT_FOUND, message, context);
  }
}
