package com.memo.ontology.exception;

import java.util.Map;

/** Illegal governance state change. Never leaves a trace in the store. */
public class InvalidTransitionException extends MemoException {
  public InvalidTransitionException(String message) {
    super(MemoErrorCode.INVALID_TRANSITION, message);
  }

  public InvalidTransitionException(String message, Map<String, ?> context) {
    super(MemoErrorCode.INVALID_TRANSITION, message, context);
  }
}
