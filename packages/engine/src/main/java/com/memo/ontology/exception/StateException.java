package com.memo.ontology.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends MemoException {
  public StateException(String message) {
    super(MemoErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(MemoErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
