package com.memo.ontology.exception;

/** The persistence driver failed to read or write. */
public class StoreException extends MemoException {
  public StoreException(String message) {
    super(MemoErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(MemoErrorCode.STORE_ERROR, message, cause);
  }
}
