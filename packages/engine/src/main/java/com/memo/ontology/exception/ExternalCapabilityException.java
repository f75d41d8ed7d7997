package com.memo.ontology.exception;

/**
 * Errors raised while calling an embedding or completion provider, including timeouts and
 * responses that do not match the expected structure.
 */
public class ExternalCapabilityException extends MemoException {
  public ExternalCapabilityException(String message) {
    super(MemoErrorCode.EXTERNAL_CAPABILITY_ERROR, message);
  }

  public ExternalCapabilityException(String message, Throwable cause) {
    super(MemoErrorCode.EXTERNAL_CAPABILITY_ERROR, message, cause);
  }
}
