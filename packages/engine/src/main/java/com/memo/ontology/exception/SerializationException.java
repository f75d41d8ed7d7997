package com.memo.ontology.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends MemoException {
  public SerializationException(String message) {
    super(MemoErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(MemoErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
