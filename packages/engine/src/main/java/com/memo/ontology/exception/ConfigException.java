package com.memo.ontology.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends MemoException {
  public ConfigException(String message) {
    super(MemoErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MemoErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
