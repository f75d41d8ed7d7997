package com.memo.ontology.exception;

/** Prompt template could not be located, parsed or rendered. */
public class PromptException extends MemoException {
  public PromptException(String message) {
    super(MemoErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(MemoErrorCode.PROMPT_ERROR, message, cause);
  }
}
