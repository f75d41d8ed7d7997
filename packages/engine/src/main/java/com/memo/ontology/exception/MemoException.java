package com.memo.ontology.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception of the ontology engine. Carries a stable {@link MemoErrorCode} and an
 * unmodifiable context naming the ids, fields or invariant involved, so callers never have to
 * parse the message.
 */
public class MemoException extends RuntimeException {
  private final MemoErrorCode code;
  private final Map<String, Object> context;

  public MemoException(MemoErrorCode code, String message) {
    this(code, message, null, null);
  }

  public MemoException(MemoErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public MemoException(MemoErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public MemoException(
      MemoErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(context));
  }

  public MemoErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder(getClass().getSimpleName())
            .append('[')
            .append(code)
            .append("] ")
            .append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    if (getCause() != null) sb.append(" caused by ").append(getCause().getClass().getSimpleName());
    return sb.toString();
  }
}
