package com.memo.ontology.exception;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public final class ExceptionUtil {
  private static final int MAX_CAUSES = 5;

  private ExceptionUtil() {}

  /** Code and context survive for {@link MemoException}s; anything else maps to UNKNOWN. */
  public static ErrorDetails toErrorDetails(Throwable t) {
    MemoException memo = t instanceof MemoException m ? m : null;
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        memo != null ? memo.getCode() : MemoErrorCode.UNKNOWN,
        Objects.toString(t.getMessage(), ""),
        memo != null ? memo.getContext() : Map.of(),
        causeChain(t),
        Instant.now());
  }

  static List<String> causeChain(Throwable t) {
    List<String> causes = new ArrayList<>();
    for (Throwable c = t.getCause(); c != null && c != t && causes.size() < MAX_CAUSES; c = c.getCause()) {
      causes.add(c.getClass().getSimpleName() + ": " + Objects.toString(c.getMessage(), ""));
    }
    return causes;
  }

  /** Returns {@code t} when it already is a {@link MemoException}, otherwise wraps it. */
  public static MemoException rethrowIfUnchecked(
      Throwable t, Function<Throwable, MemoException> wrap) {
    return t instanceof MemoException memo ? memo : wrap.apply(t);
  }
}
