package com.memo.ontology.model;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/** Executor and per-call timeout shared by every client of a registry. */
public record LlmCallOptions(ExecutorService executor, Duration timeout) {
  public LlmCallOptions {
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(timeout, "timeout");
  }
}
