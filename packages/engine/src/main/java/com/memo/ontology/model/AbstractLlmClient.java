package com.memo.ontology.model;

import com.memo.ontology.exception.ExceptionUtil;
import com.memo.ontology.exception.ExternalCapabilityException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with the common plumbing around provider calls.
 *
 * <p>Subclasses implement {@link #runCompletion} and {@link #runEmbedding} with a concrete SDK.
 * This class runs them on the shared inference executor, bounds each call by {@code
 * llm.timeoutSeconds}, logs latency and maps every failure to {@link
 * ExternalCapabilityException}.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(AbstractLlmClient.class);

  protected final Configuration configuration;
  private final ExecutorService executor;
  private final Duration timeout;

  protected AbstractLlmClient(Configuration configuration, LlmCallOptions options) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.executor = options.executor();
    this.timeout = options.timeout();
  }

  @Override
  public String complete(String model, List<Message> messages) {
    log.trace("complete() called with: model = [{}], messages = [{}]", model, messages);
    return bounded("completion", model, () -> runCompletion(model, messages));
  }

  @Override
  public float[] embed(String model, String text) {
    return bounded("embedding", model, () -> runEmbedding(model, text));
  }

  private <T> T bounded(String kind, String model, Supplier<T> call) {
    long start = System.currentTimeMillis();
    CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new ExternalCapabilityException(
          "%s %s call to %s timed out after %d s"
              .formatted(providerId(), kind, model, timeout.toSeconds()),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new ExternalCapabilityException("Interrupted while waiting for " + kind, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw ExceptionUtil.rethrowIfUnchecked(
          cause,
          ex ->
              new ExternalCapabilityException(
                  "There was a problem running the %s with %s:%s"
                      .formatted(kind, providerId(), model),
                  ex));
    } finally {
      log.debug(
          "[Inference] {} {}:{} took {} ms",
          kind,
          providerId(),
          model,
          System.currentTimeMillis() - start);
    }
  }

  /** Provider-specific completion; runs on the inference executor. */
  protected abstract String runCompletion(String model, List<Message> messages);

  /** Provider-specific embedding; runs on the inference executor. */
  protected abstract float[] runEmbedding(String model, String text);

  protected static float[] toVector(List<? extends Number> values) {
    float[] out = new float[values.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = values.get(i).floatValue();
    }
    return out;
  }
}
