package io.shopfloor.mes.scheduling.integration;

import io.shopfloor.mes.scheduling.exception.CollaboratorTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs calls to external collaborators on the collaborator executor under a deadline. Runtime
 * exceptions thrown by the collaborator propagate unchanged; exceeding the deadline raises {@link
 * CollaboratorTimeoutException} and cancels the pending call.
 */
@Component
public class CollaboratorInvoker {

  private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

  private final Executor executor;

  public CollaboratorInvoker(@Qualifier("collaboratorExecutor") Executor executor) {
    this.executor = executor;
  }

  public <T> T call(String collaborator, Duration timeout, Supplier<T> call) {
    return await(collaborator, submit(call), Instant.now().plus(timeout), timeout);
  }

  /** Starts the call without waiting; pair with {@link #await}. */
  public <T> CompletableFuture<T> submit(Supplier<T> call) {
    return CompletableFuture.supplyAsync(call, executor);
  }

  /** Waits for a submitted call until {@code deadline}. */
  public <T> T await(
      String collaborator, CompletableFuture<T> future, Instant deadline, Duration budget) {
    long remainingMillis = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
    try {
      return future.get(remainingMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("{} did not answer within {}", collaborator, budget);
      throw new CollaboratorTimeoutException(collaborator, budget, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new CollaboratorTimeoutException(collaborator, budget, e);
    } catch (CancellationException e) {
      throw new CollaboratorTimeoutException(collaborator, budget, e);
    } catch (ExecutionException e) {
      throw unwrap(collaborator, e.getCause());
    }
  }

  private static RuntimeException unwrap(String collaborator, Throwable cause) {
    if (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    log.error("{} failed with a checked exception", collaborator, cause);
    return new IllegalStateException(collaborator + " failed", cause);
  }
}
