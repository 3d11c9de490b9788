package com.recursa.core.llm;

import com.recursa.core.context.Prompt;
import com.recursa.core.metrics.RecursaMetrics;
import com.recursa.core.model.Action;
import com.recursa.core.model.ActionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorates a {@link ModelInvoker} with a per-call timeout and backoff retries
 * of transient errors. Malformed output and authorization failures are passed
 * through on the first occurrence.
 */
public class ResilientModelInvoker implements ModelInvoker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientModelInvoker.class);

    /** Blocks the calling thread; replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final ModelInvoker delegate;
    private final BackoffPolicy policy;
    private final Duration timeout;
    private final Sleeper sleeper;
    private final RecursaMetrics metrics;
    private final ExecutorService executor;

    public ResilientModelInvoker(ModelInvoker delegate, BackoffPolicy policy, Duration timeout,
                                 RecursaMetrics metrics) {
        this(delegate, policy, timeout, metrics, Thread::sleep);
    }

    public ResilientModelInvoker(ModelInvoker delegate, BackoffPolicy policy, Duration timeout,
                                 RecursaMetrics metrics, Sleeper sleeper) {
        this.delegate = delegate;
        this.policy = policy;
        this.timeout = timeout;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "recursa-model-call");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public List<Action> invoke(Prompt prompt, List<ActionSchema> permittedActions) {
        TransientModelException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return invokeWithTimeout(prompt, permittedActions);
            } catch (TransientModelException e) {
                last = e;
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                long delay = policy.delayMillis(attempt);
                log.warn("Transient model error (attempt {}/{}), retrying in {}ms: {}",
                        attempt, policy.maxAttempts(), delay, e.getMessage());
                if (metrics != null) {
                    metrics.recordModelRetry();
                }
                pause(delay);
            }
        }
        throw new TransientModelException("Model call failed after " + policy.maxAttempts()
                + " attempt(s): " + last.getMessage(), last);
    }

    private List<Action> invokeWithTimeout(Prompt prompt, List<ActionSchema> permittedActions) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return delegate.invoke(prompt, permittedActions);
        }
        Future<List<Action>> future = executor.submit(() -> delegate.invoke(prompt, permittedActions));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientModelException("Model call timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new ModelInvocationException("Model call failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelInvocationException("Interrupted while waiting for the model", e);
        }
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelInvocationException("Interrupted during model retry backoff", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
