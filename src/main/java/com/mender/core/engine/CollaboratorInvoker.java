package com.mender.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls on the collaborator pool and waits at most the
 * configured timeout for each. A call that times out is cancelled best-effort;
 * its thread may keep running until the collaborator returns.
 */
@Component
public class CollaboratorInvoker {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public CollaboratorInvoker(@Qualifier("collaboratorExecutor") Executor executor, MenderProperties properties) {
        this(executor, Duration.ofSeconds(properties.getCollaboratorTimeoutSeconds()));
    }

    public CollaboratorInvoker(Executor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Invokes {@code call} and returns its result.
     *
     * @param step short name of the call, used in errors and logs
     * @throws CollaboratorTimeoutException if the call exceeds the timeout
     * @throws RuntimeException             the call's own unchecked exception, unwrapped
     */
    public <T> T invoke(String step, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {} s", step, timeout.toSeconds());
            throw new CollaboratorTimeoutException(step, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException(step + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(step + " failed", cause);
        }
    }

    public void run(String step, Runnable call) {
        invoke(step, () -> {
            call.run();
            return null;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }
}
