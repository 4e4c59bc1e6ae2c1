package com.medledger.consentservice.services;

import com.medledger.consentservice.collaborators.BlobNotFoundException;
import com.medledger.consentservice.configurations.ConsentEngineProperties;
import com.medledger.consentservice.exceptions.ConsentEngineException;
import com.medledger.consentservice.exceptions.DependencyUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls into external dependencies on the bounded dependency pool and waits at most the
 * given timeout. Timeouts, rejections and unexpected failures all surface as a retryable
 * {@link DependencyUnavailableException}.
 */
@Component
@Slf4j
public class DependencyCalls {

    private final ThreadPoolTaskExecutor dependencyExecutor;
    private final ConsentEngineProperties properties;

    public DependencyCalls(@Qualifier("dependencyExecutor") ThreadPoolTaskExecutor dependencyExecutor,
                           ConsentEngineProperties properties) {
        this.dependencyExecutor = dependencyExecutor;
        this.properties = properties;
    }

    public <T> T call(String dependency, Supplier<T> call) {
        return call(dependency, call, properties.getDependencies().getTimeout());
    }

    public <T> T call(String dependency, Supplier<T> call, Duration timeout) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, dependencyExecutor);
        } catch (TaskRejectedException e) {
            log.error("Dependency pool saturated, rejected call to {}", dependency);
            throw new DependencyUnavailableException(dependency, "no capacity to run the call", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Call to {} timed out after {} ms", dependency, timeout.toMillis());
            throw new DependencyUnavailableException(dependency, "timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DependencyUnavailableException(dependency, "interrupted while waiting", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // Engine errors and missing blobs carry meaning for the caller; pass them through.
            if (cause instanceof ConsentEngineException) {
                throw (ConsentEngineException) cause;
            }
            if (cause instanceof BlobNotFoundException) {
                throw (BlobNotFoundException) cause;
            }
            log.error("Call to {} failed: {}", dependency, cause != null ? cause.getMessage() : e.getMessage());
            throw new DependencyUnavailableException(dependency,
                    cause != null ? cause.getMessage() : e.getMessage(), cause != null ? cause : e);
        }
    }
}
