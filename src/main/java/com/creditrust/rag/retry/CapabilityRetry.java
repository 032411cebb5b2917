package com.creditrust.rag.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import com.creditrust.rag.error.CapabilityException;
import com.creditrust.rag.error.ConfigurationException;
import com.creditrust.rag.error.RagException;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Runs calls against external capabilities with bounded exponential backoff.
 * Transport failures, server errors and rate limiting are retried; client
 * errors and domain exceptions are not. Once the attempts are exhausted the
 * last failure is wrapped into a {@link CapabilityException}.
 */
public class CapabilityRetry {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityRetry.class);

    private final RetryConfig config;

    public CapabilityRetry(int maxAttempts, Duration initialBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("Capability retry attempts must be at least 1 but was " + maxAttempts);
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (initialBackoff.toMillis() < 1) {
            throw new ConfigurationException("Capability backoff must be at least 1ms but was " + initialBackoff);
        }
        if (multiplier < 1.0d) {
            throw new ConfigurationException("Capability backoff multiplier must be >= 1 but was " + multiplier);
        }
        this.config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(CapabilityRetry::isTransient)
                .build();
    }

    /**
     * Single attempt, no backoff.
     */
    public static CapabilityRetry none() {
        return new CapabilityRetry(1, Duration.ofMillis(1), 1.0d);
    }

    public <T> T execute(String capability, Supplier<T> call,
            BiFunction<String, Throwable, ? extends CapabilityException> onFailure) {
        Retry retry = Retry.of(capability, config);
        retry.getEventPublisher().onRetry(event -> LOGGER.warn("Retrying {} call (attempt {}): {}", capability,
                event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())));
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (RagException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw onFailure.apply(capability + " call failed: " + describe(ex), ex);
        }
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof RagException) {
            return false;
        }
        if (throwable instanceof HttpClientErrorException clientError) {
            return clientError.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)
                    || clientError.getStatusCode().isSameCodeAs(HttpStatus.REQUEST_TIMEOUT);
        }
        return true;
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "" : throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
