package com.locationinsights.backend.integrations;

import com.google.common.util.concurrent.RateLimiter;
import com.locationinsights.backend.config.GooglePlacesProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single gate every Google request passes through, whatever strategy, tile, page or place issued it.
 *
 * Applies, in order:
 * 1. Local daily request budget (optional)
 * 2. Token-bucket pacing shared by all callers
 * 3. Bounded exponential-backoff retry on transient failures; each retry goes back through 1 and 2
 */
@Component
@Slf4j
public class ProviderRequestGate {

    private final RateLimiter rateLimiter;
    private final RetryConfig retryConfig;
    private final int dailyRequestBudget;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicInteger requestsToday = new AtomicInteger();
    private volatile LocalDate budgetDate;

    public ProviderRequestGate(GooglePlacesProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.rateLimiter = RateLimiter.create(Math.max(0.1, properties.getRequestsPerSecond()));
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1L, properties.getInitialBackoff().toMillis()),
                        properties.getBackoffMultiplier()))
                .retryExceptions(ProviderTransientException.class)
                .build();
        this.dailyRequestBudget = properties.getDailyRequestBudget();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.budgetDate = LocalDate.now(clock);

        log.info("Provider gate initialized: {} req/s, {} attempts, daily budget {}",
                properties.getRequestsPerSecond(), properties.getMaxAttempts(),
                dailyRequestBudget > 0 ? dailyRequestBudget : "unlimited");
    }

    /**
     * Execute one logical provider request.
     *
     * @param operation short name used in logs and metrics, e.g. {@code nearby_search}
     * @param call      the HTTP exchange; throws {@link ProviderTransientException} for retryable failures
     * @return the payload and the number of retries that preceded it
     * @throws ProviderTransientException     when every attempt failed transiently
     * @throws ProviderQuotaExceededException when the provider or local quota is spent
     * @throws PlacesProviderException        for non-retryable failures
     */
    public <T> ProviderResponse<T> execute(String operation, ProviderCall<T> call) throws PlacesProviderException {
        AtomicInteger retries = new AtomicInteger();
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> {
            retries.incrementAndGet();
            meterRegistry.counter("places.provider.retries", "operation", operation).increment();
            log.warn("Retrying {} (retry {}) after transient error: {}",
                    operation, event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
        });

        Callable<T> gated = () -> {
            acquirePermit(operation);
            return call.call();
        };

        try {
            T body = Retry.decorateCallable(retry, gated).call();
            recordOutcome(operation, "success");
            return new ProviderResponse<>(body, retries.get());
        } catch (ProviderQuotaExceededException e) {
            recordOutcome(operation, "quota_exceeded");
            log.warn("Quota exceeded during {}: {}", operation, e.getMessage());
            throw e;
        } catch (ProviderTransientException e) {
            recordOutcome(operation, "retries_exhausted");
            log.warn("{} failed after {} retries: {}", operation, retries.get(), e.getMessage());
            throw e;
        } catch (PlacesProviderException e) {
            recordOutcome(operation, "error");
            throw e;
        } catch (Exception e) {
            recordOutcome(operation, "error");
            throw new PlacesProviderException(operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Requests counted against the local budget since UTC midnight.
     */
    public int getRequestsToday() {
        resetBudgetIfNeeded();
        return requestsToday.get();
    }

    private void acquirePermit(String operation) throws ProviderQuotaExceededException {
        if (dailyRequestBudget > 0) {
            resetBudgetIfNeeded();
            if (requestsToday.incrementAndGet() > dailyRequestBudget) {
                throw new ProviderQuotaExceededException(
                        "Local daily request budget of " + dailyRequestBudget + " exhausted before " + operation);
            }
        } else {
            requestsToday.incrementAndGet();
        }
        rateLimiter.acquire();
    }

    private synchronized void resetBudgetIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(budgetDate)) {
            budgetDate = today;
            requestsToday.set(0);
        }
    }

    private void recordOutcome(String operation, String outcome) {
        meterRegistry.counter("places.provider.requests", "operation", operation, "outcome", outcome).increment();
    }
}
