package com.locationinsights.backend.services;

import com.locationinsights.backend.models.RunWarning;
import com.locationinsights.backend.models.WarningCode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run state shared by the workers of one pipeline run: stop conditions and the warning list.
 * Workers check {@link #shouldStop(String)} before every tile, page and place.
 */
@Slf4j
public class RunContext {

    private final Clock clock;
    private final Instant deadline;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean quotaExhausted = new AtomicBoolean();
    private final AtomicBoolean stopReported = new AtomicBoolean();

    private final List<RunWarning> warnings = new CopyOnWriteArrayList<>();
    private final AtomicInteger discoverySuccesses = new AtomicInteger();
    private final AtomicInteger discoveryFailures = new AtomicInteger();

    public RunContext(Clock clock, Duration maxDuration) {
        this.clock = clock;
        this.deadline = clock.instant().plus(maxDuration);
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * True once the run was cancelled, ran past its deadline or exhausted the provider quota.
     * The first stop caused by cancellation or deadline is recorded as a warning.
     */
    public boolean shouldStop(String unit) {
        if (quotaExhausted.get()) {
            return true;
        }
        boolean expired = clock.instant().isAfter(deadline);
        if (cancelled.get() || expired) {
            if (stopReported.compareAndSet(false, true)) {
                String reason = cancelled.get() ? "Run cancelled" : "Run exceeded its time budget";
                log.warn("{}; stopping before {}", reason, unit);
                warn(WarningCode.RUN_CANCELLED, unit, reason + "; results may be incomplete");
            }
            return true;
        }
        return false;
    }

    public void quotaExceeded(String unit, String message) {
        if (quotaExhausted.compareAndSet(false, true)) {
            log.warn("Provider quota exceeded at {}: {}", unit, message);
            warn(WarningCode.QUOTA_EXCEEDED, unit,
                    "Provider quota exceeded; no further requests were issued: " + message);
        }
    }

    public boolean isQuotaExhausted() {
        return quotaExhausted.get();
    }

    public void warn(WarningCode code, String unit, String message) {
        warnings.add(RunWarning.of(code, unit, message));
    }

    public void recordDiscoverySuccess() {
        discoverySuccesses.incrementAndGet();
    }

    public void recordDiscoveryFailure() {
        discoveryFailures.incrementAndGet();
    }

    public int getDiscoverySuccesses() {
        return discoverySuccesses.get();
    }

    public int getDiscoveryFailures() {
        return discoveryFailures.get();
    }

    public List<RunWarning> getWarnings() {
        return List.copyOf(warnings);
    }
}
