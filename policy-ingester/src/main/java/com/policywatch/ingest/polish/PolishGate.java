package com.policywatch.ingest.polish;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Optional rewrite of an extractive draft, under a hard daily budget.
 *
 * Every attempt that reaches the provider is counted exactly once, before the call, whatever the
 * outcome. A call the executor refuses never reaches the provider and is not counted. Nothing here ever throws: on any problem the draft comes back unchanged.
 */
@Slf4j
public class PolishGate {

    private final PolishProvider provider;
    private final BudgetState budget;
    private final Duration timeout;
    private final int minLength;
    private final Executor executor;

    /**
     * @param provider active provider, or null when polishing is disabled
     */
    public PolishGate(PolishProvider provider, BudgetState budget, Duration timeout, int minLength, Executor executor) {
        this.provider = provider;
        this.budget = budget;
        this.timeout = timeout;
        this.minLength = minLength;
        this.executor = executor;
    }

    public PolishResult polish(String draft, String title, String url) {
        if (draft == null || draft.isBlank()) {
            return PolishResult.keep(draft, PolishOutcome.SKIPPED_EMPTY);
        }
        if (provider == null) {
            return PolishResult.keep(draft, PolishOutcome.SKIPPED_NO_PROVIDER);
        }
        if (!budget.tryAcquire()) {
            log.debug("Polish skipped for {}: daily budget of {} spent", url, budget.dailyBudget());
            return PolishResult.keep(draft, PolishOutcome.SKIPPED_BUDGET);
        }

        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(() -> provider.rewrite(draft, title, url), executor);
        } catch (RejectedExecutionException e) {
            budget.release();
            log.warn("Polish skipped for {}: executor saturated", url);
            return PolishResult.keep(draft, PolishOutcome.SKIPPED_BUSY);
        }
        try {
            String out = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String cleaned = out == null ? "" : out.replaceAll("\\s+", " ").strip();
            if (cleaned.length() < minLength) {
                log.debug("Polish from {} rejected for {}: {} chars", provider.name(), url, cleaned.length());
                return PolishResult.keep(draft, PolishOutcome.REJECTED_SHORT);
            }
            return new PolishResult(cleaned, PolishOutcome.POLISHED);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Polish via {} timed out after {} ms for {}", provider.name(), timeout.toMillis(), url);
            return PolishResult.keep(draft, PolishOutcome.FAILED);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Polish via {} failed for {}: {}", provider.name(), url, cause.getMessage());
            return PolishResult.keep(draft, PolishOutcome.FAILED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PolishResult.keep(draft, PolishOutcome.FAILED);
        }
    }

    public String providerName() {
        return provider == null ? "none" : provider.name();
    }

    public BudgetState budget() {
        return budget;
    }
}
