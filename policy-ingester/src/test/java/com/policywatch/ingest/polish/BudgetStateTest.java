package com.policywatch.ingest.polish;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class BudgetStateTest {

    /** Clock the test can move forward */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    @DisplayName("Budget of two allows two calls a day and resets on the next UTC day")
    void dailyBudget() {
        // given
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T22:00:00Z"));
        BudgetState budget = new BudgetState(2, clock);

        // when / then
        assertThat(budget.tryAcquire()).isTrue();
        assertThat(budget.tryAcquire()).isTrue();
        assertThat(budget.tryAcquire()).isFalse();
        assertThat(budget.used()).isEqualTo(2);

        clock.advance(Duration.ofHours(3));
        assertThat(budget.used()).isZero();
        assertThat(budget.tryAcquire()).isTrue();
    }

    @Test
    @DisplayName("Zero budget is unlimited but still counted")
    void unlimited() {
        BudgetState budget = new BudgetState(0, Clock.systemUTC());

        for (int i = 0; i < 50; i++) {
            assertThat(budget.tryAcquire()).isTrue();
        }
        assertThat(budget.isUnlimited()).isTrue();
        assertThat(budget.used()).isEqualTo(50);
    }

    @Test
    @DisplayName("Concurrent callers never overshoot the budget")
    void concurrentCallers() throws Exception {
        // given
        BudgetState budget = new BudgetState(100, Clock.systemUTC());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            tasks.add(() -> {
                int granted = 0;
                for (int i = 0; i < 50; i++) {
                    if (budget.tryAcquire()) {
                        granted++;
                    }
                }
                return granted;
            });
        }

        // when
        int total = 0;
        try {
            for (Future<Integer> f : pool.invokeAll(tasks)) {
                total += f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        // then
        assertThat(total).isEqualTo(100);
        assertThat(budget.used()).isEqualTo(100);
    }

    @Test
    @DisplayName("A released reservation frees a slot, but never below zero or across days")
    void release() {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T23:00:00Z"));
        BudgetState budget = new BudgetState(1, clock);
        assertThat(budget.tryAcquire()).isTrue();

        budget.release();
        budget.release();

        assertThat(budget.used()).isZero();
        assertThat(budget.tryAcquire()).isTrue();
        clock.advance(Duration.ofHours(2));
        budget.release();
        assertThat(budget.used()).isZero();
    }
}
