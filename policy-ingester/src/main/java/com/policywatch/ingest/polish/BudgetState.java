package com.policywatch.ingest.polish;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Daily call counter for the polish provider. The counter belongs to the current UTC day and
 * starts again from zero the first time it is touched on a new day. Check and increment happen
 * under one lock, so concurrent callers can never overshoot the budget.
 * A budget of zero or less means unlimited; calls are still counted.
 */
public class BudgetState {

    private final int dailyBudget;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private LocalDate day;
    private int used;

    public BudgetState(int dailyBudget, Clock clock) {
        this.dailyBudget = dailyBudget;
        this.clock = clock;
    }

    /**
     * Reserves one call. Returns false, and reserves nothing, when today's budget is spent.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            rollOver();
            if (dailyBudget > 0 && used >= dailyBudget) {
                return false;
            }
            used++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands back a reservation for a call that was never sent. Only today's counter is touched.
     */
    public void release() {
        lock.lock();
        try {
            rollOver();
            if (used > 0) {
                used--;
            }
        } finally {
            lock.unlock();
        }
    }

    public int used() {
        lock.lock();
        try {
            rollOver();
            return used;
        } finally {
            lock.unlock();
        }
    }

    public int dailyBudget() {
        return dailyBudget;
    }

    public boolean isUnlimited() {
        return dailyBudget <= 0;
    }

    private void rollOver() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(day)) {
            day = today;
            used = 0;
        }
    }
}
