package io.krpc.server.core;

import java.time.Duration;

/**
 * Adjusts the RPC time budget from the observed host tick period. When the host runs slower than
 * its target period the budget shrinks by a tenth each tick, down to the floor; when it keeps up
 * the budget grows back by a tenth, up to the configured maximum.
 */
final class AdaptiveRateController {

    private final long maxNanos;
    private final long minNanos;
    private final long targetPeriodNanos;
    private long budgetNanos;
    private long lastTickStartNanos;
    private boolean started;

    AdaptiveRateController(Duration maxTimePerTick, Duration minTimePerTick, Duration targetTickPeriod) {
        this.maxNanos = maxTimePerTick.toNanos();
        this.minNanos = minTimePerTick.toNanos();
        this.targetPeriodNanos = targetTickPeriod.toNanos();
        this.budgetNanos = maxNanos;
    }

    /**
     * Budget for the tick starting at {@code tickStartNanos}.
     */
    long budgetForTick(long tickStartNanos) {
        if (started) {
            long period = tickStartNanos - lastTickStartNanos;
            long step = Math.max(budgetNanos / 10, 1L);
            if (period > targetPeriodNanos) {
                budgetNanos = Math.max(minNanos, budgetNanos - step);
            } else {
                budgetNanos = Math.min(maxNanos, budgetNanos + step);
            }
        }
        started = true;
        lastTickStartNanos = tickStartNanos;
        return budgetNanos;
    }

    long currentBudgetNanos() {
        return budgetNanos;
    }
}
