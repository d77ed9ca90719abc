package io.krpc.server.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveRateControllerTest {

    private static final long MS = 1_000_000L;

    @Test
    void shrinksToFloorWhileHostRunsSlowAndRecoversAfterwards() {
        AdaptiveRateController controller = new AdaptiveRateController(
                Duration.ofMillis(10), Duration.ofMillis(1), Duration.ofMillis(20));
        long now = 0L;

        assertThat(controller.budgetForTick(now)).isEqualTo(10 * MS);

        long previous = 10 * MS;
        for (int i = 0; i < 100; i++) {
            now += 30 * MS;
            long budget = controller.budgetForTick(now);
            assertThat(budget).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(MS);
            previous = budget;
        }
        assertThat(previous).isEqualTo(MS);

        for (int i = 0; i < 100; i++) {
            now += 16 * MS;
            controller.budgetForTick(now);
        }
        assertThat(controller.currentBudgetNanos()).isEqualTo(10 * MS);
    }
}
