package com.surveillance.baseline.engine;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.surveillance.baseline.testutil.TestDataFactory.NOW;
import static com.surveillance.baseline.testutil.TestDataFactory.daysAgo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DecayModelTest {

    private final DecayModel model = new DecayModel(0.1, 30);

    @Test
    void decay_sameInstant_isOne() {
        assertThat(model.decay(NOW, NOW)).isEqualTo(1.0);
    }

    @Test
    void decay_oneDay_equalsDecayFactor() {
        assertThat(model.decay(daysAgo(1), NOW)).isCloseTo(0.1, within(1e-12));
    }

    @Test
    void decay_fractionalDays_isContinuous() {
        // 12 hours -> 0.1^0.5
        assertThat(model.decay(daysAgo(0.5), NOW)).isCloseTo(Math.sqrt(0.1), within(1e-12));
    }

    @Test
    void decay_exactlyAtWindow_isStillPositive() {
        double decay = model.decay(daysAgo(30), NOW);

        assertThat(decay).isGreaterThan(0.0);
        assertThat(decay).isLessThanOrEqualTo(1.0);
    }

    @Test
    void decay_pastWindow_isZero() {
        assertThat(model.decay(daysAgo(30.01), NOW)).isEqualTo(0.0);
        assertThat(model.decay(daysAgo(365), NOW)).isEqualTo(0.0);
    }

    @Test
    void decay_futureLastUpdated_clampsToFullWeight() {
        Instant future = NOW.plusSeconds(3600);

        assertThat(model.decay(future, NOW)).isEqualTo(1.0);
    }

    @Test
    void decay_isNonIncreasingWithElapsedTime() {
        DecayModel slow = new DecayModel(0.9, 10);
        double previous = 1.0;
        for (int hours = 0; hours <= 10 * 24; hours += 6) {
            double current = slow.decay(daysAgo(hours / 24.0), NOW);
            assertThat(current).isLessThanOrEqualTo(previous);
            assertThat(current).isGreaterThan(0.0);
            previous = current;
        }
    }

    @Test
    void decay_factorOfOne_neverForgetsInsideWindow() {
        DecayModel noForgetting = new DecayModel(1.0, 7);

        assertThat(noForgetting.decay(daysAgo(6.9), NOW)).isEqualTo(1.0);
        assertThat(noForgetting.decay(daysAgo(7.1), NOW)).isEqualTo(0.0);
    }

    @Test
    void decayed_scalesStoredValue() {
        assertThat(model.decayed(0.8, daysAgo(1), NOW)).isCloseTo(0.08, within(1e-12));
    }

    @Test
    void fold_withinWindow_blendsTowardsOne() {
        EwmaStep step = model.fold(0.5, 4, daysAgo(1), NOW);

        // 0.1 * 0.5 + 0.9 * 1.0
        assertThat(step.value()).isCloseTo(0.95, within(1e-12));
        assertThat(step.sampleCount()).isEqualTo(5);
        assertThat(step.outcome()).isEqualTo(EwmaStep.Outcome.MERGED);
    }

    @Test
    void fold_staleRow_resets() {
        EwmaStep step = model.fold(0.2, 40, daysAgo(31), NOW);

        assertThat(step.value()).isEqualTo(1.0);
        assertThat(step.sampleCount()).isEqualTo(1);
        assertThat(step.outcome()).isEqualTo(EwmaStep.Outcome.RESET);
    }

    @Test
    void fold_keepsValueWithinUnitInterval() {
        for (double previous : new double[] {0.0, 0.25, 0.5, 1.0}) {
            for (double days : new double[] {0.0, 0.1, 1.0, 5.0, 29.0}) {
                EwmaStep step = model.fold(previous, 1, daysAgo(days), NOW);
                assertThat(step.value()).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void first_seedsWithSingleObservation() {
        EwmaStep step = EwmaStep.first();

        assertThat(step.value()).isEqualTo(1.0);
        assertThat(step.sampleCount()).isEqualTo(1);
        assertThat(step.outcome()).isEqualTo(EwmaStep.Outcome.CREATED);
    }
}
