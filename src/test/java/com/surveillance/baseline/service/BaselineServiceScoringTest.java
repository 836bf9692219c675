package com.surveillance.baseline.service;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.surveillance.baseline.config.MetricsConfig;
import com.surveillance.baseline.engine.BaselineSettings;
import com.surveillance.baseline.model.AnomalyVerdict;
import com.surveillance.baseline.model.ClassBaseline;
import com.surveillance.baseline.repository.ActivityBaselineRepository;
import com.surveillance.baseline.repository.ClassBaselineRepository;
import com.surveillance.baseline.session.BaselineSession;
import com.surveillance.baseline.session.BaselineSessionFactory;
import com.surveillance.baseline.session.TransactionMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.surveillance.baseline.testutil.TestDataFactory.NOW;
import static com.surveillance.baseline.testutil.TestDataFactory.classBaseline;
import static com.surveillance.baseline.testutil.TestDataFactory.daysAgo;
import static com.surveillance.baseline.testutil.TestDataFactory.fixedClock;
import static com.surveillance.baseline.testutil.TestDataFactory.settings;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BaselineServiceScoringTest {

    private static final OffsetDateTime AT_14 = OffsetDateTime.of(2026, 3, 2, 14, 10, 0, 0, ZoneOffset.UTC);

    @Mock
    private AerospikeClient client;

    @Mock
    private ActivityBaselineRepository activityRepository;

    @Mock
    private ClassBaselineRepository classRepository;

    private SimpleMeterRegistry meterRegistry;
    private BaselineService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = newService(BaselineSettings.defaults());
    }

    private BaselineService newService(BaselineSettings settings) {
        return new BaselineService(activityRepository, classRepository,
                new BaselineSessionFactory(client, new Policy(), new WritePolicy(), new BatchPolicy()),
                new MetricsConfig(meterRegistry), settings, fixedClock());
    }

    private void givenHour14(ClassBaseline... rows) {
        when(classRepository.findByCameraAndHour(any(), eq("cam-1"), eq(14))).thenReturn(List.of(rows));
    }

    // person 0.9 over 18 samples, vehicle 0.1 over 2 samples, both fresh
    private void givenPersonDominatedHour() {
        givenHour14(
                classBaseline("cam-1", "person", 14, 0.9, 18, NOW),
                classBaseline("cam-1", "vehicle", 14, 0.1, 2, NOW));
    }

    @Test
    void noHistory_isNeutral() {
        AnomalyVerdict verdict = service.isAnomalous("cam-1", "person", AT_14);

        assertThat(verdict.isNeutral()).isTrue();
        assertThat(verdict.isAnomalous()).isFalse();
        assertThat(verdict.getScore()).isEqualTo(0.5);
        assertThat(meterRegistry.find("baseline.anomaly.check.count").tag("verdict", "neutral").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void tooFewSamples_isNeutralEvenForUnseenClass() {
        givenHour14(
                classBaseline("cam-1", "person", 14, 0.9, 7, NOW),
                classBaseline("cam-1", "vehicle", 14, 0.1, 2, NOW));

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "bicycle", AT_14);

        assertThat(verdict).isEqualTo(AnomalyVerdict.neutral());
    }

    @Test
    void unseenClass_scoresOne() {
        givenPersonDominatedHour();

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "bicycle", AT_14);

        assertThat(verdict.isNeutral()).isFalse();
        assertThat(verdict.getScore()).isEqualTo(1.0);
        assertThat(verdict.isAnomalous()).isTrue();
    }

    @Test
    void rareClass_isAnomalousAtDefaultThreshold() {
        givenPersonDominatedHour();

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "vehicle", AT_14);

        // 1 - 0.1 / 1.0 against a cutoff of 1 - 1/3
        assertThat(verdict.getScore()).isCloseTo(0.9, within(1e-9));
        assertThat(verdict.isAnomalous()).isTrue();
    }

    @Test
    void commonClass_isNormal() {
        givenPersonDominatedHour();

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "person", AT_14);

        assertThat(verdict.getScore()).isCloseTo(0.1, within(1e-9));
        assertThat(verdict.isAnomalous()).isFalse();
        assertThat(verdict.isNeutral()).isFalse();
        assertThat(meterRegistry.find("baseline.anomaly.score").summary().count()).isEqualTo(1);
    }

    @Test
    void fullyDecayedClass_scoresNearCertain() {
        givenHour14(
                classBaseline("cam-1", "person", 14, 0.9, 18, NOW),
                classBaseline("cam-1", "vehicle", 14, 0.8, 6, daysAgo(40)));

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "vehicle", AT_14);

        assertThat(verdict.getScore()).isEqualTo(0.95);
        assertThat(verdict.isAnomalous()).isTrue();
    }

    @Test
    void decayShiftsTheShareBetweenClasses() {
        service = newService(settings(0.5, 2.0, 10));
        // vehicle row is a day old: 0.8 * 0.5 = 0.4 against person 0.4
        givenHour14(
                classBaseline("cam-1", "person", 14, 0.4, 10, NOW),
                classBaseline("cam-1", "vehicle", 14, 0.8, 10, daysAgo(1)));

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "vehicle", AT_14);

        assertThat(verdict.getScore()).isCloseTo(0.5, within(1e-9));
        assertThat(verdict.isAnomalous()).isFalse();
    }

    @Test
    void zeroThreshold_flagsAnyPositiveScore() {
        service = newService(settings(0.1, 0.0, 10));
        givenPersonDominatedHour();

        assertThat(service.isAnomalous("cam-1", "person", AT_14).isAnomalous()).isTrue();
    }

    @Test
    void loweredMinSamples_takesEffectImmediately() {
        givenHour14(classBaseline("cam-1", "person", 14, 1.0, 3, NOW));
        assertThat(service.isAnomalous("cam-1", "bicycle", AT_14).isNeutral()).isTrue();

        service.updateScoringConfig(null, 3);

        assertThat(service.isAnomalous("cam-1", "bicycle", AT_14).getScore()).isEqualTo(1.0);
    }

    @Test
    void hourComesFromTimestampOffset() {
        OffsetDateTime local = OffsetDateTime.of(2026, 3, 2, 3, 15, 0, 0, ZoneOffset.ofHours(2));

        service.isAnomalous("cam-1", "person", local);

        verify(classRepository).findByCameraAndHour(any(), eq("cam-1"), eq(3));
    }

    @Test
    void instantTimestamp_usesConfiguredZone() {
        givenPersonDominatedHour();

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "vehicle", AT_14.toInstant());

        assertThat(verdict.getScore()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void instantTimestamp_callerManaged_readsThroughCallerSession() {
        BaselineSessionFactory sessionFactory =
                new BaselineSessionFactory(client, new Policy(), new WritePolicy(), new BatchPolicy());
        BaselineSession session = sessionFactory.open();
        when(classRepository.findByCameraAndHour(eq(session), eq("cam-1"), eq(14))).thenReturn(List.of(
                classBaseline("cam-1", "person", 14, 0.9, 18, NOW),
                classBaseline("cam-1", "vehicle", 14, 0.1, 2, NOW)));

        AnomalyVerdict verdict = service.isAnomalous("cam-1", "vehicle", AT_14.toInstant(),
                TransactionMode.within(session));

        assertThat(verdict.getScore()).isCloseTo(0.9, within(1e-9));
        verifyNoInteractions(client);
    }

    @Test
    void missingTimestamp_isRejectedLikeUpdates() {
        assertThatThrownBy(() -> service.isAnomalous("cam-1", "person", (OffsetDateTime) null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timestamp");
        assertThatThrownBy(() -> service.isAnomalous("cam-1", "person", (Instant) null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timestamp");

        verifyNoInteractions(classRepository, client);
    }

    @Test
    void scoring_isReadOnly() {
        givenPersonDominatedHour();

        AnomalyVerdict first = service.isAnomalous("cam-1", "vehicle", AT_14);
        AnomalyVerdict second = service.isAnomalous("cam-1", "vehicle", AT_14);

        assertThat(second).isEqualTo(first);
        verifyNoInteractions(activityRepository, client);
    }

    @Test
    void scoresAlwaysStayInUnitInterval() {
        givenHour14(
                classBaseline("cam-1", "a", 14, 1.0, 5, NOW),
                classBaseline("cam-1", "b", 14, 0.0, 5, NOW),
                classBaseline("cam-1", "c", 14, 0.3, 5, daysAgo(0.5)));

        for (String detectionClass : new String[] {"a", "b", "c", "d"}) {
            assertThat(service.isAnomalous("cam-1", detectionClass, AT_14).getScore()).isBetween(0.0, 1.0);
        }
    }
}
