package com.clawrelay.common.infra;

import com.clawrelay.common.config.RelayConfig;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectPolicyTest {

    private static final ReconnectPolicy NO_JITTER = new ReconnectPolicy(1_000, 10_000, 2.0, 0.0, 5, 30);

    @Nested
    class Delay {
        @ParameterizedTest
        @CsvSource({ "0,1000", "1,2000", "2,4000", "3,8000", "4,10000", "10,10000" })
        void growsGeometricallyUpToMax(int attempt, long expected) {
            assertEquals(expected, NO_JITTER.delayMs(attempt, () -> 0.5));
        }

        @Test
        void jitterSpreadsInBothDirections() {
            ReconnectPolicy policy = new ReconnectPolicy(1_000, 30_000, 2.0, 0.25, 0, 60);

            assertEquals(750, policy.delayMs(0, () -> 0.0));
            assertEquals(1_000, policy.delayMs(0, () -> 0.5));
            assertEquals(1_250, policy.delayMs(0, () -> 1.0));
        }

        @Test
        void jitterAppliesAfterCap() {
            ReconnectPolicy policy = new ReconnectPolicy(1_000, 4_000, 2.0, 0.5, 0, 60);

            assertEquals(6_000, policy.delayMs(8, () -> 1.0));
        }

        @Test
        void negativeAttemptTreatedAsFirst() {
            assertEquals(1_000, NO_JITTER.delayMs(-3, () -> 0.5));
        }
    }

    @Nested
    class GiveUp {
        @Test
        void stopsAtMaxAttempts() {
            assertFalse(NO_JITTER.shouldGiveUp(4));
            assertTrue(NO_JITTER.shouldGiveUp(5));
        }

        @Test
        void zeroMeansUnlimited() {
            ReconnectPolicy unlimited = new ReconnectPolicy(1_000, 10_000, 2.0, 0.0, 0, 30);
            assertFalse(unlimited.shouldGiveUp(1_000_000));
        }
    }

    @Nested
    class FromConfig {
        @Test
        void nullSectionUsesDefaults() {
            assertEquals(ReconnectPolicy.DEFAULT, ReconnectPolicy.fromConfig(null));
        }

        @Test
        void partialConfigFillsRemainingDefaults() {
            RelayConfig.WebConfig web = new RelayConfig.WebConfig();
            web.setHeartbeatSeconds(15);
            web.getReconnect().setInitialMs(500L);
            web.getReconnect().setMaxAttempts(0);

            ReconnectPolicy policy = ReconnectPolicy.fromConfig(web);

            assertEquals(500, policy.initialMs());
            assertEquals(ReconnectPolicy.DEFAULT.maxMs(), policy.maxMs());
            assertEquals(ReconnectPolicy.DEFAULT.factor(), policy.factor());
            assertEquals(0, policy.maxAttempts());
            assertEquals(15_000, policy.heartbeatMs());
        }

        @Test
        void rejectsOutOfRangeJitter() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ReconnectPolicy(1_000, 2_000, 2.0, 1.5, 0, 60));
        }
    }
}
