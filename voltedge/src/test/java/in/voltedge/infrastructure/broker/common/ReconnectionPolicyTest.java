package in.voltedge.infrastructure.broker.common;

import in.voltedge.config.ExecutionConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Exhaustion after max attempts
 * - Reset functionality
 * - Builder validation
 */
class ReconnectionPolicyTest {

    private static ReconnectionPolicy policy(int maxAttempts) {
        return ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(5))
            .multiplier(2.0)
            .maxAttempts(maxAttempts)
            .build();
    }

    @Test
    void testExponentialBackoffCappedAtMax() {
        ReconnectionPolicy policy = policy(10);

        assertEquals(Duration.ofSeconds(1), policy.recordFailure());
        assertEquals(Duration.ofSeconds(2), policy.recordFailure());
        assertEquals(Duration.ofSeconds(4), policy.recordFailure());
        assertEquals(Duration.ofSeconds(5), policy.recordFailure(), "Delay should be capped at max");
        assertEquals(Duration.ofSeconds(5), policy.recordFailure());
        assertEquals(5, policy.getConsecutiveFailures());
        assertFalse(policy.isExhausted());
    }

    @Test
    void testSuccessResetsBackoff() {
        ReconnectionPolicy policy = policy(10);
        policy.recordFailure();
        policy.recordFailure();

        policy.recordSuccess();

        assertEquals(0, policy.getConsecutiveFailures());
        assertEquals(Duration.ofSeconds(1), policy.recordFailure());
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        ReconnectionPolicy policy = policy(3);
        policy.recordFailure();
        policy.recordFailure();
        assertFalse(policy.isExhausted());

        policy.recordFailure();
        assertTrue(policy.isExhausted());

        policy.recordSuccess();
        assertTrue(policy.isExhausted(), "Success does not revive an exhausted policy");

        policy.reset();
        assertFalse(policy.isExhausted());
        assertEquals(0, policy.getConsecutiveFailures());
    }

    @Test
    void testForBrokerCallsUsesExecutionSettings() {
        ReconnectionPolicy policy = ReconnectionPolicy.forBrokerCalls(ExecutionConfig.defaults());

        assertEquals(5, policy.getMaxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.recordFailure());
        assertEquals(Duration.ofSeconds(2), policy.recordFailure());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder()
                .initialDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(1))
                .build());
    }
}
