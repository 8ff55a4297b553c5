package com.ryuqq.contextguard.core.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scores 유틸리티 테스트.
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
class ScoresTest {

    @Test
    void percentOf_ZeroDenominator_ReturnsZero() {
        assertEquals(0.0, Scores.percentOf(0, 0));
    }

    @Test
    void percentOf_RoundsToOneDecimal() {
        assertEquals(66.7, Scores.percentOf(2, 3));
        assertEquals(33.3, Scores.percentOf(1, 3));
        assertEquals(100.0, Scores.percentOf(4, 4));
    }

    @Test
    void round1_UsesBinaryValueOfDouble() {
        // 0.35 is stored as 0.34999...
        assertEquals(0.3, Scores.round1(0.35));
        assertEquals(0.2, Scores.round1(0.25));
        assertEquals(2.7, Scores.round1(2.6501));
    }

    @Test
    void clamp_LimitsToScoreRange() {
        assertEquals(0.0, Scores.clamp(-5.0));
        assertEquals(100.0, Scores.clamp(120.0));
        assertEquals(42.5, Scores.clamp(42.5));
    }

    @Test
    void requireInRange_OutOfRange_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Scores.requireInRange("min_health_score", 101.0)
        );
        assertTrue(exception.getMessage().contains("min_health_score"));
    }

    @Test
    void constructor_ThrowsUnsupportedOperation() throws Exception {
        var constructor = Scores.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        var exception = assertThrows(java.lang.reflect.InvocationTargetException.class, constructor::newInstance);
        assertInstanceOf(UnsupportedOperationException.class, exception.getCause());
    }
}
