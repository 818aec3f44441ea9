package com.indicatorsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ComparisonOperator}.
 */
class ComparisonOperatorTest {

    @Test
    @DisplayName("Should treat equality as satisfying gte but not gt")
    void equalityBoundary() {
        assertThat(ComparisonOperator.GTE.test(10, 10)).isTrue();
        assertThat(ComparisonOperator.GT.test(10, 10)).isFalse();
        assertThat(ComparisonOperator.LTE.test(10, 10)).isTrue();
        assertThat(ComparisonOperator.LT.test(10, 10)).isFalse();
        assertThat(ComparisonOperator.EQ.test(10, 10)).isTrue();
    }

    @Test
    @DisplayName("Should compare below and above the threshold")
    void belowAndAbove() {
        assertThat(ComparisonOperator.LT.test(5, 10)).isTrue();
        assertThat(ComparisonOperator.GT.test(5, 10)).isFalse();
        assertThat(ComparisonOperator.GT.test(11, 10)).isTrue();
        assertThat(ComparisonOperator.EQ.test(10.5, 10)).isFalse();
    }

    @Test
    @DisplayName("Should treat negative and positive zero as equal")
    void signedZero() {
        assertThat(ComparisonOperator.EQ.test(-0.0, 0)).isTrue();
        assertThat(ComparisonOperator.GTE.test(-0.0, 0)).isTrue();
    }

    @Test
    @DisplayName("Should parse codes case-insensitively and reject unknown ones")
    void parsing() {
        assertThat(ComparisonOperator.fromCode("gte")).isEqualTo(ComparisonOperator.GTE);
        assertThat(ComparisonOperator.fromCode(" LT ")).isEqualTo(ComparisonOperator.LT);
        assertThatThrownBy(() -> ComparisonOperator.fromCode("ne"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
