/* (C)2026 */
package com.ammann.reflectometry.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PolarizationStateTest {

    @Test
    void enumHasNineValues() {
        assertThat(PolarizationState.values()).hasSize(9);
    }

    @Test
    void fromCodeResolvesEveryState() {
        for (PolarizationState state : PolarizationState.values()) {
            assertThat(PolarizationState.fromCode(state.getCode())).isEqualTo(state);
        }
        assertThat(PolarizationState.fromCode("pm")).isEqualTo(PolarizationState.PM);
    }

    @Test
    void fromCodeRejectsUnknownCode() {
        assertThatThrownBy(() -> PolarizationState.fromCode("xx"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xx");
    }

    @Test
    void onlyFallbackIsUnpolarized() {
        assertThat(PolarizationState.UNPOLARIZED.isUnpolarized()).isTrue();
        assertThat(PolarizationState.PP.isUnpolarized()).isFalse();
    }
}
