package com.signal.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Bar")
class BarTest {

    @Test
    @DisplayName("Rejects high/low that do not bracket open and close")
    void rangeInvariant() {
        assertThatThrownBy(() -> new Bar(0, 1.0, 0.9, 0.8, 0.85, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bar(0, 1.0, 1.2, 1.05, 1.1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bar(0, 1.0, 1.0, 1.0, 1.0, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bar(-1, 1.0, 1.0, 1.0, 1.0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new Bar(0, 1.0, 1.2, 0.9, 1.1, 3).high()).isEqualTo(1.2);
    }

    @ParameterizedTest(name = "{0} in any field is rejected")
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    void nonFiniteRejected(double bad) {
        assertThatThrownBy(() -> new Bar(0, bad, 1.2, 0.9, 1.1, 0))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("finite");
        assertThatThrownBy(() -> new Bar(0, 1.0, bad, 0.9, 1.1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bar(0, 1.0, 1.2, bad, 1.1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bar(0, 1.0, 1.2, 0.9, bad, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Bar(0, 1.0, 1.2, 0.9, 1.1, bad)).isInstanceOf(IllegalArgumentException.class);
    }
}
